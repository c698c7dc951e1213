/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.tessera.client.transport;

import com.tessera.client.request.QueryRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Sends a fully routed request to the database and returns the raw response.
 * <p>
 * Implementations complete the returned future exceptionally with a {@link DispatchException}
 * when the server rejects the request. Cancellation of a request already in flight is governed by
 * the implementation.
 */
public interface Transport {

    /**
     * Dispatches the given request.
     *
     * @param request the request, already routed to a partition key range or marked for gateway routing
     * @return a future completing with the raw response
     */
    CompletableFuture<StoreResponse> sendAsync(QueryRequest request);
}
