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

package com.tessera.client.cache;

import com.tessera.client.request.QueryRequest;
import com.tessera.client.routing.CollectionDescriptor;

import java.util.concurrent.CompletableFuture;

/**
 * Maps collection names to their current identity.
 * <p>
 * Implementations are shared by all execution contexts and must tolerate concurrent reads and
 * concurrent, duplicate invalidations.
 */
public interface CollectionCache {

    /**
     * Resolves the collection addressed by the request. A request flagged with
     * {@link QueryRequest#isForceNameCacheRefresh()} bypasses any cached entry.
     *
     * @param request the request whose resource link names the collection
     * @return a future completing with the collection descriptor
     */
    CompletableFuture<CollectionDescriptor> resolveAsync(QueryRequest request);

    /**
     * Discards the cached identity of the named collection so that the next resolution reads
     * authoritative state.
     *
     * @param collectionLink the name-based link of the collection
     */
    void invalidate(String collectionLink);
}
