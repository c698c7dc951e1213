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

package com.tessera.client;

import com.tessera.client.request.QueryRequest;
import com.tessera.client.transport.StoreResponse;
import com.tessera.client.transport.Transport;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link Transport} that parks every request until {@link #release()} forwards the parked requests
 * to the delegate.
 */
public class HoldingTransport implements Transport {
    private final Transport delegate;
    private final List<Parked> parked = new ArrayList<>();

    public HoldingTransport(Transport delegate) {
        this.delegate = delegate;
    }

    public synchronized int getParkedCount() {
        return parked.size();
    }

    @Override
    public synchronized CompletableFuture<StoreResponse> sendAsync(QueryRequest request) {
        CompletableFuture<StoreResponse> future = new CompletableFuture<>();
        parked.add(new Parked(request, future));
        return future;
    }

    public void release() {
        List<Parked> toRelease;
        synchronized (this) {
            toRelease = new ArrayList<>(parked);
            parked.clear();
        }
        for (Parked entry : toRelease) {
            delegate.sendAsync(entry.request()).whenComplete((response, throwable) -> {
                if (throwable != null) {
                    entry.future().completeExceptionally(throwable);
                } else {
                    entry.future().complete(response);
                }
            });
        }
    }

    private record Parked(QueryRequest request, CompletableFuture<StoreResponse> future) {
    }
}
