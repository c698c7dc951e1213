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

import com.tessera.client.cache.CollectionCache;
import com.tessera.client.request.QueryRequest;
import com.tessera.client.routing.CollectionDescriptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Delegating {@link CollectionCache} that records invalidations and forced resolutions.
 */
public class RecordingCollectionCache implements CollectionCache {
    private final CollectionCache delegate;
    private final List<String> invalidations = new CopyOnWriteArrayList<>();
    private final List<String> forcedResolutions = new CopyOnWriteArrayList<>();

    public RecordingCollectionCache(CollectionCache delegate) {
        this.delegate = delegate;
    }

    public List<String> getInvalidations() {
        return invalidations;
    }

    public List<String> getForcedResolutions() {
        return forcedResolutions;
    }

    @Override
    public CompletableFuture<CollectionDescriptor> resolveAsync(QueryRequest request) {
        if (request.isForceNameCacheRefresh()) {
            forcedResolutions.add(request.getResourceLink());
        }
        return delegate.resolveAsync(request);
    }

    @Override
    public void invalidate(String collectionLink) {
        invalidations.add(collectionLink);
        delegate.invalidate(collectionLink);
    }
}
