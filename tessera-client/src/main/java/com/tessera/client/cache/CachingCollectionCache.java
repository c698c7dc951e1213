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

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.tessera.client.request.QueryRequest;
import com.tessera.client.routing.CollectionDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link CollectionCache} backed by a Guava cache of in-flight or completed resolutions, keyed by
 * collection link. Failed resolutions are evicted so the next caller retries the source.
 */
public class CachingCollectionCache implements CollectionCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(CachingCollectionCache.class);
    private static final long DEFAULT_EXPIRE_AFTER_ACCESS_MINUTES = 30;

    private final CollectionMetadataSource source;
    private final Cache<String, CompletableFuture<CollectionDescriptor>> collections;

    public CachingCollectionCache(CollectionMetadataSource source) {
        this(source, DEFAULT_EXPIRE_AFTER_ACCESS_MINUTES);
    }

    public CachingCollectionCache(CollectionMetadataSource source, long expireAfterAccessMinutes) {
        this.source = source;
        this.collections = CacheBuilder.newBuilder()
                .expireAfterAccess(expireAfterAccessMinutes, TimeUnit.MINUTES)
                .build();
    }

    @Override
    public CompletableFuture<CollectionDescriptor> resolveAsync(QueryRequest request) {
        String link = request.getResourceLink();
        if (request.isForceNameCacheRefresh()) {
            invalidate(link);
        }
        CompletableFuture<CollectionDescriptor> future;
        try {
            future = collections.get(link, () -> source.fetchAsync(link));
        } catch (ExecutionException | UncheckedExecutionException e) {
            return CompletableFuture.failedFuture(e.getCause());
        }
        future.whenComplete((descriptor, throwable) -> {
            if (throwable != null) {
                collections.asMap().remove(link, future);
            }
        });
        return future;
    }

    @Override
    public void invalidate(String collectionLink) {
        LOGGER.debug("Invalidating cached identity of collection {}", collectionLink);
        collections.invalidate(collectionLink);
    }
}
