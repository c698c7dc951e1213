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
import com.tessera.client.routing.KeyRange;
import com.tessera.client.routing.PartitionKeyRange;
import com.tessera.client.routing.RoutingMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link PartitionKeyRangeCache} keeping one {@link RoutingMap} per collection resource id.
 * <p>
 * Loads are shared: concurrent callers missing on the same collection wait on a single fetch.
 * Failed loads and unknown collections are not cached.
 */
public class CachingPartitionKeyRangeCache implements PartitionKeyRangeCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(CachingPartitionKeyRangeCache.class);
    private static final long DEFAULT_EXPIRE_AFTER_ACCESS_MINUTES = 30;

    private final PartitionKeyRangeSource source;
    private final Cache<String, CompletableFuture<RoutingMap>> routingMaps;

    public CachingPartitionKeyRangeCache(PartitionKeyRangeSource source) {
        this(source, DEFAULT_EXPIRE_AFTER_ACCESS_MINUTES);
    }

    public CachingPartitionKeyRangeCache(PartitionKeyRangeSource source, long expireAfterAccessMinutes) {
        this.source = source;
        this.routingMaps = CacheBuilder.newBuilder()
                .expireAfterAccess(expireAfterAccessMinutes, TimeUnit.MINUTES)
                .build();
    }

    /**
     * Returns the routing map of a collection.
     *
     * @param collectionRid resource id of the collection
     * @param forceRefresh  {@code true} to reload the map from the source
     * @return a future completing with the routing map, or {@code null} if the collection is unknown
     */
    public CompletableFuture<RoutingMap> tryLookupAsync(String collectionRid, boolean forceRefresh) {
        if (forceRefresh) {
            invalidate(collectionRid);
        }
        CompletableFuture<RoutingMap> future;
        try {
            future = routingMaps.get(collectionRid, () -> load(collectionRid));
        } catch (ExecutionException | UncheckedExecutionException e) {
            return CompletableFuture.failedFuture(e.getCause());
        }
        future.whenComplete((routingMap, throwable) -> {
            if (throwable != null || routingMap == null) {
                routingMaps.asMap().remove(collectionRid, future);
            }
        });
        return future;
    }

    private CompletableFuture<RoutingMap> load(String collectionRid) {
        LOGGER.debug("Loading partition map of collection {}", collectionRid);
        return source.fetchRangesAsync(collectionRid).thenApply(ranges -> {
            if (ranges == null || ranges.isEmpty()) {
                return null;
            }
            return RoutingMap.create(collectionRid, ranges);
        });
    }

    @Override
    public CompletableFuture<List<PartitionKeyRange>> getOverlappingRangesAsync(String collectionRid, KeyRange range, boolean forceRefresh) {
        return tryLookupAsync(collectionRid, forceRefresh).thenApply(routingMap -> {
            if (routingMap == null) {
                return List.of();
            }
            return routingMap.getOverlappingRanges(range);
        });
    }

    @Override
    public CompletableFuture<PartitionKeyRange> tryGetRangeByEffectivePartitionKeyAsync(String collectionRid, String effectivePartitionKey) {
        return tryLookupAsync(collectionRid, false).thenApply(routingMap -> {
            if (routingMap == null) {
                return null;
            }
            return routingMap.getRangeByEffectivePartitionKey(effectivePartitionKey);
        });
    }

    @Override
    public void invalidate(String collectionRid) {
        LOGGER.debug("Invalidating partition map of collection {}", collectionRid);
        routingMaps.invalidate(collectionRid);
    }
}
