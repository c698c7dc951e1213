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

import com.tessera.client.routing.KeyRange;
import com.tessera.client.routing.PartitionKeyRange;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Provides the partition map of collections, addressed by collection resource id.
 * <p>
 * The cached map may lag behind splits and merges; callers detect staleness and ask for a
 * refresh. Implementations must tolerate concurrent reads and concurrent, duplicate
 * invalidations.
 */
public interface PartitionKeyRangeCache {

    /**
     * Returns the partition key ranges overlapping {@code range}, in ascending key order.
     *
     * @param collectionRid resource id of the collection
     * @param range         the key range
     * @param forceRefresh  {@code true} to discard the cached map before reading
     * @return a future completing with the overlapping ranges, or an empty list if the collection
     * is unknown
     */
    CompletableFuture<List<PartitionKeyRange>> getOverlappingRangesAsync(String collectionRid, KeyRange range, boolean forceRefresh);

    /**
     * Returns the partition key range owning the given effective partition key.
     *
     * @return a future completing with the range, or {@code null} if the collection is unknown
     */
    CompletableFuture<PartitionKeyRange> tryGetRangeByEffectivePartitionKeyAsync(String collectionRid, String effectivePartitionKey);

    /**
     * Discards the cached partition map of a collection.
     *
     * @param collectionRid resource id of the collection
     */
    void invalidate(String collectionRid);
}
