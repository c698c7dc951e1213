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

package com.tessera.client.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable snapshot of a collection's partition map.
 * <p>
 * The ranges of a routing map cover the whole effective partition key space without gaps and
 * without overlaps; {@link #create(String, List)} rejects any list that violates this.
 */
public final class RoutingMap {
    private final String collectionRid;
    private final List<PartitionKeyRange> orderedRanges;
    private final Map<String, PartitionKeyRange> rangesById;

    private RoutingMap(String collectionRid, List<PartitionKeyRange> orderedRanges) {
        this.collectionRid = collectionRid;
        this.orderedRanges = Collections.unmodifiableList(orderedRanges);
        Map<String, PartitionKeyRange> byId = new HashMap<>();
        for (PartitionKeyRange range : orderedRanges) {
            if (byId.put(range.id(), range) != null) {
                throw new IllegalArgumentException("Duplicate partition key range id " + range.id()
                        + " in collection " + collectionRid);
            }
        }
        this.rangesById = Collections.unmodifiableMap(byId);
    }

    /**
     * Builds a routing map from an unordered list of ranges.
     *
     * @param collectionRid resource id of the collection
     * @param ranges        the collection's current partition key ranges
     * @return the routing map
     * @throws IllegalArgumentException if the ranges leave a gap, overlap or do not span the key space
     */
    public static RoutingMap create(String collectionRid, List<PartitionKeyRange> ranges) {
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("Collection " + collectionRid + " has no partition key ranges");
        }
        List<PartitionKeyRange> sorted = new ArrayList<>(ranges);
        sorted.sort(Comparator.comparing(PartitionKeyRange::minInclusive));

        String expectedMin = KeyRange.MIN_INCLUSIVE;
        for (PartitionKeyRange range : sorted) {
            if (!range.minInclusive().equals(expectedMin)) {
                throw new IllegalArgumentException(String.format(
                        "Partition map of collection %s is not contiguous: expected a range starting at '%s', found %s",
                        collectionRid, expectedMin, range.id()));
            }
            expectedMin = range.maxExclusive();
        }
        if (!expectedMin.equals(KeyRange.MAX_EXCLUSIVE)) {
            throw new IllegalArgumentException(String.format(
                    "Partition map of collection %s ends at '%s' instead of '%s'",
                    collectionRid, expectedMin, KeyRange.MAX_EXCLUSIVE));
        }
        return new RoutingMap(collectionRid, sorted);
    }

    public String getCollectionRid() {
        return collectionRid;
    }

    /**
     * Returns all ranges in ascending key order.
     */
    public List<PartitionKeyRange> getOrderedRanges() {
        return orderedRanges;
    }

    public PartitionKeyRange getRangeById(String id) {
        return rangesById.get(id);
    }

    /**
     * Returns the range containing the given effective partition key, or {@code null} if the key lies
     * outside the key space.
     */
    public PartitionKeyRange getRangeByEffectivePartitionKey(String effectivePartitionKey) {
        if (effectivePartitionKey.compareTo(KeyRange.MAX_EXCLUSIVE) >= 0) {
            return null;
        }
        int low = 0;
        int high = orderedRanges.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            PartitionKeyRange range = orderedRanges.get(mid);
            if (effectivePartitionKey.compareTo(range.minInclusive()) < 0) {
                high = mid - 1;
            } else if (effectivePartitionKey.compareTo(range.maxExclusive()) >= 0) {
                low = mid + 1;
            } else {
                return range;
            }
        }
        return null;
    }

    /**
     * Returns the ranges overlapping the given key range, in ascending key order.
     */
    public List<PartitionKeyRange> getOverlappingRanges(KeyRange keyRange) {
        List<PartitionKeyRange> result = new ArrayList<>();
        for (PartitionKeyRange range : orderedRanges) {
            if (range.toRange().overlaps(keyRange)) {
                result.add(range);
            }
        }
        return result;
    }
}
