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

import java.util.List;

/**
 * A physical partition: the contiguous interval {@code [minInclusive, maxExclusive)} of the
 * effective partition key space owned by one partition at a point in time.
 *
 * @param id           stable range id, never reused by a collection
 * @param minInclusive lower bound
 * @param maxExclusive upper bound
 * @param parents      ids of the ranges this one was split or merged from, oldest first
 */
public record PartitionKeyRange(String id, String minInclusive, String maxExclusive, List<String> parents) {

    public PartitionKeyRange {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("partition key range id cannot be empty");
        }
        if (minInclusive.compareTo(maxExclusive) >= 0) {
            throw new IllegalArgumentException("partition key range " + id + " is empty or inverted");
        }
        parents = parents == null ? List.of() : List.copyOf(parents);
    }

    public PartitionKeyRange(String id, String minInclusive, String maxExclusive) {
        this(id, minInclusive, maxExclusive, List.of());
    }

    public KeyRange toRange() {
        return new KeyRange(minInclusive, maxExclusive);
    }
}
