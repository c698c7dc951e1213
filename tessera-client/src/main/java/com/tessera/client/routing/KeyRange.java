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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * An interval over the effective partition key space. Effective partition keys are upper-case hex
 * strings compared in ordinal order; the space runs from {@link #MIN_INCLUSIVE} to
 * {@link #MAX_EXCLUSIVE}.
 * <p>
 * A range is {@code [min, max)} except when {@code min} equals {@code max}: such a range is a single
 * value, the point produced by an equality predicate on the partition key.
 */
@JsonPropertyOrder({"min", "max"})
public record KeyRange(@JsonProperty("min") String min, @JsonProperty("max") String max) {
    public static final String MIN_INCLUSIVE = "";
    public static final String MAX_EXCLUSIVE = "FF";
    public static final KeyRange FULL = new KeyRange(MIN_INCLUSIVE, MAX_EXCLUSIVE);

    public KeyRange {
        if (min == null || max == null) {
            throw new IllegalArgumentException("range bounds cannot be null");
        }
        if (min.compareTo(max) > 0) {
            throw new IllegalArgumentException("range min " + min + " is greater than max " + max);
        }
    }

    public static KeyRange point(String effectivePartitionKey) {
        return new KeyRange(effectivePartitionKey, effectivePartitionKey);
    }

    public boolean isSingleValue() {
        return min.equals(max);
    }

    /**
     * Returns whether the given effective partition key falls inside this range.
     */
    public boolean contains(String effectivePartitionKey) {
        if (isSingleValue()) {
            return min.equals(effectivePartitionKey);
        }
        return min.compareTo(effectivePartitionKey) <= 0 && effectivePartitionKey.compareTo(max) < 0;
    }

    public boolean overlaps(KeyRange other) {
        if (isSingleValue()) {
            return other.contains(min);
        }
        if (other.isSingleValue()) {
            return contains(other.min);
        }
        return min.compareTo(other.max) < 0 && other.min.compareTo(max) < 0;
    }

    @Override
    public String toString() {
        return isSingleValue() ? "[" + min + "]" : "[" + min + "," + max + ")";
    }
}
