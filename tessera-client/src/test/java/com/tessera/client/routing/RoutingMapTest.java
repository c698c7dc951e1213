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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoutingMapTest {
    private static final String RID = "rid";

    private RoutingMap threeRanges() {
        // Deliberately unordered
        return RoutingMap.create(RID, List.of(
                new PartitionKeyRange("2", "40", "A0"),
                new PartitionKeyRange("1", KeyRange.MIN_INCLUSIVE, "40"),
                new PartitionKeyRange("3", "A0", KeyRange.MAX_EXCLUSIVE)
        ));
    }

    @Test
    public void test_ranges_are_ordered() {
        List<PartitionKeyRange> ordered = threeRanges().getOrderedRanges();
        assertEquals(List.of("1", "2", "3"), ordered.stream().map(PartitionKeyRange::id).toList());
    }

    @Test
    public void test_getRangeByEffectivePartitionKey() {
        RoutingMap routingMap = threeRanges();
        assertEquals("1", routingMap.getRangeByEffectivePartitionKey("").id());
        assertEquals("2", routingMap.getRangeByEffectivePartitionKey("40").id());
        assertEquals("2", routingMap.getRangeByEffectivePartitionKey("9F").id());
        assertEquals("3", routingMap.getRangeByEffectivePartitionKey("A0").id());
        assertNull(routingMap.getRangeByEffectivePartitionKey(KeyRange.MAX_EXCLUSIVE));
    }

    @Test
    public void test_getOverlappingRanges() {
        RoutingMap routingMap = threeRanges();
        List<PartitionKeyRange> overlapping = routingMap.getOverlappingRanges(new KeyRange("30", "A0"));
        assertEquals(List.of("1", "2"), overlapping.stream().map(PartitionKeyRange::id).toList());
        assertEquals(1, routingMap.getOverlappingRanges(KeyRange.point("A0")).size());
        assertEquals(3, routingMap.getOverlappingRanges(KeyRange.FULL).size());
    }

    @Test
    public void test_getRangeById() {
        assertEquals("40", threeRanges().getRangeById("2").minInclusive());
        assertNull(threeRanges().getRangeById("9"));
    }

    @Test
    public void test_gap_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> RoutingMap.create(RID, List.of(
                new PartitionKeyRange("1", KeyRange.MIN_INCLUSIVE, "40"),
                new PartitionKeyRange("2", "50", KeyRange.MAX_EXCLUSIVE)
        )));
    }

    @Test
    public void test_overlap_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> RoutingMap.create(RID, List.of(
                new PartitionKeyRange("1", KeyRange.MIN_INCLUSIVE, "60"),
                new PartitionKeyRange("2", "50", KeyRange.MAX_EXCLUSIVE)
        )));
    }

    @Test
    public void test_incomplete_coverage_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> RoutingMap.create(RID, List.of(
                new PartitionKeyRange("1", KeyRange.MIN_INCLUSIVE, "60")
        )));
        assertThrows(IllegalArgumentException.class, () -> RoutingMap.create(RID, List.of()));
    }

    @Test
    public void test_duplicate_ids_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> RoutingMap.create(RID, List.of(
                new PartitionKeyRange("1", KeyRange.MIN_INCLUSIVE, "60"),
                new PartitionKeyRange("1", "60", KeyRange.MAX_EXCLUSIVE)
        )));
    }
}
