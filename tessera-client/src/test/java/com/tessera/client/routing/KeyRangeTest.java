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

import static org.junit.jupiter.api.Assertions.*;

class KeyRangeTest {

    @Test
    public void test_contains() {
        KeyRange range = new KeyRange("10", "80");
        assertTrue(range.contains("10"));
        assertTrue(range.contains("7F"));
        assertFalse(range.contains("80"));
        assertFalse(range.contains("05"));
    }

    @Test
    public void test_point_range() {
        KeyRange point = KeyRange.point("42");
        assertTrue(point.isSingleValue());
        assertTrue(point.contains("42"));
        assertFalse(point.contains("43"));
        assertTrue(point.overlaps(new KeyRange("40", "50")));
        assertFalse(point.overlaps(new KeyRange("50", "60")));
    }

    @Test
    public void test_overlaps_is_half_open() {
        KeyRange left = new KeyRange(KeyRange.MIN_INCLUSIVE, "80");
        KeyRange right = new KeyRange("80", KeyRange.MAX_EXCLUSIVE);
        assertFalse(left.overlaps(right));
        assertTrue(KeyRange.FULL.overlaps(left));
        assertTrue(right.overlaps(KeyRange.point("80")));
    }

    @Test
    public void test_inverted_bounds_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new KeyRange("80", "10"));
        assertThrows(IllegalArgumentException.class, () -> new KeyRange(null, "10"));
    }
}
