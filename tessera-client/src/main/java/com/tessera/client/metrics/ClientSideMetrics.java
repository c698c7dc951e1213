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

package com.tessera.client.metrics;

import java.util.List;
import java.util.Map;

/**
 * What the client observed while fetching a page.
 *
 * @param retries                      retries of the logical call
 * @param requestCharge                request charge reported by the server
 * @param fetchExecutionRanges         per-attempt records, in completion order
 * @param partitionSchedulingTimeSpans scheduling time spans keyed by partition key range id, present
 *                                     only on the last page of a query
 */
public record ClientSideMetrics(
        long retries,
        double requestCharge,
        List<FetchExecutionRange> fetchExecutionRanges,
        Map<String, SchedulingTimeSpan> partitionSchedulingTimeSpans) {

    public ClientSideMetrics {
        fetchExecutionRanges = List.copyOf(fetchExecutionRanges);
        partitionSchedulingTimeSpans = Map.copyOf(partitionSchedulingTimeSpans);
    }
}
