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
 * Diagnostics attached to every page.
 *
 * @param requestCharge           request charge of the page
 * @param retryCount              retries needed to fetch the page
 * @param executionRanges         per-attempt records of the page, in completion order
 * @param partitionedQueryMetrics server metrics keyed by partition key range id, empty unless the
 *                                server returned them
 */
public record QueryDiagnostics(
        double requestCharge,
        long retryCount,
        List<FetchExecutionRange> executionRanges,
        Map<String, QueryMetrics> partitionedQueryMetrics) {

    public QueryDiagnostics {
        executionRanges = List.copyOf(executionRanges);
        partitionedQueryMetrics = Map.copyOf(partitionedQueryMetrics);
    }
}
