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

import java.time.Duration;

/**
 * Server-side execution metrics of a query on one partition key range, merged with the client-side
 * observations of the same fetch.
 */
public record QueryMetrics(
        long retrievedDocumentCount,
        long retrievedDocumentSize,
        long outputDocumentCount,
        long outputDocumentSize,
        double indexHitRatio,
        Duration totalQueryExecutionTime,
        Duration queryCompilationTime,
        Duration logicalPlanBuildTime,
        Duration physicalPlanBuildTime,
        Duration queryOptimizationTime,
        Duration indexLookupTime,
        Duration documentLoadTime,
        Duration vmExecutionTime,
        Duration documentWriteTime,
        ClientSideMetrics clientSideMetrics,
        String activityId) {
}
