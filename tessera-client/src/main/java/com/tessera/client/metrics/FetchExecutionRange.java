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
import java.time.Instant;

/**
 * Wall-clock record of one dispatch attempt.
 *
 * @param partitionId       id of the partition key range the attempt targeted, {@code null} if it
 *                          failed before routing
 * @param startTime         when the attempt started
 * @param endTime           when the attempt completed
 * @param numberOfDocuments documents returned, zero for a failed attempt
 * @param retryCount        retries of the logical call when the attempt completed
 */
public record FetchExecutionRange(String partitionId, Instant startTime, Instant endTime, long numberOfDocuments, long retryCount) {

    public Duration elapsed() {
        return Duration.between(startTime, endTime);
    }
}
