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

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects {@link FetchExecutionRange} records, one per attempt, until they are drained into a
 * diagnostics payload. Owned by a single execution context and never shared.
 */
public class FetchExecutionRangeAccumulator {
    private final Clock clock;
    private final List<FetchExecutionRange> executionRanges = new ArrayList<>();
    private Instant startTime;
    private boolean isFetching;

    public FetchExecutionRangeAccumulator() {
        this(Clock.systemUTC());
    }

    public FetchExecutionRangeAccumulator(Clock clock) {
        this.clock = clock;
    }

    public void beginFetchRange() {
        if (!isFetching) {
            startTime = clock.instant();
            isFetching = true;
        }
    }

    /**
     * Closes the attempt opened by {@link #beginFetchRange()}. Ignored if no attempt is open.
     */
    public void endFetchRange(String partitionId, long numberOfDocuments, long retryCount) {
        if (isFetching) {
            executionRanges.add(new FetchExecutionRange(partitionId, startTime, clock.instant(), numberOfDocuments, retryCount));
            isFetching = false;
        }
    }

    /**
     * Drops the attempt opened by {@link #beginFetchRange()} without recording it.
     */
    public void abandonFetchRange() {
        isFetching = false;
        startTime = null;
    }

    /**
     * Returns the records accumulated since the last call, in completion order, and clears them.
     */
    public List<FetchExecutionRange> getExecutionRanges() {
        List<FetchExecutionRange> result = List.copyOf(executionRanges);
        executionRanges.clear();
        return result;
    }
}
