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
 * Result of routing a query: the partition key range to target now, plus the continuation tokens
 * still to be visited. The first token, if any, belongs to {@code resolvedRange}.
 */
public record ResolvedRangeInfo(PartitionKeyRange resolvedRange, List<CompositeContinuationToken> continuationTokens) {

    public ResolvedRangeInfo {
        continuationTokens = List.copyOf(continuationTokens);
    }

    /**
     * Returns the backend continuation to send to {@code resolvedRange}, or {@code null} to start
     * reading it from the beginning.
     */
    public String innerContinuation() {
        return continuationTokens.isEmpty() ? null : continuationTokens.get(0).token();
    }
}
