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

package com.tessera.client.query;

import com.tessera.client.routing.KeyRange;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable cursor of a query: the continuation the next page starts from, whether the query is
 * exhausted, and the provided ranges already computed per collection resource id.
 */
public final class ExecutionState {
    private final String continuation;
    private final boolean exhausted;
    private final Map<String, List<KeyRange>> providedRanges;

    private ExecutionState(String continuation, boolean exhausted, Map<String, List<KeyRange>> providedRanges) {
        this.continuation = continuation;
        this.exhausted = exhausted;
        this.providedRanges = providedRanges;
    }

    /**
     * Creates the state of a query that has not fetched any page yet.
     *
     * @param continuation the continuation supplied by the caller, {@code null} to start from the beginning
     */
    public static ExecutionState initial(String continuation) {
        return new ExecutionState(continuation, false, Map.of());
    }

    public String getContinuation() {
        return continuation;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    /**
     * Returns the cached provided ranges of a collection, or {@code null} if they were not computed yet.
     */
    public List<KeyRange> getProvidedRanges(String collectionRid) {
        return providedRanges.get(collectionRid);
    }

    /**
     * Moves the cursor past a page. A {@code null} continuation marks the query as exhausted.
     */
    public ExecutionState withContinuation(String continuation) {
        return new ExecutionState(continuation, continuation == null, providedRanges);
    }

    public ExecutionState withProvidedRanges(String collectionRid, List<KeyRange> ranges) {
        Map<String, List<KeyRange>> copy = new HashMap<>(providedRanges);
        copy.put(collectionRid, ranges);
        return new ExecutionState(continuation, exhausted, Map.copyOf(copy));
    }
}
