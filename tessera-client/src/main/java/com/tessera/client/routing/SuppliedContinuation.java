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
 * The continuation a request arrived with, already decoded.
 *
 * @param raw    the header value as supplied, {@code null} if there was none
 * @param tokens the decoded tokens, empty if there was no continuation
 */
public record SuppliedContinuation(String raw, List<CompositeContinuationToken> tokens) {
    public static final SuppliedContinuation NONE = new SuppliedContinuation(null, List.of());

    public SuppliedContinuation {
        tokens = List.copyOf(tokens);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    /**
     * Returns the token of the range the query has to resume at.
     */
    public CompositeContinuationToken first() {
        return tokens.isEmpty() ? null : tokens.get(0);
    }
}
