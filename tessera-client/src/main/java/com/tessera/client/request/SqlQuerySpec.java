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

package com.tessera.client.request;

import java.util.Map;

/**
 * A query text with its named parameters.
 *
 * @param queryText  the query text
 * @param parameters parameter values keyed by name, e.g. {@code @city}
 */
public record SqlQuerySpec(String queryText, Map<String, Object> parameters) {

    public SqlQuerySpec {
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("queryText cannot be empty");
        }
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public SqlQuerySpec(String queryText) {
        this(queryText, Map.of());
    }
}
