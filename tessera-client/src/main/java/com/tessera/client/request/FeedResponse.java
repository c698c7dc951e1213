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

import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.client.metrics.QueryDiagnostics;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One page of query results.
 * <p>
 * Instances are immutable; the {@code with*} methods return modified copies.
 */
public class FeedResponse {
    private final List<JsonNode> items;
    private final Map<String, String> headers;
    private final String continuation;
    private final QueryDiagnostics diagnostics;

    public FeedResponse(List<JsonNode> items, Map<String, String> headers, String continuation) {
        this(items, headers, continuation, null);
    }

    private FeedResponse(List<JsonNode> items, Map<String, String> headers, String continuation, QueryDiagnostics diagnostics) {
        this.items = List.copyOf(items);
        this.headers = Collections.unmodifiableMap(new HashMap<>(headers));
        this.continuation = continuation;
        this.diagnostics = diagnostics;
    }

    public List<JsonNode> getItems() {
        return items;
    }

    public int getCount() {
        return items.size();
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    /**
     * Returns the continuation to resume the query after this page, or {@code null} when the
     * query has no more results.
     */
    public String getContinuation() {
        return continuation;
    }

    public double getRequestCharge() {
        String value = headers.get(QueryHeaders.REQUEST_CHARGE);
        if (value == null || value.isEmpty()) {
            return 0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public String getActivityId() {
        return headers.get(QueryHeaders.ACTIVITY_ID);
    }

    public QueryDiagnostics getDiagnostics() {
        return diagnostics;
    }

    public FeedResponse withContinuation(String continuation) {
        return new FeedResponse(items, headers, continuation, diagnostics);
    }

    public FeedResponse withDiagnostics(QueryDiagnostics diagnostics) {
        return new FeedResponse(items, headers, continuation, diagnostics);
    }
}
