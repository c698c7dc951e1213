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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-supplied options of a paged query. Translated into request headers for every attempt.
 */
public class FeedOptions {
    // Raw header overrides, applied last
    private final Map<String, String> customHeaders = new LinkedHashMap<>();
    private String requestContinuation;
    private String partitionKey;
    private String partitionKeyRangeId;
    private Boolean enableCrossPartitionQuery;
    private Integer maxItemCount;
    private boolean populateQueryMetrics;

    public String getRequestContinuation() {
        return requestContinuation;
    }

    public FeedOptions setRequestContinuation(String requestContinuation) {
        this.requestContinuation = requestContinuation;
        return this;
    }

    public String getPartitionKey() {
        return partitionKey;
    }

    /**
     * Sets the serialized partition key value. A request carrying a partition key is dispatched
     * without range resolution.
     */
    public FeedOptions setPartitionKey(String partitionKey) {
        this.partitionKey = partitionKey;
        return this;
    }

    public String getPartitionKeyRangeId() {
        return partitionKeyRangeId;
    }

    public FeedOptions setPartitionKeyRangeId(String partitionKeyRangeId) {
        this.partitionKeyRangeId = partitionKeyRangeId;
        return this;
    }

    public Boolean getEnableCrossPartitionQuery() {
        return enableCrossPartitionQuery;
    }

    public FeedOptions setEnableCrossPartitionQuery(Boolean enableCrossPartitionQuery) {
        this.enableCrossPartitionQuery = enableCrossPartitionQuery;
        return this;
    }

    public Integer getMaxItemCount() {
        return maxItemCount;
    }

    public FeedOptions setMaxItemCount(Integer maxItemCount) {
        this.maxItemCount = maxItemCount;
        return this;
    }

    public boolean isPopulateQueryMetrics() {
        return populateQueryMetrics;
    }

    public FeedOptions setPopulateQueryMetrics(boolean populateQueryMetrics) {
        this.populateQueryMetrics = populateQueryMetrics;
        return this;
    }

    public Map<String, String> getCustomHeaders() {
        return Collections.unmodifiableMap(customHeaders);
    }

    public FeedOptions setCustomHeader(String name, String value) {
        customHeaders.put(name, value);
        return this;
    }
}
