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
import java.util.HashMap;
import java.util.Map;

/**
 * A single dispatch attempt. A new instance is built for every attempt so no routing or refresh
 * state leaks from one attempt into the next.
 */
public class QueryRequest {
    private final ResourceType resourceType;
    private final String resourceLink;
    private final SqlQuerySpec querySpec;
    private final Map<String, String> headers = new HashMap<>();
    private PartitionKeyRangeIdentity partitionKeyRangeIdentity;
    private boolean forceNameCacheRefresh;
    private boolean useGatewayMode;

    public QueryRequest(ResourceType resourceType, String resourceLink, SqlQuerySpec querySpec, Map<String, String> headers) {
        this.resourceType = resourceType;
        this.resourceLink = resourceLink;
        this.querySpec = querySpec;
        this.headers.putAll(headers);
    }

    public ResourceType getResourceType() {
        return resourceType;
    }

    public String getResourceLink() {
        return resourceLink;
    }

    /**
     * Returns the query of this request, or {@code null} for a plain read feed.
     */
    public SqlQuerySpec getQuerySpec() {
        return querySpec;
    }

    public String getHeader(String name) {
        return headers.get(name);
    }

    public void setHeader(String name, String value) {
        if (value == null) {
            headers.remove(name);
        } else {
            headers.put(name, value);
        }
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    /**
     * Routes the request to a partition key range. The identity travels in the
     * {@code PartitionKeyRangeId} header as {@code collectionRid,partitionKeyRangeId}.
     */
    public void routeTo(PartitionKeyRangeIdentity identity) {
        this.partitionKeyRangeIdentity = identity;
        setHeader(QueryHeaders.PARTITION_KEY_RANGE_ID, identity == null ? null : identity.toString());
    }

    public PartitionKeyRangeIdentity getPartitionKeyRangeIdentity() {
        return partitionKeyRangeIdentity;
    }

    public boolean isForceNameCacheRefresh() {
        return forceNameCacheRefresh;
    }

    public void setForceNameCacheRefresh(boolean forceNameCacheRefresh) {
        this.forceNameCacheRefresh = forceNameCacheRefresh;
    }

    public boolean isUseGatewayMode() {
        return useGatewayMode;
    }

    public void setUseGatewayMode(boolean useGatewayMode) {
        this.useGatewayMode = useGatewayMode;
    }
}
