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

/**
 * Header names exchanged between the query engine and the transport.
 */
public final class QueryHeaders {
    public static final String CONTINUATION = "Continuation";
    public static final String PARTITION_KEY = "PartitionKey";
    public static final String PARTITION_KEY_RANGE_ID = "PartitionKeyRangeId";
    public static final String ENABLE_CROSS_PARTITION_QUERY = "EnableCrossPartitionQuery";
    public static final String IS_CONTINUATION_EXPECTED = "IsContinuationExpected";
    public static final String VERSION = "Version";
    public static final String MAX_ITEM_COUNT = "MaxItemCount";
    public static final String POPULATE_QUERY_METRICS = "PopulateQueryMetrics";

    // Response headers
    public static final String QUERY_METRICS = "QueryMetrics";
    public static final String REQUEST_CHARGE = "RequestCharge";
    public static final String ACTIVITY_ID = "ActivityId";

    private QueryHeaders() {
    }
}
