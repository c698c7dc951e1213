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
import java.util.HashMap;
import java.util.Map;

/**
 * Parses the {@code QueryMetrics} response header, a semicolon separated list of {@code name=value}
 * pairs such as {@code totalExecutionTimeInMs=33.67;retrievedDocumentCount=2000}. Unknown names are
 * ignored and missing ones default to zero.
 */
public class QueryMetricsParser {
    static final String RETRIEVED_DOCUMENT_COUNT = "retrievedDocumentCount";
    static final String RETRIEVED_DOCUMENT_SIZE = "retrievedDocumentSize";
    static final String OUTPUT_DOCUMENT_COUNT = "outputDocumentCount";
    static final String OUTPUT_DOCUMENT_SIZE = "outputDocumentSize";
    static final String INDEX_HIT_RATIO = "indexUtilizationRatio";
    static final String TOTAL_QUERY_EXECUTION_TIME = "totalExecutionTimeInMs";
    static final String QUERY_COMPILATION_TIME = "queryCompileTimeInMs";
    static final String LOGICAL_PLAN_BUILD_TIME = "queryLogicalPlanBuildTimeInMs";
    static final String PHYSICAL_PLAN_BUILD_TIME = "queryPhysicalPlanBuildTimeInMs";
    static final String QUERY_OPTIMIZATION_TIME = "queryOptimizationTimeInMs";
    static final String INDEX_LOOKUP_TIME = "indexLookupTimeInMs";
    static final String DOCUMENT_LOAD_TIME = "documentLoadTimeInMs";
    static final String VM_EXECUTION_TIME = "VMExecutionTimeInMs";
    static final String DOCUMENT_WRITE_TIME = "writeOutputTimeInMs";

    /**
     * @param delimited       the header value
     * @param clientSideMetrics the client-side observations of the same fetch
     * @param activityId      activity id of the response, may be {@code null}
     * @return the parsed metrics
     * @throws IllegalArgumentException if a pair is malformed or a value is not a number
     */
    public QueryMetrics parse(String delimited, ClientSideMetrics clientSideMetrics, String activityId) {
        Map<String, Double> values = new HashMap<>();
        for (String pair : delimited.split(";")) {
            if (pair.isBlank()) {
                continue;
            }
            int separator = pair.indexOf('=');
            if (separator <= 0 || separator == pair.length() - 1) {
                throw new IllegalArgumentException("Malformed query metrics entry: " + pair);
            }
            String name = pair.substring(0, separator).trim();
            String value = pair.substring(separator + 1).trim();
            try {
                values.put(name, Double.parseDouble(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Query metrics entry " + name + " is not a number: " + value, e);
            }
        }

        return new QueryMetrics(
                count(values, RETRIEVED_DOCUMENT_COUNT),
                count(values, RETRIEVED_DOCUMENT_SIZE),
                count(values, OUTPUT_DOCUMENT_COUNT),
                count(values, OUTPUT_DOCUMENT_SIZE),
                values.getOrDefault(INDEX_HIT_RATIO, 0d),
                millis(values, TOTAL_QUERY_EXECUTION_TIME),
                millis(values, QUERY_COMPILATION_TIME),
                millis(values, LOGICAL_PLAN_BUILD_TIME),
                millis(values, PHYSICAL_PLAN_BUILD_TIME),
                millis(values, QUERY_OPTIMIZATION_TIME),
                millis(values, INDEX_LOOKUP_TIME),
                millis(values, DOCUMENT_LOAD_TIME),
                millis(values, VM_EXECUTION_TIME),
                millis(values, DOCUMENT_WRITE_TIME),
                clientSideMetrics,
                activityId
        );
    }

    private long count(Map<String, Double> values, String name) {
        return values.getOrDefault(name, 0d).longValue();
    }

    private Duration millis(Map<String, Double> values, String name) {
        double value = values.getOrDefault(name, 0d);
        return Duration.ofNanos(Math.round(value * 1_000_000d));
    }
}
