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

import com.tessera.client.request.FeedResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * Attaches {@link QueryDiagnostics} to a page. A pure function of its inputs; malformed server
 * metrics are logged and left out, they never fail the page.
 */
public class DiagnosticsMerger {
    private static final Logger LOGGER = LoggerFactory.getLogger(DiagnosticsMerger.class);
    private final QueryMetricsParser parser;

    public DiagnosticsMerger() {
        this(new QueryMetricsParser());
    }

    public DiagnosticsMerger(QueryMetricsParser parser) {
        this.parser = parser;
    }

    /**
     * @param response          the page as decoded from the transport
     * @param partitionId       id of the partition key range the page was read from
     * @param rawQueryMetrics   value of the {@code QueryMetrics} header, {@code null} or empty if absent
     * @param clientSideMetrics the client-side observations of this fetch
     * @return the page with diagnostics
     */
    public FeedResponse merge(FeedResponse response, String partitionId, @Nullable String rawQueryMetrics, ClientSideMetrics clientSideMetrics) {
        Map<String, QueryMetrics> partitionedQueryMetrics = Map.of();
        if (rawQueryMetrics != null && !rawQueryMetrics.isEmpty()) {
            try {
                QueryMetrics metrics = parser.parse(rawQueryMetrics, clientSideMetrics, response.getActivityId());
                partitionedQueryMetrics = Map.of(partitionId, metrics);
            } catch (IllegalArgumentException e) {
                LOGGER.warn("Ignoring malformed query metrics of partition key range {}: {}", partitionId, e.getMessage());
            }
        }
        QueryDiagnostics diagnostics = new QueryDiagnostics(
                clientSideMetrics.requestCharge(),
                clientSideMetrics.retries(),
                clientSideMetrics.fetchExecutionRanges(),
                partitionedQueryMetrics
        );
        return response.withDiagnostics(diagnostics);
    }
}
