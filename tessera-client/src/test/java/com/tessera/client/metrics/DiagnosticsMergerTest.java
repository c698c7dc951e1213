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
import com.tessera.client.request.QueryHeaders;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsMergerTest {
    private final DiagnosticsMerger merger = new DiagnosticsMerger();

    private ClientSideMetrics clientSideMetrics() {
        Instant now = Instant.now();
        return new ClientSideMetrics(1, 4.5, List.of(new FetchExecutionRange("3", now, now, 2, 1)), Map.of());
    }

    private FeedResponse response() {
        return new FeedResponse(List.of(), Map.of(QueryHeaders.ACTIVITY_ID, "activity"), "next");
    }

    @Test
    public void test_merge_with_query_metrics() {
        FeedResponse merged = merger.merge(response(), "3", "retrievedDocumentCount=2", clientSideMetrics());

        QueryDiagnostics diagnostics = merged.getDiagnostics();
        assertEquals(4.5, diagnostics.requestCharge());
        assertEquals(1, diagnostics.retryCount());
        assertEquals(1, diagnostics.executionRanges().size());
        QueryMetrics metrics = diagnostics.partitionedQueryMetrics().get("3");
        assertEquals(2, metrics.retrievedDocumentCount());
        assertEquals("activity", metrics.activityId());
        assertEquals("next", merged.getContinuation());
    }

    @Test
    public void test_merge_without_query_metrics() {
        FeedResponse merged = merger.merge(response(), "3", null, clientSideMetrics());

        assertNotNull(merged.getDiagnostics());
        assertTrue(merged.getDiagnostics().partitionedQueryMetrics().isEmpty());
        assertEquals(1, merged.getDiagnostics().retryCount());
    }

    @Test
    public void test_malformed_query_metrics_are_skipped() {
        FeedResponse merged = merger.merge(response(), "3", "retrievedDocumentCount=lots", clientSideMetrics());

        assertTrue(merged.getDiagnostics().partitionedQueryMetrics().isEmpty());
        assertEquals(4.5, merged.getDiagnostics().requestCharge());
    }
}
