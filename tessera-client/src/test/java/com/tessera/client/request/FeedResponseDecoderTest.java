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

import com.tessera.client.transport.StoreResponse;
import com.tessera.common.TesseraException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeedResponseDecoderTest {
    private final FeedResponseDecoder decoder = new FeedResponseDecoder();

    private StoreResponse response(Map<String, String> headers, String body) {
        return new StoreResponse(headers, body.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void test_decode() {
        FeedResponse response = decoder.decode(response(
                Map.of(QueryHeaders.CONTINUATION, "10|b", QueryHeaders.REQUEST_CHARGE, "3.25"),
                "{\"Documents\":[{\"id\":\"a\"},{\"id\":\"b\"}],\"_count\":2}"));

        assertEquals(2, response.getCount());
        assertEquals("b", response.getItems().get(1).get("id").asText());
        assertEquals("10|b", response.getContinuation());
        assertEquals(3.25, response.getRequestCharge());
    }

    @Test
    public void test_empty_continuation_means_end() {
        FeedResponse response = decoder.decode(response(Map.of(QueryHeaders.CONTINUATION, ""), "{\"Documents\":[],\"_count\":0}"));
        assertNull(response.getContinuation());
        assertEquals(0, response.getCount());
        assertEquals(0, response.getRequestCharge());
    }

    @Test
    public void test_malformed_bodies_are_rejected() {
        assertThrows(TesseraException.class, () -> decoder.decode(response(Map.of(), "{not json")));
        assertThrows(TesseraException.class, () -> decoder.decode(response(Map.of(), "{\"Documents\":{}}")));
        assertThrows(TesseraException.class, () -> decoder.decode(response(Map.of(), "{\"Documents\":[],\"_count\":3}")));
    }
}
