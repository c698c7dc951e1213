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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.client.transport.StoreResponse;
import com.tessera.common.TesseraException;
import com.tessera.common.utils.Utils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the JSON body of a feed response: {@code {"Documents": [...], "_count": n}}.
 */
public class FeedResponseDecoder {
    static final String DOCUMENTS = "Documents";
    static final String COUNT = "_count";
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public FeedResponse decode(StoreResponse response) {
        List<JsonNode> items = new ArrayList<>();
        byte[] body = response.getBody();
        if (body != null && body.length > 0) {
            JsonNode root;
            try {
                root = objectMapper.readTree(body);
            } catch (IOException e) {
                throw new TesseraException("Feed response body is not valid JSON", e);
            }
            JsonNode documents = root.get(DOCUMENTS);
            if (documents != null && !documents.isNull()) {
                if (!documents.isArray()) {
                    throw new TesseraException("Feed response field '" + DOCUMENTS + "' is not an array");
                }
                documents.forEach(items::add);
            }
            JsonNode count = root.get(COUNT);
            if (count != null && count.isNumber() && count.asInt() != items.size()) {
                throw new TesseraException("Feed response declares " + count.asInt()
                        + " documents but contains " + items.size());
            }
        }
        String continuation = response.getHeader(QueryHeaders.CONTINUATION);
        return new FeedResponse(items, response.getHeaders(), Utils.isEmpty(continuation) ? null : continuation);
    }
}
