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

package com.tessera.client.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.client.InputInvalidException;
import com.tessera.client.request.QueryHeaders;
import com.tessera.common.TesseraException;

import java.util.List;

/**
 * Encodes and decodes the composite continuation token carried in the {@code Continuation} header.
 * <p>
 * The wire form is a JSON array of {@link CompositeContinuationToken}, for example
 * {@code [{"rangeId":"1","range":{"min":"","max":"7F"},"token":"42"}]}. Encoding is deterministic, so
 * a token decoded and re-encoded without changes is byte-for-byte identical.
 */
public class ContinuationTokenCodec {
    private static final TypeReference<List<CompositeContinuationToken>> TOKEN_LIST = new TypeReference<>() {
    };
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public String encode(List<CompositeContinuationToken> tokens) {
        try {
            return objectMapper.writeValueAsString(tokens);
        } catch (JsonProcessingException e) {
            throw new TesseraException("Continuation token serialization failed", e);
        }
    }

    /**
     * Decodes a composite continuation token.
     *
     * @param continuation the header value
     * @return the tokens, never empty
     * @throws InputInvalidException if the value is not a well-formed composite token
     */
    public List<CompositeContinuationToken> decode(String continuation) {
        List<CompositeContinuationToken> tokens;
        try {
            tokens = objectMapper.readValue(continuation, TOKEN_LIST);
        } catch (JsonProcessingException e) {
            throw invalid(continuation, e);
        }
        if (tokens == null || tokens.isEmpty()) {
            throw invalid(continuation, null);
        }
        for (CompositeContinuationToken token : tokens) {
            if (token == null || token.range() == null || token.rangeId() == null || token.rangeId().isEmpty()) {
                throw invalid(continuation, null);
            }
        }
        return List.copyOf(tokens);
    }

    private InputInvalidException invalid(String continuation, Throwable cause) {
        String message = "Invalid continuation token: " + continuation;
        if (cause == null) {
            return new InputInvalidException(QueryHeaders.CONTINUATION, message);
        }
        return new InputInvalidException(QueryHeaders.CONTINUATION, message, cause);
    }
}
