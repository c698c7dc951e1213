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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A partition-scoped cursor: the backend continuation {@code token} of the partition key range
 * identified by {@code rangeId} and bounded by {@code range}.
 * <p>
 * {@code token} is {@code null} when the range has not been read yet.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"rangeId", "range", "token"})
public record CompositeContinuationToken(
        @JsonProperty("rangeId") String rangeId,
        @JsonProperty("range") KeyRange range,
        @JsonProperty("token") String token) {

    public CompositeContinuationToken withToken(String token) {
        return new CompositeContinuationToken(rangeId, range, token);
    }

    public static CompositeContinuationToken of(PartitionKeyRange range, String token) {
        return new CompositeContinuationToken(range.id(), range.toRange(), token);
    }
}
