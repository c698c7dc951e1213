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

package com.tessera.client.transport;

/**
 * Classification of a failed dispatch as reported by the transport layer.
 */
public enum FailureKind {
    /**
     * The addressed partition key range no longer exists, typically because it was split or merged
     * while the request was in flight.
     */
    PARTITION_KEY_RANGE_GONE,

    /**
     * The collection no longer has the identity the client cached for its name.
     */
    INVALID_PARTITION,

    NOT_FOUND,

    BAD_REQUEST,

    TRANSIENT
}
