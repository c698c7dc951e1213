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

package com.tessera.client;

import com.tessera.common.TesseraException;

/**
 * Thrown when no partition key range could be resolved for a query even after the collection
 * cache was force-refreshed.
 */
public class RoutingUnresolvableException extends TesseraException {
    private final String collectionRid;
    private final String suppliedContinuation;

    public RoutingUnresolvableException(String collectionRid, String suppliedContinuation) {
        super(String.format(
                "Could not resolve a partition key range even after a forced collection cache refresh, collectionRid: %s, supplied continuation: %s",
                collectionRid, suppliedContinuation));
        this.collectionRid = collectionRid;
        this.suppliedContinuation = suppliedContinuation;
    }

    public String getCollectionRid() {
        return collectionRid;
    }

    public String getSuppliedContinuation() {
        return suppliedContinuation;
    }
}
