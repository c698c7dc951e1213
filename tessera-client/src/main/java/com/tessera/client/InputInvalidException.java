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
 * Thrown when caller input can never succeed, such as a malformed header value or a continuation
 * token that cannot be parsed. Never retried.
 */
public class InputInvalidException extends TesseraException {
    private final String field;

    public InputInvalidException(String field, String message) {
        super(message);
        this.field = field;
    }

    public InputInvalidException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * Returns the name of the offending header or option.
     */
    public String getField() {
        return field;
    }
}
