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

import com.tessera.common.TesseraException;

/**
 * Signals a failed dispatch. The {@link FailureKind} drives the retry policy chain; the exception
 * itself is surfaced unchanged once no policy claims it.
 */
public class DispatchException extends TesseraException {
    private final FailureKind kind;

    public DispatchException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DispatchException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + kind + "]: " + getMessage();
    }
}
