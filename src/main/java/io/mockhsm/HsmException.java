/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.mockhsm;

import static java.util.Objects.requireNonNull;

/**
 * Base class for the recoverable failures reported by the object store. Every failure carries a {@link Kind} so
 * that a command dispatch layer can map it onto the corresponding protocol status code without inspecting
 * messages. A failed operation never leaves the store partially modified.
 */
public abstract class HsmException extends Exception {
    private final Kind kind;

    HsmException(Kind kind, String message) {
        super(message);
        this.kind = requireNonNull(kind, "kind");
    }

    HsmException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }

    public enum Kind {
        OBJECT_NOT_FOUND,
        OBJECT_EXISTS,
        UNSUPPORTED_ALGORITHM,
        INSUFFICIENT_CAPABILITY,
        DECRYPTION_FAILED,
        MALFORMED_OBJECT
    }
}
