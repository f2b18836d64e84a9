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

import java.util.Optional;

/**
 * Provenance of an object. Once an object has been exported under wrap its origin is promoted to the corresponding
 * wrapped value, and stays there.
 */
public enum ObjectOrigin {
    GENERATED(0x01),
    IMPORTED(0x02),
    WRAPPED_GENERATED(0x11),
    WRAPPED_IMPORTED(0x12);

    private static final int WRAPPED_FLAG = 0x10;

    private final int code;

    ObjectOrigin(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isWrapped() {
        return (code & WRAPPED_FLAG) != 0;
    }

    /**
     * The origin recorded for an object after it has been exported under wrap. Idempotent.
     */
    public ObjectOrigin wrapped() {
        switch (this) {
            case GENERATED:
                return WRAPPED_GENERATED;
            case IMPORTED:
                return WRAPPED_IMPORTED;
            default:
                return this;
        }
    }

    public static Optional<ObjectOrigin> fromCode(int code) {
        for (var origin : values()) {
            if (origin.code == code) {
                return Optional.of(origin);
            }
        }
        return Optional.empty();
    }
}
