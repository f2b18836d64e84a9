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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;

/**
 * A human-readable object label. Labels are limited to {@value #MAX_SIZE} bytes of UTF-8 and must be well-formed
 * Unicode: unpaired surrogates are rejected.
 */
public final class ObjectLabel {
    public static final int MAX_SIZE = 40;

    private final String value;

    private ObjectLabel(String value) {
        this.value = value;
    }

    public static ObjectLabel of(String value) {
        var length = utf8Length(requireNonNull(value, "value"));
        Utils.require(length <= MAX_SIZE, "Label too long: " + length + " bytes (max " + MAX_SIZE + ")");
        return new ObjectLabel(value);
    }

    private static int utf8Length(String value) {
        try {
            return UTF_8.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(value))
                    .remaining();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Label is not valid Unicode", e);
        }
    }

    public static ObjectLabel empty() {
        return new ObjectLabel("");
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof ObjectLabel)) { return false; }
        return value.equals(((ObjectLabel) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
