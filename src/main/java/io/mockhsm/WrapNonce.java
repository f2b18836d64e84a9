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

import java.util.Arrays;

/**
 * The nonce supplied with a wrap or unwrap request. The device protocol uses {@value #SIZE}-byte nonces, of which
 * only the first {@value #AEAD_NONCE_SIZE} bytes feed the AEAD cipher. Shorter values are rejected up front.
 */
public final class WrapNonce {
    public static final int SIZE = 13;
    public static final int AEAD_NONCE_SIZE = 12;

    private final byte[] bytes;

    private WrapNonce(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Creates a nonce from caller-supplied bytes. The bytes are copied.
     *
     * @param bytes the nonce, which must be at least {@value #AEAD_NONCE_SIZE} bytes long.
     * @return the nonce.
     * @throws IllegalArgumentException if the nonce is too short.
     */
    public static WrapNonce of(byte[] bytes) {
        Utils.require(requireNonNull(bytes, "bytes").length >= AEAD_NONCE_SIZE,
                "Wrap nonce must be at least " + AEAD_NONCE_SIZE + " bytes");
        return new WrapNonce(bytes.clone());
    }

    public static WrapNonce generate() {
        return new WrapNonce(Crypto.randomBytes(SIZE));
    }

    /**
     * The nonce passed to the AEAD cipher: the first {@value #AEAD_NONCE_SIZE} bytes.
     */
    byte[] aeadNonce() {
        return Arrays.copyOf(bytes, AEAD_NONCE_SIZE);
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof WrapNonce)) { return false; }
        return Arrays.equals(bytes, ((WrapNonce) other).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "WrapNonce{" + Utils.hex(bytes) + '}';
    }
}
