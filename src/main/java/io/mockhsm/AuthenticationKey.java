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

import java.util.Arrays;

/**
 * Key material for session authentication: a 16-byte encryption key followed by a 16-byte MAC key. Keys are
 * normally derived from a password with PBKDF2-HMAC-SHA256.
 */
public final class AuthenticationKey {
    public static final int SIZE = 32;
    public static final String DEFAULT_PASSWORD = "password";

    static final byte[] PBKDF2_SALT = "Yubico".getBytes(UTF_8);
    static final int PBKDF2_ITERATIONS = 10_000;

    private static final int HALF = SIZE / 2;

    private final byte[] keyMaterial;

    private AuthenticationKey(byte[] keyMaterial) {
        this.keyMaterial = keyMaterial;
    }

    /**
     * Derives an authentication key from a password.
     *
     * @param password the password. The caller may wipe the array once this returns.
     * @return the derived key.
     */
    public static AuthenticationKey fromPassword(char[] password) {
        requireNonNull(password, "password");
        return new AuthenticationKey(Crypto.pbkdf2(password, PBKDF2_SALT, PBKDF2_ITERATIONS, SIZE));
    }

    /**
     * The factory-default credential, derived from {@value #DEFAULT_PASSWORD}.
     */
    public static AuthenticationKey defaultKey() {
        return fromPassword(DEFAULT_PASSWORD.toCharArray());
    }

    public static AuthenticationKey fromBytes(byte[] keyMaterial) {
        Utils.require(requireNonNull(keyMaterial, "keyMaterial").length == SIZE,
                "Authentication key must be " + SIZE + " bytes");
        return new AuthenticationKey(keyMaterial.clone());
    }

    static AuthenticationKey random() {
        return new AuthenticationKey(Crypto.randomBytes(SIZE));
    }

    public byte[] encryptionKey() {
        return Arrays.copyOfRange(keyMaterial, 0, HALF);
    }

    public byte[] macKey() {
        return Arrays.copyOfRange(keyMaterial, HALF, SIZE);
    }

    byte[] toByteArray() {
        return keyMaterial.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof AuthenticationKey)) { return false; }
        return Crypto.constantTimeEquals(keyMaterial, ((AuthenticationKey) other).keyMaterial);
    }

    @Override
    public int hashCode() {
        return SIZE;
    }

    @Override
    public String toString() {
        return "AuthenticationKey{<redacted>}";
    }
}
