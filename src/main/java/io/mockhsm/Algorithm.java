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
 * The algorithms an object may be tagged with. Each algorithm belongs to exactly one {@link ObjectType} and one
 * {@link Family}, and knows the size of the key material it uses:
 * <ul>
 *     <li>{@link #keyLength()} is the size of freshly generated material.</li>
 *     <li>{@link #minLength()} and {@link #maxLength()} bound the size of imported material. For fixed-size keys
 *     all three are equal.</li>
 * </ul>
 * The set is closed: anything the device does not list here cannot be stored.
 */
public enum Algorithm {
    EC_P256(12, Family.ASYMMETRIC, 32, "secp256r1"),
    EC_P384(13, Family.ASYMMETRIC, 48, "secp384r1"),
    EC_P521(14, Family.ASYMMETRIC, 66, "secp521r1"),
    EC_ED25519(46, Family.ASYMMETRIC, 32, null),

    HMAC_SHA1(19, Family.HMAC, 20, 1, 64),
    HMAC_SHA256(20, Family.HMAC, 32, 1, 64),
    HMAC_SHA384(21, Family.HMAC, 48, 1, 128),
    HMAC_SHA512(22, Family.HMAC, 64, 1, 128),

    AES128_CCM_WRAP(29, Family.WRAP, 16),
    AES192_CCM_WRAP(41, Family.WRAP, 24),
    AES256_CCM_WRAP(42, Family.WRAP, 32),

    OPAQUE_DATA(30, Family.OPAQUE, 0, 1, Algorithm.MAX_OBJECT_SIZE),
    OPAQUE_X509_CERTIFICATE(31, Family.OPAQUE, 0, 1, Algorithm.MAX_OBJECT_SIZE),

    AES128_YUBICO_AUTHENTICATION(38, Family.AUTHENTICATION, AuthenticationKey.SIZE);

    /**
     * The largest payload the device accepts for a single object.
     */
    public static final int MAX_OBJECT_SIZE = 2028;

    private final int code;
    private final Family family;
    private final int keyLength;
    private final int minLength;
    private final int maxLength;
    private final String curveName;

    Algorithm(int code, Family family, int keyLength) {
        this(code, family, keyLength, keyLength, keyLength, null);
    }

    Algorithm(int code, Family family, int keyLength, String curveName) {
        this(code, family, keyLength, keyLength, keyLength, curveName);
    }

    Algorithm(int code, Family family, int keyLength, int minLength, int maxLength) {
        this(code, family, keyLength, minLength, maxLength, null);
    }

    Algorithm(int code, Family family, int keyLength, int minLength, int maxLength, String curveName) {
        this.code = code;
        this.family = family;
        this.keyLength = keyLength;
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.curveName = curveName;
    }

    public int code() {
        return code;
    }

    public Family family() {
        return family;
    }

    public ObjectType objectType() {
        return family.objectType;
    }

    /**
     * The length of freshly generated key material, or 0 if this algorithm cannot be generated.
     */
    public int keyLength() {
        return keyLength;
    }

    public int minLength() {
        return minLength;
    }

    public int maxLength() {
        return maxLength;
    }

    /**
     * The JCA standard name of the elliptic curve used by this algorithm, for short-Weierstrass EC algorithms only.
     */
    Optional<String> curveName() {
        return Optional.ofNullable(curveName);
    }

    public static Optional<Algorithm> fromCode(int code) {
        for (var algorithm : values()) {
            if (algorithm.code == code) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }

    /**
     * The families of key material a device stores. Each family is represented by one {@link Payload} variant.
     */
    public enum Family {
        AUTHENTICATION(ObjectType.AUTHENTICATION_KEY),
        ASYMMETRIC(ObjectType.ASYMMETRIC_KEY),
        HMAC(ObjectType.HMAC_KEY),
        WRAP(ObjectType.WRAP_KEY),
        OPAQUE(ObjectType.OPAQUE);

        private final ObjectType objectType;

        Family(ObjectType objectType) {
            this.objectType = objectType;
        }

        public ObjectType objectType() {
            return objectType;
        }
    }
}
