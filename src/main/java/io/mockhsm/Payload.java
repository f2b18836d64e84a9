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

import java.math.BigInteger;
import java.security.PrivateKey;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.EdECPrivateKey;
import java.security.spec.ECPrivateKeySpec;
import java.security.spec.EdECPrivateKeySpec;
import java.security.spec.NamedParameterSpec;

/**
 * The raw key material or data of a stored object. There is one variant per {@link Algorithm.Family}, and each
 * variant knows how long its material must be for a given algorithm:
 * <ul>
 *     <li>{@link AuthenticationKeyPayload} - a 32-byte session authentication key.</li>
 *     <li>{@link AsymmetricKeyPayload} - an EC private scalar or Ed25519 seed.</li>
 *     <li>{@link HmacKeyPayload} - an HMAC key.</li>
 *     <li>{@link WrapKeyPayload} - an AES key used to wrap other objects.</li>
 *     <li>{@link OpaquePayload} - arbitrary data such as an X.509 certificate.</li>
 * </ul>
 * Payloads are immutable and never reveal their contents through {@link #toString()}.
 */
public abstract sealed class Payload {
    private final Algorithm algorithm;

    private Payload(Algorithm algorithm) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
    }

    /**
     * Generates fresh material for the given algorithm.
     *
     * @param algorithm the algorithm.
     * @return a new payload of {@link Algorithm#keyLength()} bytes.
     * @throws UnsupportedAlgorithmException if material for this algorithm cannot be generated on the device.
     */
    public static Payload generate(Algorithm algorithm) throws UnsupportedAlgorithmException {
        switch (algorithm.family()) {
            case AUTHENTICATION:
                return new AuthenticationKeyPayload(algorithm, AuthenticationKey.random());
            case ASYMMETRIC:
                return AsymmetricKeyPayload.generateKey(algorithm);
            case HMAC:
                return new HmacKeyPayload(algorithm, Crypto.randomBytes(algorithm.keyLength()));
            case WRAP:
                return new WrapKeyPayload(algorithm, Crypto.randomBytes(algorithm.keyLength()));
            case OPAQUE:
                throw new UnsupportedAlgorithmException(algorithm, "cannot generate " + algorithm + " objects");
            default:
                throw new AssertionError("Unhandled algorithm family: " + algorithm.family());
        }
    }

    /**
     * Builds a payload from externally supplied material. The bytes are copied.
     *
     * @param algorithm the algorithm the material is for.
     * @param bytes the material.
     * @return the payload.
     * @throws IllegalArgumentException if the material is not valid for the algorithm.
     */
    public static Payload fromBytes(Algorithm algorithm, byte[] bytes) {
        requireNonNull(bytes, "bytes");
        Utils.require(bytes.length >= algorithm.minLength() && bytes.length <= algorithm.maxLength(),
                "Invalid " + algorithm + " material length: " + bytes.length);
        switch (algorithm.family()) {
            case AUTHENTICATION:
                return new AuthenticationKeyPayload(algorithm, AuthenticationKey.fromBytes(bytes));
            case ASYMMETRIC:
                return AsymmetricKeyPayload.fromKeyBytes(algorithm, bytes.clone());
            case HMAC:
                return new HmacKeyPayload(algorithm, bytes.clone());
            case WRAP:
                return new WrapKeyPayload(algorithm, bytes.clone());
            case OPAQUE:
                return new OpaquePayload(algorithm, bytes.clone());
            default:
                throw new AssertionError("Unhandled algorithm family: " + algorithm.family());
        }
    }

    public Algorithm algorithm() {
        return algorithm;
    }

    /**
     * The number of bytes of material in this payload.
     */
    public abstract int length();

    /**
     * Returns a copy of the raw material. Callers own the returned array and should wipe it when finished.
     */
    public abstract byte[] toByteArray();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{algorithm=" + algorithm + ", length=" + length() + '}';
    }

    /**
     * Common base for the variants that hold their material as a plain byte array.
     */
    private abstract static sealed class RawPayload extends Payload {
        final byte[] material;

        RawPayload(Algorithm algorithm, byte[] material) {
            super(algorithm);
            this.material = material;
        }

        @Override
        public int length() {
            return material.length;
        }

        @Override
        public byte[] toByteArray() {
            return material.clone();
        }
    }

    public static final class AuthenticationKeyPayload extends Payload {
        private final AuthenticationKey key;

        private AuthenticationKeyPayload(Algorithm algorithm, AuthenticationKey key) {
            super(algorithm);
            this.key = requireNonNull(key, "key");
        }

        static AuthenticationKeyPayload of(AuthenticationKey key) {
            return new AuthenticationKeyPayload(Algorithm.AES128_YUBICO_AUTHENTICATION, key);
        }

        public AuthenticationKey authenticationKey() {
            return key;
        }

        @Override
        public int length() {
            return AuthenticationKey.SIZE;
        }

        @Override
        public byte[] toByteArray() {
            return key.toByteArray();
        }
    }

    public static final class AsymmetricKeyPayload extends RawPayload {

        private AsymmetricKeyPayload(Algorithm algorithm, byte[] material) {
            super(algorithm, material);
        }

        static AsymmetricKeyPayload generateKey(Algorithm algorithm) {
            var curveName = algorithm.curveName();
            if (curveName.isPresent()) {
                var keyPair = Crypto.generateKeyPair("EC", curveName.get());
                var scalar = ((ECPrivateKey) keyPair.getPrivate()).getS();
                return new AsymmetricKeyPayload(algorithm, Utils.toUnsignedBigEndian(scalar, algorithm.keyLength()));
            }
            var keyPair = Crypto.generateKeyPair("Ed25519", null);
            var seed = ((EdECPrivateKey) keyPair.getPrivate()).getBytes()
                    .orElseThrow(() -> new IllegalStateException("Ed25519 private key is not extractable"));
            return new AsymmetricKeyPayload(algorithm, seed);
        }

        static AsymmetricKeyPayload fromKeyBytes(Algorithm algorithm, byte[] material) {
            var curveName = algorithm.curveName();
            if (curveName.isPresent()) {
                var order = Crypto.curveParameters(curveName.get()).getOrder();
                var scalar = Utils.fromUnsignedBigEndian(material);
                if (scalar.signum() == 0 || scalar.compareTo(order) >= 0) {
                    Utils.wipe(material);
                    throw new IllegalArgumentException("Private scalar out of range for " + algorithm);
                }
            }
            return new AsymmetricKeyPayload(algorithm, material);
        }

        /**
         * Materializes the stored key as a JCA private key, for use by signing and key agreement operations.
         */
        public PrivateKey privateKey() {
            var curveName = algorithm().curveName();
            if (curveName.isPresent()) {
                var spec = new ECPrivateKeySpec(new BigInteger(1, material), Crypto.curveParameters(curveName.get()));
                return Crypto.privateKey("EC", spec);
            }
            return Crypto.privateKey("Ed25519", new EdECPrivateKeySpec(NamedParameterSpec.ED25519, material));
        }
    }

    public static final class HmacKeyPayload extends RawPayload {
        private HmacKeyPayload(Algorithm algorithm, byte[] material) {
            super(algorithm, material);
        }
    }

    public static final class WrapKeyPayload extends RawPayload {
        private WrapKeyPayload(Algorithm algorithm, byte[] material) {
            super(algorithm, material);
        }
    }

    public static final class OpaquePayload extends RawPayload {
        private OpaquePayload(Algorithm algorithm, byte[] material) {
            super(algorithm, material);
        }
    }
}
