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
 * An AEAD cipher used to seal and open wrapped objects. Both operations work in place on a single buffer whose last
 * {@link #tagSizeBytes()} bytes are reserved for the authentication tag:
 * <pre>
 *     seal:  [ plaintext | tag-sized padding ]  becomes  [ ciphertext | tag ]
 *     open:  [ ciphertext | tag ]               becomes  [ plaintext | zeroes ]
 * </pre>
 * Nonces are always {@value WrapNonce#AEAD_NONCE_SIZE} bytes.
 */
interface WrapCipher {

    /**
     * A unique identifier for this cipher, for logging.
     */
    String getIdentifier();

    int keySizeBytes();

    int tagSizeBytes();

    /**
     * Imports raw wrap key material. The cipher makes its own copy, so callers can wipe the input afterwards.
     *
     * @param keyMaterial the key bytes, exactly {@link #keySizeBytes()} long.
     * @return the imported key, which the caller should destroy when finished.
     */
    WrapKey importKey(byte[] keyMaterial);

    /**
     * Encrypts and authenticates a buffer in place.
     *
     * @param key the wrap key.
     * @param nonce the nonce.
     * @param associatedData data to authenticate but not encrypt (may be empty).
     * @param buffer the plaintext followed by {@link #tagSizeBytes()} bytes of padding.
     */
    void sealInPlace(WrapKey key, byte[] nonce, byte[] associatedData, byte[] buffer);

    /**
     * Decrypts and verifies a buffer in place. No information is given about why verification failed. On failure the
     * buffer is wiped so that no unverified plaintext is released.
     *
     * @param key the wrap key.
     * @param nonce the nonce used when sealing.
     * @param associatedData the associated data used when sealing.
     * @param buffer the ciphertext followed by the tag.
     * @return true if the tag verified, in which case the first {@code buffer.length - tagSizeBytes()} bytes hold
     * the plaintext.
     */
    boolean openInPlace(WrapKey key, byte[] nonce, byte[] associatedData, byte[] buffer);

    /**
     * Selects the cipher used for wrap keys of the given algorithm. The CCM-named wrap algorithms are served by
     * AES-GCM with the same key size; AES-192 keys have no cipher.
     *
     * @param algorithm the wrap key's algorithm.
     * @return the cipher, or empty if the algorithm cannot be used for wrapping.
     */
    static Optional<WrapCipher> forAlgorithm(Algorithm algorithm) {
        switch (algorithm) {
            case AES128_CCM_WRAP:
                return Optional.of(AesGcmWrapCipher.A128GCM);
            case AES256_CCM_WRAP:
                return Optional.of(AesGcmWrapCipher.A256GCM);
            default:
                return Optional.empty();
        }
    }
}
