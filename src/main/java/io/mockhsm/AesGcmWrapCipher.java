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

import static io.mockhsm.Utils.require;
import static java.util.Objects.requireNonNull;

import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.spec.GCMParameterSpec;

/**
 * AES in Galois/Counter Mode with a 96-bit nonce and a 128-bit tag. Two key sizes are supported, 128 and 256 bits.
 * <p>
 * A new {@link Cipher} is obtained for every call: the JDK provider refuses to re-initialise an encrypting GCM
 * cipher with a key and IV it has already used, and wrap nonces are chosen by the caller.
 */
final class AesGcmWrapCipher implements WrapCipher {
    private static final RedactedLogger logger = RedactedLogger.getLogger(AesGcmWrapCipher.class);
    private static final String ENC_ALGORITHM = "AES/GCM/NoPadding";
    private static final int TAG_SIZE = 16;

    static final AesGcmWrapCipher A128GCM = new AesGcmWrapCipher("A128GCM", 16);
    static final AesGcmWrapCipher A256GCM = new AesGcmWrapCipher("A256GCM", 32);

    private final String identifier;
    private final int keySize;

    private AesGcmWrapCipher(String identifier, int keySize) {
        this.identifier = identifier;
        this.keySize = keySize;
    }

    @Override
    public String getIdentifier() {
        return identifier;
    }

    @Override
    public int keySizeBytes() {
        return keySize;
    }

    @Override
    public int tagSizeBytes() {
        return TAG_SIZE;
    }

    @Override
    public WrapKey importKey(byte[] keyMaterial) {
        require(requireNonNull(keyMaterial).length == keySize, identifier + " key must be " + keySize + " bytes");
        return new WrapKey(keyMaterial);
    }

    @Override
    public void sealInPlace(WrapKey key, byte[] nonce, byte[] associatedData, byte[] buffer) {
        require(buffer.length >= TAG_SIZE, "Buffer has no room for the authentication tag");
        var cipher = init(Cipher.ENCRYPT_MODE, key, nonce, associatedData);
        byte[] sealed = null;
        try {
            sealed = cipher.doFinal(buffer, 0, buffer.length - TAG_SIZE);
            assert sealed.length == buffer.length;
            System.arraycopy(sealed, 0, buffer, 0, sealed.length);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        } finally {
            Utils.wipe(sealed);
        }
    }

    @Override
    public boolean openInPlace(WrapKey key, byte[] nonce, byte[] associatedData, byte[] buffer) {
        if (buffer.length < TAG_SIZE) {
            logger.debug("Ciphertext shorter than {} byte tag", TAG_SIZE);
            return false;
        }
        var cipher = init(Cipher.DECRYPT_MODE, key, nonce, associatedData);
        try {
            var plaintext = cipher.doFinal(buffer, 0, buffer.length);
            System.arraycopy(plaintext, 0, buffer, 0, plaintext.length);
            Utils.wipe(plaintext);
            Arrays.fill(buffer, buffer.length - TAG_SIZE, buffer.length, (byte) 0);
            return true;
        } catch (AEADBadTagException e) {
            logger.debug("{} tag verification failed", identifier);
            Utils.wipe(buffer);
            return false;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    private Cipher init(int mode, WrapKey key, byte[] nonce, byte[] associatedData) {
        require(key.size() == keySize, identifier + " key must be " + keySize + " bytes");
        require(nonce.length == WrapNonce.AEAD_NONCE_SIZE, "Nonce must be " + WrapNonce.AEAD_NONCE_SIZE + " bytes");
        try {
            var cipher = Cipher.getInstance(ENC_ALGORITHM);
            cipher.init(mode, key, new GCMParameterSpec(TAG_SIZE * 8, nonce));
            if (associatedData.length > 0) {
                cipher.updateAAD(associatedData);
            }
            return cipher;
        } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
            throw new AssertionError("JVM doesn't support AES/GCM encryption", e);
        } catch (InvalidKeyException | InvalidAlgorithmParameterException e) {
            throw new IllegalArgumentException(e);
        }
    }

    @Override
    public String toString() {
        return identifier;
    }
}
