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

import javax.crypto.SecretKey;

/**
 * A working copy of a stored wrap key, handed to a {@link WrapCipher} for the duration of a single wrap or unwrap
 * call. Closing the key scrubs its material, so the stored payload remains the only long-lived copy.
 */
final class WrapKey implements SecretKey, AutoCloseable {
    private final byte[] keyMaterial;
    private volatile boolean destroyed;

    /**
     * Takes a private copy of the given AES key material.
     */
    WrapKey(byte[] keyMaterial) {
        this.keyMaterial = requireNonNull(keyMaterial, "keyMaterial").clone();
    }

    int size() {
        return keyMaterial.length;
    }

    @Override
    public String getAlgorithm() {
        return "AES";
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        if (destroyed) {
            throw new IllegalStateException("Wrap key has been destroyed");
        }
        return keyMaterial.clone();
    }

    @Override
    public void destroy() {
        destroyed = true;
        Utils.wipe(keyMaterial);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public String toString() {
        return "WrapKey{size=" + keyMaterial.length + ", destroyed=" + destroyed + '}';
    }
}
