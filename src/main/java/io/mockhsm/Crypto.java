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

import java.security.AlgorithmParameters;
import java.security.InvalidAlgorithmParameterException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.InvalidParameterSpecException;
import java.security.spec.KeySpec;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

import software.pando.crypto.nacl.Bytes;

final class Crypto {
    static final String PBKDF2_ALGORITHM = "PBKDF2WithHmacSHA256";

    static byte[] randomBytes(int numBytes) {
        return Bytes.secureRandom(numBytes);
    }

    static boolean constantTimeEquals(byte[] a, byte[] b) {
        return Bytes.equal(a, b);
    }

    static byte[] pbkdf2(char[] password, byte[] salt, int iterations, int outputBytes) {
        var spec = new PBEKeySpec(password, salt, iterations, outputBytes * 8);
        try {
            return SecretKeyFactory.getInstance(PBKDF2_ALGORITHM).generateSecret(spec).getEncoded();
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("JVM doesn't support " + PBKDF2_ALGORITHM, e);
        } catch (InvalidKeySpecException e) {
            throw new IllegalArgumentException(e);
        } finally {
            spec.clearPassword();
        }
    }

    static KeyPair generateKeyPair(String algorithm, String curveName) {
        try {
            var generator = KeyPairGenerator.getInstance(algorithm);
            if (curveName != null) {
                generator.initialize(new ECGenParameterSpec(curveName));
            }
            return generator.generateKeyPair();
        } catch (NoSuchAlgorithmException | InvalidAlgorithmParameterException e) {
            throw new AssertionError("JVM doesn't support " + algorithm + " key generation", e);
        }
    }

    static ECParameterSpec curveParameters(String curveName) {
        try {
            var parameters = AlgorithmParameters.getInstance("EC");
            parameters.init(new ECGenParameterSpec(curveName));
            return parameters.getParameterSpec(ECParameterSpec.class);
        } catch (NoSuchAlgorithmException | InvalidParameterSpecException e) {
            throw new AssertionError("JVM doesn't support curve " + curveName, e);
        }
    }

    static PrivateKey privateKey(String algorithm, KeySpec keySpec) {
        try {
            return KeyFactory.getInstance(algorithm).generatePrivate(keySpec);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("JVM doesn't support " + algorithm + " keys", e);
        } catch (InvalidKeySpecException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private Crypto() {}
}
