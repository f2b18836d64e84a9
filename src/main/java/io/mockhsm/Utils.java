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

import java.math.BigInteger;
import java.util.Arrays;

final class Utils {
    static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    static int requireObjectId(int objectId) {
        require(objectId >= 0 && objectId <= 0xFFFF, "Object id must be a 16-bit unsigned value: " + objectId);
        return objectId;
    }

    /**
     * Encodes a non-negative integer as a fixed-length big-endian byte array, as used for raw EC private scalars.
     *
     * @param value the value to encode.
     * @param length the required output length.
     * @return the encoded value, left-padded with zero bytes.
     * @throws IllegalArgumentException if the value does not fit into the given length.
     */
    static byte[] toUnsignedBigEndian(BigInteger value, int length) {
        require(value.signum() >= 0, "Value must not be negative");
        var bytes = value.toByteArray();
        if (bytes.length > length && bytes[0] == 0) {
            // Remove sign byte
            bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        require(bytes.length <= length, "Value too large for " + length + " bytes");
        var result = new byte[length];
        System.arraycopy(bytes, 0, result, length - bytes.length, bytes.length);
        wipe(bytes);
        return result;
    }

    static BigInteger fromUnsignedBigEndian(byte[] bigEndian) {
        return new BigInteger(1, bigEndian);
    }

    static String hex(byte[] data) {
        if (data.length == 0) {
            return "";
        }
        var i = new BigInteger(1, data);
        return String.format("%0" + (data.length << 1) + "x", i);
    }

    /**
     * Attempts to wipe any sensitive data from memory by writing zero bytes over the array contents. This is a
     * best-effort attempt, because the garbage collector may already have copied the data elsewhere in the heap.
     *
     * @param sensitiveData the arrays to wipe. Null arguments are ignored.
     */
    static void wipe(byte[]... sensitiveData) {
        for (var data : sensitiveData) {
            if (data != null) {
                Arrays.fill(data, (byte) 0);
            }
        }
    }

    private Utils() {}
}
