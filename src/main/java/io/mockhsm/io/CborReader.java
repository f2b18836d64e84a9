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

package io.mockhsm.io;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Objects;

import co.nstant.in.cbor.CborDecoder;
import co.nstant.in.cbor.CborException;
import co.nstant.in.cbor.model.Array;
import co.nstant.in.cbor.model.ByteString;
import co.nstant.in.cbor.model.DataItem;
import co.nstant.in.cbor.model.UnicodeString;
import co.nstant.in.cbor.model.UnsignedInteger;

/**
 * Reads structured records written by {@link CborWriter}. Any deviation from the expected structure is reported
 * as an {@link IOException}.
 */
public final class CborReader implements Closeable {
    private static final int MAJOR_TYPE_ARRAY = 4;

    private final InputStream inputStream;
    private final CborDecoder decoder;

    /**
     * Initializes the reader with the given input stream.
     *
     * @param inputStream the stream to read CBOR data items from.
     */
    public CborReader(InputStream inputStream) {
        this.inputStream = new BufferedInputStream(Objects.requireNonNull(inputStream, "inputStream"));
        this.decoder = new CborDecoder(this.inputStream);
    }

    public byte[] readBytes() throws IOException {
        return decodeNext(ByteString.class).getBytes();
    }

    public String readString() throws IOException {
        return decodeNext(UnicodeString.class).getString();
    }

    public long readUnsigned() throws IOException {
        return toLong(decodeNext(UnsignedInteger.class));
    }

    /**
     * Begins reading a CBOR array from the input stream.
     *
     * @return an {@link ArrayReader} to read individual items from the array.
     * @throws IOException if an I/O error occurs or the next item is not an array.
     */
    public ArrayReader readArray() throws IOException {
        return new ArrayReader(decodeNext(Array.class));
    }

    /**
     * Begins reading a CBOR array whose header declares at most {@code maxSize} items. The header is checked before
     * any of the array contents are decoded.
     *
     * @param maxSize the largest acceptable number of items.
     * @return an {@link ArrayReader} to read individual items from the array.
     * @throws IOException if an I/O error occurs, the next item is not an array or it declares too many items.
     */
    public ArrayReader readArray(int maxSize) throws IOException {
        var declared = peekArrayLength();
        if (declared > maxSize) {
            throw new IOException("Array declares " + declared + " items but at most " + maxSize + " are allowed");
        }
        return readArray();
    }

    /**
     * Checks that no further data items remain in the input.
     *
     * @throws IOException if there is trailing data.
     */
    public void requireEndOfInput() throws IOException {
        try {
            if (decoder.decodeNext() != null) {
                throw new IOException("Unexpected trailing data after CBOR record");
            }
        } catch (CborException e) {
            throw new IOException("Unexpected trailing data after CBOR record", e);
        }
    }

    /**
     * Closes the underlying input stream.
     *
     * @throws IOException if an I/O error occurs while closing the underlying stream.
     */
    @Override
    public void close() throws IOException {
        inputStream.close();
    }

    private <T extends DataItem> T decodeNext(Class<T> expectedType) throws IOException {
        try {
            var dataItem = decoder.decodeNext();
            if (dataItem == null) {
                throw new EOFException();
            }
            if (expectedType.isInstance(dataItem)) {
                return expectedType.cast(dataItem);
            }
            throw new IOException("Unexpected CBOR data item - expected " + expectedType.getSimpleName() +
                    " but got " + dataItem.getClass().getSimpleName());
        } catch (CborException e) {
            if (e.getCause() instanceof IOException) {
                throw (IOException) e.getCause();
            }
            throw new IOException(e);
        }
    }

    // Returns the item count from a definite-length array header, or -1 for an indefinite-length array.
    private long peekArrayLength() throws IOException {
        inputStream.mark(9);
        try {
            var initial = readByte();
            if ((initial >>> 5) != MAJOR_TYPE_ARRAY) {
                throw new IOException("Unexpected CBOR data item - expected Array");
            }
            var info = initial & 0x1F;
            if (info < 24) {
                return info;
            }
            if (info == 31) {
                return -1;
            }
            if (info > 27) {
                throw new IOException("Invalid CBOR array header: " + Integer.toHexString(initial));
            }
            var length = 0L;
            for (int i = 0; i < 1 << (info - 24); i++) {
                length = (length << 8) | readByte();
            }
            return length < 0 ? Long.MAX_VALUE : length;
        } finally {
            inputStream.reset();
        }
    }

    private int readByte() throws IOException {
        var b = inputStream.read();
        if (b < 0) {
            throw new EOFException();
        }
        return b;
    }

    private static long toLong(UnsignedInteger value) throws IOException {
        var bigValue = value.getValue();
        if (bigValue.bitLength() > 63) {
            throw new IOException("Unsigned integer too large: " + bigValue);
        }
        return bigValue.longValue();
    }

    /**
     * A facade for reading data items from a CBOR array object.
     *
     * @implNote The current implementation reads the entire array contents into memory and then simply returns
     * subsequent items from the array data in response to method calls on this object.
     */
    public static final class ArrayReader implements Closeable {
        private final Iterator<DataItem> dataItemIterator;
        private final int size;

        private ArrayReader(Array items) {
            this.size = items.getDataItems().size();
            this.dataItemIterator = items.getDataItems().iterator();
        }

        /**
         * The total number of items in the array. This doesn't change as items are read.
         */
        public int size() {
            return size;
        }

        public byte[] readBytes() throws IOException {
            return readNext(ByteString.class).getBytes();
        }

        public String readString() throws IOException {
            return readNext(UnicodeString.class).getString();
        }

        public long readUnsigned() throws IOException {
            return toLong(readNext(UnsignedInteger.class));
        }

        /**
         * Reads an unsigned integer and checks that it lies within the given inclusive bound.
         *
         * @param max the largest acceptable value.
         * @return the value read.
         * @throws IOException if the next item is not an unsigned integer or is larger than {@code max}.
         */
        public int readUnsigned(int max) throws IOException {
            var value = readUnsigned();
            if (value > max) {
                throw new IOException("Integer value " + value + " exceeds maximum " + max);
            }
            return (int) value;
        }

        /**
         * Checks that all items have been consumed from the array.
         *
         * @throws IOException if not all elements of the array have been read.
         */
        @Override
        public void close() throws IOException {
            if (dataItemIterator.hasNext()) {
                throw new IOException("Extra items not read from array");
            }
        }

        private <T extends DataItem> T readNext(Class<T> expectedType) throws IOException {
            if (!dataItemIterator.hasNext()) {
                throw new EOFException();
            }
            var next = dataItemIterator.next();
            if (!expectedType.isInstance(next)) {
                throw new IOException("Unexpected CBOR data item in array: was expecting " +
                        expectedType.getSimpleName() + " but got " + next.getClass().getSimpleName());
            }
            return expectedType.cast(next);
        }
    }
}
