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

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

import co.nstant.in.cbor.CborBuilder;
import co.nstant.in.cbor.CborEncoder;
import co.nstant.in.cbor.CborException;
import co.nstant.in.cbor.builder.ArrayBuilder;
import co.nstant.in.cbor.model.ByteString;
import co.nstant.in.cbor.model.DataItem;
import co.nstant.in.cbor.model.UnicodeString;
import co.nstant.in.cbor.model.UnsignedInteger;

/**
 * Writes structured records to an output stream in <a href="https://cbor.io">CBOR</a> format. Only the handful of
 * data types needed for wrapped objects are supported. Output is deterministic: the same sequence of calls always
 * produces the same bytes.
 */
public final class CborWriter implements Closeable, Flushable {
    private final OutputStream outputStream;
    private final CborEncoder encoder;

    public CborWriter(OutputStream outputStream) {
        this.outputStream = Objects.requireNonNull(outputStream, "outputStream");
        this.encoder = new CborEncoder(outputStream);
    }

    public CborWriter writeBytes(byte[] bytes) throws IOException {
        write(new ByteString(bytes));
        return this;
    }

    public CborWriter writeString(String string) throws IOException {
        write(new UnicodeString(string));
        return this;
    }

    public CborWriter writeUnsigned(long value) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("Value must not be negative: " + value);
        }
        write(new UnsignedInteger(value));
        return this;
    }

    /**
     * Begins writing a definite-length array. The array is buffered and written when {@link ArrayWriter#end()}
     * is called.
     *
     * @return a writer for the array elements.
     */
    public ArrayWriter beginArray() {
        return new ArrayWriter(this);
    }

    @Override
    public void close() throws IOException {
        outputStream.close();
    }

    @Override
    public void flush() throws IOException {
        outputStream.flush();
    }

    private void write(DataItem dataItem) throws IOException {
        try {
            encoder.encode(dataItem);
        } catch (CborException e) {
            throw unwrap(e);
        }
    }

    private static IOException unwrap(CborException e) {
        if (e.getCause() instanceof IOException) {
            return (IOException) e.getCause();
        }
        return new IOException(e);
    }

    public static final class ArrayWriter {
        private final ArrayBuilder<CborBuilder> builder;
        private final CborWriter cborWriter;

        private ArrayWriter(CborWriter cborWriter) {
            this.cborWriter = cborWriter;
            this.builder = new CborBuilder().addArray();
        }

        public ArrayWriter writeBytes(byte[] bytes) {
            builder.add(bytes);
            return this;
        }

        public ArrayWriter writeString(String string) {
            builder.add(string);
            return this;
        }

        public ArrayWriter writeUnsigned(long value) {
            if (value < 0) {
                throw new IllegalArgumentException("Value must not be negative: " + value);
            }
            builder.add(value);
            return this;
        }

        public CborWriter end() throws IOException {
            try {
                cborWriter.encoder.encode(builder.end().build());
                return cborWriter;
            } catch (CborException e) {
                throw unwrap(e);
            }
        }
    }
}
