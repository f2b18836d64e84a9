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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

import io.mockhsm.io.CborReader;
import io.mockhsm.io.CborWriter;

/**
 * The plaintext envelope that is sealed when an object is exported under wrap: the object's metadata together with
 * its raw payload bytes. Envelopes only exist for the duration of a wrap or unwrap call.
 * <p>
 * The encoding is a single CBOR array:
 * <pre>
 * [ version, id, type, algorithm, capabilities, delegatedCapabilities, domains, length, sequence, origin, label,
 *   data ]
 * </pre>
 * All integers are unsigned, the label is a text string and the data is a byte string.
 */
final class WrappedObject {
    private static final RedactedLogger logger = RedactedLogger.getLogger(WrappedObject.class);

    static final int FORMAT_VERSION = 1;
    private static final int FIELD_COUNT = 12;

    private final ObjectInfo info;
    private final byte[] data;

    WrappedObject(ObjectInfo info, byte[] data) {
        this.info = requireNonNull(info, "info");
        this.data = requireNonNull(data, "data");
    }

    ObjectInfo info() {
        return info;
    }

    byte[] data() {
        return data;
    }

    byte[] encode() {
        try (var baos = new ByteArrayOutputStream();
             var out = new CborWriter(baos)) {
            out.beginArray()
                    .writeUnsigned(FORMAT_VERSION)
                    .writeUnsigned(info.objectId())
                    .writeUnsigned(info.objectType().code())
                    .writeUnsigned(info.algorithm().code())
                    .writeUnsigned(info.capabilities().bits())
                    .writeUnsigned(info.delegatedCapabilities().bits())
                    .writeUnsigned(info.domains().bits())
                    .writeUnsigned(info.length())
                    .writeUnsigned(info.sequence())
                    .writeUnsigned(info.origin().code())
                    .writeString(info.label().value())
                    .writeBytes(data)
                    .end();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Decodes an envelope, validating every field.
     *
     * @param encoded the encoded envelope.
     * @return the decoded envelope.
     * @throws IOException if the envelope is malformed.
     */
    static WrappedObject decode(byte[] encoded) throws IOException {
        try (var in = new CborReader(new ByteArrayInputStream(encoded))) {
            var array = in.readArray(FIELD_COUNT);
            if (array.size() != FIELD_COUNT) {
                throw new IOException("Expected " + FIELD_COUNT + " envelope fields but got " + array.size());
            }
            var version = array.readUnsigned();
            if (version != FORMAT_VERSION) {
                throw new IOException("Unsupported envelope version: " + version);
            }
            var objectId = array.readUnsigned(0xFFFF);
            var typeCode = array.readUnsigned(0xFF);
            var objectType = ObjectType.fromCode(typeCode)
                    .orElseThrow(() -> new IOException("Unknown object type: " + typeCode));
            var algorithmCode = array.readUnsigned(0xFF);
            var algorithm = Algorithm.fromCode(algorithmCode)
                    .orElseThrow(() -> new IOException("Unknown algorithm: " + algorithmCode));
            var capabilities = array.readUnsigned();
            var delegatedCapabilities = array.readUnsigned();
            var domains = array.readUnsigned(0xFFFF);
            var length = array.readUnsigned(0xFFFF);
            var sequence = array.readUnsigned(0xFF);
            var originCode = array.readUnsigned(0xFF);
            var origin = ObjectOrigin.fromCode(originCode)
                    .orElseThrow(() -> new IOException("Unknown object origin: " + originCode));
            var label = array.readString();
            var data = array.readBytes();
            array.close();
            in.requireEndOfInput();

            if (length != data.length) {
                throw new IOException("Declared length " + length + " does not match data length " + data.length);
            }

            var info = new ObjectInfo(objectId, objectType, algorithm, Capability.fromBits(capabilities),
                    Capability.fromBits(delegatedCapabilities), Domain.fromBits(domains), length, sequence, origin,
                    ObjectLabel.of(label));
            logger.trace("Decoded wrapped object {} ({} bytes of data)", info.handle(), data.length);
            return new WrappedObject(info, data);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid wrapped object metadata: " + e.getMessage(), e);
        }
    }
}
