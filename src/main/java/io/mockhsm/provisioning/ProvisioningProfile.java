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

package io.mockhsm.provisioning;

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.grack.nanojson.JsonArray;
import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;

import io.mockhsm.Algorithm;
import io.mockhsm.Capability;
import io.mockhsm.Domain;
import io.mockhsm.HsmException;
import io.mockhsm.ObjectHandle;
import io.mockhsm.ObjectLabel;
import io.mockhsm.ObjectStore;
import io.mockhsm.ObjectType;
import io.mockhsm.Payload;

/**
 * The initial inventory of a device, read from JSON:
 * <pre>{@code
 * { "objects": [
 *     { "id": 10, "type": "WRAP_KEY", "algorithm": "AES256_CCM_WRAP", "label": "wrap",
 *       "capabilities": ["EXPORT_WRAPPED", "IMPORT_WRAPPED"],
 *       "delegatedCapabilities": ["EXPORTABLE_UNDER_WRAP"],
 *       "domains": [1, 2],
 *       "data": "<base64url key material>" }
 * ] }
 * }</pre>
 * Objects with a {@code data} member are imported; objects without one are generated. Missing labels, capability
 * lists and domain lists default to empty.
 */
public final class ProvisioningProfile {
    private static final Logger logger = LoggerFactory.getLogger(ProvisioningProfile.class);

    private final List<ProvisionedObject> objects;

    private ProvisioningProfile(List<ProvisionedObject> objects) {
        this.objects = Collections.unmodifiableList(objects);
    }

    /**
     * Reads a profile from a stream of UTF-8 JSON. The stream is not closed.
     *
     * @param in the stream.
     * @return the profile.
     * @throws ProvisioningException if the JSON is malformed or describes an invalid object.
     */
    public static ProvisioningProfile load(InputStream in) throws ProvisioningException {
        requireNonNull(in, "in");
        try {
            return fromJson(JsonParser.object().from(in));
        } catch (JsonParserException e) {
            throw new ProvisioningException("Unable to parse provisioning profile", e);
        }
    }

    /**
     * Reads a profile from a classpath resource.
     *
     * @param resourceName the absolute resource name, such as {@code /provisioning/default.json}.
     * @return the profile.
     * @throws ProvisioningException if the resource is missing or invalid.
     * @throws IOException if the resource cannot be read.
     */
    public static ProvisioningProfile loadResource(String resourceName) throws IOException {
        try (var in = ProvisioningProfile.class.getResourceAsStream(resourceName)) {
            if (in == null) {
                throw new ProvisioningException("No such provisioning profile: " + resourceName);
            }
            logger.debug("Loading provisioning profile {}", resourceName);
            return load(in);
        }
    }

    public static ProvisioningProfile parse(String json) throws ProvisioningException {
        requireNonNull(json, "json");
        try {
            return fromJson(JsonParser.object().from(json));
        } catch (JsonParserException e) {
            throw new ProvisioningException("Unable to parse provisioning profile", e);
        }
    }

    public List<ProvisionedObject> objects() {
        return objects;
    }

    /**
     * Inserts every object of the profile into a store, in profile order. Stops at the first object that cannot be
     * inserted; objects inserted before it remain in the store.
     *
     * @param store the store to populate.
     * @return the handles of the inserted objects.
     * @throws HsmException if an object cannot be inserted.
     */
    public List<ObjectHandle> applyTo(ObjectStore store) throws HsmException {
        var handles = new ArrayList<ObjectHandle>(objects.size());
        for (var object : objects) {
            handles.add(object.insertInto(store));
        }
        logger.info("Provisioned {} objects", handles.size());
        return Collections.unmodifiableList(handles);
    }

    private static ProvisioningProfile fromJson(JsonObject json) throws ProvisioningException {
        var entries = json.get("objects");
        if (!(entries instanceof JsonArray)) {
            throw new ProvisioningException("Profile must contain an \"objects\" array");
        }
        var objects = new ArrayList<ProvisionedObject>();
        for (var entry : (JsonArray) entries) {
            if (!(entry instanceof JsonObject)) {
                throw new ProvisioningException("Profile entry " + objects.size() + " is not an object");
            }
            objects.add(ProvisionedObject.fromJson((JsonObject) entry));
        }
        return new ProvisioningProfile(objects);
    }

    /**
     * One object of a profile.
     */
    public static final class ProvisionedObject {
        private final int objectId;
        private final ObjectType objectType;
        private final Algorithm algorithm;
        private final ObjectLabel label;
        private final Capability capabilities;
        private final Capability delegatedCapabilities;
        private final Domain domains;
        private final byte[] data;

        private ProvisionedObject(int objectId, ObjectType objectType, Algorithm algorithm, ObjectLabel label,
                Capability capabilities, Capability delegatedCapabilities, Domain domains, byte[] data) {
            this.objectId = objectId;
            this.objectType = objectType;
            this.algorithm = algorithm;
            this.label = label;
            this.capabilities = capabilities;
            this.delegatedCapabilities = delegatedCapabilities;
            this.domains = domains;
            this.data = data;
        }

        public int objectId() {
            return objectId;
        }

        public ObjectType objectType() {
            return objectType;
        }

        public Algorithm algorithm() {
            return algorithm;
        }

        public ObjectLabel label() {
            return label;
        }

        public Capability capabilities() {
            return capabilities;
        }

        public Capability delegatedCapabilities() {
            return delegatedCapabilities;
        }

        public Domain domains() {
            return domains;
        }

        /**
         * True if the object is generated on the device rather than imported.
         */
        public boolean isGenerated() {
            return data == null;
        }

        ObjectHandle insertInto(ObjectStore store) throws HsmException {
            if (data == null) {
                return store.generate(objectId, objectType, algorithm, label, capabilities, delegatedCapabilities,
                        domains);
            }
            return store.put(objectId, objectType, algorithm, label, capabilities, delegatedCapabilities, domains,
                    data.clone());
        }

        static ProvisionedObject fromJson(JsonObject json) throws ProvisioningException {
            var objectId = integer(json, "id", 0xFFFF);
            var objectType = constant(json, "type", ObjectType.class);
            var algorithm = constant(json, "algorithm", Algorithm.class);
            if (algorithm.objectType() != objectType) {
                throw new ProvisioningException("Algorithm " + algorithm + " cannot be used for " + objectType);
            }
            var label = parseLabel(json);
            var capabilities = parseCapabilities(json, "capabilities");
            var delegatedCapabilities = parseCapabilities(json, "delegatedCapabilities");
            var domains = parseDomains(json);
            var data = parseData(json).orElse(null);
            if (data != null) {
                try {
                    Payload.fromBytes(algorithm, data);
                } catch (IllegalArgumentException e) {
                    throw new ProvisioningException("Invalid " + algorithm + " data: " + e.getMessage(), e);
                }
            }
            return new ProvisionedObject(objectId, objectType, algorithm, label, capabilities,
                    delegatedCapabilities, domains, data);
        }

        @Override
        public String toString() {
            return "ProvisionedObject{" +
                    "objectId=" + objectId +
                    ", objectType=" + objectType +
                    ", algorithm=" + algorithm +
                    ", label=" + label +
                    ", generated=" + isGenerated() +
                    '}';
        }
    }

    private static int integer(JsonObject json, String field, int max) throws ProvisioningException {
        var value = json.get(field);
        if (!(value instanceof Number)) {
            throw new ProvisioningException("\"" + field + "\" must be a number");
        }
        return integer((Number) value, field, max);
    }

    private static int integer(Number number, String field, int max) throws ProvisioningException {
        var value = number.longValue();
        if (number.doubleValue() != value || value < 0 || value > max) {
            throw new ProvisioningException("\"" + field + "\" must be an integer between 0 and " + max);
        }
        return (int) value;
    }

    private static <E extends Enum<E>> E constant(JsonObject json, String field, Class<E> type)
            throws ProvisioningException {
        var value = json.get(field);
        if (!(value instanceof String)) {
            throw new ProvisioningException("\"" + field + "\" must be a string");
        }
        try {
            return Enum.valueOf(type, (String) value);
        } catch (IllegalArgumentException e) {
            throw new ProvisioningException("Unknown " + field + ": " + value, e);
        }
    }

    private static ObjectLabel parseLabel(JsonObject json) throws ProvisioningException {
        var value = json.get("label");
        if (value == null) {
            return ObjectLabel.empty();
        }
        if (!(value instanceof String)) {
            throw new ProvisioningException("\"label\" must be a string");
        }
        try {
            return ObjectLabel.of((String) value);
        } catch (IllegalArgumentException e) {
            throw new ProvisioningException("Invalid label: " + e.getMessage(), e);
        }
    }

    private static Capability parseCapabilities(JsonObject json, String field) throws ProvisioningException {
        var capabilities = Capability.none();
        for (var name : array(json, field)) {
            if (!(name instanceof String)) {
                throw new ProvisioningException("\"" + field + "\" must contain capability names");
            }
            var capability = Capability.valueOf((String) name)
                    .orElseThrow(() -> new ProvisioningException("Unknown capability: " + name));
            capabilities = capabilities.union(capability);
        }
        return capabilities;
    }

    private static Domain parseDomains(JsonObject json) throws ProvisioningException {
        var domains = Domain.none();
        for (var number : array(json, "domains")) {
            if (!(number instanceof Number)) {
                throw new ProvisioningException("\"domains\" must contain domain numbers");
            }
            var domain = integer((Number) number, "domains", Domain.MAX_DOMAINS);
            if (domain == 0) {
                throw new ProvisioningException("Domains are numbered from 1 to " + Domain.MAX_DOMAINS);
            }
            domains = domains.union(Domain.at(domain));
        }
        return domains;
    }

    private static Optional<byte[]> parseData(JsonObject json) throws ProvisioningException {
        var value = json.get("data");
        if (value == null) {
            return Optional.empty();
        }
        if (!(value instanceof String)) {
            throw new ProvisioningException("\"data\" must be a base64url string");
        }
        try {
            return Optional.of(Base64.getUrlDecoder().decode((String) value));
        } catch (IllegalArgumentException e) {
            throw new ProvisioningException("\"data\" is not valid base64url", e);
        }
    }

    private static JsonArray array(JsonObject json, String field) throws ProvisioningException {
        var value = json.get(field);
        if (value == null) {
            return new JsonArray();
        }
        if (!(value instanceof JsonArray)) {
            throw new ProvisioningException("\"" + field + "\" must be an array");
        }
        return (JsonArray) value;
    }
}
