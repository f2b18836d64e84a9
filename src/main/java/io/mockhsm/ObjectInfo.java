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

import java.util.Objects;

/**
 * Metadata describing a stored object. The {@code length} is always that of the object's payload, and the
 * {@code sequence} is fixed at 1 for every object created by this store.
 */
public final class ObjectInfo {
    static final int INITIAL_SEQUENCE = 1;

    private final int objectId;
    private final ObjectType objectType;
    private final Algorithm algorithm;
    private final Capability capabilities;
    private final Capability delegatedCapabilities;
    private final Domain domains;
    private final int length;
    private final int sequence;
    private final ObjectOrigin origin;
    private final ObjectLabel label;

    ObjectInfo(int objectId, ObjectType objectType, Algorithm algorithm, Capability capabilities,
            Capability delegatedCapabilities, Domain domains, int length, int sequence, ObjectOrigin origin,
            ObjectLabel label) {
        this.objectId = Utils.requireObjectId(objectId);
        this.objectType = requireNonNull(objectType, "objectType");
        this.algorithm = requireNonNull(algorithm, "algorithm");
        this.capabilities = requireNonNull(capabilities, "capabilities");
        this.delegatedCapabilities = requireNonNull(delegatedCapabilities, "delegatedCapabilities");
        this.domains = requireNonNull(domains, "domains");
        this.origin = requireNonNull(origin, "origin");
        this.label = requireNonNull(label, "label");
        Utils.require(algorithm.objectType() == objectType,
                "Algorithm " + algorithm + " cannot be used for objects of type " + objectType);
        Utils.require(length >= 0 && length <= 0xFFFF, "Invalid object length: " + length);
        Utils.require(sequence >= 0 && sequence <= 0xFF, "Invalid sequence number: " + sequence);
        this.length = length;
        this.sequence = sequence;
    }

    public ObjectHandle handle() {
        return new ObjectHandle(objectId, objectType);
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

    public Capability capabilities() {
        return capabilities;
    }

    public Capability delegatedCapabilities() {
        return delegatedCapabilities;
    }

    public Domain domains() {
        return domains;
    }

    public int length() {
        return length;
    }

    public int sequence() {
        return sequence;
    }

    public ObjectOrigin origin() {
        return origin;
    }

    public ObjectLabel label() {
        return label;
    }

    ObjectInfo withOrigin(ObjectOrigin origin) {
        return new ObjectInfo(objectId, objectType, algorithm, capabilities, delegatedCapabilities, domains, length,
                sequence, origin, label);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof ObjectInfo)) { return false; }
        ObjectInfo that = (ObjectInfo) other;
        return objectId == that.objectId
                && objectType == that.objectType
                && algorithm == that.algorithm
                && capabilities.equals(that.capabilities)
                && delegatedCapabilities.equals(that.delegatedCapabilities)
                && domains.equals(that.domains)
                && length == that.length
                && sequence == that.sequence
                && origin == that.origin
                && label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(objectId, objectType, algorithm, capabilities, delegatedCapabilities, domains, length,
                sequence, origin, label);
    }

    @Override
    public String toString() {
        return "ObjectInfo{" +
                "handle=" + handle() +
                ", algorithm=" + algorithm +
                ", capabilities=" + capabilities +
                ", delegatedCapabilities=" + delegatedCapabilities +
                ", domains=" + domains +
                ", length=" + length +
                ", sequence=" + sequence +
                ", origin=" + origin +
                ", label='" + label + '\'' +
                '}';
    }
}
