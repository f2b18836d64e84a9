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

import java.util.Comparator;

/**
 * Uniquely identifies an object in the store. Objects with the same id but a different type are distinct. Handles
 * are ordered by id and then by type code.
 *
 * @param objectId the 16-bit object id.
 * @param objectType the object type.
 */
public record ObjectHandle(int objectId, ObjectType objectType) implements Comparable<ObjectHandle> {
    private static final Comparator<ObjectHandle> ORDER =
            Comparator.comparingInt(ObjectHandle::objectId).thenComparingInt(h -> h.objectType().code());

    public ObjectHandle {
        Utils.requireObjectId(objectId);
        requireNonNull(objectType, "objectType");
    }

    @Override
    public int compareTo(ObjectHandle other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return objectType + "[0x" + String.format("%04x", objectId) + "]";
    }
}
