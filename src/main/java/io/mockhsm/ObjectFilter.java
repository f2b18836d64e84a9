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

import java.util.function.Predicate;

/**
 * Criteria for listing objects. Every criterion that has been set must match:
 * <ul>
 *     <li>id, type, algorithm and label match exactly;</li>
 *     <li>domains match if the object belongs to at least one of the given domains;</li>
 *     <li>capabilities match if the object has all of the given capabilities.</li>
 * </ul>
 * Filters are immutable; each {@code with} method returns a new filter.
 */
public final class ObjectFilter implements Predicate<ObjectInfo> {
    private static final ObjectFilter ALL = new ObjectFilter(info -> true);

    private final Predicate<ObjectInfo> predicate;

    private ObjectFilter(Predicate<ObjectInfo> predicate) {
        this.predicate = predicate;
    }

    /**
     * A filter that matches every object.
     */
    public static ObjectFilter all() {
        return ALL;
    }

    public ObjectFilter withId(int objectId) {
        Utils.requireObjectId(objectId);
        return matching(info -> info.objectId() == objectId);
    }

    public ObjectFilter withType(ObjectType objectType) {
        requireNonNull(objectType, "objectType");
        return matching(info -> info.objectType() == objectType);
    }

    public ObjectFilter withAlgorithm(Algorithm algorithm) {
        requireNonNull(algorithm, "algorithm");
        return matching(info -> info.algorithm() == algorithm);
    }

    public ObjectFilter withLabel(ObjectLabel label) {
        requireNonNull(label, "label");
        return matching(info -> info.label().equals(label));
    }

    public ObjectFilter withDomains(Domain domains) {
        requireNonNull(domains, "domains");
        return matching(info -> info.domains().intersects(domains));
    }

    public ObjectFilter withCapabilities(Capability capabilities) {
        requireNonNull(capabilities, "capabilities");
        return matching(info -> info.capabilities().contains(capabilities));
    }

    @Override
    public boolean test(ObjectInfo info) {
        return predicate.test(info);
    }

    private ObjectFilter matching(Predicate<ObjectInfo> criterion) {
        return new ObjectFilter(predicate.and(criterion));
    }
}
