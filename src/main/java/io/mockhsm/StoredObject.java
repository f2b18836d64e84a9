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

/**
 * An object held by the store: its metadata together with its payload. The two always travel together.
 */
public final class StoredObject {
    private final ObjectInfo info;
    private final Payload payload;

    StoredObject(ObjectInfo info, Payload payload) {
        this.info = requireNonNull(info, "info");
        this.payload = requireNonNull(payload, "payload");
        Utils.require(info.length() == payload.length(), "Object length does not match payload");
        Utils.require(info.algorithm() == payload.algorithm(), "Object algorithm does not match payload");
    }

    public ObjectHandle handle() {
        return info.handle();
    }

    public ObjectInfo info() {
        return info;
    }

    public Payload payload() {
        return payload;
    }

    public Algorithm algorithm() {
        return info.algorithm();
    }

    @Override
    public String toString() {
        return "StoredObject{" +
                "info=" + info +
                ", payload=" + payload +
                '}';
    }
}
