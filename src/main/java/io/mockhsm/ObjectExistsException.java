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
 * Thrown when an insert targets a handle that is already occupied. The existing object is left untouched.
 */
public final class ObjectExistsException extends HsmException {
    private final ObjectHandle handle;

    ObjectExistsException(ObjectHandle handle) {
        super(Kind.OBJECT_EXISTS, "object already exists: " + handle);
        this.handle = requireNonNull(handle, "handle");
    }

    public ObjectHandle handle() {
        return handle;
    }
}
