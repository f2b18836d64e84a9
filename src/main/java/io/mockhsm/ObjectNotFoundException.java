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
 * Thrown when a referenced object (including a wrap key) does not exist.
 */
public final class ObjectNotFoundException extends HsmException {
    private final ObjectHandle handle;

    ObjectNotFoundException(ObjectHandle handle, String message) {
        super(Kind.OBJECT_NOT_FOUND, message);
        this.handle = requireNonNull(handle, "handle");
    }

    /**
     * The handle that could not be resolved.
     */
    public ObjectHandle handle() {
        return handle;
    }
}
