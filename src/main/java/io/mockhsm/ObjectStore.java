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
import static java.util.stream.Collectors.toUnmodifiableList;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * The object inventory of one simulated device.
 * <p>
 * A new store holds a single object, the factory-default authentication key. Objects are added with
 * {@link #generate}, {@link #put} or {@link #unwrap} and removed with {@link #remove}. Each handle holds at most one
 * object: inserting over an occupied handle fails with {@link ObjectExistsException} and leaves the store as it
 * was.
 * <p>
 * {@link #wrap} exports an object and its metadata sealed under a stored wrap key; {@link #unwrap} opens such a
 * blob and inserts the object it contains. The wire format is
 * {@code [ encoded WrappedObject | 16-byte tag ]}, sealed with the first 12 bytes of the caller's nonce and empty
 * associated data.
 * <p>
 * Stores are not thread-safe. The owner must serialize access, as a real device processes one command at a time.
 * Separate instances share no state.
 */
public final class ObjectStore implements Iterable<StoredObject> {
    private static final RedactedLogger logger = RedactedLogger.getLogger(ObjectStore.class);
    private static final byte[] EMPTY_AAD = new byte[0];

    public static final int DEFAULT_AUTHENTICATION_KEY_ID = 1;
    public static final String DEFAULT_AUTHENTICATION_KEY_LABEL = "DEFAULT AUTHKEY CHANGE THIS ASAP";

    private static final AuthenticationKey DEFAULT_AUTHENTICATION_KEY = AuthenticationKey.defaultKey();

    private final NavigableMap<ObjectHandle, StoredObject> objects = new TreeMap<>();

    public ObjectStore() {
        insertDefaultAuthenticationKey();
    }

    /**
     * Generates a new object with fresh key material.
     *
     * @return the handle of the new object.
     * @throws ObjectExistsException if an object with the same id and type already exists.
     * @throws UnsupportedAlgorithmException if the algorithm's material cannot be generated.
     * @throws IllegalArgumentException if the algorithm does not belong to the object type.
     */
    public ObjectHandle generate(int objectId, ObjectType objectType, Algorithm algorithm, ObjectLabel label,
            Capability capabilities, Capability delegatedCapabilities, Domain domains)
            throws ObjectExistsException, UnsupportedAlgorithmException {
        var handle = new ObjectHandle(objectId, objectType);
        requireAlgorithmFor(objectType, algorithm);
        checkVacant(handle);

        var payload = Payload.generate(algorithm);
        var info = new ObjectInfo(objectId, objectType, algorithm, capabilities, delegatedCapabilities, domains,
                payload.length(), ObjectInfo.INITIAL_SEQUENCE, ObjectOrigin.GENERATED, label);
        insert(new StoredObject(info, payload));
        return handle;
    }

    /**
     * Imports an object from caller-supplied key material or data.
     *
     * @return the handle of the new object.
     * @throws ObjectExistsException if an object with the same id and type already exists.
     * @throws IllegalArgumentException if the data is not valid for the algorithm, or the algorithm does not belong
     * to the object type.
     */
    public ObjectHandle put(int objectId, ObjectType objectType, Algorithm algorithm, ObjectLabel label,
            Capability capabilities, Capability delegatedCapabilities, Domain domains, byte[] data)
            throws ObjectExistsException {
        var handle = new ObjectHandle(objectId, objectType);
        requireAlgorithmFor(objectType, algorithm);
        checkVacant(handle);

        var payload = Payload.fromBytes(algorithm, data);
        var info = new ObjectInfo(objectId, objectType, algorithm, capabilities, delegatedCapabilities, domains,
                payload.length(), ObjectInfo.INITIAL_SEQUENCE, ObjectOrigin.IMPORTED, label);
        insert(new StoredObject(info, payload));
        return handle;
    }

    public Optional<StoredObject> get(int objectId, ObjectType objectType) {
        return get(new ObjectHandle(objectId, objectType));
    }

    public Optional<StoredObject> get(ObjectHandle handle) {
        return Optional.ofNullable(objects.get(handle));
    }

    public boolean contains(int objectId, ObjectType objectType) {
        return objects.containsKey(new ObjectHandle(objectId, objectType));
    }

    /**
     * Deletes an object.
     *
     * @return the removed object, or empty if there was no such object.
     */
    public Optional<StoredObject> remove(int objectId, ObjectType objectType) {
        var removed = Optional.ofNullable(objects.remove(new ObjectHandle(objectId, objectType)));
        removed.ifPresent(object -> logger.debug("Removed {}", object.handle()));
        return removed;
    }

    public int size() {
        return objects.size();
    }

    /**
     * Iterates over the stored objects in handle order. The iterator is a read-only view of the current contents.
     */
    @Override
    public Iterator<StoredObject> iterator() {
        return Collections.unmodifiableCollection(objects.values()).iterator();
    }

    public Stream<StoredObject> stream() {
        return objects.values().stream();
    }

    /**
     * A read-only view of the handle to object mapping, in handle order.
     */
    public Set<Map.Entry<ObjectHandle, StoredObject>> entries() {
        return Collections.unmodifiableNavigableMap(objects).entrySet();
    }

    /**
     * Lists the metadata of every object matching the filter, in handle order.
     */
    public List<ObjectInfo> list(ObjectFilter filter) {
        requireNonNull(filter, "filter");
        return objects.values().stream()
                .map(StoredObject::info)
                .filter(filter)
                .collect(toUnmodifiableList());
    }

    /**
     * Restores the factory state: every object is deleted and the default authentication key is reinstated.
     */
    public void reset() {
        logger.info("Resetting device: deleting {} objects", objects.size());
        objects.clear();
        insertDefaultAuthenticationKey();
    }

    /**
     * Exports an object, together with its metadata, encrypted under a wrap key. The stored object is not modified;
     * the exported metadata records the object's origin as wrapped.
     *
     * @param wrapKeyId the id of the wrap key.
     * @param objectId the id of the object to export.
     * @param objectType the type of the object to export.
     * @param nonce the nonce to seal with.
     * @return the sealed object.
     * @throws ObjectNotFoundException if the wrap key or the object does not exist.
     * @throws UnsupportedAlgorithmException if the wrap key's algorithm cannot be used for wrapping.
     * @throws InsufficientCapabilityException if the object is not exportable under wrap.
     */
    public byte[] wrap(int wrapKeyId, int objectId, ObjectType objectType, WrapNonce nonce) throws HsmException {
        requireNonNull(nonce, "nonce");
        var wrapKey = requireWrapKey(wrapKeyId);
        var cipher = cipherFor(wrapKey);

        var handle = new ObjectHandle(objectId, objectType);
        var object = objects.get(handle);
        if (object == null) {
            throw new ObjectNotFoundException(handle, "no such object: " + handle);
        }
        if (!object.info().capabilities().contains(Capability.EXPORTABLE_UNDER_WRAP)) {
            throw new InsufficientCapabilityException(handle, Capability.EXPORTABLE_UNDER_WRAP);
        }

        var info = object.info().withOrigin(object.info().origin().wrapped());
        var data = object.payload().toByteArray();
        var plaintext = new WrappedObject(info, data).encode();
        // Room for the tag, which is written in place
        var buffer = Arrays.copyOf(plaintext, plaintext.length + cipher.tagSizeBytes());
        Utils.wipe(data, plaintext);

        seal(cipher, wrapKey, nonce, buffer);
        logger.debug("Wrapped {} under {} with {}: {} bytes", handle, wrapKey.handle(), cipher.getIdentifier(),
                buffer.length);
        return buffer;
    }

    /**
     * Decrypts an object previously exported with {@link #wrap} and inserts it into the store with the metadata it
     * was exported with.
     *
     * @param wrapKeyId the id of the wrap key.
     * @param nonce the nonce the object was sealed with.
     * @param ciphertext the sealed object. The array is not modified.
     * @return the handle of the inserted object.
     * @throws ObjectNotFoundException if the wrap key does not exist.
     * @throws UnsupportedAlgorithmException if the wrap key's algorithm cannot be used for wrapping.
     * @throws DecryptionFailedException if the ciphertext does not authenticate under the key and nonce.
     * @throws MalformedObjectException if the decrypted contents are not a valid object.
     * @throws ObjectExistsException if an object with the same id and type already exists.
     */
    public ObjectHandle unwrap(int wrapKeyId, WrapNonce nonce, byte[] ciphertext) throws HsmException {
        requireNonNull(nonce, "nonce");
        requireNonNull(ciphertext, "ciphertext");
        var wrapKey = requireWrapKey(wrapKeyId);
        var cipher = cipherFor(wrapKey);

        var buffer = ciphertext.clone();
        if (!open(cipher, wrapKey, nonce, buffer)) {
            logger.debug("Wrapped object failed authentication under {}", wrapKey.handle());
            throw new DecryptionFailedException();
        }
        var plaintext = Arrays.copyOf(buffer, buffer.length - cipher.tagSizeBytes());
        Utils.wipe(buffer);

        WrappedObject envelope;
        try {
            envelope = WrappedObject.decode(plaintext);
        } catch (IOException e) {
            throw new MalformedObjectException("malformed wrapped object", e);
        } finally {
            Utils.wipe(plaintext);
        }

        var info = envelope.info();
        StoredObject object;
        try {
            object = new StoredObject(info, Payload.fromBytes(info.algorithm(), envelope.data()));
        } catch (IllegalArgumentException e) {
            throw new MalformedObjectException("invalid wrapped " + info.algorithm() + " object", e);
        } finally {
            Utils.wipe(envelope.data());
        }

        var handle = object.handle();
        checkVacant(handle);
        insert(object);
        logger.debug("Unwrapped {} under {} with {}", handle, wrapKey.handle(), cipher.getIdentifier());
        return handle;
    }

    private void insertDefaultAuthenticationKey() {
        var payload = Payload.AuthenticationKeyPayload.of(DEFAULT_AUTHENTICATION_KEY);
        var info = new ObjectInfo(DEFAULT_AUTHENTICATION_KEY_ID, ObjectType.AUTHENTICATION_KEY,
                payload.algorithm(), Capability.all(), Capability.all(), Domain.all(), payload.length(),
                ObjectInfo.INITIAL_SEQUENCE, ObjectOrigin.IMPORTED, ObjectLabel.of(DEFAULT_AUTHENTICATION_KEY_LABEL));
        insert(new StoredObject(info, payload));
    }

    private void insert(StoredObject object) {
        var previous = objects.putIfAbsent(object.handle(), object);
        if (previous != null) {
            throw new IllegalStateException("Handle already occupied: " + object.handle());
        }
        logger.debug("Stored {} ({}, origin={})", object.handle(), object.algorithm(), object.info().origin());
    }

    private void checkVacant(ObjectHandle handle) throws ObjectExistsException {
        if (objects.containsKey(handle)) {
            logger.debug("Rejecting insert over existing object {}", handle);
            throw new ObjectExistsException(handle);
        }
    }

    private StoredObject requireWrapKey(int wrapKeyId) throws ObjectNotFoundException {
        var handle = new ObjectHandle(wrapKeyId, ObjectType.WRAP_KEY);
        var wrapKey = objects.get(handle);
        if (wrapKey == null) {
            throw new ObjectNotFoundException(handle, "no such wrap key: " + handle);
        }
        return wrapKey;
    }

    private static WrapCipher cipherFor(StoredObject wrapKey) throws UnsupportedAlgorithmException {
        var algorithm = wrapKey.algorithm();
        return WrapCipher.forAlgorithm(algorithm).orElseThrow(() ->
                new UnsupportedAlgorithmException(algorithm, "unsupported wrap key algorithm: " + algorithm));
    }

    private static void seal(WrapCipher cipher, StoredObject wrapKey, WrapNonce nonce, byte[] buffer) {
        var keyMaterial = wrapKey.payload().toByteArray();
        try (var key = cipher.importKey(keyMaterial)) {
            cipher.sealInPlace(key, nonce.aeadNonce(), EMPTY_AAD, buffer);
        } finally {
            Utils.wipe(keyMaterial);
        }
    }

    private static boolean open(WrapCipher cipher, StoredObject wrapKey, WrapNonce nonce, byte[] buffer) {
        var keyMaterial = wrapKey.payload().toByteArray();
        try (var key = cipher.importKey(keyMaterial)) {
            return cipher.openInPlace(key, nonce.aeadNonce(), EMPTY_AAD, buffer);
        } finally {
            Utils.wipe(keyMaterial);
        }
    }

    private static void requireAlgorithmFor(ObjectType objectType, Algorithm algorithm) {
        requireNonNull(algorithm, "algorithm");
        Utils.require(algorithm.objectType() == objectType,
                "Algorithm " + algorithm + " cannot be used for objects of type " + objectType);
    }
}
