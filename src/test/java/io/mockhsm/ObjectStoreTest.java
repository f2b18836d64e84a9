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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.assertj.core.api.SoftAssertions;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import io.mockhsm.io.CborWriter;

public class ObjectStoreTest {
    private static final int WRAP_KEY_ID = 10;
    private static final int HMAC_KEY_ID = 20;
    private static final byte[] HMAC_KEY_DATA = new byte[] {
            1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16,
            17, 18, 19, 20, 21, 22, 23, 24, 25, 26, 27, 28, 29, 30, 31, 32
    };
    private static final WrapNonce ZERO_NONCE = WrapNonce.of(new byte[12]);

    private ObjectStore store;

    @BeforeMethod
    public void createStore() throws Exception {
        store = new ObjectStore();
        store.generate(WRAP_KEY_ID, ObjectType.WRAP_KEY, Algorithm.AES256_CCM_WRAP, ObjectLabel.of("wrap key"),
                Capability.of(Capability.EXPORT_WRAPPED, Capability.IMPORT_WRAPPED),
                Capability.EXPORTABLE_UNDER_WRAP, Domain.all());
        store.put(HMAC_KEY_ID, ObjectType.HMAC_KEY, Algorithm.HMAC_SHA256, ObjectLabel.of("hmac key"),
                Capability.of(Capability.SIGN_HMAC, Capability.EXPORTABLE_UNDER_WRAP), Capability.none(),
                Domain.of(Domain.DOM1, Domain.DOM2), HMAC_KEY_DATA);
    }

    @Test
    public void newStoreShouldContainOnlyDefaultAuthenticationKey() {
        var fresh = new ObjectStore();

        assertThat(fresh.size()).isEqualTo(1);
        var authKey = fresh.get(ObjectStore.DEFAULT_AUTHENTICATION_KEY_ID, ObjectType.AUTHENTICATION_KEY)
                .orElseThrow();
        var info = authKey.info();

        var softly = new SoftAssertions();
        softly.assertThat(info.algorithm()).isEqualTo(Algorithm.AES128_YUBICO_AUTHENTICATION);
        softly.assertThat(info.capabilities()).isEqualTo(Capability.all());
        softly.assertThat(info.delegatedCapabilities()).isEqualTo(Capability.all());
        softly.assertThat(info.domains()).isEqualTo(Domain.all());
        softly.assertThat(info.origin()).isEqualTo(ObjectOrigin.IMPORTED);
        softly.assertThat(info.length()).isEqualTo(32);
        softly.assertThat(info.sequence()).isEqualTo(1);
        softly.assertThat(info.label().value()).isEqualTo(ObjectStore.DEFAULT_AUTHENTICATION_KEY_LABEL);
        softly.assertThat(((Payload.AuthenticationKeyPayload) authKey.payload()).authenticationKey())
                .isEqualTo(AuthenticationKey.defaultKey());
        softly.assertAll();
    }

    @Test
    public void separateStoresShouldBeIndependent() throws Exception {
        var other = new ObjectStore();
        assertThat(other.contains(WRAP_KEY_ID, ObjectType.WRAP_KEY)).isFalse();
        assertThat(store.contains(WRAP_KEY_ID, ObjectType.WRAP_KEY)).isTrue();
    }

    @Test
    public void generateShouldRecordMetadata() {
        var info = store.get(WRAP_KEY_ID, ObjectType.WRAP_KEY).orElseThrow().info();

        assertThat(info.origin()).isEqualTo(ObjectOrigin.GENERATED);
        assertThat(info.length()).isEqualTo(32);
        assertThat(info.sequence()).isEqualTo(1);
        assertThat(info.label()).isEqualTo(ObjectLabel.of("wrap key"));
        assertThat(info.delegatedCapabilities()).isEqualTo(Capability.EXPORTABLE_UNDER_WRAP);
    }

    @Test
    public void putShouldStoreImportedMaterial() {
        var object = store.get(HMAC_KEY_ID, ObjectType.HMAC_KEY).orElseThrow();

        assertThat(object.info().origin()).isEqualTo(ObjectOrigin.IMPORTED);
        assertThat(object.info().length()).isEqualTo(HMAC_KEY_DATA.length);
        assertThat(object.payload().toByteArray()).isEqualTo(HMAC_KEY_DATA);
    }

    @Test
    public void shouldRejectDuplicateHandlesWithoutModifyingStore() {
        var before = store.get(HMAC_KEY_ID, ObjectType.HMAC_KEY).orElseThrow();

        assertThatThrownBy(() -> store.put(HMAC_KEY_ID, ObjectType.HMAC_KEY, Algorithm.HMAC_SHA256,
                ObjectLabel.empty(), Capability.none(), Capability.none(), Domain.none(), new byte[32]))
                .isInstanceOf(ObjectExistsException.class);
        assertThatThrownBy(() -> store.generate(HMAC_KEY_ID, ObjectType.HMAC_KEY, Algorithm.HMAC_SHA1,
                ObjectLabel.empty(), Capability.none(), Capability.none(), Domain.none()))
                .isInstanceOf(ObjectExistsException.class)
                .extracting(e -> ((ObjectExistsException) e).handle())
                .isEqualTo(new ObjectHandle(HMAC_KEY_ID, ObjectType.HMAC_KEY));

        assertThat(store.size()).isEqualTo(3);
        assertThat(store.get(HMAC_KEY_ID, ObjectType.HMAC_KEY)).containsSame(before);
    }

    @Test
    public void sameIdWithDifferentTypeShouldCoexist() throws Exception {
        store.put(HMAC_KEY_ID, ObjectType.OPAQUE, Algorithm.OPAQUE_DATA, ObjectLabel.empty(), Capability.none(),
                Capability.none(), Domain.none(), new byte[] { 42 });

        assertThat(store.size()).isEqualTo(4);
        assertThat(store.contains(HMAC_KEY_ID, ObjectType.OPAQUE)).isTrue();
        assertThat(store.contains(HMAC_KEY_ID, ObjectType.HMAC_KEY)).isTrue();
    }

    @Test
    public void shouldRejectAlgorithmOfWrongType() {
        assertThatThrownBy(() -> store.generate(30, ObjectType.WRAP_KEY, Algorithm.HMAC_SHA256,
                ObjectLabel.empty(), Capability.none(), Capability.none(), Domain.none()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.contains(30, ObjectType.WRAP_KEY)).isFalse();
    }

    @Test
    public void shouldNotGenerateOpaqueObjects() {
        assertThatThrownBy(() -> store.generate(30, ObjectType.OPAQUE, Algorithm.OPAQUE_DATA,
                ObjectLabel.empty(), Capability.none(), Capability.none(), Domain.none()))
                .isInstanceOf(UnsupportedAlgorithmException.class);
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    public void shouldRemoveObjects() {
        var removed = store.remove(HMAC_KEY_ID, ObjectType.HMAC_KEY);

        assertThat(removed).isPresent();
        assertThat(removed.get().payload().toByteArray()).isEqualTo(HMAC_KEY_DATA);
        assertThat(store.get(HMAC_KEY_ID, ObjectType.HMAC_KEY)).isEmpty();
        assertThat(store.remove(HMAC_KEY_ID, ObjectType.HMAC_KEY)).isEmpty();
    }

    @Test
    public void shouldIterateInHandleOrder() throws Exception {
        store.put(5, ObjectType.OPAQUE, Algorithm.OPAQUE_DATA, ObjectLabel.empty(), Capability.none(),
                Capability.none(), Domain.none(), new byte[] { 1 });

        var handles = new ArrayList<ObjectHandle>();
        for (var object : store) {
            handles.add(object.handle());
        }

        assertThat(handles).containsExactly(
                new ObjectHandle(1, ObjectType.AUTHENTICATION_KEY),
                new ObjectHandle(5, ObjectType.OPAQUE),
                new ObjectHandle(WRAP_KEY_ID, ObjectType.WRAP_KEY),
                new ObjectHandle(HMAC_KEY_ID, ObjectType.HMAC_KEY));
        assertThat(store.entries()).extracting(e -> e.getKey()).containsExactlyElementsOf(handles);
    }

    @Test
    public void viewsShouldBeReadOnly() {
        var iterator = store.iterator();
        iterator.next();

        assertThatThrownBy(iterator::remove).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> store.entries().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    public void shouldListMatchingObjects() {
        assertThat(store.list(ObjectFilter.all())).hasSize(3);
        assertThat(store.list(ObjectFilter.all().withType(ObjectType.WRAP_KEY)))
                .extracting(ObjectInfo::objectId).containsExactly(WRAP_KEY_ID);
        assertThat(store.list(ObjectFilter.all().withCapabilities(Capability.EXPORTABLE_UNDER_WRAP)))
                .extracting(ObjectInfo::objectId).containsExactly(1, HMAC_KEY_ID);
        assertThat(store.list(ObjectFilter.all().withDomains(Domain.DOM2)))
                .extracting(ObjectInfo::objectId).containsExactly(1, WRAP_KEY_ID, HMAC_KEY_ID);
        assertThat(store.list(ObjectFilter.all().withDomains(Domain.DOM3).withId(HMAC_KEY_ID))).isEmpty();
        assertThat(store.list(ObjectFilter.all().withLabel(ObjectLabel.of("hmac key"))
                .withAlgorithm(Algorithm.HMAC_SHA256)))
                .extracting(ObjectInfo::objectId).containsExactly(HMAC_KEY_ID);
    }

    @Test
    public void shouldStreamObjects() {
        assertThat(store.stream().map(StoredObject::algorithm))
                .containsExactly(Algorithm.AES128_YUBICO_AUTHENTICATION, Algorithm.AES256_CCM_WRAP,
                        Algorithm.HMAC_SHA256);
    }

    @Test
    public void resetShouldRestoreFactoryState() {
        store.reset();

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.contains(ObjectStore.DEFAULT_AUTHENTICATION_KEY_ID, ObjectType.AUTHENTICATION_KEY))
                .isTrue();
    }

    @Test
    public void shouldWrapAndUnwrapObject() throws Exception {
        var original = store.get(HMAC_KEY_ID, ObjectType.HMAC_KEY).orElseThrow().info();
        var expectedEnvelope = new WrappedObject(original.withOrigin(ObjectOrigin.WRAPPED_IMPORTED), HMAC_KEY_DATA);

        var ciphertext = store.wrap(WRAP_KEY_ID, HMAC_KEY_ID, ObjectType.HMAC_KEY, ZERO_NONCE);

        assertThat(ciphertext).hasSize(expectedEnvelope.encode().length + 16);
        assertThat(store.get(HMAC_KEY_ID, ObjectType.HMAC_KEY).orElseThrow().info().origin())
                .isEqualTo(ObjectOrigin.IMPORTED);

        store.remove(HMAC_KEY_ID, ObjectType.HMAC_KEY);
        var handle = store.unwrap(WRAP_KEY_ID, ZERO_NONCE, ciphertext);

        assertThat(handle).isEqualTo(new ObjectHandle(HMAC_KEY_ID, ObjectType.HMAC_KEY));
        var restored = store.get(handle).orElseThrow();
        assertThat(restored.info()).isEqualTo(expectedEnvelope.info());
        assertThat(restored.payload().toByteArray()).isEqualTo(HMAC_KEY_DATA);
    }

    @Test
    public void shouldPreserveNonAsciiLabelsThroughWrap() throws Exception {
        var label = ObjectLabel.of("cl\u00e9 \uD83D\uDD11");
        store.put(60, ObjectType.HMAC_KEY, Algorithm.HMAC_SHA256, label, Capability.EXPORTABLE_UNDER_WRAP,
                Capability.none(), Domain.DOM1, HMAC_KEY_DATA);

        var ciphertext = store.wrap(WRAP_KEY_ID, 60, ObjectType.HMAC_KEY, ZERO_NONCE);
        store.remove(60, ObjectType.HMAC_KEY);
        var handle = store.unwrap(WRAP_KEY_ID, ZERO_NONCE, ciphertext);

        assertThat(store.get(handle).orElseThrow().info().label()).isEqualTo(label);
    }

    @Test
    public void wrappedOriginShouldBeIdempotent() throws Exception {
        for (int i = 0; i < 2; ++i) {
            var ciphertext = store.wrap(WRAP_KEY_ID, HMAC_KEY_ID, ObjectType.HMAC_KEY, ZERO_NONCE);
            store.remove(HMAC_KEY_ID, ObjectType.HMAC_KEY);
            store.unwrap(WRAP_KEY_ID, ZERO_NONCE, ciphertext);
        }

        assertThat(store.get(HMAC_KEY_ID, ObjectType.HMAC_KEY).orElseThrow().info().origin())
                .isEqualTo(ObjectOrigin.WRAPPED_IMPORTED);
    }

    @Test
    public void shouldWrapGeneratedAsymmetricKeys() throws Exception {
        store.generate(40, ObjectType.ASYMMETRIC_KEY, Algorithm.EC_P256, ObjectLabel.of("signing"),
                Capability.of(Capability.SIGN_ECDSA, Capability.EXPORTABLE_UNDER_WRAP), Capability.none(),
                Domain.DOM1);
        var material = store.get(40, ObjectType.ASYMMETRIC_KEY).orElseThrow().payload().toByteArray();

        var nonce = WrapNonce.generate();
        var ciphertext = store.wrap(WRAP_KEY_ID, 40, ObjectType.ASYMMETRIC_KEY, nonce);
        store.remove(40, ObjectType.ASYMMETRIC_KEY);
        store.unwrap(WRAP_KEY_ID, nonce, ciphertext);

        var restored = store.get(40, ObjectType.ASYMMETRIC_KEY).orElseThrow();
        assertThat(restored.info().origin()).isEqualTo(ObjectOrigin.WRAPPED_GENERATED);
        assertThat(restored.payload().toByteArray()).isEqualTo(material);
    }

    @Test
    public void shouldWrapUnderAes128Keys() throws Exception {
        store.put(11, ObjectType.WRAP_KEY, Algorithm.AES128_CCM_WRAP, ObjectLabel.empty(),
                Capability.of(Capability.EXPORT_WRAPPED, Capability.IMPORT_WRAPPED), Capability.none(),
                Domain.DOM1, new byte[16]);

        var ciphertext = store.wrap(11, HMAC_KEY_ID, ObjectType.HMAC_KEY, ZERO_NONCE);
        store.remove(HMAC_KEY_ID, ObjectType.HMAC_KEY);

        assertThat(store.unwrap(11, ZERO_NONCE, ciphertext))
                .isEqualTo(new ObjectHandle(HMAC_KEY_ID, ObjectType.HMAC_KEY));
    }

    @Test
    public void wrappingShouldBeDeterministicForSameNonce() throws Exception {
        var first = store.wrap(WRAP_KEY_ID, HMAC_KEY_ID, ObjectType.HMAC_KEY, ZERO_NONCE);
        var second = store.wrap(WRAP_KEY_ID, HMAC_KEY_ID, ObjectType.HMAC_KEY, ZERO_NONCE);

        assertThat(first).isEqualTo(second);
    }

    @Test
    public void onlyFirstTwelveNonceBytesShouldMatter() throws Exception {
        var nonce = new byte[WrapNonce.SIZE];
        var ciphertext = store.wrap(WRAP_KEY_ID, HMAC_KEY_ID, ObjectType.HMAC_KEY, WrapNonce.of(nonce));
        store.remove(HMAC_KEY_ID, ObjectType.HMAC_KEY);

        nonce[12] = 1;
        assertThat(store.unwrap(WRAP_KEY_ID, WrapNonce.of(nonce), ciphertext))
                .isEqualTo(new ObjectHandle(HMAC_KEY_ID, ObjectType.HMAC_KEY));
    }

    @Test
    public void unwrapShouldRejectExistingObject() throws Exception {
        var ciphertext = store.wrap(WRAP_KEY_ID, HMAC_KEY_ID, ObjectType.HMAC_KEY, ZERO_NONCE);
        var before = store.get(HMAC_KEY_ID, ObjectType.HMAC_KEY).orElseThrow();

        assertThatThrownBy(() -> store.unwrap(WRAP_KEY_ID, ZERO_NONCE, ciphertext))
                .isInstanceOf(ObjectExistsException.class);
        assertThat(store.get(HMAC_KEY_ID, ObjectType.HMAC_KEY)).containsSame(before);
    }

    @Test
    public void shouldRequireExportableUnderWrap() throws Exception {
        store.put(21, ObjectType.HMAC_KEY, Algorithm.HMAC_SHA256, ObjectLabel.empty(),
                Capability.of(Capability.SIGN_HMAC), Capability.none(), Domain.DOM1, HMAC_KEY_DATA);

        assertThatThrownBy(() -> store.wrap(WRAP_KEY_ID, 21, ObjectType.HMAC_KEY, ZERO_NONCE))
                .isInstanceOf(InsufficientCapabilityException.class)
                .extracting(e -> ((HsmException) e).kind())
                .isEqualTo(HsmException.Kind.INSUFFICIENT_CAPABILITY);
    }

    @Test
    public void shouldReportMissingObjects() {
        assertThatThrownBy(() -> store.wrap(99, HMAC_KEY_ID, ObjectType.HMAC_KEY, ZERO_NONCE))
                .isInstanceOf(ObjectNotFoundException.class);
        assertThatThrownBy(() -> store.wrap(HMAC_KEY_ID, HMAC_KEY_ID, ObjectType.HMAC_KEY, ZERO_NONCE))
                .isInstanceOf(ObjectNotFoundException.class);
        assertThatThrownBy(() -> store.wrap(WRAP_KEY_ID, 99, ObjectType.HMAC_KEY, ZERO_NONCE))
                .isInstanceOf(ObjectNotFoundException.class)
                .extracting(e -> ((ObjectNotFoundException) e).handle())
                .isEqualTo(new ObjectHandle(99, ObjectType.HMAC_KEY));
        assertThatThrownBy(() -> store.unwrap(99, ZERO_NONCE, new byte[64]))
                .isInstanceOf(ObjectNotFoundException.class);
    }

    @Test
    public void shouldRejectAes192WrapKeys() throws Exception {
        store.put(12, ObjectType.WRAP_KEY, Algorithm.AES192_CCM_WRAP, ObjectLabel.empty(),
                Capability.of(Capability.EXPORT_WRAPPED, Capability.IMPORT_WRAPPED), Capability.none(),
                Domain.DOM1, new byte[24]);

        assertThatThrownBy(() -> store.wrap(12, HMAC_KEY_ID, ObjectType.HMAC_KEY, ZERO_NONCE))
                .isInstanceOf(UnsupportedAlgorithmException.class)
                .extracting(e -> ((UnsupportedAlgorithmException) e).algorithm())
                .isEqualTo(Algorithm.AES192_CCM_WRAP);
        assertThatThrownBy(() -> store.unwrap(12, ZERO_NONCE, new byte[64]))
                .isInstanceOf(UnsupportedAlgorithmException.class);
    }

    @Test
    public void shouldDetectTamperingAnywhereInCiphertext() throws Exception {
        var ciphertext = store.wrap(WRAP_KEY_ID, HMAC_KEY_ID, ObjectType.HMAC_KEY, ZERO_NONCE);
        store.remove(HMAC_KEY_ID, ObjectType.HMAC_KEY);

        var softly = new SoftAssertions();
        for (int i = 0; i < ciphertext.length; ++i) {
            var tampered = ciphertext.clone();
            tampered[i] ^= 0x01;
            softly.assertThatThrownBy(() -> store.unwrap(WRAP_KEY_ID, ZERO_NONCE, tampered))
                    .as("byte %d", i)
                    .isInstanceOf(DecryptionFailedException.class);
        }
        softly.assertAll();
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    public void shouldRejectWrongNonceOrKey() throws Exception {
        store.generate(13, ObjectType.WRAP_KEY, Algorithm.AES256_CCM_WRAP, ObjectLabel.empty(),
                Capability.of(Capability.IMPORT_WRAPPED), Capability.none(), Domain.DOM1);
        var ciphertext = store.wrap(WRAP_KEY_ID, HMAC_KEY_ID, ObjectType.HMAC_KEY, ZERO_NONCE);
        store.remove(HMAC_KEY_ID, ObjectType.HMAC_KEY);

        var otherNonce = new byte[12];
        otherNonce[11] = 1;
        assertThatThrownBy(() -> store.unwrap(WRAP_KEY_ID, WrapNonce.of(otherNonce), ciphertext))
                .isInstanceOf(DecryptionFailedException.class);
        assertThatThrownBy(() -> store.unwrap(13, ZERO_NONCE, ciphertext))
                .isInstanceOf(DecryptionFailedException.class);
        assertThat(store.contains(HMAC_KEY_ID, ObjectType.HMAC_KEY)).isFalse();
    }

    @Test
    public void shouldRejectTruncatedCiphertext() {
        assertThatThrownBy(() -> store.unwrap(WRAP_KEY_ID, ZERO_NONCE, new byte[15]))
                .isInstanceOf(DecryptionFailedException.class);
        assertThatThrownBy(() -> store.unwrap(WRAP_KEY_ID, ZERO_NONCE, new byte[0]))
                .isInstanceOf(DecryptionFailedException.class);
    }

    @Test
    public void unwrapShouldNotModifyCallerCiphertext() throws Exception {
        var ciphertext = store.wrap(WRAP_KEY_ID, HMAC_KEY_ID, ObjectType.HMAC_KEY, ZERO_NONCE);
        var copy = ciphertext.clone();
        store.remove(HMAC_KEY_ID, ObjectType.HMAC_KEY);

        store.unwrap(WRAP_KEY_ID, ZERO_NONCE, ciphertext);

        assertThat(ciphertext).isEqualTo(copy);
    }

    @Test
    public void shouldRejectAuthenticPayloadThatIsNotAWrappedObject() throws Exception {
        var garbage = new ByteArrayOutputStream();
        try (var out = new CborWriter(garbage)) {
            out.writeString("not a wrapped object");
        }
        var ciphertext = sealUnderWrapKey(garbage.toByteArray());

        assertThatThrownBy(() -> store.unwrap(WRAP_KEY_ID, ZERO_NONCE, ciphertext))
                .isInstanceOf(MalformedObjectException.class);
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    public void shouldRejectAuthenticPayloadDeclaringHugeArray() {
        var ciphertext = sealUnderWrapKey(new byte[] { (byte) 0x9A, 0x7F, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF });

        assertThatThrownBy(() -> store.unwrap(WRAP_KEY_ID, ZERO_NONCE, ciphertext))
                .isInstanceOf(MalformedObjectException.class);
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    public void shouldRejectWrappedObjectWithInvalidMaterial() throws Exception {
        var info = new ObjectInfo(50, ObjectType.WRAP_KEY, Algorithm.AES256_CCM_WRAP, Capability.none(),
                Capability.none(), Domain.DOM1, 8, 1, ObjectOrigin.WRAPPED_GENERATED, ObjectLabel.empty());
        var ciphertext = sealUnderWrapKey(new WrappedObject(info, new byte[8]).encode());

        assertThatThrownBy(() -> store.unwrap(WRAP_KEY_ID, ZERO_NONCE, ciphertext))
                .isInstanceOf(MalformedObjectException.class);
        assertThat(store.contains(50, ObjectType.WRAP_KEY)).isFalse();
    }

    @Test
    public void wrapShouldNotChangeStore() throws Exception {
        List<ObjectInfo> before = store.list(ObjectFilter.all());

        store.wrap(WRAP_KEY_ID, HMAC_KEY_ID, ObjectType.HMAC_KEY, ZERO_NONCE);

        assertThat(store.list(ObjectFilter.all())).isEqualTo(before);
    }

    private byte[] sealUnderWrapKey(byte[] plaintext) {
        var keyMaterial = store.get(WRAP_KEY_ID, ObjectType.WRAP_KEY).orElseThrow().payload().toByteArray();
        var cipher = AesGcmWrapCipher.A256GCM;
        var buffer = Arrays.copyOf(plaintext, plaintext.length + cipher.tagSizeBytes());
        cipher.sealInPlace(cipher.importKey(keyMaterial), ZERO_NONCE.aeadNonce(), new byte[0], buffer);
        return buffer;
    }
}
