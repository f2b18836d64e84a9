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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A set of capabilities, which gate the operations that may be performed with or on an object. Capabilities are a
 * flat 64-bit set: there is no hierarchy between them, and a permission check is simply a subset test via
 * {@link #contains(Capability)}.
 */
public final class Capability {
    private static final Map<String, Capability> NAMED = new LinkedHashMap<>();

    public static final Capability GET_OPAQUE = named("GET_OPAQUE", 0);
    public static final Capability PUT_OPAQUE = named("PUT_OPAQUE", 1);
    public static final Capability PUT_AUTHENTICATION_KEY = named("PUT_AUTHENTICATION_KEY", 2);
    public static final Capability PUT_ASYMMETRIC_KEY = named("PUT_ASYMMETRIC_KEY", 3);
    public static final Capability GENERATE_ASYMMETRIC_KEY = named("GENERATE_ASYMMETRIC_KEY", 4);
    public static final Capability SIGN_PKCS = named("SIGN_PKCS", 5);
    public static final Capability SIGN_PSS = named("SIGN_PSS", 6);
    public static final Capability SIGN_ECDSA = named("SIGN_ECDSA", 7);
    public static final Capability SIGN_EDDSA = named("SIGN_EDDSA", 8);
    public static final Capability DECRYPT_PKCS = named("DECRYPT_PKCS", 9);
    public static final Capability DECRYPT_OAEP = named("DECRYPT_OAEP", 10);
    public static final Capability DERIVE_ECDH = named("DERIVE_ECDH", 11);
    public static final Capability EXPORT_WRAPPED = named("EXPORT_WRAPPED", 12);
    public static final Capability IMPORT_WRAPPED = named("IMPORT_WRAPPED", 13);
    public static final Capability PUT_WRAP_KEY = named("PUT_WRAP_KEY", 14);
    public static final Capability GENERATE_WRAP_KEY = named("GENERATE_WRAP_KEY", 15);
    public static final Capability EXPORTABLE_UNDER_WRAP = named("EXPORTABLE_UNDER_WRAP", 16);
    public static final Capability SET_OPTION = named("SET_OPTION", 17);
    public static final Capability GET_OPTION = named("GET_OPTION", 18);
    public static final Capability GET_PSEUDO_RANDOM = named("GET_PSEUDO_RANDOM", 19);
    public static final Capability PUT_HMAC_KEY = named("PUT_HMAC_KEY", 20);
    public static final Capability GENERATE_HMAC_KEY = named("GENERATE_HMAC_KEY", 21);
    public static final Capability SIGN_HMAC = named("SIGN_HMAC", 22);
    public static final Capability VERIFY_HMAC = named("VERIFY_HMAC", 23);
    public static final Capability GET_LOG_ENTRIES = named("GET_LOG_ENTRIES", 24);
    public static final Capability SIGN_SSH_CERTIFICATE = named("SIGN_SSH_CERTIFICATE", 25);
    public static final Capability GET_TEMPLATE = named("GET_TEMPLATE", 26);
    public static final Capability PUT_TEMPLATE = named("PUT_TEMPLATE", 27);
    public static final Capability RESET_DEVICE = named("RESET_DEVICE", 28);
    public static final Capability DECRYPT_OTP = named("DECRYPT_OTP", 29);
    public static final Capability CREATE_OTP_AEAD = named("CREATE_OTP_AEAD", 30);
    public static final Capability RANDOMIZE_OTP_AEAD = named("RANDOMIZE_OTP_AEAD", 31);
    public static final Capability REWRAP_FROM_OTP_AEAD_KEY = named("REWRAP_FROM_OTP_AEAD_KEY", 32);
    public static final Capability REWRAP_TO_OTP_AEAD_KEY = named("REWRAP_TO_OTP_AEAD_KEY", 33);
    public static final Capability SIGN_ATTESTATION_CERTIFICATE = named("SIGN_ATTESTATION_CERTIFICATE", 34);
    public static final Capability PUT_OTP_AEAD_KEY = named("PUT_OTP_AEAD_KEY", 35);
    public static final Capability GENERATE_OTP_AEAD_KEY = named("GENERATE_OTP_AEAD_KEY", 36);
    public static final Capability WRAP_DATA = named("WRAP_DATA", 37);
    public static final Capability UNWRAP_DATA = named("UNWRAP_DATA", 38);
    public static final Capability DELETE_OPAQUE = named("DELETE_OPAQUE", 39);
    public static final Capability DELETE_AUTHENTICATION_KEY = named("DELETE_AUTHENTICATION_KEY", 40);
    public static final Capability DELETE_ASYMMETRIC_KEY = named("DELETE_ASYMMETRIC_KEY", 41);
    public static final Capability DELETE_WRAP_KEY = named("DELETE_WRAP_KEY", 42);
    public static final Capability DELETE_HMAC_KEY = named("DELETE_HMAC_KEY", 43);
    public static final Capability DELETE_TEMPLATE = named("DELETE_TEMPLATE", 44);
    public static final Capability DELETE_OTP_AEAD_KEY = named("DELETE_OTP_AEAD_KEY", 45);
    public static final Capability CHANGE_AUTHENTICATION_KEY = named("CHANGE_AUTHENTICATION_KEY", 46);

    private static final Capability NONE = new Capability(0L);
    private static final Capability ALL = new Capability(
            NAMED.values().stream().mapToLong(Capability::bits).reduce(0L, (a, b) -> a | b));

    private final long bits;

    private Capability(long bits) {
        this.bits = bits;
    }

    private static Capability named(String name, int bit) {
        var capability = new Capability(1L << bit);
        NAMED.put(name, capability);
        return capability;
    }

    public static Capability none() {
        return NONE;
    }

    /**
     * The set of every capability known to the device. Assigned to the factory-default authentication key.
     */
    public static Capability all() {
        return ALL;
    }

    /**
     * Reconstructs a capability set from its wire representation.
     *
     * @param bits the raw 64-bit mask.
     * @return the capability set.
     * @throws IllegalArgumentException if the mask contains bits that do not correspond to any known capability.
     */
    public static Capability fromBits(long bits) {
        Utils.require((bits & ~ALL.bits) == 0, "Unknown capability bits: 0x" + Long.toHexString(bits & ~ALL.bits));
        return new Capability(bits);
    }

    public static Capability of(Capability... capabilities) {
        long bits = 0L;
        for (var capability : capabilities) {
            bits |= capability.bits;
        }
        return new Capability(bits);
    }

    public static Optional<Capability> valueOf(String name) {
        return Optional.ofNullable(NAMED.get(requireNonNull(name, "name")));
    }

    public Capability union(Capability other) {
        return new Capability(bits | other.bits);
    }

    /**
     * Subset test: returns true if every capability in {@code other} is also present in this set.
     */
    public boolean contains(Capability other) {
        return (bits & other.bits) == other.bits;
    }

    public boolean isEmpty() {
        return bits == 0L;
    }

    public long bits() {
        return bits;
    }

    public Set<String> names() {
        var names = new LinkedHashSet<String>();
        NAMED.forEach((name, capability) -> {
            if (contains(capability)) {
                names.add(name);
            }
        });
        return Collections.unmodifiableSet(names);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof Capability)) { return false; }
        return bits == ((Capability) other).bits;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bits);
    }

    @Override
    public String toString() {
        return "Capability" + names();
    }
}
