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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A set of up to 16 logical domains that partition the objects on a device. The store records domains but does not
 * enforce them; that is left to the command dispatch layer.
 */
public final class Domain {
    public static final int MAX_DOMAINS = 16;

    public static final Domain DOM1 = at(1);
    public static final Domain DOM2 = at(2);
    public static final Domain DOM3 = at(3);
    public static final Domain DOM4 = at(4);
    public static final Domain DOM5 = at(5);
    public static final Domain DOM6 = at(6);
    public static final Domain DOM7 = at(7);
    public static final Domain DOM8 = at(8);
    public static final Domain DOM9 = at(9);
    public static final Domain DOM10 = at(10);
    public static final Domain DOM11 = at(11);
    public static final Domain DOM12 = at(12);
    public static final Domain DOM13 = at(13);
    public static final Domain DOM14 = at(14);
    public static final Domain DOM15 = at(15);
    public static final Domain DOM16 = at(16);

    private static final Domain NONE = new Domain(0);
    private static final Domain ALL = new Domain(0xFFFF);

    private final int bits;

    private Domain(int bits) {
        this.bits = bits;
    }

    /**
     * Returns the singleton set for the given domain number.
     *
     * @param domain the domain number, from 1 to 16.
     * @return the domain set.
     */
    public static Domain at(int domain) {
        Utils.require(domain >= 1 && domain <= MAX_DOMAINS, "Domain must be between 1 and 16: " + domain);
        return new Domain(1 << (domain - 1));
    }

    public static Domain none() {
        return NONE;
    }

    public static Domain all() {
        return ALL;
    }

    public static Domain fromBits(int bits) {
        Utils.require((bits & ~0xFFFF) == 0, "Domain mask must fit in 16 bits: 0x" + Integer.toHexString(bits));
        return new Domain(bits);
    }

    public static Domain of(Domain... domains) {
        int bits = 0;
        for (var domain : domains) {
            bits |= domain.bits;
        }
        return new Domain(bits);
    }

    public Domain union(Domain other) {
        return new Domain(bits | other.bits);
    }

    public boolean contains(Domain other) {
        return (bits & other.bits) == other.bits;
    }

    public boolean intersects(Domain other) {
        return (bits & other.bits) != 0;
    }

    public boolean isEmpty() {
        return bits == 0;
    }

    public int bits() {
        return bits;
    }

    /**
     * The domain numbers (1-16) contained in this set, in ascending order.
     */
    public List<Integer> numbers() {
        var numbers = new ArrayList<Integer>();
        for (int i = 0; i < MAX_DOMAINS; ++i) {
            if ((bits & (1 << i)) != 0) {
                numbers.add(i + 1);
            }
        }
        return Collections.unmodifiableList(numbers);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof Domain)) { return false; }
        return bits == ((Domain) other).bits;
    }

    @Override
    public int hashCode() {
        return bits;
    }

    @Override
    public String toString() {
        return "Domain" + numbers();
    }
}
