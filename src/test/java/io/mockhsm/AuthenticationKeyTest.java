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

import java.util.HexFormat;

import org.testng.annotations.Test;

public class AuthenticationKeyTest {

    @Test
    public void defaultKeyShouldMatchKnownDerivation() {
        var key = AuthenticationKey.defaultKey();

        assertThat(key.encryptionKey()).isEqualTo(HexFormat.of().parseHex("090b47dbed595654901dee1cc655e420"));
        assertThat(key.macKey()).isEqualTo(HexFormat.of().parseHex("592fd483f759e29909a04c4505d2ce0a"));
    }

    @Test
    public void shouldDeriveSameKeyFromSamePassword() {
        assertThat(AuthenticationKey.fromPassword("password".toCharArray())).isEqualTo(AuthenticationKey.defaultKey());
        assertThat(AuthenticationKey.fromPassword("other".toCharArray())).isNotEqualTo(AuthenticationKey.defaultKey());
    }

    @Test
    public void shouldRequireThirtyTwoBytes() {
        assertThatThrownBy(() -> AuthenticationKey.fromBytes(new byte[16]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldNotRevealKeyMaterial() {
        var key = AuthenticationKey.fromBytes(new byte[32]);
        assertThat(key.toString()).doesNotContain("0000");
    }
}
