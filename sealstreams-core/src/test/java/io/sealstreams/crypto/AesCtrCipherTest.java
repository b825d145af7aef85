/*
 * Copyright 2024 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.sealstreams.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.util.HexFormat;

import org.testng.annotations.Test;

public class AesCtrCipherTest {
    private static final HexFormat HEX = HexFormat.of();

    // NIST SP 800-38A, F.5.5 CTR-AES256.Encrypt
    private static final byte[] KEY = HEX.parseHex(
            "603deb1015ca71be2b73aef0857d77811f352c073b6108d72d9810a30914dff4");
    private static final byte[] INITIAL_COUNTER = HEX.parseHex("f0f1f2f3f4f5f6f7f8f9fafbfcfdfeff");
    private static final byte[] PLAINTEXT = HEX.parseHex(
            "6bc1bee22e409f96e93d7e117393172aae2d8a571e03ac9c9eb76fac45af8e51");
    private static final byte[] CIPHERTEXT = HEX.parseHex(
            "601ec313775789a5b7a7f504bbf3d228f443e3ca4d62b59aca84e990cacaf5c5");

    private final CounterModeCipher cipher = CounterModeCipher.AES_CTR;

    @Test
    public void shouldMatchNistTestVector() {
        var key = cipher.key(KEY);

        assertThat(cipher.encrypt(key, INITIAL_COUNTER, PLAINTEXT)).isEqualTo(CIPHERTEXT);
        assertThat(cipher.decrypt(key, INITIAL_COUNTER, CIPHERTEXT)).isEqualTo(PLAINTEXT);
    }

    @Test
    public void shouldNotModifyInput() {
        var input = PLAINTEXT.clone();

        cipher.encrypt(cipher.key(KEY), INITIAL_COUNTER, input);

        assertThat(input).isEqualTo(PLAINTEXT);
    }

    @Test
    public void shouldHandleEmptyInput() {
        assertThat(cipher.encrypt(cipher.key(KEY), INITIAL_COUNTER, new byte[0])).isEmpty();
    }

    @Test
    public void shouldRejectWrongKeySize() {
        assertThatIllegalArgumentException().isThrownBy(() -> cipher.key(new byte[16]));
    }

    @Test
    public void shouldHaveCorrectIdentifier() {
        assertThat(cipher.identifier()).isEqualTo("A256CTR");
    }
}
