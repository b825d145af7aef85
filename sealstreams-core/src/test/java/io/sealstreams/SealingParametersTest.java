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

package io.sealstreams;

import static org.assertj.core.api.SoftAssertions.assertSoftly;

import org.testng.annotations.Test;

import io.sealstreams.crypto.CounterModeCipher;
import io.sealstreams.crypto.KeyedDigest;

public class SealingParametersTest {

    @Test
    public void shouldApplyDefaults() {
        var params = SealingParameters.builder()
                .macKey(TestParameters.MAC_KEY)
                .cipherKey(TestParameters.CIPHER_KEY)
                .iv(TestParameters.IV)
                .build();

        assertSoftly(softly -> {
            softly.assertThat(params.header()).isEmpty();
            softly.assertThat(params.chunkSize()).isEqualTo(131072);
            softly.assertThat(params.offset()).isZero();
            softly.assertThat(params.cipher()).isSameAs(CounterModeCipher.AES_CTR);
            softly.assertThat(params.digest()).isSameAs(KeyedDigest.SHA3_256);
        });
    }

    @Test
    public void shouldRejectWrongSizedParameters() {
        assertSoftly(softly -> {
            softly.assertThatIllegalArgumentException()
                    .isThrownBy(() -> TestParameters.builder().macKey(new byte[31]).build())
                    .withMessage("MAC key must be 32 bytes");
            softly.assertThatIllegalArgumentException()
                    .isThrownBy(() -> TestParameters.builder().cipherKey(new byte[33]).build())
                    .withMessage("cipher key must be 32 bytes");
            softly.assertThatIllegalArgumentException()
                    .isThrownBy(() -> TestParameters.builder().iv(new byte[12]).build())
                    .withMessage("IV must be 16 bytes");
            softly.assertThatIllegalArgumentException()
                    .isThrownBy(() -> TestParameters.builder().macKey(null).build());
            softly.assertThatIllegalArgumentException()
                    .isThrownBy(() -> TestParameters.builder().chunkSize(0).build());
            softly.assertThatIllegalArgumentException()
                    .isThrownBy(() -> TestParameters.builder().offset(-1).build());
        });
    }

    @Test
    public void shouldCopyByteArrays() {
        var header = new byte[] { 1, 2, 3 };
        var params = TestParameters.builder().header(header).build();

        header[0] = 42;
        params.header()[1] = 42;

        assertSoftly(softly -> softly.assertThat(params.header()).isEqualTo(new byte[] { 1, 2, 3 }));
    }

    @Test
    public void shouldNotLeakKeysInToString() {
        var params = TestParameters.builder().build();

        assertSoftly(softly -> softly.assertThat(params.toString())
                .contains("A256CTR", "KSHA3256")
                .doesNotContain("1111"));
    }
}
