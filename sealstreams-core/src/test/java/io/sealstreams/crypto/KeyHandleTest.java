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
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;

import org.testng.annotations.Test;

public class KeyHandleTest {

    @Test
    public void shouldWipeAndRefuseAccessOnceDestroyed() {
        var key = new KeyHandle(new byte[] { 1, 2, 3, 4 }, "AES");

        key.destroy();

        assertThat(key.isDestroyed()).isTrue();
        assertThatIllegalStateException().isThrownBy(key::getEncoded);
        assertThat(key.toString()).contains("destroyed");
    }

    @Test
    public void shouldCopyKeyMaterial() {
        var material = new byte[] { 1, 2, 3, 4 };
        var key = new KeyHandle(material, "AES");

        material[1] = 42;

        assertThat(key.getEncoded()).isEqualTo(new byte[] { 1, 2, 3, 4 });
    }

    @Test
    public void shouldNotRevealKeyMaterialInToString() {
        var key = new KeyHandle(new byte[] { 5, 6, 7, 8 }, "HmacSHA512");

        assertThat(key.toString()).isEqualTo("KeyHandle[HmacSHA512, 32 bits]");
    }

    @Test
    public void shouldBeDestroyedByTheCipherThatCreatedIt() throws Exception {
        var key = CounterModeCipher.AES_CTR.key(new byte[32]);

        assertThat(key).isInstanceOf(KeyHandle.class);
        key.destroy();
        assertThat(key.isDestroyed()).isTrue();
    }
}
