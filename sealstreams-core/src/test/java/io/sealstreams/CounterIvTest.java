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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.ByteBuffer;
import java.util.Arrays;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class CounterIvTest {

    @DataProvider
    public Object[][] lengths() {
        return new Object[][] {
                { 0, 0L },
                { 1, 1L },
                { 15, 1L },
                { 16, 1L },
                { 17, 2L },
                { 4095, 256L },
                { 4096, 256L },
        };
    }

    @Test(dataProvider = "lengths")
    public void shouldAdvanceByBlockCount(int length, long expectedBlocks) {
        var iv = new CounterIv(ivWithCounter(1000L));

        iv.advance(length);

        assertThat(iv.counter()).isEqualTo(1000L + expectedBlocks);
    }

    @Test
    public void shouldDecodeCounterAsBigEndian() {
        var bytes = ivWithCounter(0L);
        bytes[15] = 1;
        bytes[14] = 2;

        assertThat(new CounterIv(bytes).counter()).isEqualTo(0x0201L);
    }

    @Test
    public void shouldNeverChangeTheNonce() {
        var initial = ivWithCounter(0xFFFFFFFFL);
        var iv = new CounterIv(initial);

        iv.advance(4096);
        iv.advance(17);

        var bytes = iv.toBytes();
        assertThat(Arrays.copyOf(bytes, 8)).isEqualTo(Arrays.copyOf(initial, 8));
        assertThat(ByteBuffer.wrap(bytes, 8, 8).getLong()).isEqualTo(0xFFFFFFFFL + 258);
    }

    @Test
    public void shouldTreatCounterAsUnsigned() {
        var iv = new CounterIv(ivWithCounter(Long.MAX_VALUE));

        iv.advance(16);

        assertThat(Long.toUnsignedString(iv.counter())).isEqualTo("9223372036854775808");
    }

    @Test
    public void shouldUseTheLastCounterValueButNeverWrap() {
        var iv = new CounterIv(ivWithCounter(-2L));

        iv.advance(16);
        assertThat(iv.counter()).isEqualTo(-1L);
        iv.advance(1);
        assertThat(iv.isExhausted()).isTrue();

        assertThatThrownBy(() -> iv.advance(1)).isInstanceOf(StreamTooLargeException.class);
        assertThat(iv.isExhausted()).isTrue();
    }

    @Test
    public void shouldAllowAChunkEndingExactlyAtTheEndOfTheCounterSpace() {
        var iv = new CounterIv(ivWithCounter(-3L));

        iv.advance(48);

        assertThat(iv.isExhausted()).isTrue();
    }

    @Test
    public void shouldRejectAChunkNeedingOneBlockMoreThanRemains() {
        var iv = new CounterIv(ivWithCounter(-3L));

        assertThatThrownBy(() -> iv.advance(49)).isInstanceOf(StreamTooLargeException.class);
        assertThat(iv.counter()).isEqualTo(-3L);
        assertThat(iv.isExhausted()).isFalse();
    }

    @Test
    public void shouldSkipPastTheEndWithoutFailing() {
        var iv = new CounterIv(ivWithCounter(-1L));
        var start = iv.snapshot();

        iv.skip(32);
        iv.skip(32);

        assertThat(iv.isExhausted()).isTrue();
        assertThatThrownBy(() -> iv.requireCapacity(1)).isInstanceOf(StreamTooLargeException.class);
        iv.requireCapacity(0);
        start.requireCapacity(16);
        assertThatThrownBy(() -> start.requireCapacity(17)).isInstanceOf(StreamTooLargeException.class);
    }

    @Test
    public void shouldKeepSnapshotsIndependent() {
        var iv = new CounterIv(ivWithCounter(5L));
        var snapshot = iv.snapshot();

        iv.advance(64);

        assertThat(snapshot.counter()).isEqualTo(5L);
        assertThat(snapshot.toBytes()).isEqualTo(ivWithCounter(5L));
        assertThat(iv.counter()).isEqualTo(9L);
    }

    @Test
    public void shouldAllowEmptyChunksAtTheLastCounterValue() {
        var iv = new CounterIv(ivWithCounter(-1L));

        iv.advance(0);

        assertThat(iv.counter()).isEqualTo(-1L);
    }

    @Test
    public void shouldRejectWrongSizedIv() {
        assertThatIllegalArgumentException().isThrownBy(() -> new CounterIv(new byte[15]));
        assertThatIllegalArgumentException().isThrownBy(() -> new CounterIv(new byte[17]));
    }

    static byte[] ivWithCounter(long counter) {
        return ByteBuffer.allocate(16).put(TestParameters.IV, 0, 8).putLong(counter).array();
    }
}
