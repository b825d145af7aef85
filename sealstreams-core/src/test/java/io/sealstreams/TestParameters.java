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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

final class TestParameters {
    static final byte[] MAC_KEY = filled(32, 0x11);
    static final byte[] CIPHER_KEY = filled(32, 0x22);
    static final byte[] IV = new byte[] {
            (byte) 0xa0, (byte) 0xa1, (byte) 0xa2, (byte) 0xa3, (byte) 0xa4, (byte) 0xa5, (byte) 0xa6, (byte) 0xa7,
            0, 0, 0, 0, 0, 0, 0, 0
    };
    static final byte[] HEADER = "sealed-header-v1".getBytes(UTF_8);

    static SealingParameters.Builder builder() {
        return SealingParameters.builder()
                .macKey(MAC_KEY)
                .cipherKey(CIPHER_KEY)
                .iv(IV)
                .header(HEADER);
    }

    static SealingParameters withChunkSize(int chunkSize) {
        return builder().chunkSize(chunkSize).build();
    }

    static byte[] filled(int length, int value) {
        var bytes = new byte[length];
        Arrays.fill(bytes, (byte) value);
        return bytes;
    }

    static byte[] randomBytes(int length, long seed) {
        var bytes = new byte[length];
        new Random(seed).nextBytes(bytes);
        return bytes;
    }

    /**
     * Splits the data into fragments of random sizes between 0 and {@code maxFragment} inclusive.
     */
    static List<byte[]> randomFragments(byte[] data, int maxFragment, long seed) {
        var random = new Random(seed);
        var fragments = new ArrayList<byte[]>();
        int position = 0;
        while (position < data.length) {
            int size = Math.min(random.nextInt(maxFragment + 1), data.length - position);
            fragments.add(Arrays.copyOfRange(data, position, position + size));
            position += size;
        }
        return fragments;
    }

    static byte[] concat(Iterator<byte[]> segments) {
        var out = new ByteArrayOutputStream();
        segments.forEachRemaining(out::writeBytes);
        return out.toByteArray();
    }

    static byte[] concat(List<byte[]> segments) {
        return concat(segments.iterator());
    }

    private TestParameters() {}
}
