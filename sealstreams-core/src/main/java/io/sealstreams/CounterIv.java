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

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * A counter-mode IV: an 8-byte nonce followed by an 8-byte big-endian unsigned block counter. Only the counter
 * changes, and it never wraps: every counter value up to 2<sup>64</sup> - 1 can be used once, after which the IV is
 * exhausted.
 */
final class CounterIv {
    static final int SIZE = 16;
    static final int NONCE_SIZE = 8;
    static final int BLOCK_SIZE = 16;

    private final byte[] nonce;
    private long counter;
    private boolean exhausted;

    CounterIv(byte[] iv) {
        Require.exactLength(iv, SIZE, "IV must be " + SIZE + " bytes");
        this.nonce = Arrays.copyOf(iv, NONCE_SIZE);
        this.counter = ByteBuffer.wrap(iv, NONCE_SIZE, SIZE - NONCE_SIZE).getLong();
    }

    private CounterIv(CounterIv other) {
        this.nonce = other.nonce;
        this.counter = other.counter;
        this.exhausted = other.exhausted;
    }

    static long blocksFor(long length) {
        return (length + BLOCK_SIZE - 1) / BLOCK_SIZE;
    }

    /**
     * The counter as an unsigned 64-bit value. Meaningless once the IV is exhausted.
     */
    long counter() {
        return counter;
    }

    boolean isExhausted() {
        return exhausted;
    }

    byte[] toBytes() {
        return ByteBuffer.allocate(SIZE).put(nonce).putLong(counter).array();
    }

    /**
     * An independent copy of the current position.
     */
    CounterIv snapshot() {
        return new CounterIv(this);
    }

    /**
     * Moves the counter past the blocks consumed by {@code length} bytes of data.
     *
     * @throws StreamTooLargeException if the data needs a block beyond counter 2<sup>64</sup> - 1.
     */
    void advance(int length) {
        requireCapacity(length);
        move(blocksFor(length));
    }

    /**
     * Moves the counter past {@code length} bytes that will not necessarily be processed, so running past the end of
     * the counter space is not an error. Any later attempt to process data from beyond the end fails instead.
     */
    void skip(int length) {
        long blocks = blocksFor(length);
        if (hasCapacity(blocks)) {
            move(blocks);
        } else {
            exhausted = true;
            counter = 0;
        }
    }

    /**
     * Checks that {@code length} bytes of data can be processed starting at the current position.
     *
     * @throws StreamTooLargeException if they cannot.
     */
    void requireCapacity(int length) {
        if (!hasCapacity(blocksFor(length))) {
            throw new StreamTooLargeException(exhausted
                    ? "block counter exhausted"
                    : "block counter exhausted at " + Long.toUnsignedString(counter));
        }
    }

    private boolean hasCapacity(long blocks) {
        if (blocks == 0) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        // 2^64 - counter blocks remain, which is -counter as an unsigned value
        return counter == 0 || Long.compareUnsigned(blocks, -counter) <= 0;
    }

    private void move(long blocks) {
        counter += blocks;
        if (blocks > 0 && counter == 0) {
            exhausted = true;
        }
    }

    @Override
    public String toString() {
        return "CounterIv{nonce=" + Utils.hex(nonce) + ", counter=" +
                (exhausted ? "exhausted" : Long.toUnsignedString(counter)) + '}';
    }
}
