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

import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

/**
 * Re-chunks a sequence of arbitrarily sized fragments into chunks of exactly {@code chunkSize} bytes. Only the last
 * chunk may be shorter, and it is produced even when empty. A number of leading bytes of the stream can be skipped
 * before chunking starts.
 * <p>
 * Every chunk is a fresh array that the chunker does not touch again.
 */
public final class Chunker implements StreamTransform {
    private static final byte[] EMPTY = new byte[0];

    private final byte[] buffer;
    private int fill;
    private long toSkip;

    public Chunker(long offset, int chunkSize) {
        Require.nonNegative(offset, "offset must not be negative");
        Require.positive(chunkSize, "chunk size must be positive");
        this.buffer = new byte[chunkSize];
        this.toSkip = offset;
    }

    public Chunker(int chunkSize) {
        this(0, chunkSize);
    }

    /**
     * Lazily re-chunks the given fragments. Fragments are only pulled from the source when a chunk is requested and
     * the buffered data is not enough to fill it.
     *
     * @param fragments the source fragments. Each fragment must not be modified after it has been pulled.
     * @param offset the number of leading bytes to discard.
     * @param chunkSize the size of every chunk except the last.
     * @return the chunks. The iterator is not restartable.
     */
    public static Iterator<byte[]> rebuffer(Iterator<byte[]> fragments, long offset, int chunkSize) {
        return new ChunkIterator(requireNonNull(fragments, "fragments"), new Chunker(offset, chunkSize));
    }

    public int chunkSize() {
        return buffer.length;
    }

    @Override
    public void start(Consumer<byte[]> sink) {
        // Nothing is emitted before the first fragment
    }

    @Override
    public void transform(byte[] fragment, Consumer<byte[]> sink) {
        requireNonNull(fragment, "fragment");
        int position = 0;
        while (true) {
            position = absorb(fragment, position);
            if (!isFull()) {
                return;
            }
            sink.accept(takeFull());
        }
    }

    @Override
    public void flush(Consumer<byte[]> sink) {
        sink.accept(takeRemainder());
    }

    /**
     * Copies as much of the fragment as fits into the buffer, after first skipping any outstanding offset.
     *
     * @return the position in the fragment up to which bytes have been consumed.
     */
    private int absorb(byte[] fragment, int from) {
        if (toSkip > 0) {
            int skipped = (int) Math.min(toSkip, fragment.length - from);
            toSkip -= skipped;
            from += skipped;
        }
        int count = Math.min(fragment.length - from, buffer.length - fill);
        System.arraycopy(fragment, from, buffer, fill, count);
        fill += count;
        return from + count;
    }

    private boolean isFull() {
        return fill == buffer.length;
    }

    private byte[] takeFull() {
        assert isFull();
        fill = 0;
        return buffer.clone();
    }

    private byte[] takeRemainder() {
        var remainder = Arrays.copyOf(buffer, fill);
        fill = 0;
        return remainder;
    }

    private static final class ChunkIterator implements Iterator<byte[]> {
        private final Iterator<byte[]> fragments;
        private final Chunker chunker;

        private byte[] fragment = EMPTY;
        private int position;
        private byte[] next;
        private boolean exhausted;

        ChunkIterator(Iterator<byte[]> fragments, Chunker chunker) {
            this.fragments = fragments;
            this.chunker = chunker;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            while (true) {
                position = chunker.absorb(fragment, position);
                if (chunker.isFull()) {
                    next = chunker.takeFull();
                    return true;
                }
                if (!fragments.hasNext()) {
                    fragment = EMPTY;
                    next = chunker.takeRemainder();
                    exhausted = true;
                    return true;
                }
                fragment = requireNonNull(fragments.next(), "fragment");
                position = 0;
            }
        }

        @Override
        public byte[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var chunk = next;
            next = null;
            return chunk;
        }
    }
}
