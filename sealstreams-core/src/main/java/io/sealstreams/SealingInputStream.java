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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * An {@link InputStream} that reads from an underlying stream through a sealing pipeline. Nothing is read from the
 * underlying stream until data is requested. A failure of the pipeline, including a failed authentication check at
 * the end of a decrypted stream, is reported as an {@link IOException} once all output produced before it has been
 * read.
 */
final class SealingInputStream extends InputStream {
    private static final byte[] EMPTY = new byte[0];

    private final InputStream in;
    private final Iterator<byte[]> output;

    private byte[] current = EMPTY;
    private int position;

    SealingInputStream(InputStream in, int readSize, UnaryOperator<Iterator<byte[]>> pipeline) {
        this.in = requireNonNull(in, "in");
        this.output = pipeline.apply(new Fragments(in, Require.positive(readSize, "read size must be positive")));
    }

    @Override
    public int read() throws IOException {
        if (!ensureAvailable()) {
            return -1;
        }
        return current[position++] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (len == 0) {
            return 0;
        }
        if (!ensureAvailable()) {
            return -1;
        }
        int count = Math.min(len, current.length - position);
        System.arraycopy(current, position, b, off, count);
        position += count;
        return count;
    }

    @Override
    public int available() {
        return current.length - position;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    private boolean ensureAvailable() throws IOException {
        try {
            while (position == current.length) {
                if (!output.hasNext()) {
                    return false;
                }
                current = output.next();
                position = 0;
            }
            return true;
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } catch (SealingException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    private static final class Fragments implements Iterator<byte[]> {
        private final InputStream in;
        private final byte[] buffer;
        private byte[] next;
        private boolean eof;

        Fragments(InputStream in, int readSize) {
            this.in = in;
            this.buffer = new byte[readSize];
        }

        @Override
        public boolean hasNext() {
            while (next == null && !eof) {
                try {
                    int read = in.read(buffer);
                    if (read < 0) {
                        eof = true;
                    } else if (read > 0) {
                        next = Arrays.copyOf(buffer, read);
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
            return next != null;
        }

        @Override
        public byte[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var fragment = next;
            next = null;
            return fragment;
        }
    }
}
