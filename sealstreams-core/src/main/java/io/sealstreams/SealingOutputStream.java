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

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An {@link OutputStream} that pushes everything written to it through a {@link StreamTransform} and writes the
 * output to the underlying stream. Closing the stream flushes the transform, which for an encrypting transform writes
 * the tag and for a decrypting transform verifies it.
 */
final class SealingOutputStream extends FilterOutputStream {
    private final StreamTransform transform;
    private final Consumer<byte[]> sink;
    private boolean closed;
    private boolean failed;

    SealingOutputStream(OutputStream out, StreamTransform transform) throws IOException {
        super(requireNonNull(out, "out"));
        this.transform = requireNonNull(transform, "transform");
        this.sink = segment -> {
            try {
                this.out.write(segment);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        };
        run(() -> transform.start(sink));
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[] { (byte) b }, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        if (closed) {
            throw new IOException("stream is closed");
        }
        if (failed) {
            throw new IOException("stream has already failed");
        }
        if (len > 0) {
            var fragment = Arrays.copyOfRange(b, off, off + len);
            run(() -> transform.transform(fragment, sink));
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            // a failed transform has already reported its error and destroyed its keys
            if (!failed) {
                run(() -> transform.flush(sink));
            }
            out.flush();
        } finally {
            out.close();
        }
    }

    private void run(Runnable step) throws IOException {
        try {
            step.run();
        } catch (UncheckedIOException e) {
            failed = true;
            throw e.getCause();
        } catch (SealingException e) {
            failed = true;
            throw new IOException(e.getMessage(), e);
        } catch (RuntimeException e) {
            failed = true;
            throw e;
        }
    }

    @Override
    public String toString() {
        return "SealingOutputStream:" + out;
    }
}
