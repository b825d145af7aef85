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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Pull-driven adapter that runs a {@link StreamTransform} over a source iterator. Input is only pulled, and the
 * transform only invoked, when the consumer asks for more output, so a consumer that stops iterating stops all
 * further work.
 * <p>
 * A failure raised by the transform is held back until the output produced before it has been consumed, and is then
 * rethrown from every subsequent call to {@link #hasNext()}.
 */
final class TransformingIterator implements Iterator<byte[]> {
    private final Iterator<byte[]> source;
    private final StreamTransform transform;
    private final Deque<byte[]> ready = new ArrayDeque<>();

    private boolean started;
    private boolean finished;
    private RuntimeException failure;

    TransformingIterator(Iterator<byte[]> source, StreamTransform transform) {
        this.source = requireNonNull(source, "source");
        this.transform = requireNonNull(transform, "transform");
    }

    @Override
    public boolean hasNext() {
        fill();
        if (!ready.isEmpty()) {
            return true;
        }
        if (failure != null) {
            throw failure;
        }
        return false;
    }

    @Override
    public byte[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return ready.removeFirst();
    }

    private void fill() {
        try {
            if (!started) {
                started = true;
                transform.start(ready::addLast);
            }
            while (ready.isEmpty() && !finished) {
                if (source.hasNext()) {
                    transform.transform(source.next(), ready::addLast);
                } else {
                    finished = true;
                    transform.flush(ready::addLast);
                }
            }
        } catch (RuntimeException e) {
            finished = true;
            if (failure == null) {
                failure = e;
            }
        }
    }
}
