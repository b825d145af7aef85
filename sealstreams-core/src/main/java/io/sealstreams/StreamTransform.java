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

import java.util.function.Consumer;

/**
 * A single-use, single-threaded transformation of an ordered sequence of byte arrays. The transform is driven by its
 * caller: {@link #start(Consumer)} once, {@link #transform(byte[], Consumer)} for each input in order, and finally
 * {@link #flush(Consumer)} once at the end of input. Output segments are passed to the supplied sink in the order
 * they are produced.
 */
public interface StreamTransform {

    void start(Consumer<byte[]> sink);

    void transform(byte[] input, Consumer<byte[]> sink);

    void flush(Consumer<byte[]> sink);

    /**
     * Returns a transform that feeds the output of this transform into {@code next}.
     *
     * @param next the downstream transform.
     * @return the composed transform.
     */
    default StreamTransform andThen(StreamTransform next) {
        requireNonNull(next, "next");
        var self = this;
        return new StreamTransform() {
            @Override
            public void start(Consumer<byte[]> sink) {
                next.start(sink);
                self.start(segment -> next.transform(segment, sink));
            }

            @Override
            public void transform(byte[] input, Consumer<byte[]> sink) {
                self.transform(input, segment -> next.transform(segment, sink));
            }

            @Override
            public void flush(Consumer<byte[]> sink) {
                self.flush(segment -> next.transform(segment, sink));
                next.flush(sink);
            }
        };
    }
}
