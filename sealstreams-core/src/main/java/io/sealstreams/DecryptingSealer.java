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

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import software.pando.crypto.nacl.Bytes;

/**
 * Decrypts {@code ciphertext || tag}. Because the tag is only identified by being the last {@value #TAG_SIZE} bytes
 * of the stream, incoming chunks are held back until at least that many bytes have arrived after them. Only then is a
 * chunk known to be pure ciphertext, so it is authenticated, decrypted under the IV it was received at, and emitted.
 * <p>
 * When chunks are at least {@value #TAG_SIZE} bytes long, at most one chunk is held back. The tag may straddle the
 * last two chunks, in which case it is reassembled from both and the earlier chunk is truncated.
 * <p>
 * Plaintext is emitted before the tag has been checked. If {@link #flush(Consumer)} fails with
 * {@link AuthenticationFailedException} then all output of the stream must be discarded.
 */
final class DecryptingSealer extends Sealer {
    private static final Logger logger = LoggerFactory.getLogger(DecryptingSealer.class);

    private final Deque<Segment> pending = new ArrayDeque<>();
    private long pendingBytes;
    private boolean tagSplit;

    DecryptingSealer(SealingParameters params) {
        super(params);
    }

    @Override
    void onStart(Consumer<byte[]> sink) {
        logger.debug("Unsealing stream: {}", params);
    }

    @Override
    void onChunk(byte[] chunk, Consumer<byte[]> sink) {
        var start = iv.snapshot();
        // the last TAG_SIZE bytes are never decrypted, so only a released segment is checked against the counter
        iv.skip(chunk.length);
        if (chunk.length == 0) {
            return;
        }

        pending.addLast(new Segment(chunk.clone(), start));
        pendingBytes += chunk.length;

        while (pendingBytes - pending.getFirst().length() >= TAG_SIZE) {
            var segment = pending.removeFirst();
            pendingBytes -= segment.length();
            release(segment, sink);
        }
    }

    @Override
    void onFinish(Consumer<byte[]> sink) {
        if (pendingBytes < TAG_SIZE) {
            throw new MalformedStreamException("stream of " + pendingBytes +
                    " bytes is too short to contain a " + TAG_SIZE + "-byte tag");
        }

        var tag = new byte[TAG_SIZE];
        int missing = TAG_SIZE;
        int tagSegments = 0;
        while (missing > 0) {
            var last = pending.removeLast();
            int take = Math.min(missing, last.length());
            System.arraycopy(last.ciphertext(), last.length() - take, tag, missing - take, take);
            missing -= take;
            tagSegments++;
            if (take < last.length()) {
                pending.addLast(last.truncate(last.length() - take));
            }
        }
        tagSplit = tagSegments > 1;
        if (tagSplit) {
            logger.debug("Tag was split across {} chunks", tagSegments);
        }

        while (!pending.isEmpty()) {
            release(pending.removeFirst(), sink);
        }
        pendingBytes = 0;

        var computed = computeTag();
        logger.trace("Tag found in stream: {}, computed tag: {}", Utils.maskForLog(tag), Utils.maskForLog(computed));
        if (!Bytes.equal(computed, tag)) {
            logger.debug("Authentication tag mismatch, stream rejected");
            throw new AuthenticationFailedException("authentication tag does not match");
        }
    }

    /**
     * Whether the tag of the finished stream spanned more than one chunk.
     */
    boolean isTagSplit() {
        return tagSplit;
    }

    /**
     * Number of ciphertext bytes received but not yet decrypted.
     */
    long pendingBytes() {
        return pendingBytes;
    }

    private void release(Segment segment, Consumer<byte[]> sink) {
        segment.start().requireCapacity(segment.length());
        authenticate(segment.ciphertext());
        var plaintext = applyCipher(segment.start().toBytes(), segment.ciphertext(), false);
        logger.trace("Decrypted chunk: length={}", segment.length());
        emit(sink, plaintext);
    }

    private record Segment(byte[] ciphertext, CounterIv start) {
        int length() {
            return ciphertext.length;
        }

        Segment truncate(int newLength) {
            return new Segment(Arrays.copyOf(ciphertext, newLength), start);
        }
    }
}
