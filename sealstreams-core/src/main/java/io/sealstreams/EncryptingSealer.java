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

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encrypt-then-MAC: each chunk is encrypted, absorbed into the digest and emitted. The tag follows the last chunk.
 */
final class EncryptingSealer extends Sealer {
    private static final Logger logger = LoggerFactory.getLogger(EncryptingSealer.class);

    EncryptingSealer(SealingParameters params) {
        super(params);
    }

    @Override
    void onStart(Consumer<byte[]> sink) {
        logger.debug("Sealing stream: {}", params);
        emit(sink, params.header());
    }

    @Override
    void onChunk(byte[] chunk, Consumer<byte[]> sink) {
        var chunkIv = iv.toBytes();
        iv.advance(chunk.length);

        var ciphertext = applyCipher(chunkIv, chunk, true);
        authenticate(ciphertext);
        logger.trace("Encrypted chunk: length={}, next {}", chunk.length, iv);
        emit(sink, ciphertext);
    }

    @Override
    void onFinish(Consumer<byte[]> sink) {
        var tag = computeTag();
        logger.trace("Produced tag: {}", Utils.maskForLog(tag));
        sink.accept(tag);
    }
}
