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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.List;

/**
 * Entry points for sealing and unsealing streams. Each pipeline re-chunks its input with a {@link Chunker} and feeds
 * the chunks to a {@link Sealer}.
 * <p>
 * The decrypting entry points expect the full sealed form {@code header || ciphertext || tag} and skip the header
 * (plus any configured offset) before unsealing. Data is decrypted in chunks aligned with the ones it was encrypted
 * in, so the chunk size used to unseal must equal the one used to seal unless both are multiples of 16.
 * <p>
 * The streaming entry points release plaintext before the end of the stream has been authenticated. Callers must
 * treat it as provisional and discard it if the stream ends with an error. The one-shot
 * {@link #decrypt(byte[], SealingParameters)} only returns plaintext once it has been verified.
 */
public final class SealedStreams {
    static final int READ_SIZE = 8192;

    /**
     * Lazily encrypts a stream of fragments.
     *
     * @return {@code header}, the ciphertext chunks, and finally the {@value Sealer#TAG_SIZE}-byte tag.
     */
    public static Iterator<byte[]> encrypt(Iterator<byte[]> fragments, SealingParameters params) {
        var chunks = Chunker.rebuffer(fragments, params.offset(), params.chunkSize());
        return new TransformingIterator(chunks, Sealer.encrypting(params));
    }

    /**
     * Lazily decrypts a sealed stream of fragments. Iteration fails with {@link AuthenticationFailedException} after
     * the last plaintext chunk if the tag does not match, or with {@link MalformedStreamException} if the stream is
     * too short to hold a tag.
     */
    public static Iterator<byte[]> decrypt(Iterator<byte[]> fragments, SealingParameters params) {
        var chunks = Chunker.rebuffer(fragments, sealedOffset(params), params.chunkSize());
        return new TransformingIterator(chunks, Sealer.decrypting(params));
    }

    public static byte[] encrypt(byte[] plaintext, SealingParameters params) {
        return collect(encrypt(List.of(plaintext.clone()).iterator(), params));
    }

    /**
     * Decrypts a complete sealed message.
     *
     * @throws AuthenticationFailedException if the message has been tampered with.
     */
    public static byte[] decrypt(byte[] sealed, SealingParameters params) {
        return collect(decrypt(List.of(sealed.clone()).iterator(), params));
    }

    /**
     * Returns a stream that encrypts everything written to it. The header is written to {@code out} immediately and
     * the tag when the returned stream is closed.
     */
    public static OutputStream encryptingOutputStream(OutputStream out, SealingParameters params) throws IOException {
        var chunker = new Chunker(params.offset(), params.chunkSize());
        return new SealingOutputStream(out, chunker.andThen(Sealer.encrypting(params)));
    }

    /**
     * Returns a stream that decrypts the sealed data written to it. Closing it throws an {@link IOException} if the
     * stream fails authentication.
     */
    public static OutputStream decryptingOutputStream(OutputStream out, SealingParameters params) throws IOException {
        var chunker = new Chunker(sealedOffset(params), params.chunkSize());
        return new SealingOutputStream(out, chunker.andThen(Sealer.decrypting(params)));
    }

    public static InputStream encryptingInputStream(InputStream in, SealingParameters params) {
        requireNonNull(params, "params");
        return new SealingInputStream(in, READ_SIZE, fragments -> encrypt(fragments, params));
    }

    /**
     * Returns a stream of the plaintext of the sealed data read from {@code in}. Reading fails with an
     * {@link IOException} at the end of the stream if it fails authentication.
     */
    public static InputStream decryptingInputStream(InputStream in, SealingParameters params) {
        requireNonNull(params, "params");
        return new SealingInputStream(in, READ_SIZE, fragments -> decrypt(fragments, params));
    }

    private static long sealedOffset(SealingParameters params) {
        return Math.addExact(params.headerLength(), params.offset());
    }

    private static byte[] collect(Iterator<byte[]> segments) {
        var out = new ByteArrayOutputStream();
        segments.forEachRemaining(out::writeBytes);
        return out.toByteArray();
    }

    private SealedStreams() {}
}
