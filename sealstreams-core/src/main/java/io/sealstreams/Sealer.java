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

import javax.crypto.SecretKey;
import javax.security.auth.DestroyFailedException;
import javax.security.auth.Destroyable;

import io.sealstreams.crypto.KeyedDigest;

/**
 * Encrypts or decrypts a stream of chunks with a counter-mode cipher while computing a keyed digest over the header
 * and the ciphertext. The encrypted form of a stream is {@code header || ciphertext || tag}, where the tag is the
 * {@value #TAG_SIZE}-byte digest of {@code macKey || header || ciphertext}.
 * <p>
 * A sealer is a state machine that moves from {@link State#INIT} through {@link State#PROCESSING} to
 * {@link State#FINALIZED}. Any failure moves it to {@link State#FAILED}. Either way its keys are destroyed and it
 * cannot be used again.
 */
public abstract class Sealer implements StreamTransform {
    public static final int TAG_SIZE = KeyedDigest.OUTPUT_SIZE_BYTES;

    enum State { INIT, PROCESSING, FINALIZED, FAILED }

    final SealingParameters params;
    final CounterIv iv;

    private State state = State.INIT;
    private SecretKey cipherKey;
    private SecretKey macKey;
    private KeyedDigest.Accumulator mac;

    Sealer(SealingParameters params) {
        this.params = requireNonNull(params, "params");
        this.iv = new CounterIv(params.iv());
    }

    /**
     * Creates a transform that turns plaintext chunks into {@code header || ciphertext || tag}.
     */
    public static Sealer encrypting(SealingParameters params) {
        return new EncryptingSealer(params);
    }

    /**
     * Creates a transform that turns {@code ciphertext || tag} chunks back into plaintext. The header must already
     * have been removed from the input; it is taken from the parameters instead.
     */
    public static Sealer decrypting(SealingParameters params) {
        return new DecryptingSealer(params);
    }

    @Override
    public final void start(Consumer<byte[]> sink) {
        requireNonNull(sink, "sink");
        requireState(State.INIT);
        runStep(() -> {
            var cipherKeyBytes = params.cipherKey();
            var macKeyBytes = params.macKey();
            try {
                cipherKey = params.cipher().key(cipherKeyBytes);
                macKey = params.digest().key(macKeyBytes);
            } finally {
                Utils.wipe(cipherKeyBytes, macKeyBytes);
            }
            mac = params.digest().begin(macKey);
            mac.absorb(params.header());
            onStart(sink);
        });
        state = State.PROCESSING;
    }

    @Override
    public final void transform(byte[] chunk, Consumer<byte[]> sink) {
        requireNonNull(chunk, "chunk");
        requireNonNull(sink, "sink");
        requireState(State.PROCESSING);
        runStep(() -> onChunk(chunk, sink));
    }

    @Override
    public final void flush(Consumer<byte[]> sink) {
        requireNonNull(sink, "sink");
        requireState(State.PROCESSING);
        runStep(() -> onFinish(sink));
        state = State.FINALIZED;
        destroyKeys();
    }

    abstract void onStart(Consumer<byte[]> sink);

    abstract void onChunk(byte[] chunk, Consumer<byte[]> sink);

    abstract void onFinish(Consumer<byte[]> sink);

    State state() {
        return state;
    }

    /**
     * Encrypts or decrypts data at the keystream position of the given IV.
     */
    byte[] applyCipher(byte[] chunkIv, byte[] data, boolean encrypt) {
        return encrypt
                ? params.cipher().encrypt(cipherKey, chunkIv, data)
                : params.cipher().decrypt(cipherKey, chunkIv, data);
    }

    void authenticate(byte[] ciphertext) {
        mac.absorb(ciphertext);
    }

    byte[] computeTag() {
        return mac.finish();
    }

    static void emit(Consumer<byte[]> sink, byte[] segment) {
        if (segment.length > 0) {
            sink.accept(segment);
        }
    }

    private void requireState(State expected) {
        if (state != expected) {
            throw new IllegalStateException("sealer is " + state + ", expected " + expected);
        }
    }

    private void runStep(Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            state = State.FAILED;
            destroyKeys();
            throw e;
        }
    }

    private void destroyKeys() {
        destroy(cipherKey, macKey);
        mac = null;
    }

    private static void destroy(Destroyable... toDestroy) {
        for (var it : toDestroy) {
            if (it != null && !it.isDestroyed()) {
                try {
                    it.destroy();
                } catch (DestroyFailedException e) {
                    // Ignore - keys from other providers may not support being destroyed
                }
            }
        }
    }
}
