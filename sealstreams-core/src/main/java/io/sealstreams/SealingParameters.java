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

import io.sealstreams.crypto.CounterModeCipher;
import io.sealstreams.crypto.KeyedDigest;

/**
 * Everything needed to seal or unseal one stream. Instances are immutable and may be reused to create any number of
 * sealers, but the same MAC key, cipher key and IV must never be used to encrypt two different streams.
 */
public final class SealingParameters {
    public static final int KEY_SIZE = 32;
    public static final int IV_SIZE = CounterIv.SIZE;
    public static final int DEFAULT_CHUNK_SIZE = 128 * 1024;

    private final byte[] macKey;
    private final byte[] cipherKey;
    private final byte[] iv;
    private final byte[] header;
    private final int chunkSize;
    private final long offset;
    private final CounterModeCipher cipher;
    private final KeyedDigest digest;

    private SealingParameters(Builder builder) {
        this.macKey = Require.exactLength(builder.macKey, KEY_SIZE, "MAC key must be " + KEY_SIZE + " bytes").clone();
        this.cipherKey = Require.exactLength(builder.cipherKey, KEY_SIZE,
                "cipher key must be " + KEY_SIZE + " bytes").clone();
        this.iv = Require.exactLength(builder.iv, IV_SIZE, "IV must be " + IV_SIZE + " bytes").clone();
        this.header = requireNonNull(builder.header, "header").clone();
        this.chunkSize = Require.positive(builder.chunkSize, "chunk size must be positive");
        this.offset = Require.nonNegative(builder.offset, "offset must not be negative");
        this.cipher = requireNonNull(builder.cipher, "cipher");
        this.digest = requireNonNull(builder.digest, "digest");
    }

    public static Builder builder() {
        return new Builder();
    }

    byte[] macKey() {
        return macKey.clone();
    }

    byte[] cipherKey() {
        return cipherKey.clone();
    }

    public byte[] iv() {
        return iv.clone();
    }

    public byte[] header() {
        return header.clone();
    }

    public int headerLength() {
        return header.length;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public long offset() {
        return offset;
    }

    public CounterModeCipher cipher() {
        return cipher;
    }

    public KeyedDigest digest() {
        return digest;
    }

    /**
     * Returns a builder initialised with a copy of these parameters.
     */
    public Builder toBuilder() {
        return new Builder().macKey(macKey).cipherKey(cipherKey).iv(iv).header(header)
                .chunkSize(chunkSize).offset(offset).cipher(cipher).digest(digest);
    }

    @Override
    public String toString() {
        return "SealingParameters{" +
                "cipher=" + cipher.identifier() +
                ", digest=" + digest.identifier() +
                ", headerLength=" + header.length +
                ", chunkSize=" + chunkSize +
                ", offset=" + offset +
                '}';
    }

    public static final class Builder {
        private byte[] macKey;
        private byte[] cipherKey;
        private byte[] iv;
        private byte[] header = new byte[0];
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private long offset = 0;
        private CounterModeCipher cipher = CounterModeCipher.AES_CTR;
        private KeyedDigest digest = KeyedDigest.SHA3_256;

        private Builder() {}

        public Builder macKey(byte[] macKey) {
            this.macKey = macKey;
            return this;
        }

        public Builder cipherKey(byte[] cipherKey) {
            this.cipherKey = cipherKey;
            return this;
        }

        public Builder iv(byte[] iv) {
            this.iv = iv;
            return this;
        }

        public Builder header(byte[] header) {
            this.header = header;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        /**
         * Number of leading bytes to discard from the input before any processing.
         */
        public Builder offset(long offset) {
            this.offset = offset;
            return this;
        }

        public Builder cipher(CounterModeCipher cipher) {
            this.cipher = cipher;
            return this;
        }

        public Builder digest(KeyedDigest digest) {
            this.digest = digest;
            return this;
        }

        /**
         * Validates and builds the parameters.
         *
         * @throws IllegalArgumentException if a key or the IV has the wrong length, or the chunk size or offset is
         * out of range.
         */
        public SealingParameters build() {
            return new SealingParameters(this);
        }
    }
}
