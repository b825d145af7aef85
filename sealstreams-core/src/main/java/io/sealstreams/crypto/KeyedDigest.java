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

package io.sealstreams.crypto;

import javax.crypto.SecretKey;

/**
 * An incremental keyed digest. Absorbing the same byte strings in a different order yields a different digest.
 */
public interface KeyedDigest {
    /**
     * Size in bytes of every value returned from {@link Accumulator#finish()}.
     */
    int OUTPUT_SIZE_BYTES = 32;

    /**
     * SHA3-256 over the MAC key followed by the message, {@code H(k || m)}. SHA-3 is not subject to length extension,
     * so the prefix-keyed construction is a secure MAC.
     */
    KeyedDigest SHA3_256 = new PrefixKeyedDigest("SHA3-256");

    /**
     * HMAC-SHA-512 truncated to the first 256 bits of output.
     */
    KeyedDigest HS512 = new HmacDigest("HmacSHA512");

    String identifier();

    /**
     * Imports raw key material as a MAC key for this digest.
     */
    SecretKey key(byte[] keyMaterial);

    /**
     * Starts a new digest computation keyed with the given key.
     *
     * @param key the MAC key, as returned from {@link #key(byte[])}.
     * @return a fresh accumulator that has absorbed the key.
     */
    Accumulator begin(SecretKey key);

    interface Accumulator {
        void absorb(byte[] data);

        /**
         * Completes the computation. The accumulator cannot be used afterwards.
         *
         * @return exactly {@link #OUTPUT_SIZE_BYTES} bytes.
         */
        byte[] finish();
    }
}
