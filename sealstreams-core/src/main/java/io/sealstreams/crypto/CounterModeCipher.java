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
 * A block cipher operated in counter mode. Implementations are length-preserving and deterministic: the output
 * depends only on the key, the keystream position given by the IV, and the input.
 */
public interface CounterModeCipher {

    /**
     * AES-256 in CTR mode with a 16-byte IV whose low 64 bits are the block counter.
     */
    CounterModeCipher AES_CTR = new AesCtrCipher();

    /**
     * A short identifier for the algorithm, used in log output.
     */
    String identifier();

    /**
     * Imports raw key material as a key for this cipher. The caller keeps ownership of the key material and should
     * wipe it afterwards.
     *
     * @param keyMaterial the raw key bytes.
     * @return the imported key.
     */
    SecretKey key(byte[] keyMaterial);

    /**
     * Encrypts the given data starting at the keystream position identified by the IV.
     *
     * @param key the key, as returned from {@link #key(byte[])}.
     * @param iv the 16-byte IV including the initial block counter.
     * @param data the plaintext. Not modified.
     * @return a new array holding the ciphertext, the same length as the input.
     * @throws CryptoFailureException if the underlying primitive fails.
     */
    byte[] encrypt(SecretKey key, byte[] iv, byte[] data);

    /**
     * Decrypts the given data. For a counter-mode cipher this is the same keystream operation as encryption.
     */
    default byte[] decrypt(SecretKey key, byte[] iv, byte[] data) {
        return encrypt(key, iv, data);
    }
}
