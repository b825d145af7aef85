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

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

import javax.crypto.SecretKey;

final class PrefixKeyedDigest implements KeyedDigest {
    private final String algorithmName;

    PrefixKeyedDigest(String algorithmName) {
        this.algorithmName = algorithmName;
        try {
            var digest = MessageDigest.getInstance(algorithmName);
            if (digest.getDigestLength() < OUTPUT_SIZE_BYTES) {
                throw new IllegalArgumentException(algorithmName + " output is shorter than the tag size");
            }
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException(e);
        }
    }

    @Override
    public String identifier() {
        return "K" + algorithmName.replace("-", "");
    }

    @Override
    public SecretKey key(byte[] keyMaterial) {
        return new KeyHandle(keyMaterial, algorithmName);
    }

    @Override
    public Accumulator begin(SecretKey key) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(algorithmName);
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoFailureException("digest unavailable: " + algorithmName, e);
        }
        var keyBytes = key.getEncoded();
        try {
            digest.update(keyBytes);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
        return new Accumulator() {
            @Override
            public void absorb(byte[] data) {
                digest.update(data);
            }

            @Override
            public byte[] finish() {
                return Arrays.copyOf(digest.digest(), OUTPUT_SIZE_BYTES);
            }
        };
    }
}
