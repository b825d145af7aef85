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

import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

import javax.crypto.Mac;
import javax.crypto.SecretKey;

final class HmacDigest implements KeyedDigest {
    private final String algorithmName;

    HmacDigest(String algorithmName) {
        this.algorithmName = algorithmName;
        try {
            var mac = Mac.getInstance(algorithmName);
            if (mac.getMacLength() < OUTPUT_SIZE_BYTES) {
                throw new IllegalArgumentException(algorithmName + " output is shorter than the tag size");
            }
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException(e);
        }
    }

    @Override
    public String identifier() {
        return algorithmName.replace("HmacSHA", "HS");
    }

    @Override
    public SecretKey key(byte[] keyMaterial) {
        return new KeyHandle(keyMaterial, algorithmName);
    }

    @Override
    public Accumulator begin(SecretKey key) {
        Mac mac;
        try {
            mac = Mac.getInstance(algorithmName);
            mac.init(key);
        } catch (NoSuchAlgorithmException e) {
            throw new CryptoFailureException("MAC unavailable: " + algorithmName, e);
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException(e);
        }
        return new Accumulator() {
            @Override
            public void absorb(byte[] data) {
                mac.update(data);
            }

            @Override
            public byte[] finish() {
                return Arrays.copyOf(mac.doFinal(), OUTPUT_SIZE_BYTES);
            }
        };
    }
}
