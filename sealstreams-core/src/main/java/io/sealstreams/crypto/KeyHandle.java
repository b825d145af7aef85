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

import static java.util.Objects.requireNonNull;

import java.util.Arrays;

import javax.crypto.SecretKey;

/**
 * Raw key material for one sealer. Unlike {@link javax.crypto.spec.SecretKeySpec}, {@link #destroy()} zeroes the
 * bytes, after which the key can no longer be read.
 */
final class KeyHandle implements SecretKey {
    private final String algorithm;
    private final byte[] material;
    private volatile boolean destroyed;

    KeyHandle(byte[] material, String algorithm) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        this.material = requireNonNull(material, "material").clone();
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        if (destroyed) {
            throw new IllegalStateException(algorithm + " key has been destroyed");
        }
        return material.clone();
    }

    @Override
    public void destroy() {
        destroyed = true;
        Arrays.fill(material, (byte) 0);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return "KeyHandle[" + algorithm + ", " + material.length * 8 + " bits" + (destroyed ? ", destroyed]" : "]");
    }
}
