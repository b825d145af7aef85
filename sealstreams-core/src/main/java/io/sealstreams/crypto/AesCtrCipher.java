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

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.IvParameterSpec;

final class AesCtrCipher implements CounterModeCipher {

    @Override
    public String identifier() {
        return "A256CTR";
    }

    @Override
    public SecretKey key(byte[] keyMaterial) {
        if (keyMaterial.length != 32) {
            throw new IllegalArgumentException("AES-256 key must be 32 bytes");
        }
        return new KeyHandle(keyMaterial, "AES");
    }

    @Override
    public byte[] encrypt(SecretKey key, byte[] iv, byte[] data) {
        if (data.length == 0) {
            return new byte[0];
        }
        try {
            var cipher = Cipher.getInstance("AES/CTR/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new IvParameterSpec(iv));
            return cipher.doFinal(data);
        } catch (InvalidKeyException e) {
            throw new IllegalArgumentException(e);
        } catch (GeneralSecurityException e) {
            throw new CryptoFailureException("AES-CTR operation failed", e);
        }
    }
}
