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

/**
 * Thrown at the end of a decrypted stream when the tag carried by the stream does not match the tag computed over
 * the header and ciphertext. Any plaintext already emitted by the stream must be discarded.
 */
public final class AuthenticationFailedException extends SealingException {
    public AuthenticationFailedException(String message) {
        super(message);
    }
}
