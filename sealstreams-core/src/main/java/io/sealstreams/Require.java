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
 * Utilities for checking preconditions.
 */
final class Require {
    static byte[] exactLength(byte[] value, int length, String msg) {
        if (value == null || value.length != length) {
            throw new IllegalArgumentException(msg);
        }
        return value;
    }

    static int positive(int value, String msg) {
        if (value <= 0) {
            throw new IllegalArgumentException(msg);
        }
        return value;
    }

    static long nonNegative(long value, String msg) {
        if (value < 0) {
            throw new IllegalArgumentException(msg);
        }
        return value;
    }

    private Require() {}
}
