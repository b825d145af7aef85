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

import java.util.Arrays;
import java.util.HexFormat;

final class Utils {
    private static final HexFormat HEX = HexFormat.of();

    static String hex(byte[] data) {
        return HEX.formatHex(data);
    }

    /**
     * Renders secret or authentication material for log output, keeping only enough to correlate log lines.
     */
    static String maskForLog(byte[] secret) {
        return secret == null
                ? "null"
                : secret.length < 16
                ? "<redacted>"
                : hex(Arrays.copyOf(secret, 3)) + "..." +
                hex(Arrays.copyOfRange(secret, secret.length - 3, secret.length));
    }

    static void wipe(byte[]... data) {
        for (var datum : data) {
            Arrays.fill(datum, (byte) 0);
        }
    }

    private Utils() {}
}
