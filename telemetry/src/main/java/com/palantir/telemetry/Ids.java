/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
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

package com.palantir.telemetry;

import java.util.concurrent.ThreadLocalRandom;

/** Identifier generation for traces, spans, sessions and cost entries. */
public final class Ids {

    private static final char[] HEX_DIGITS = {
        '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'
    };

    private Ids() {}

    /** Returns a random ID suitable for span and trace IDs. */
    public static String randomId() {
        return longToPaddedHex(ThreadLocalRandom.current().nextLong());
    }

    /** Converts a long to a 16 character, zero padded, big-endian hex string. */
    static String longToPaddedHex(long number) {
        char[] data = new char[16];
        for (int i = 0; i < 16; i++) {
            data[i] = HEX_DIGITS[(int) ((number >> (60 - 4 * i)) & 0xF)];
        }
        return new String(data);
    }
}
