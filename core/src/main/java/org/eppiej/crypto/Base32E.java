/*
 * Copyright 2024 the eppiej developers
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eppiej.crypto;

import org.eppiej.core.KeyFormatException;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Base32 variant used for public key addresses. The alphabet leaves out characters that are easy to confuse
 * when typed or read aloud ({@code l}, {@code o}, {@code 0}, {@code 1}).</p>
 *
 * <p>Input bytes are read as one big-endian bit string. When the bit count is not a multiple of five, zero bits are
 * prepended so that the last symbol ends exactly on the last input bit. 33 bytes therefore become 53 symbols
 * with one leading pad bit. Encoding produces lower case; decoding accepts either case.</p>
 */
public final class Base32E {
    public static final String ALPHABET = "abcdefghijkmnpqrstuvwxyz23456789";

    private static final char[] ENCODE_TABLE = ALPHABET.toCharArray();
    private static final byte[] DECODE_TABLE = new byte[128];

    static {
        Arrays.fill(DECODE_TABLE, (byte) -1);
        for (int i = 0; i < ENCODE_TABLE.length; i++) {
            DECODE_TABLE[ENCODE_TABLE[i]] = (byte) i;
            DECODE_TABLE[Character.toUpperCase(ENCODE_TABLE[i])] = (byte) i;
        }
    }

    private Base32E() { }

    /** Number of symbols needed for {@code byteLength} bytes. */
    public static int encodedLength(int byteLength) {
        checkArgument(byteLength >= 0);
        return (byteLength * 8 + 4) / 5;
    }

    /** Returns true if {@code c} is part of the alphabet, in either case. */
    public static boolean isValidCharacter(char c) {
        return c < 128 && DECODE_TABLE[c] >= 0;
    }

    public static String encode(byte[] data) {
        checkNotNull(data);
        int length = encodedLength(data.length);
        StringBuilder sb = new StringBuilder(length);
        int buffer = 0;
        int bits = length * 5 - data.length * 8; // leading zero pad bits
        for (byte b : data) {
            buffer = (buffer << 8) | (b & 0xff);
            bits += 8;
            while (bits >= 5) {
                sb.append(ENCODE_TABLE[(buffer >>> (bits - 5)) & 0x1f]);
                bits -= 5;
                buffer &= (1 << bits) - 1;
            }
        }
        return sb.toString();
    }

    /**
     * Decodes {@code encoded} into exactly {@code byteLength} bytes.
     *
     * @throws KeyFormatException.InvalidLength if the text has the wrong number of symbols
     * @throws KeyFormatException.InvalidCharacter if a character is outside of the alphabet
     * @throws KeyFormatException.InvalidPrefix if one of the pad bits is set
     */
    public static byte[] decode(String encoded, int byteLength) throws KeyFormatException {
        checkNotNull(encoded);
        int length = encodedLength(byteLength);
        if (encoded.length() != length)
            throw new KeyFormatException.InvalidLength("Expected " + length + " characters, got " + encoded.length());
        int pad = length * 5 - byteLength * 8;
        byte[] out = new byte[byteLength];
        int outPos = 0;
        int buffer = 0;
        int bits = 0;
        boolean padChecked = pad == 0;
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            int value = c < 128 ? DECODE_TABLE[c] : -1;
            if (value < 0)
                throw new KeyFormatException.InvalidCharacter(c, i);
            buffer = (buffer << 5) | value;
            bits += 5;
            if (!padChecked && bits >= pad) {
                if ((buffer >>> (bits - pad)) != 0)
                    throw new KeyFormatException.InvalidPrefix("Non-zero padding bit in leading character");
                bits -= pad;
                buffer &= (1 << bits) - 1;
                padChecked = true;
            }
            while (bits >= 8) {
                out[outPos++] = (byte) (buffer >>> (bits - 8));
                bits -= 8;
                buffer &= (1 << bits) - 1;
            }
        }
        return out;
    }
}
