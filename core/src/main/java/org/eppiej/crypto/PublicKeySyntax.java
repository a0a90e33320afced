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

import javax.annotation.Nullable;

/**
 * Cheap textual check of a public key address. It never touches elliptic curve code, so it is safe to run on
 * untrusted input before anything expensive.
 */
public final class PublicKeySyntax {
    /** Length of an encoded compressed secp256k1 key. */
    public static final int LENGTH = Base32E.encodedLength(PublicKeyCodec.COMPRESSED_KEY_LENGTH);

    private PublicKeySyntax() { }

    /**
     * Returns true if {@code address} has the length and alphabet of an encoded key, and its first two characters
     * are consistent with a 0x02 or 0x03 prefix byte.
     */
    public static boolean isValid(@Nullable String address) {
        if (address == null || address.length() != LENGTH)
            return false;
        char first = Character.toLowerCase(address.charAt(0));
        char second = Character.toLowerCase(address.charAt(1));
        if (first != 'a' || second < 'e' || second > 'h')
            return false;
        for (int i = 2; i < address.length(); i++) {
            if (!Base32E.isValidCharacter(address.charAt(i)))
                return false;
        }
        return true;
    }
}
