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

package org.eppiej.core;

/**
 * Thrown when a public key address is well typed but cannot be parsed. Subclasses tell which part was wrong.
 */
public class KeyFormatException extends IllegalArgumentException {
    public KeyFormatException(String message) {
        super(message);
    }

    public KeyFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    /** The address does not have the fixed length of an encoded key. */
    public static class InvalidLength extends KeyFormatException {
        public InvalidLength(String message) {
            super(message);
        }
    }

    /** The address contains a character outside of the address alphabet. */
    public static class InvalidCharacter extends KeyFormatException {
        public final char character;
        public final int position;

        public InvalidCharacter(char character, int position) {
            super("Invalid character '" + character + "' at position " + position);
            this.character = character;
            this.position = position;
        }
    }

    /** The decoded leading byte is not a compressed point prefix, or the padding bit is set. */
    public static class InvalidPrefix extends KeyFormatException {
        public InvalidPrefix(String message) {
            super(message);
        }
    }

    /** The decoded bytes are not a point on secp256k1. */
    public static class InvalidPoint extends KeyFormatException {
        public InvalidPoint(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
