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

import org.bitcoinj.core.ECKey;
import org.eppiej.core.KeyFormatException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@link PublicKeyCodec} writing the 33 byte compressed point with {@link Base32E}, giving 53 characters.
 */
public class Secp256k1Base32ECodec implements PublicKeyCodec {

    @Override
    public String encode(ECKey key) {
        checkNotNull(key, "key");
        return encode(key.getPubKey());
    }

    @Override
    public String encode(byte[] compressedPublicKey) {
        checkNotNull(compressedPublicKey, "compressedPublicKey");
        checkArgument(compressedPublicKey.length == COMPRESSED_KEY_LENGTH,
                "Expected a %s byte compressed public key, got %s bytes", COMPRESSED_KEY_LENGTH, compressedPublicKey.length);
        return Base32E.encode(compressedPublicKey);
    }

    @Override
    public ECKey decode(String address) {
        checkNotNull(address, "address");
        byte[] bytes = Base32E.decode(address, COMPRESSED_KEY_LENGTH);
        if (bytes[0] != 0x02 && bytes[0] != 0x03)
            throw new KeyFormatException.InvalidPrefix(String.format("Invalid compressed key prefix 0x%02x", bytes[0]));
        try {
            return ECKey.fromPublicOnly(bytes);
        } catch (IllegalArgumentException e) {
            throw new KeyFormatException.InvalidPoint("Address does not encode a point on secp256k1", e);
        }
    }
}
