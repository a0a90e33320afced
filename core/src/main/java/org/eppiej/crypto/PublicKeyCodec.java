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

/**
 * Converts compressed secp256k1 public keys to and from their address form.
 */
public interface PublicKeyCodec {
    int COMPRESSED_KEY_LENGTH = 33;

    String encode(ECKey key);

    String encode(byte[] compressedPublicKey);

    /** Returns a public-only key. Throws {@link org.eppiej.core.KeyFormatException} for unparseable input. */
    ECKey decode(String address);
}
