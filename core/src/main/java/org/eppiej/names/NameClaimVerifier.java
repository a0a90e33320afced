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

package org.eppiej.names;

import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.SignatureDecodeException;
import org.bouncycastle.util.encoders.Base64;
import org.eppiej.crypto.PublicKeyCodec;

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Checks name claim signatures. Malformed input of any kind makes the claim invalid rather than raising.
 */
public class NameClaimVerifier {
    private final PublicKeyCodec codec;

    public NameClaimVerifier(PublicKeyCodec codec) {
        this.codec = checkNotNull(codec, "codec");
    }

    public boolean verifyClaimV1Signature(@Nullable String name, @Nullable String publicKeyAddress,
                                          @Nullable String signatureBase64) {
        if (isBlank(name) || isBlank(publicKeyAddress) || isBlank(signatureBase64))
            return false;
        ECKey key;
        ECKey.ECDSASignature signature;
        try {
            key = codec.decode(publicKeyAddress);
            signature = ECKey.ECDSASignature.decodeFromDER(Base64.decode(signatureBase64));
        } catch (SignatureDecodeException | RuntimeException e) {
            return false;
        }
        if (signature.r.signum() <= 0 || signature.s.signum() <= 0 || !signature.isCanonical())
            return false;
        byte[] payload = NameClaim.buildPayloadV1(name, publicKeyAddress).getBytes(StandardCharsets.UTF_8);
        return ECKey.verify(Sha256Hash.hash(payload), signature, key.getPubKey());
    }

    private static boolean isBlank(@Nullable String s) {
        return s == null || s.trim().isEmpty();
    }
}
