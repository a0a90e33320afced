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

package org.eppiej.keys;

import org.bouncycastle.crypto.digests.KeccakDigest;
import org.eppiej.core.NetworkType;

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Ethereum account addresses, {@code 0x} followed by 40 hex digits. Mixed case addresses must carry a valid EIP-55
 * checksum; all lower or all upper case addresses have none.
 */
public class EthereumNetworkPublicKeyRules implements NetworkPublicKeyRules {
    private static final Pattern ADDRESS = Pattern.compile("0x[0-9a-fA-F]{40}");

    @Override
    public NetworkType getNetwork() {
        return NetworkType.ETHEREUM;
    }

    @Override
    public boolean isSyntacticallyValid(@Nullable String value) {
        return value != null && ADDRESS.matcher(value).matches();
    }

    @Override
    public boolean trySemanticValidate(String value) {
        String body = value.substring(2);
        String lower = body.toLowerCase(Locale.ROOT);
        if (body.equals(lower) || body.equals(body.toUpperCase(Locale.ROOT)))
            return true;
        byte[] hash = keccak256(lower.getBytes(StandardCharsets.US_ASCII));
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (!Character.isLetter(c))
                continue;
            int nibble = (hash[i / 2] >> (i % 2 == 0 ? 4 : 0)) & 0x0f;
            if ((nibble >= 8) != Character.isUpperCase(c))
                return false;
        }
        return true;
    }

    private static byte[] keccak256(byte[] input) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }
}
