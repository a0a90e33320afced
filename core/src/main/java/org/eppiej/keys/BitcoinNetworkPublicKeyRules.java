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

import org.bitcoinj.core.Address;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.params.TestNet3Params;
import org.eppiej.core.NetworkType;

import javax.annotation.Nullable;
import java.util.Locale;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Bitcoin addresses: legacy base58 (P2PKH, P2SH) or bech32 segwit. The semantic check verifies the checksum and
 * the network through bitcoinj. Decentralized mail runs on the Bitcoin test network unless other parameters are
 * given, so {@code m}, {@code n}, {@code 2} and {@code tb1} addresses are accepted by default.
 */
public class BitcoinNetworkPublicKeyRules implements NetworkPublicKeyRules {
    private static final String BECH32_CHARS = "[02-9ac-hj-np-z]{11,71}";

    private final NetworkParameters params;
    private final Pattern base58;
    private final Pattern bech32Lower;
    private final Pattern bech32Upper;

    public BitcoinNetworkPublicKeyRules() {
        this(TestNet3Params.get());
    }

    public BitcoinNetworkPublicKeyRules(NetworkParameters params) {
        this.params = checkNotNull(params, "params");
        String prefixes = NetworkParameters.ID_MAINNET.equals(params.getId()) ? "13" : "mn2";
        this.base58 = Pattern.compile("[" + prefixes + "][1-9A-HJ-NP-Za-km-z]{25,34}");
        String lower = params.getSegwitAddressHrp().toLowerCase(Locale.ROOT) + "1" + BECH32_CHARS;
        this.bech32Lower = Pattern.compile(lower);
        this.bech32Upper = Pattern.compile(lower.toUpperCase(Locale.ROOT));
    }

    public NetworkParameters getParams() {
        return params;
    }

    @Override
    public NetworkType getNetwork() {
        return NetworkType.BITCOIN;
    }

    @Override
    public boolean isSyntacticallyValid(@Nullable String value) {
        if (value == null)
            return false;
        return base58.matcher(value).matches() || bech32Lower.matcher(value).matches()
                || bech32Upper.matcher(value).matches();
    }

    @Override
    public boolean trySemanticValidate(String value) {
        try {
            Address.fromString(params, value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
