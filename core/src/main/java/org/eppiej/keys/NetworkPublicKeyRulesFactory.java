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

import org.eppiej.core.NetworkType;
import org.eppiej.crypto.PublicKeyCodec;

import static com.google.common.base.Preconditions.checkNotNull;

/** Returns the address rules of a network. */
public final class NetworkPublicKeyRulesFactory {
    private NetworkPublicKeyRulesFactory() { }

    /**
     * @throws UnsupportedOperationException for {@link NetworkType#UNSUPPORTED}
     */
    public static NetworkPublicKeyRules create(NetworkType network, PublicKeyCodec codec) {
        checkNotNull(network, "network");
        checkNotNull(codec, "codec");
        switch (network) {
            case EPPIE:
                return new EppieNetworkPublicKeyRules(codec);
            case BITCOIN:
                return new BitcoinNetworkPublicKeyRules();
            case ETHEREUM:
                return new EthereumNetworkPublicKeyRules();
            default:
                throw new UnsupportedOperationException("No address rules for network " + network);
        }
    }
}
