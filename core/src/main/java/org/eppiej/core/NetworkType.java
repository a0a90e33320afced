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

import javax.annotation.Nullable;

/**
 * Networks a decentralized address can live on, together with the constants used to derive its keys.
 */
public enum NetworkType {
    EPPIE("@eppie", 3630, 10, 0),
    BITCOIN("@bitcoin", 0, 0, 0),
    ETHEREUM("@ethereum", 60, 0, 0),
    UNSUPPORTED(null, -1, -1, -1);

    @Nullable private final String postfix;
    private final int coinType;
    private final int channel;
    private final int keyIndex;

    NetworkType(@Nullable String postfix, int coinType, int channel, int keyIndex) {
        this.postfix = postfix;
        this.coinType = coinType;
        this.channel = channel;
        this.keyIndex = keyIndex;
    }

    /** Domain part that marks an address of this network, for example {@code @eppie}. */
    @Nullable
    public String getPostfix() {
        return postfix;
    }

    /** BIP44 coin type used for keys of this network. */
    public int getCoinType() {
        return coinType;
    }

    public int getChannel() {
        return channel;
    }

    public int getKeyIndex() {
        return keyIndex;
    }

    public boolean isSupported() {
        return this != UNSUPPORTED;
    }
}
