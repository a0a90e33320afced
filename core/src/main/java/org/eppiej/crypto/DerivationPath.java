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

import com.google.common.collect.ImmutableList;
import org.bitcoinj.crypto.ChildNumber;
import org.eppiej.core.NetworkType;

import javax.annotation.Nullable;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Location of a key below the master key. Either a BIP44 style index path
 * {@code m/44'/coinType'/account'/channel/keyIndex}, or an opaque tag such as a mail address.
 */
public final class DerivationPath {
    public static final int PURPOSE = 44;

    private final int coinType;
    private final int account;
    private final int channel;
    private final int keyIndex;
    @Nullable private final String tag;

    private DerivationPath(int coinType, int account, int channel, int keyIndex, @Nullable String tag) {
        this.coinType = coinType;
        this.account = account;
        this.channel = channel;
        this.keyIndex = keyIndex;
        this.tag = tag;
    }

    public static DerivationPath of(int coinType, int account, int channel, int keyIndex) {
        checkArgument(coinType >= 0, "coinType must not be negative: %s", coinType);
        checkArgument(account >= 0, "account must not be negative: %s", account);
        checkArgument(channel >= 0, "channel must not be negative: %s", channel);
        checkArgument(keyIndex >= 0, "keyIndex must not be negative: %s", keyIndex);
        return new DerivationPath(coinType, account, channel, keyIndex, null);
    }

    /** Index path of {@code account} using the coin type, channel and key index of {@code network}. */
    public static DerivationPath forNetwork(NetworkType network, int account) {
        checkNotNull(network, "network");
        checkArgument(network.isSupported(), "Unsupported network type %s", network);
        return of(network.getCoinType(), account, network.getChannel(), network.getKeyIndex());
    }

    public static DerivationPath ofTag(String tag) {
        checkNotNull(tag, "tag");
        checkArgument(!tag.isEmpty(), "tag must not be empty");
        return new DerivationPath(-1, -1, -1, -1, tag);
    }

    public boolean isTagged() {
        return tag != null;
    }

    @Nullable
    public String getTag() {
        return tag;
    }

    public int getCoinType() {
        return coinType;
    }

    public int getAccount() {
        return account;
    }

    public int getChannel() {
        return channel;
    }

    public int getKeyIndex() {
        return keyIndex;
    }

    /** BIP32 child numbers of an index path. Purpose, coin type and account are hardened. */
    public ImmutableList<ChildNumber> toChildNumbers() {
        checkState(!isTagged(), "Tagged paths have no child numbers");
        return ImmutableList.of(new ChildNumber(PURPOSE, true), new ChildNumber(coinType, true),
                new ChildNumber(account, true), new ChildNumber(channel, false), new ChildNumber(keyIndex, false));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DerivationPath other = (DerivationPath) o;
        return coinType == other.coinType && account == other.account && channel == other.channel
                && keyIndex == other.keyIndex && Objects.equals(tag, other.tag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coinType, account, channel, keyIndex, tag);
    }

    @Override
    public String toString() {
        if (isTagged())
            return "tag:" + tag;
        return "m/" + PURPOSE + "'/" + coinType + "'/" + account + "'/" + channel + '/' + keyIndex;
    }
}
