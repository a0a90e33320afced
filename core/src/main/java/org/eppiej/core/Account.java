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

import com.google.common.base.MoreObjects;
import org.eppiej.crypto.DerivationPath;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Local identity a mailbox works for. Decentralized accounts carry the index their key is derived at.
 */
public final class Account {
    /** Marker for an account that has no decentralized index assigned. */
    public static final int NO_ACCOUNT_INDEX = -1;

    private final EmailAddress email;
    private final int decentralizedAccountIndex;

    public Account(EmailAddress email) {
        this(email, NO_ACCOUNT_INDEX);
    }

    public Account(EmailAddress email, int decentralizedAccountIndex) {
        this.email = checkNotNull(email, "email");
        this.decentralizedAccountIndex = decentralizedAccountIndex;
    }

    public EmailAddress getEmail() {
        return email;
    }

    public int getDecentralizedAccountIndex() {
        return decentralizedAccountIndex;
    }

    public boolean hasDecentralizedAccountIndex() {
        return decentralizedAccountIndex >= 0;
    }

    /**
     * Where this account's key lives. Hybrid addresses and accounts without an index use their key tag, pure
     * decentralized accounts use the index path of their network.
     */
    public DerivationPath getDerivationPath() {
        if (!email.isHybrid() && email.isDecentralized() && hasDecentralizedAccountIndex())
            return DerivationPath.forNetwork(email.getNetwork(), decentralizedAccountIndex);
        return DerivationPath.ofTag(email.getKeyTag());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("email", email.getAddress())
                .add("index", decentralizedAccountIndex)
                .toString();
    }
}
