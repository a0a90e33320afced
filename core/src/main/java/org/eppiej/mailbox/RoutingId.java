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

package org.eppiej.mailbox;

import org.bitcoinj.core.Sha256Hash;
import org.eppiej.crypto.PublicKeySyntax;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Address a mailbox is published under on the backends. It is a versioned one-way hash of the owner's public key
 * address, so backends never see the key itself. Case of the key address does not matter.
 */
public final class RoutingId {
    public static final String PREFIX = "tuvi.dec.route.v1|";

    private final String value;

    private RoutingId(String value) {
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException if {@code publicKeyAddress} is not a public key address
     */
    public static RoutingId of(String publicKeyAddress) {
        checkNotNull(publicKeyAddress, "publicKeyAddress");
        checkArgument(PublicKeySyntax.isValid(publicKeyAddress), "Not a public key address: %s", publicKeyAddress);
        String input = PREFIX + publicKeyAddress.toUpperCase(Locale.ROOT);
        byte[] hash = Sha256Hash.hash(input.getBytes(StandardCharsets.US_ASCII));
        return new RoutingId(Sha256Hash.wrap(hash).toString().toUpperCase(Locale.ROOT));
    }

    /** 64 upper case hex characters. */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((RoutingId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
