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
import org.eppiej.crypto.PublicKeySyntax;

import javax.annotation.Nullable;
import java.util.Locale;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>A mail address, either classic ({@code bob@example.com}) or decentralized. Decentralized addresses end with
 * the postfix of their network, for example {@code <key or alias>@eppie}. A hybrid address embeds a public key in a
 * classic address: {@code bob+<key>@example.com}. Hybrids belong to the Eppie network.</p>
 *
 * <p>Equality ignores the case of the address and the display name.</p>
 */
public final class EmailAddress implements Comparable<EmailAddress> {
    private final String address;
    @Nullable private final String name;

    // Parsed parts, null when the address has no '@'.
    @Nullable private final String localName;
    @Nullable private final String embeddedKey;
    @Nullable private final String domain;

    public EmailAddress(String address) {
        this(address, null);
    }

    public EmailAddress(String address, @Nullable String name) {
        this.address = checkNotNull(address, "address");
        this.name = name;
        String[] parts = address.split("@", -1);
        if (parts.length == 2) {
            domain = parts[1];
            String[] nameParts = parts[0].split("\\+", -1);
            localName = nameParts[0];
            embeddedKey = nameParts.length == 2 && PublicKeySyntax.isValid(nameParts[1]) ? nameParts[1] : null;
        } else {
            domain = null;
            localName = null;
            embeddedKey = null;
        }
    }

    /**
     * Creates {@code <segment><postfix>} for the given network. The segment is a public key address, an alias or a
     * foreign network address.
     *
     * @throws IllegalArgumentException if the segment is blank or the network is not supported
     * @throws UnsupportedOperationException if the segment carries a hybrid {@code +key} part
     */
    public static EmailAddress createDecentralizedAddress(NetworkType network, String segment) {
        checkNotNull(network, "network");
        checkArgument(segment != null && !segment.trim().isEmpty(), "Address is required");
        checkArgument(network.isSupported(), "Unsupported network type %s", network);
        EmailAddress result = new EmailAddress(segment + network.getPostfix());
        if (result.embeddedKey != null)
            throw new UnsupportedOperationException("Hybrid local part is not allowed for decentralized network addresses");
        return result;
    }

    /**
     * Builds the hybrid form {@code name+key@domain} of this classic address.
     */
    public EmailAddress makeHybrid(String publicKeyAddress) {
        checkArgument(publicKeyAddress != null && !publicKeyAddress.trim().isEmpty(), "Public key is required");
        checkArgument(PublicKeySyntax.isValid(publicKeyAddress), "Invalid public key format");
        if (isHybrid())
            throw new UnsupportedOperationException("Cannot create hybrid from an existing hybrid address");
        if (isDecentralized())
            throw new UnsupportedOperationException("Cannot create hybrid address for a decentralized network address");
        checkArgument(domain != null, "Not a mail address: %s", address);
        String hybridName = name == null ? null : name + " (Hybrid)";
        return new EmailAddress(localName + '+' + publicKeyAddress + '@' + domain, hybridName);
    }

    public String getAddress() {
        return address;
    }

    @Nullable
    public String getName() {
        return name;
    }

    public boolean isHybrid() {
        return embeddedKey != null;
    }

    public boolean isDecentralized() {
        return getNetwork().isSupported();
    }

    public NetworkType getNetwork() {
        for (NetworkType type : NetworkType.values()) {
            if (type.isSupported() && endsWithIgnoreCase(address, type.getPostfix()))
                return type;
        }
        return isHybrid() ? NetworkType.EPPIE : NetworkType.UNSUPPORTED;
    }

    /** The address without the embedded key of a hybrid, otherwise the address itself. */
    public String getStandardAddress() {
        return isHybrid() ? localName + '@' + domain : address;
    }

    /**
     * The part that identifies the owner on its network: the embedded key of a hybrid, or the segment before the
     * network postfix. Empty for classic addresses.
     */
    public String getDecentralizedAddress() {
        if (isHybrid())
            return embeddedKey;
        for (NetworkType type : NetworkType.values()) {
            String postfix = type.getPostfix();
            if (postfix != null && endsWithIgnoreCase(address, postfix))
                return address.substring(0, address.length() - postfix.length());
        }
        return "";
    }

    /** Tag the key of this address is derived from when it is not addressed by account index. */
    public String getKeyTag() {
        return isHybrid() ? getStandardAddress() : address;
    }

    private static boolean endsWithIgnoreCase(String s, String suffix) {
        return s.regionMatches(true, s.length() - suffix.length(), suffix, 0, suffix.length());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return address.equalsIgnoreCase(((EmailAddress) o).address);
    }

    @Override
    public int hashCode() {
        return address.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public int compareTo(EmailAddress other) {
        return address.compareToIgnoreCase(other.address);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("address", address).add("name", name).toString();
    }
}
