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

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Result of resolving an address to a public key. Absence (nothing registered) and malformation (something
 * registered that is not a usable key) are kept apart so callers can report them differently.
 */
public final class KeyResolution {
    public enum Status {
        FOUND,
        ABSENT,
        MALFORMED
    }

    private final Status status;
    @Nullable private final String publicKeyAddress;
    private final String detail;

    private KeyResolution(Status status, @Nullable String publicKeyAddress, String detail) {
        this.status = status;
        this.publicKeyAddress = publicKeyAddress;
        this.detail = detail;
    }

    public static KeyResolution found(String publicKeyAddress) {
        checkNotNull(publicKeyAddress);
        return new KeyResolution(Status.FOUND, publicKeyAddress, "");
    }

    public static KeyResolution absent(String detail) {
        return new KeyResolution(Status.ABSENT, null, checkNotNull(detail));
    }

    public static KeyResolution malformed(String detail) {
        return new KeyResolution(Status.MALFORMED, null, checkNotNull(detail));
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public String getPublicKeyAddress() {
        checkState(isFound(), "No key was resolved: %s", detail);
        return publicKeyAddress;
    }

    /** Why no key was found; empty for a found key. */
    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("status", status).add("key", publicKeyAddress).add("detail", detail.isEmpty() ? null : detail)
                .toString();
    }
}
