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

import javax.annotation.Nullable;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text form of a claim that a name belongs to a public key. Names are canonicalized before they are signed, so
 * spellings that differ only in case, spaces or {@code +} signs make the same claim.
 */
public final class NameClaim {
    public static final String VERSION_1 = "claim-v1";

    /** Registry suffix every canonical name carries. */
    public static final String NAME_SUFFIX = ".test";

    private static final Pattern REMOVED = Pattern.compile("[ +]");
    private static final Pattern UNSAFE = Pattern.compile("[\r\n=]");

    private NameClaim() { }

    /**
     * Trims and lower cases the name, removes spaces and {@code +} signs and appends {@link #NAME_SUFFIX} when missing.
     * Blank input gives an empty string.
     */
    public static String canonicalizeName(@Nullable String name) {
        if (name == null || name.trim().isEmpty())
            return "";
        String canonical = REMOVED.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll("");
        if (!canonical.endsWith(NAME_SUFFIX))
            canonical += NAME_SUFFIX;
        return canonical;
    }

    /** The exact text that is hashed and signed for a version 1 claim. */
    public static String buildPayloadV1(@Nullable String name, @Nullable String publicKeyAddress) {
        return VERSION_1 + '\n'
                + "name=" + sanitize(canonicalizeName(name)) + '\n'
                + "publicKey=" + sanitize(publicKeyAddress);
    }

    private static String sanitize(@Nullable String value) {
        if (value == null || value.isEmpty())
            return "";
        return UNSAFE.matcher(value).replaceAll("");
    }
}
