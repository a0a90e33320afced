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

import org.eppiej.core.EmailAddress;

import javax.annotation.Nullable;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Remembers names that resolved to a key, for the lifetime of one session. Entries must be invalidated when the
 * registration of a name is known to have changed.
 */
public class ResolutionCache {
    private final ConcurrentHashMap<EmailAddress, String> entries = new ConcurrentHashMap<>();

    @Nullable
    public String get(EmailAddress email) {
        return entries.get(checkNotNull(email));
    }

    public void put(EmailAddress email, String publicKeyAddress) {
        entries.put(checkNotNull(email), checkNotNull(publicKeyAddress));
    }

    public void invalidate(EmailAddress email) {
        entries.remove(checkNotNull(email));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
