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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import org.eppiej.core.EmailAddress;
import org.eppiej.utils.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Resolver for the Eppie network. A segment that already is a valid public key address is returned as is;
 * anything else is treated as a name and looked up through the {@link NameResolver}.
 */
public class EppieEmailPublicKeyResolver implements EmailPublicKeyResolver {
    private static final Logger log = LoggerFactory.getLogger(EppieEmailPublicKeyResolver.class);

    private final NetworkPublicKeyRules keyRules;
    private final NameResolver nameResolver;

    public EppieEmailPublicKeyResolver(NetworkPublicKeyRules keyRules, NameResolver nameResolver) {
        this.keyRules = checkNotNull(keyRules, "keyRules");
        this.nameResolver = checkNotNull(nameResolver, "nameResolver");
    }

    @Override
    public ListenableFuture<KeyResolution> resolve(EmailAddress email, CancellationSignal signal) {
        checkNotNull(email, "email");
        checkNotNull(signal, "signal");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();

        String segment = email.getDecentralizedAddress();
        if (segment.trim().isEmpty())
            return Futures.immediateFuture(KeyResolution.absent("Eppie address segment is empty"));
        if (keyRules.tryValidate(segment))
            return Futures.immediateFuture(KeyResolution.found(segment));

        log.debug("Resolving name {}", segment);
        return Futures.transform(nameResolver.resolve(segment, signal),
                resolved -> checkResolved(segment, resolved), MoreExecutors.directExecutor());
    }

    private KeyResolution checkResolved(String name, @Nullable String resolved) {
        if (resolved == null || resolved.isEmpty())
            return KeyResolution.absent("Public key not found for " + name);
        if (!keyRules.tryValidate(resolved))
            return KeyResolution.malformed("Resolved value for " + name + " has invalid format");
        return KeyResolution.found(resolved);
    }
}
