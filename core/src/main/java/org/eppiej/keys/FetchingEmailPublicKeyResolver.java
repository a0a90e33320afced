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

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Resolver for foreign networks such as Bitcoin and Ethereum. The address segment must be a valid address of that
 * network; its public key is then fetched from the network and must be a valid public key address.
 */
public class FetchingEmailPublicKeyResolver implements EmailPublicKeyResolver {
    private final NetworkPublicKeyRules addressRules;
    private final NetworkPublicKeyRules keyRules;
    private final PublicKeyFetcher fetcher;

    /**
     * @param addressRules rules of the foreign network the addresses belong to
     * @param keyRules rules the fetched public key address has to satisfy
     */
    public FetchingEmailPublicKeyResolver(NetworkPublicKeyRules addressRules, NetworkPublicKeyRules keyRules,
                                          PublicKeyFetcher fetcher) {
        this.addressRules = checkNotNull(addressRules, "addressRules");
        this.keyRules = checkNotNull(keyRules, "keyRules");
        this.fetcher = checkNotNull(fetcher, "fetcher");
    }

    @Override
    public ListenableFuture<KeyResolution> resolve(EmailAddress email, CancellationSignal signal) {
        checkNotNull(email, "email");
        checkNotNull(signal, "signal");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();

        String address = email.getDecentralizedAddress();
        if (!addressRules.tryValidate(address))
            return Futures.immediateFuture(KeyResolution.malformed(
                    "Not a valid " + addressRules.getNetwork() + " address: " + address));
        return Futures.transform(fetcher.fetch(address, signal),
                fetched -> checkFetched(address, fetched), MoreExecutors.directExecutor());
    }

    private KeyResolution checkFetched(String address, @Nullable String fetched) {
        if (fetched == null || fetched.isEmpty())
            return KeyResolution.absent("Public key is not found for the " + address + " "
                    + addressRules.getNetwork() + " address");
        if (!keyRules.tryValidate(fetched))
            return KeyResolution.malformed("Public key fetched for " + address + " has invalid format");
        return KeyResolution.found(fetched);
    }
}
