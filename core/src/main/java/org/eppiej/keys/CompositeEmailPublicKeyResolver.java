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

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ListenableFuture;
import org.eppiej.core.EmailAddress;
import org.eppiej.core.NetworkType;
import org.eppiej.utils.CancellationSignal;

import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/** Dispatches to the resolver registered for the network of the address. */
public class CompositeEmailPublicKeyResolver implements EmailPublicKeyResolver {
    private final ImmutableMap<NetworkType, EmailPublicKeyResolver> resolvers;

    public CompositeEmailPublicKeyResolver(Map<NetworkType, ? extends EmailPublicKeyResolver> resolvers) {
        this.resolvers = ImmutableMap.copyOf(checkNotNull(resolvers, "resolvers"));
    }

    /**
     * @throws UnsupportedOperationException if no resolver is registered for the network of {@code email}
     */
    @Override
    public ListenableFuture<KeyResolution> resolve(EmailAddress email, CancellationSignal signal) {
        checkNotNull(email, "email");
        EmailPublicKeyResolver resolver = resolvers.get(email.getNetwork());
        if (resolver == null)
            throw new UnsupportedOperationException("Network type " + email.getNetwork()
                    + " is not supported for decentralized mail");
        return resolver.resolve(email, signal);
    }
}
