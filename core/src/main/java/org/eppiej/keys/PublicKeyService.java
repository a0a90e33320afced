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
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import org.bitcoinj.core.ECKey;
import org.eppiej.core.EmailAddress;
import org.eppiej.core.NetworkType;
import org.eppiej.crypto.DerivationPath;
import org.eppiej.crypto.KeyDerivation;
import org.eppiej.crypto.MasterKey;
import org.eppiej.crypto.PublicKeyCodec;
import org.eppiej.crypto.Secp256k1Base32ECodec;
import org.eppiej.utils.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Single entry point for public keys: encoding and decoding of key addresses, derivation of local keys and
 * resolution of mail addresses to keys.</p>
 *
 * <p>Resolution goes through a composite resolver keyed by network. A failed resolution completes the returned
 * future with {@link NoPublicKeyException}; an address of a network without a resolver throws
 * {@link UnsupportedOperationException} before any lookup.</p>
 */
public class PublicKeyService {
    private static final Logger log = LoggerFactory.getLogger(PublicKeyService.class);

    private final PublicKeyCodec codec;
    private final EmailPublicKeyResolver resolver;
    @Nullable private final ResolutionCache cache;

    public PublicKeyService(PublicKeyCodec codec, EmailPublicKeyResolver resolver) {
        this(codec, resolver, null);
    }

    public PublicKeyService(PublicKeyCodec codec, EmailPublicKeyResolver resolver, @Nullable ResolutionCache cache) {
        this.codec = checkNotNull(codec, "codec");
        this.resolver = checkNotNull(resolver, "resolver");
        this.cache = cache;
    }

    /** Service for Eppie, Bitcoin and Ethereum addresses, without a resolution cache. */
    public static PublicKeyService createDefault(NameResolver nameResolver, PublicKeyFetcher bitcoinFetcher,
                                                 PublicKeyFetcher ethereumFetcher) {
        return createDefault(nameResolver, bitcoinFetcher, ethereumFetcher, null);
    }

    public static PublicKeyService createDefault(NameResolver nameResolver, PublicKeyFetcher bitcoinFetcher,
                                                 PublicKeyFetcher ethereumFetcher, @Nullable ResolutionCache cache) {
        PublicKeyCodec codec = new Secp256k1Base32ECodec();
        NetworkPublicKeyRules keyRules = NetworkPublicKeyRulesFactory.create(NetworkType.EPPIE, codec);
        ImmutableMap<NetworkType, EmailPublicKeyResolver> resolvers = ImmutableMap.of(
                NetworkType.EPPIE, new EppieEmailPublicKeyResolver(keyRules, nameResolver),
                NetworkType.BITCOIN, new FetchingEmailPublicKeyResolver(
                        NetworkPublicKeyRulesFactory.create(NetworkType.BITCOIN, codec), keyRules, bitcoinFetcher),
                NetworkType.ETHEREUM, new FetchingEmailPublicKeyResolver(
                        NetworkPublicKeyRulesFactory.create(NetworkType.ETHEREUM, codec), keyRules, ethereumFetcher));
        return new PublicKeyService(codec, new CompositeEmailPublicKeyResolver(resolvers), cache);
    }

    public PublicKeyCodec getCodec() {
        return codec;
    }

    public String encode(ECKey key) {
        return codec.encode(key);
    }

    public ECKey decode(String publicKeyAddress) {
        return codec.decode(publicKeyAddress);
    }

    /** Public key at {@code path}. */
    public ECKey derive(MasterKey masterKey, DerivationPath path) {
        return KeyDerivation.derivePublicKey(masterKey, path);
    }

    public ECKey derive(MasterKey masterKey, String tag) {
        return derive(masterKey, DerivationPath.ofTag(tag));
    }

    /** Private key at {@code path}, for signing and decryption. */
    public ECKey derivePrivateKey(MasterKey masterKey, DerivationPath path) {
        return KeyDerivation.deriveKey(masterKey, path);
    }

    public String deriveEncoded(MasterKey masterKey, DerivationPath path) {
        return encode(derive(masterKey, path));
    }

    public String deriveEncoded(MasterKey masterKey, String tag) {
        return encode(derive(masterKey, tag));
    }

    /** Resolves {@code email} without turning a failed resolution into an exception. */
    public ListenableFuture<KeyResolution> resolve(EmailAddress email, CancellationSignal signal) {
        checkNotNull(email, "email");
        checkNotNull(signal, "signal");
        if (cache != null) {
            String cached = cache.get(email);
            if (cached != null) {
                log.debug("Resolution cache hit for {}", email.getAddress());
                return Futures.immediateFuture(KeyResolution.found(cached));
            }
        }
        ListenableFuture<KeyResolution> resolution = resolver.resolve(email, signal);
        if (cache == null)
            return resolution;
        return Futures.transform(resolution, result -> {
            // direct keys cost nothing to resolve again
            if (result.isFound() && !result.getPublicKeyAddress().equals(email.getDecentralizedAddress()))
                cache.put(email, result.getPublicKeyAddress());
            return result;
        }, MoreExecutors.directExecutor());
    }

    /** Public key address of the owner of {@code email}. Fails with {@link NoPublicKeyException}. */
    public ListenableFuture<String> getEncodedByEmail(EmailAddress email, CancellationSignal signal) {
        return Futures.transform(resolve(email, signal), result -> {
            if (!result.isFound())
                throw new NoPublicKeyException(email, result.getStatus(), result.getDetail());
            return result.getPublicKeyAddress();
        }, MoreExecutors.directExecutor());
    }

    public ListenableFuture<ECKey> getByEmail(EmailAddress email, CancellationSignal signal) {
        return Futures.transform(getEncodedByEmail(email, signal), codec::decode, MoreExecutors.directExecutor());
    }
}
