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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bouncycastle.util.encoders.Base64;
import org.eppiej.core.Account;
import org.eppiej.core.EmailAddress;
import org.eppiej.core.NetworkType;
import org.eppiej.keys.PublicKeyService;
import org.eppiej.mailbox.KeyStorage;
import org.eppiej.utils.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Signs name claims with the key of a decentralized Eppie account. Signatures are deterministic (RFC 6979) with a
 * low S value, DER encoded and then Base64 encoded.
 */
public class NameClaimSigner {
    private static final Logger log = LoggerFactory.getLogger(NameClaimSigner.class);

    private final KeyStorage keyStorage;
    private final PublicKeyService publicKeyService;

    public NameClaimSigner(KeyStorage keyStorage, PublicKeyService publicKeyService) {
        this.keyStorage = checkNotNull(keyStorage, "keyStorage");
        this.publicKeyService = checkNotNull(publicKeyService, "publicKeyService");
    }

    /**
     * Signs the claim that {@code name} belongs to the key of {@code account}.
     *
     * @throws IllegalArgumentException if the name is blank
     * @throws UnsupportedOperationException if the account is not a decentralized Eppie account with an index
     */
    public ListenableFuture<String> signClaim(String name, Account account, CancellationSignal signal) {
        checkArgument(name != null && !name.trim().isEmpty(), "Name is required");
        checkNotNull(account, "account");
        checkNotNull(signal, "signal");
        EmailAddress email = account.getEmail();
        if (email.getNetwork() != NetworkType.EPPIE || email.isHybrid())
            throw new UnsupportedOperationException("Name claims can only be signed for Eppie accounts, not "
                    + email.getAddress());
        if (!account.hasDecentralizedAccountIndex())
            throw new UnsupportedOperationException("Account " + email.getAddress() + " has no decentralized index");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();

        return Futures.transform(keyStorage.getMasterKey(signal), masterKey -> {
            ECKey key = publicKeyService.derivePrivateKey(masterKey, account.getDerivationPath());
            String publicKeyAddress = publicKeyService.encode(key);
            log.info("Signing name claim for {}", NameClaim.canonicalizeName(name));
            return signClaimV1(name, publicKeyAddress, key);
        }, MoreExecutors.directExecutor());
    }

    /**
     * Signs the version 1 claim payload of {@code name} and {@code publicKeyAddress} with {@code key}.
     *
     * @throws IllegalArgumentException if the name or the public key address is blank
     */
    public static String signClaimV1(String name, String publicKeyAddress, ECKey key) {
        checkArgument(name != null && !name.trim().isEmpty(), "Name must not be blank");
        checkArgument(publicKeyAddress != null && !publicKeyAddress.trim().isEmpty(), "Public key address must not be blank");
        checkNotNull(key, "key");
        byte[] payload = NameClaim.buildPayloadV1(name, publicKeyAddress).getBytes(StandardCharsets.UTF_8);
        ECKey.ECDSASignature signature = key.sign(Sha256Hash.of(payload));
        return Base64.toBase64String(signature.encodeToDER());
    }
}
