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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.crypto.KeyCrypterException;
import org.eppiej.core.Account;
import org.eppiej.core.EmailAddress;
import org.eppiej.crypto.KeyCrypterECIES;
import org.eppiej.keys.PublicKeyService;
import org.eppiej.utils.CancellationSignal;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@link DecProtector} based on {@link KeyCrypterECIES}. The recipient side derives its key from the master key
 * at the derivation path of the account, so no key material is stored besides the master key.
 */
public class EccDecProtector implements DecProtector {
    private final KeyStorage keyStorage;
    private final PublicKeyService publicKeyService;
    private final KeyCrypterECIES crypter;

    public EccDecProtector(KeyStorage keyStorage, PublicKeyService publicKeyService) {
        this(keyStorage, publicKeyService, new KeyCrypterECIES());
    }

    public EccDecProtector(KeyStorage keyStorage, PublicKeyService publicKeyService, KeyCrypterECIES crypter) {
        this.keyStorage = checkNotNull(keyStorage, "keyStorage");
        this.publicKeyService = checkNotNull(publicKeyService, "publicKeyService");
        this.crypter = checkNotNull(crypter, "crypter");
    }

    @Override
    public byte[] encrypt(String publicKeyAddress, byte[] data) {
        checkNotNull(publicKeyAddress, "publicKeyAddress");
        checkNotNull(data, "data");
        ECKey recipientKey = publicKeyService.decode(publicKeyAddress);
        try {
            return crypter.encrypt(data, recipientKey);
        } catch (KeyCrypterException e) {
            throw new MessageProtectionException("Could not encrypt for " + publicKeyAddress, e);
        }
    }

    @Override
    public ListenableFuture<byte[]> encrypt(EmailAddress recipient, byte[] data, CancellationSignal signal) {
        checkNotNull(recipient, "recipient");
        checkNotNull(data, "data");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        return Futures.transform(publicKeyService.getEncodedByEmail(recipient, signal),
                key -> encrypt(key, data), MoreExecutors.directExecutor());
    }

    @Override
    public ListenableFuture<byte[]> decrypt(Account account, byte[] data, CancellationSignal signal) {
        checkNotNull(account, "account");
        checkNotNull(data, "data");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        return Futures.transform(keyStorage.getMasterKey(signal), masterKey -> {
            ECKey key = publicKeyService.derivePrivateKey(masterKey, account.getDerivationPath());
            try {
                return crypter.decrypt(data, key);
            } catch (KeyCrypterException e) {
                throw new MessageProtectionException("Could not decrypt message for " + account.getEmail().getAddress(), e);
            }
        }, MoreExecutors.directExecutor());
    }
}
