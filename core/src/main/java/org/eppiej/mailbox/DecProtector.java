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

import com.google.common.util.concurrent.ListenableFuture;
import org.eppiej.core.Account;
import org.eppiej.core.EmailAddress;
import org.eppiej.utils.CancellationSignal;

/**
 * Encryption of raw payloads between decentralized addresses.
 */
public interface DecProtector {
    /** Encrypts {@code data} to the key behind {@code publicKeyAddress}. */
    byte[] encrypt(String publicKeyAddress, byte[] data);

    /** Resolves the key of {@code recipient} and encrypts {@code data} to it. */
    ListenableFuture<byte[]> encrypt(EmailAddress recipient, byte[] data, CancellationSignal signal);

    /** Decrypts {@code data} with the local key of {@code account}. */
    ListenableFuture<byte[]> decrypt(Account account, byte[] data, CancellationSignal signal);
}
