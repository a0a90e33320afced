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
import org.eppiej.core.Message;
import org.eppiej.utils.CancellationSignal;

/**
 * Protection of structured messages: a detached signature by the sender plus encryption to the recipient.
 */
public interface MessageProtector {
    /** Serialized, signed but unencrypted form of {@code message}. */
    ListenableFuture<byte[]> sign(Account sender, Message message, CancellationSignal signal);

    ListenableFuture<byte[]> signAndEncrypt(Account sender, String recipientPublicKeyAddress, Message message,
                                            CancellationSignal signal);

    /**
     * Decrypts and parses a message. The sender signature is checked when present; the outcome is reported through
     * {@link Message#getSignatureStatus()} and never fails the operation.
     */
    ListenableFuture<Message> tryVerifyAndDecrypt(Account recipient, byte[] data, CancellationSignal signal);
}
