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
import org.eppiej.core.DecMessage;
import org.eppiej.core.EmailAddress;
import org.eppiej.core.Folder;
import org.eppiej.utils.CancellationSignal;

import java.util.List;

/**
 * Local persistence of decentralized messages, keyed by account address, folder and content hash.
 */
public interface DecStorage extends KeyStorage {
    ListenableFuture<Boolean> isDecMessageExists(EmailAddress email, Folder folder, String hash, CancellationSignal signal);

    ListenableFuture<DecMessage> addDecMessage(EmailAddress email, DecMessage message, CancellationSignal signal);

    /** Up to {@code count} messages of the folder, oldest first. A count of zero or less returns all of them. */
    ListenableFuture<List<DecMessage>> getDecMessages(EmailAddress email, Folder folder, int count, CancellationSignal signal);

    /** Completes with null if there is no such message. */
    ListenableFuture<DecMessage> getDecMessage(EmailAddress email, Folder folder, String hash, CancellationSignal signal);

    /** Replaces the stored message with the same folder and hash. */
    ListenableFuture<DecMessage> updateDecMessage(EmailAddress email, DecMessage message, CancellationSignal signal);
}
