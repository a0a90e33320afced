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

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.eppiej.core.DecMessage;
import org.eppiej.core.EmailAddress;
import org.eppiej.core.Folder;
import org.eppiej.crypto.MasterKey;
import org.eppiej.utils.CancellationSignal;

import javax.annotation.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@link DecStorage} held in memory. Adding a message whose hash is already stored in the folder keeps the stored
 * one.
 */
public class MemoryDecStorage implements DecStorage {
    private final MasterKey masterKey;

    private final Object lock = new Object();
    @GuardedBy("lock") private final Map<String, LinkedHashMap<String, DecMessage>> folders = new HashMap<>();

    public MemoryDecStorage(MasterKey masterKey) {
        this.masterKey = checkNotNull(masterKey, "masterKey");
    }

    @Override
    public ListenableFuture<MasterKey> getMasterKey(CancellationSignal signal) {
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        return Futures.immediateFuture(masterKey);
    }

    @Override
    public ListenableFuture<Boolean> isDecMessageExists(EmailAddress email, Folder folder, String hash,
                                                        CancellationSignal signal) {
        checkNotNull(hash, "hash");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        synchronized (lock) {
            return Futures.immediateFuture(folder(email, folder).containsKey(hash));
        }
    }

    @Override
    public ListenableFuture<DecMessage> addDecMessage(EmailAddress email, DecMessage message, CancellationSignal signal) {
        checkNotNull(message, "message");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        synchronized (lock) {
            DecMessage existing = folder(email, message.getFolder()).putIfAbsent(message.getHash(), message);
            return Futures.immediateFuture(existing != null ? existing : message);
        }
    }

    @Override
    public ListenableFuture<List<DecMessage>> getDecMessages(EmailAddress email, Folder folder, int count,
                                                             CancellationSignal signal) {
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        synchronized (lock) {
            List<DecMessage> messages = new ArrayList<>(folder(email, folder).values());
            if (count > 0 && messages.size() > count)
                messages = messages.subList(0, count);
            return Futures.immediateFuture(ImmutableList.copyOf(messages));
        }
    }

    @Override
    public ListenableFuture<DecMessage> getDecMessage(EmailAddress email, Folder folder, String hash,
                                                      CancellationSignal signal) {
        checkNotNull(hash, "hash");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        synchronized (lock) {
            return Futures.immediateFuture(folder(email, folder).get(hash));
        }
    }

    @Override
    public ListenableFuture<DecMessage> updateDecMessage(EmailAddress email, DecMessage message, CancellationSignal signal) {
        checkNotNull(message, "message");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        synchronized (lock) {
            Map<String, DecMessage> stored = folder(email, message.getFolder());
            if (!stored.containsKey(message.getHash()))
                return Futures.immediateFailedFuture(new IllegalArgumentException("No message " + message.getHash()));
            stored.put(message.getHash(), message);
            return Futures.immediateFuture(message);
        }
    }

    @GuardedBy("lock")
    private LinkedHashMap<String, DecMessage> folder(EmailAddress email, Folder folder) {
        checkNotNull(email, "email");
        checkNotNull(folder, "folder");
        String key = email.getAddress().toLowerCase(Locale.ROOT) + '/' + folder.getFullName();
        return folders.computeIfAbsent(key, k -> new LinkedHashMap<>());
    }
}
