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
import com.google.common.util.concurrent.FluentFuture;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Utils;
import org.eppiej.core.Account;
import org.eppiej.core.DecMessage;
import org.eppiej.core.EmailAddress;
import org.eppiej.core.Folder;
import org.eppiej.core.Message;
import org.eppiej.keys.PublicKeyService;
import org.eppiej.utils.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Mailbox of one decentralized account on top of any number of independent storage backends.</p>
 *
 * <p>Sending encrypts the message for every decentralized recipient, stores the ciphertext on every backend with
 * {@code put} and publishes the route entry {@code (routing id, hash)} with {@code send}. Receiving lists the routing
 * id of the account on every backend, merges the hashes, downloads each unknown hash from the first backend that
 * serves it and stores the decrypted message in the Inbox.</p>
 *
 * <p>Each backend step succeeds when at least one backend succeeds, and fails with {@link TransportException} when
 * all of them fail. The mailbox only has the two local folders Inbox and Sent.</p>
 */
public class DecMailBox {
    private static final Logger log = LoggerFactory.getLogger(DecMailBox.class);

    private final Account account;
    private final DecStorage storage;
    private final ImmutableList<DecStorageClient> clients;
    private final MessageProtector protector;
    private final PublicKeyService publicKeyService;
    private final DecMailBoxOptions options;

    public DecMailBox(Account account, DecStorage storage, List<? extends DecStorageClient> clients,
                      MessageProtector protector, PublicKeyService publicKeyService) {
        this(account, storage, clients, protector, publicKeyService, DecMailBoxOptions.defaults());
    }

    public DecMailBox(Account account, DecStorage storage, List<? extends DecStorageClient> clients,
                      MessageProtector protector, PublicKeyService publicKeyService, DecMailBoxOptions options) {
        this.account = checkNotNull(account, "account");
        this.storage = checkNotNull(storage, "storage");
        this.clients = ImmutableList.copyOf(checkNotNull(clients, "clients"));
        checkArgument(!this.clients.isEmpty(), "At least one backend client is required");
        this.protector = checkNotNull(protector, "protector");
        this.publicKeyService = checkNotNull(publicKeyService, "publicKeyService");
        this.options = checkNotNull(options, "options");
    }

    public Account getAccount() {
        return account;
    }

    public List<Folder> getFoldersStructure() {
        return ImmutableList.of(Folder.INBOX, Folder.SENT);
    }

    public Folder getDefaultInboxFolder() {
        return Folder.INBOX;
    }

    /**
     * Sends {@code message} to its decentralized To, Cc and Bcc recipients and stores an unread copy in Sent. An
     * address listed more than once gets the message once. Recipients are handled one after the other; a recipient that cannot be delivered fails the operation without undoing the
     * deliveries before it.
     *
     * @throws IllegalArgumentException if the message has no decentralized recipient
     */
    public ListenableFuture<DecMessage> sendMessage(Message message, CancellationSignal signal) {
        checkNotNull(message, "message");
        checkNotNull(signal, "signal");
        List<EmailAddress> recipients = new ArrayList<>();
        for (EmailAddress recipient : message.getAllRecipients()) {
            if (recipient.isDecentralized())
                recipients.add(recipient);
            else
                log.warn("Skipping recipient {}, it is not a decentralized address", recipient.getAddress());
        }
        checkArgument(!recipients.isEmpty(), "Message has no decentralized recipients");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();

        Message outgoing = message.copy();
        outgoing.setFrom(account.getEmail());
        outgoing.setDate(Utils.now());

        List<String> hashes = new ArrayList<>();
        FluentFuture<List<String>> delivered = FluentFuture.from(Futures.immediateFuture(hashes));
        for (EmailAddress recipient : recipients) {
            delivered = delivered.transformAsync(done -> FluentFuture.from(deliver(outgoing, recipient, signal))
                    .transform(hash -> {
                        done.add(hash);
                        return done;
                    }, MoreExecutors.directExecutor()), MoreExecutors.directExecutor());
        }
        return delivered.transformAsync(done -> {
            log.info("Sent message to {} recipients", done.size());
            outgoing.setMarkedAsRead(false);
            DecMessage sent = new DecMessage(sentCopyHash(done), Folder.SENT, outgoing);
            return storage.addDecMessage(account.getEmail(), sent, signal);
        }, MoreExecutors.directExecutor());
    }

    private ListenableFuture<String> deliver(Message message, EmailAddress recipient, CancellationSignal signal) {
        return FluentFuture.from(publicKeyService.getEncodedByEmail(recipient, signal))
                .transformAsync(recipientKey -> FluentFuture.from(
                        protector.signAndEncrypt(account, recipientKey, message, signal))
                        .transformAsync(data -> publish(recipientKey, data, signal), MoreExecutors.directExecutor()),
                        MoreExecutors.directExecutor());
    }

    private ListenableFuture<String> publish(String recipientKey, byte[] data, CancellationSignal signal) {
        String hash = contentHash(data);
        String routingId = RoutingId.of(recipientKey).getValue();
        return FluentFuture.from(broadcast("put", client -> client.put(data, signal), signal))
                .transformAsync(stored -> {
                    for (String reported : stored) {
                        if (!hash.equalsIgnoreCase(reported))
                            log.warn("Backend reported hash {} for blob {}", reported, hash);
                    }
                    return broadcast("send", client -> client.send(routingId, hash, signal), signal);
                }, MoreExecutors.directExecutor())
                .transform(acks -> {
                    log.debug("Published {} to {} on {} backends", hash, routingId, acks.size());
                    return hash;
                }, MoreExecutors.directExecutor());
    }

    /**
     * Downloads new messages into the Inbox, then returns up to {@code count} messages of {@code folder}.
     */
    public ListenableFuture<List<DecMessage>> getMessages(Folder folder, int count, CancellationSignal signal) {
        checkNotNull(folder, "folder");
        checkNotNull(signal, "signal");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        if (folder != Folder.INBOX)
            return storage.getDecMessages(account.getEmail(), folder, count, signal);
        return Futures.transformAsync(receiveNewMessages(signal),
                received -> storage.getDecMessages(account.getEmail(), folder, count, signal),
                MoreExecutors.directExecutor());
    }

    /**
     * Lists the routing id of this account on every backend and stores every message that is not known locally.
     * Completes with the newly stored messages.
     */
    public ListenableFuture<List<DecMessage>> receiveNewMessages(CancellationSignal signal) {
        checkNotNull(signal, "signal");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        return FluentFuture.from(storage.getMasterKey(signal))
                .transform(masterKey -> publicKeyService.deriveEncoded(masterKey, account.getDerivationPath()),
                        MoreExecutors.directExecutor())
                .transformAsync(address -> {
                    String routingId = RoutingId.of(address).getValue();
                    return broadcast("list", client -> client.list(routingId, signal), signal);
                }, MoreExecutors.directExecutor())
                .transformAsync(listings -> fetchAll(union(listings), signal), MoreExecutors.directExecutor());
    }

    // Backends may report the same hash in different hex case.
    private static Set<String> union(List<List<String>> listings) {
        Set<String> hashes = new LinkedHashSet<>();
        for (List<String> listing : listings) {
            if (listing == null)
                continue;
            for (String hash : listing) {
                if (hash != null)
                    hashes.add(normalizeHash(hash));
            }
        }
        return hashes;
    }

    private static String normalizeHash(String hash) {
        return hash.toLowerCase(Locale.ROOT);
    }

    private ListenableFuture<List<DecMessage>> fetchAll(Collection<String> hashes, CancellationSignal signal) {
        List<DecMessage> received = new ArrayList<>();
        FluentFuture<List<DecMessage>> chain = FluentFuture.from(Futures.immediateFuture(received));
        for (String hash : hashes) {
            chain = chain.transformAsync(stored -> {
                if (stored.size() >= options.getMaxFetchPerReceive())
                    return Futures.immediateFuture(stored);
                return FluentFuture.from(fetchIfUnknown(hash, signal)).transform(message -> {
                    if (message != null)
                        stored.add(message);
                    return stored;
                }, MoreExecutors.directExecutor());
            }, MoreExecutors.directExecutor());
        }
        return chain.transform(stored -> {
            log.info("Received {} new messages out of {} listed", stored.size(), hashes.size());
            return stored;
        }, MoreExecutors.directExecutor());
    }

    // Completes with null when the hash is already known or had to be skipped.
    private ListenableFuture<DecMessage> fetchIfUnknown(String hash, CancellationSignal signal) {
        return FluentFuture.from(storage.isDecMessageExists(account.getEmail(), Folder.INBOX, hash, signal))
                .transformAsync(exists -> {
                    if (exists)
                        return Futures.immediateFuture(null);
                    return fetch(hash, signal);
                }, MoreExecutors.directExecutor());
    }

    private ListenableFuture<DecMessage> fetch(String hash, CancellationSignal signal) {
        return FluentFuture.from(getFromBackends(hash, 0, null, signal))
                .transformAsync(data -> protector.tryVerifyAndDecrypt(account, data, signal), MoreExecutors.directExecutor())
                .transformAsync(message -> {
                    message.setFolder(Folder.INBOX);
                    message.setMarkedAsRead(false);
                    return storage.addDecMessage(account.getEmail(), new DecMessage(hash, Folder.INBOX, message), signal);
                }, MoreExecutors.directExecutor())
                .catching(TransportException.class, e -> {
                    log.warn("Skipping message {}: {}", hash, e.getMessage());
                    return null;
                }, MoreExecutors.directExecutor())
                .catching(MessageProtectionException.class, e -> {
                    log.warn("Skipping message {}, it could not be decrypted: {}", hash, e.getMessage());
                    return null;
                }, MoreExecutors.directExecutor());
    }

    private ListenableFuture<byte[]> getFromBackends(String hash, int index, @Nullable Throwable lastFailure,
                                                     CancellationSignal signal) {
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        if (index == clients.size())
            return Futures.immediateFailedFuture(new TransportException("No backend could serve " + hash, lastFailure));
        ListenableFuture<byte[]> attempt;
        try {
            attempt = clients.get(index).get(hash, signal);
        } catch (RuntimeException e) {
            attempt = Futures.immediateFailedFuture(e);
        }
        if (options.getCallTimeout() != null)
            attempt = Futures.withTimeout(attempt, options.getCallTimeout(), options.getTimeoutExecutor());
        return FluentFuture.from(attempt).catchingAsync(Exception.class, e -> {
            if (e instanceof CancellationException)
                throw e;
            log.warn("get {} failed on backend #{}: {}", hash, index, e.toString());
            return getFromBackends(hash, index + 1, e, signal);
        }, MoreExecutors.directExecutor());
    }

    /** Completes with null if there is no such message. */
    public ListenableFuture<DecMessage> getMessage(Folder folder, String hash, CancellationSignal signal) {
        checkNotNull(folder, "folder");
        checkNotNull(hash, "hash");
        return storage.getDecMessage(account.getEmail(), folder, normalizeHash(hash), signal);
    }

    public ListenableFuture<List<DecMessage>> markAsRead(Folder folder, Collection<String> hashes, CancellationSignal signal) {
        return update(folder, hashes, stored -> stored.withMarkedAsRead(true), signal);
    }

    public ListenableFuture<List<DecMessage>> markAsUnread(Folder folder, Collection<String> hashes, CancellationSignal signal) {
        return update(folder, hashes, stored -> stored.withMarkedAsRead(false), signal);
    }

    public ListenableFuture<List<DecMessage>> markAsFlagged(Folder folder, Collection<String> hashes, CancellationSignal signal) {
        return update(folder, hashes, stored -> stored.withFlagged(true), signal);
    }

    public ListenableFuture<List<DecMessage>> markAsUnflagged(Folder folder, Collection<String> hashes, CancellationSignal signal) {
        return update(folder, hashes, stored -> stored.withFlagged(false), signal);
    }

    // Fails with IllegalArgumentException when one of the hashes is not stored in the folder.
    private ListenableFuture<List<DecMessage>> update(Folder folder, Collection<String> hashes,
                                                      Function<DecMessage, DecMessage> change, CancellationSignal signal) {
        checkNotNull(folder, "folder");
        checkNotNull(hashes, "hashes");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        List<ListenableFuture<DecMessage>> updates = new ArrayList<>();
        for (String requested : hashes) {
            String hash = normalizeHash(requested);
            updates.add(Futures.transformAsync(storage.getDecMessage(account.getEmail(), folder, hash, signal), stored -> {
                if (stored == null)
                    throw new IllegalArgumentException("No message " + hash + " in " + folder.getFullName());
                return storage.updateDecMessage(account.getEmail(), change.apply(stored), signal);
            }, MoreExecutors.directExecutor()));
        }
        return Futures.allAsList(updates);
    }

    private <T> ListenableFuture<List<T>> broadcast(String operation, Function<DecStorageClient, ListenableFuture<T>> call,
                                                    CancellationSignal signal) {
        return new BackendBroadcast<>(operation, clients, call, signal, options).broadcast();
    }

    /** Lower case hex SHA-256 of {@code data}, the identity of a blob. */
    public static String contentHash(byte[] data) {
        return Sha256Hash.of(data).toString();
    }

    private static String sentCopyHash(List<String> hashes) {
        if (hashes.size() == 1)
            return hashes.get(0);
        ByteArrayOutputStream concatenated = new ByteArrayOutputStream();
        for (String hash : hashes) {
            byte[] bytes = hash.getBytes(StandardCharsets.US_ASCII);
            concatenated.write(bytes, 0, bytes.length);
        }
        return contentHash(concatenated.toByteArray());
    }
}
