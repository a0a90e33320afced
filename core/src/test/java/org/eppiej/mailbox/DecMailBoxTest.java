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
import com.google.common.util.concurrent.ListenableFuture;
import org.bitcoinj.core.Utils;
import org.eppiej.core.Account;
import org.eppiej.core.DecMessage;
import org.eppiej.core.EmailAddress;
import org.eppiej.core.Folder;
import org.eppiej.core.Message;
import org.eppiej.core.NetworkType;
import org.eppiej.core.SignatureStatus;
import org.eppiej.crypto.DerivationPath;
import org.eppiej.crypto.MasterKey;
import org.eppiej.keys.NoOpNameResolver;
import org.eppiej.keys.NoOpPublicKeyFetcher;
import org.eppiej.keys.NoPublicKeyException;
import org.eppiej.keys.PublicKeyService;
import org.eppiej.utils.CancellationSignal;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DecMailBoxTest {
    private final PublicKeyService service = PublicKeyService.createDefault(new NoOpNameResolver(),
            new NoOpPublicKeyFetcher(), new NoOpPublicKeyFetcher());

    private MasterKey aliceKey;
    private MasterKey bobKey;
    private Account alice;
    private Account bob;
    private FakeDecStorageClient first;
    private FakeDecStorageClient second;
    private ScheduledExecutorService scheduler;

    @Before
    public void setUp() {
        aliceKey = MasterKey.fromSeed(Utils.HEX.decode("000102030405060708090a0b0c0d0e0f"));
        bobKey = MasterKey.fromSeed(Utils.HEX.decode("fffcf9f6f3f0edeae7e4e1dedbd8d5d2"));
        alice = createAccount(aliceKey);
        bob = createAccount(bobKey);
        first = new FakeDecStorageClient();
        second = new FakeDecStorageClient();
    }

    @After
    public void tearDown() {
        if (scheduler != null)
            scheduler.shutdownNow();
    }

    private Account createAccount(MasterKey masterKey) {
        String address = service.deriveEncoded(masterKey, DerivationPath.forNetwork(NetworkType.EPPIE, 0));
        return new Account(EmailAddress.createDecentralizedAddress(NetworkType.EPPIE, address), 0);
    }

    private DecMailBox createMailBox(Account account, MasterKey masterKey, DecMailBoxOptions options,
                                     DecStorageClient... clients) {
        MemoryDecStorage storage = new MemoryDecStorage(masterKey);
        DecMessageProtector protector = new DecMessageProtector(storage, service, new EccDecProtector(storage, service));
        return new DecMailBox(account, storage, ImmutableList.copyOf(clients), protector, service, options);
    }

    private DecMailBox createMailBox(Account account, MasterKey masterKey, DecStorageClient... clients) {
        return createMailBox(account, masterKey, DecMailBoxOptions.defaults(), clients);
    }

    private Message createMessage(String subject, EmailAddress... to) {
        Message message = new Message();
        for (EmailAddress address : to)
            message.addTo(address);
        message.setSubject(subject);
        message.setTextBody("Body of " + subject);
        return message;
    }

    private static Throwable failureOf(ListenableFuture<?> future) throws InterruptedException {
        try {
            future.get(10, TimeUnit.SECONDS);
            fail("Expected the future to fail");
            return null;
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (TimeoutException e) {
            throw new AssertionError("Future did not complete", e);
        }
    }

    @Test
    public void folders() {
        DecMailBox mailBox = createMailBox(alice, aliceKey, first);
        assertEquals(ImmutableList.of(Folder.INBOX, Folder.SENT), mailBox.getFoldersStructure());
        assertEquals(Folder.INBOX, mailBox.getDefaultInboxFolder());
        assertThrows(IllegalArgumentException.class,
                () -> new DecMailBox(alice, new MemoryDecStorage(aliceKey), ImmutableList.<DecStorageClient>of(),
                        new DecMessageProtector(new MemoryDecStorage(aliceKey), service,
                                new EccDecProtector(new MemoryDecStorage(aliceKey), service)), service));
    }

    @Test
    public void sendAndReceiveOverTwoBackends() throws Exception {
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first, second);
        DecMailBox bobBox = createMailBox(bob, bobKey, first, second);

        DecMessage sent = aliceBox.sendMessage(createMessage("Hello", bob.getEmail()), CancellationSignal.none()).get();
        assertEquals(Folder.SENT, sent.getFolder());
        assertFalse(sent.isMarkedAsRead());
        assertEquals(alice.getEmail(), sent.getMessage().getFrom());
        assertEquals(1, first.puts.get());
        assertEquals(1, second.puts.get());
        assertEquals(1, first.sends.get());
        assertEquals(1, second.sends.get());
        assertEquals(ImmutableList.of(sent.getHash()), first.getBackend().list(RoutingId.of(key(bob)).getValue(),
                CancellationSignal.none()).get());

        List<DecMessage> inbox = bobBox.getMessages(Folder.INBOX, 0, CancellationSignal.none()).get();
        assertEquals(1, inbox.size());
        DecMessage received = inbox.get(0);
        assertEquals(sent.getHash(), received.getHash());
        assertEquals(Folder.INBOX, received.getFolder());
        assertFalse(received.isMarkedAsRead());
        Message message = received.getMessage();
        assertEquals("Hello", message.getSubject());
        assertEquals("Body of Hello", message.getTextBody());
        assertEquals(alice.getEmail(), message.getFrom());
        assertEquals(SignatureStatus.VERIFIED, message.getSignatureStatus());
        // both backends list the hash, one download is enough
        assertEquals(1, first.gets.get() + second.gets.get());

        List<DecMessage> sentFolder = aliceBox.getMessages(Folder.SENT, 0, CancellationSignal.none()).get();
        assertEquals(ImmutableList.of(sent), sentFolder);
    }

    @Test
    public void knownMessagesAreNotDownloadedAgain() throws Exception {
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first, second);
        DecMailBox bobBox = createMailBox(bob, bobKey, first, second);
        aliceBox.sendMessage(createMessage("Once", bob.getEmail()), CancellationSignal.none()).get();

        assertEquals(1, bobBox.receiveNewMessages(CancellationSignal.none()).get().size());
        int gets = first.gets.get() + second.gets.get();
        assertTrue(bobBox.receiveNewMessages(CancellationSignal.none()).get().isEmpty());
        assertEquals(gets, first.gets.get() + second.gets.get());
        assertEquals(2, first.lists.get());
        assertEquals(1, bobBox.getMessages(Folder.INBOX, 0, CancellationSignal.none()).get().size());
    }

    @Test
    public void mergesListingsOfDisjointBackends() throws Exception {
        DecMailBox aliceOnFirst = createMailBox(alice, aliceKey, first);
        DecMailBox aliceOnSecond = createMailBox(alice, aliceKey, second);
        aliceOnFirst.sendMessage(createMessage("One", bob.getEmail()), CancellationSignal.none()).get();
        aliceOnSecond.sendMessage(createMessage("Two", bob.getEmail()), CancellationSignal.none()).get();

        DecMailBox bobBox = createMailBox(bob, bobKey, first, second);
        List<DecMessage> received = bobBox.receiveNewMessages(CancellationSignal.none()).get();
        assertEquals(2, received.size());
        // the first backend does not hold the second blob, the second one serves it
        assertEquals(ImmutableList.of("One", "Two"), ImmutableList.of(received.get(0).getMessage().getSubject(),
                received.get(1).getMessage().getSubject()));
    }

    @Test
    public void hashesListedInDifferentCaseAreOneMessage() throws Exception {
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first, second);
        String hash = aliceBox.sendMessage(createMessage("Once", bob.getEmail()), CancellationSignal.none()).get().getHash();

        second.upperCaseListing = true;
        DecMailBox bobBox = createMailBox(bob, bobKey, first, second);
        List<DecMessage> received = bobBox.receiveNewMessages(CancellationSignal.none()).get();
        assertEquals(1, received.size());
        assertEquals(hash, received.get(0).getHash());
        assertEquals(1, bobBox.getMessages(Folder.INBOX, 0, CancellationSignal.none()).get().size());

        // only the upper case listing is left
        DecMailBox upperOnly = createMailBox(bob, bobKey, second);
        assertEquals(hash, upperOnly.receiveNewMessages(CancellationSignal.none()).get().get(0).getHash());
        assertEquals(hash, bobBox.getMessage(Folder.INBOX, hash.toUpperCase(Locale.ROOT),
                CancellationSignal.none()).get().getHash());
    }

    @Test
    public void sessionSignalKeepsNoListeners() throws Exception {
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first, second);
        DecMailBox bobBox = createMailBox(bob, bobKey, first, second);
        CancellationSignal session = CancellationSignal.none();
        aliceBox.sendMessage(createMessage("Polled", bob.getEmail()), session).get();
        for (int i = 0; i < 1000; i++)
            bobBox.receiveNewMessages(session).get();
        assertEquals(0, session.getListenerCount());
        assertEquals(1, bobBox.getMessages(Folder.INBOX, 0, session).get().size());
    }

    @Test
    public void oneHealthyBackendIsEnough() throws Exception {
        second.failAll();
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first, second);
        DecMailBox bobBox = createMailBox(bob, bobKey, second, first);

        aliceBox.sendMessage(createMessage("Resilient", bob.getEmail()), CancellationSignal.none()).get();
        assertEquals(1, second.puts.get());

        List<DecMessage> received = bobBox.receiveNewMessages(CancellationSignal.none()).get();
        assertEquals(1, received.size());
        assertEquals("Resilient", received.get(0).getMessage().getSubject());
    }

    @Test
    public void sendFailsWhenAllBackendsFail() throws Exception {
        first.failAll();
        second.failAll();
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first, second);
        Throwable failure = failureOf(aliceBox.sendMessage(createMessage("Lost", bob.getEmail()), CancellationSignal.none()));
        assertTrue(failure instanceof TransportException);
        assertEquals(0, first.sends.get());
        assertTrue(aliceBox.getMessages(Folder.SENT, 0, CancellationSignal.none()).get().isEmpty());
    }

    @Test
    public void sendFailsWhenNoBackendAcceptsTheRoute() throws Exception {
        first.sendMode = FakeDecStorageClient.Mode.FAIL;
        second.sendMode = FakeDecStorageClient.Mode.FAIL;
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first, second);
        Throwable failure = failureOf(aliceBox.sendMessage(createMessage("Lost", bob.getEmail()), CancellationSignal.none()));
        assertTrue(failure instanceof TransportException);
        assertEquals(1, first.puts.get());
    }

    @Test
    public void receiveFailsWhenNoBackendLists() throws Exception {
        first.listMode = FakeDecStorageClient.Mode.FAIL;
        second.listMode = FakeDecStorageClient.Mode.FAIL;
        DecMailBox bobBox = createMailBox(bob, bobKey, first, second);
        Throwable failure = failureOf(bobBox.receiveNewMessages(CancellationSignal.none()));
        assertTrue(failure instanceof TransportException);
        assertEquals(0, first.gets.get() + second.gets.get());
        assertTrue(failureOf(bobBox.getMessages(Folder.INBOX, 0, CancellationSignal.none())) instanceof TransportException);
    }

    @Test
    public void cancelledSignalTouchesNoBackend() {
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first, second);
        CancellationSignal signal = CancellationSignal.none();
        signal.cancel();

        ListenableFuture<DecMessage> send = aliceBox.sendMessage(createMessage("Never", bob.getEmail()), signal);
        assertTrue(send.isCancelled());
        assertThrows(CancellationException.class, send::get);
        assertTrue(aliceBox.receiveNewMessages(signal).isCancelled());
        assertTrue(aliceBox.getMessages(Folder.INBOX, 10, signal).isCancelled());
        assertEquals(0, first.totalCalls() + second.totalCalls());
    }

    @Test
    public void unreachableHashIsSkipped() throws Exception {
        String routingId = RoutingId.of(key(bob)).getValue();
        String missing = DecMailBox.contentHash("nowhere".getBytes(StandardCharsets.UTF_8));
        first.getBackend().send(routingId, missing, CancellationSignal.none()).get();

        DecMailBox aliceBox = createMailBox(alice, aliceKey, first, second);
        aliceBox.sendMessage(createMessage("Real", bob.getEmail()), CancellationSignal.none()).get();

        DecMailBox bobBox = createMailBox(bob, bobKey, first, second);
        List<DecMessage> received = bobBox.receiveNewMessages(CancellationSignal.none()).get();
        assertEquals(1, received.size());
        assertEquals("Real", received.get(0).getMessage().getSubject());
        assertNull(bobBox.getMessage(Folder.INBOX, missing, CancellationSignal.none()).get());
    }

    @Test
    public void undecryptableBlobIsSkipped() throws Exception {
        byte[] garbage = "not for bob".getBytes(StandardCharsets.UTF_8);
        String hash = first.getBackend().put(garbage, CancellationSignal.none()).get();
        first.getBackend().send(RoutingId.of(key(bob)).getValue(), hash, CancellationSignal.none()).get();

        DecMailBox bobBox = createMailBox(bob, bobKey, first);
        assertTrue(bobBox.receiveNewMessages(CancellationSignal.none()).get().isEmpty());
        assertTrue(bobBox.getMessages(Folder.INBOX, 0, CancellationSignal.none()).get().isEmpty());
    }

    @Test
    public void classicRecipientsAreSkipped() throws Exception {
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first);
        EmailAddress classic = new EmailAddress("carol@example.com");
        assertThrows(IllegalArgumentException.class,
                () -> aliceBox.sendMessage(createMessage("Nobody", classic), CancellationSignal.none()));
        assertEquals(0, first.totalCalls());

        aliceBox.sendMessage(createMessage("Mixed", classic, bob.getEmail()), CancellationSignal.none()).get();
        assertEquals(1, first.puts.get());
        assertEquals(1, first.sends.get());
    }

    @Test
    public void unresolvableRecipientFailsSend() throws Exception {
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first);
        EmailAddress alias = EmailAddress.createDecentralizedAddress(NetworkType.EPPIE, "nobody");
        Throwable failure = failureOf(aliceBox.sendMessage(createMessage("Lost", alias), CancellationSignal.none()));
        assertTrue(failure instanceof NoPublicKeyException);
        assertEquals(0, first.totalCalls());
    }

    @Test
    public void sentCopyOfSeveralRecipients() throws Exception {
        MasterKey carolKey = MasterKey.fromSeed(Utils.HEX.decode("4b381541583be4423346c643850da4b3"));
        Account carol = createAccount(carolKey);
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first);
        DecMessage sent = aliceBox.sendMessage(createMessage("Both", bob.getEmail(), carol.getEmail()),
                CancellationSignal.none()).get();
        assertEquals(2, first.puts.get());
        assertEquals(2, sent.getMessage().getTo().size());

        DecMessage toBob = createMailBox(bob, bobKey, first).receiveNewMessages(CancellationSignal.none()).get().get(0);
        DecMessage toCarol = createMailBox(carol, carolKey, first).receiveNewMessages(CancellationSignal.none()).get().get(0);
        assertFalse(toBob.getHash().equals(toCarol.getHash()));
        assertEquals(DecMailBox.contentHash((toBob.getHash() + toCarol.getHash()).getBytes(StandardCharsets.US_ASCII)),
                sent.getHash());
    }

    @Test
    public void ccAndBccRecipientsReceiveOneCopyEach() throws Exception {
        MasterKey carolKey = MasterKey.fromSeed(Utils.HEX.decode("4b381541583be4423346c643850da4b3"));
        Account carol = createAccount(carolKey);
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first);
        Message message = createMessage("Copies", bob.getEmail());
        message.addCc(carol.getEmail());
        message.addBcc(bob.getEmail());
        message.addBcc(new EmailAddress("dave@example.com"));
        DecMessage sent = aliceBox.sendMessage(message, CancellationSignal.none()).get();
        assertEquals(2, first.puts.get());
        assertEquals(2, first.sends.get());
        assertEquals(ImmutableList.of(carol.getEmail()), sent.getMessage().getCc());

        List<DecMessage> toBob = createMailBox(bob, bobKey, first).receiveNewMessages(CancellationSignal.none()).get();
        assertEquals(1, toBob.size());
        List<DecMessage> toCarol = createMailBox(carol, carolKey, first).receiveNewMessages(CancellationSignal.none()).get();
        assertEquals(1, toCarol.size());
        Message received = toCarol.get(0).getMessage();
        assertEquals("Copies", received.getSubject());
        assertEquals(ImmutableList.of(bob.getEmail()), received.getTo());
        assertEquals(ImmutableList.of(carol.getEmail()), received.getCc());
    }

    @Test
    public void onlyCcRecipientIsEnough() throws Exception {
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first);
        Message message = createMessage("Cc only", new EmailAddress("carol@example.com"));
        message.addCc(bob.getEmail());
        aliceBox.sendMessage(message, CancellationSignal.none()).get();
        assertEquals(1, createMailBox(bob, bobKey, first).receiveNewMessages(CancellationSignal.none()).get().size());
    }

    @Test
    public void fetchLimitDefersTheRest() throws Exception {
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first);
        aliceBox.sendMessage(createMessage("One", bob.getEmail()), CancellationSignal.none()).get();
        aliceBox.sendMessage(createMessage("Two", bob.getEmail()), CancellationSignal.none()).get();

        DecMailBox bobBox = createMailBox(bob, bobKey,
                DecMailBoxOptions.builder().maxFetchPerReceive(1).build(), first);
        assertEquals(1, bobBox.receiveNewMessages(CancellationSignal.none()).get().size());
        assertEquals(1, bobBox.receiveNewMessages(CancellationSignal.none()).get().size());
        assertTrue(bobBox.receiveNewMessages(CancellationSignal.none()).get().isEmpty());
        assertEquals(2, bobBox.getMessages(Folder.INBOX, 0, CancellationSignal.none()).get().size());
        assertEquals(1, bobBox.getMessages(Folder.INBOX, 1, CancellationSignal.none()).get().size());
    }

    @Test
    public void hangingBackendTimesOut() throws Exception {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        DecMailBoxOptions options = DecMailBoxOptions.builder().callTimeout(Duration.ofMillis(200), scheduler).build();
        DecMailBox aliceBox = createMailBox(alice, aliceKey, options, first);
        aliceBox.sendMessage(createMessage("Slow", bob.getEmail()), CancellationSignal.none()).get();

        FakeDecStorageClient hanging = new FakeDecStorageClient(first.getBackend());
        hanging.listMode = FakeDecStorageClient.Mode.HANG;
        hanging.getMode = FakeDecStorageClient.Mode.HANG;
        DecMailBox bobBox = createMailBox(bob, bobKey, options, hanging, first);
        List<DecMessage> received = bobBox.receiveNewMessages(CancellationSignal.none()).get(10, TimeUnit.SECONDS);
        assertEquals(1, received.size());
        assertEquals(1, hanging.gets.get());
    }

    @Test
    public void readFlags() throws Exception {
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first);
        DecMailBox bobBox = createMailBox(bob, bobKey, first);
        String hash = aliceBox.sendMessage(createMessage("Flag", bob.getEmail()), CancellationSignal.none()).get().getHash();
        bobBox.receiveNewMessages(CancellationSignal.none()).get();

        List<DecMessage> read = bobBox.markAsRead(Folder.INBOX, ImmutableList.of(hash), CancellationSignal.none()).get();
        assertTrue(read.get(0).isMarkedAsRead());
        assertTrue(bobBox.getMessage(Folder.INBOX, hash, CancellationSignal.none()).get().isMarkedAsRead());

        bobBox.markAsUnread(Folder.INBOX, ImmutableList.of(hash), CancellationSignal.none()).get();
        assertFalse(bobBox.getMessage(Folder.INBOX, hash, CancellationSignal.none()).get().isMarkedAsRead());

        assertTrue(failureOf(bobBox.markAsRead(Folder.SENT, ImmutableList.of(hash), CancellationSignal.none()))
                instanceof IllegalArgumentException);
    }

    @Test
    public void flags() throws Exception {
        DecMailBox aliceBox = createMailBox(alice, aliceKey, first);
        DecMailBox bobBox = createMailBox(bob, bobKey, first);
        String hash = aliceBox.sendMessage(createMessage("Star", bob.getEmail()), CancellationSignal.none()).get().getHash();
        DecMessage received = bobBox.receiveNewMessages(CancellationSignal.none()).get().get(0);
        assertFalse(received.isFlagged());

        List<DecMessage> flagged = bobBox.markAsFlagged(Folder.INBOX, ImmutableList.of(hash), CancellationSignal.none()).get();
        assertTrue(flagged.get(0).isFlagged());
        DecMessage stored = bobBox.getMessage(Folder.INBOX, hash, CancellationSignal.none()).get();
        assertTrue(stored.isFlagged());
        assertTrue(stored.getMessage().isFlagged());
        assertFalse(stored.isMarkedAsRead());

        bobBox.markAsRead(Folder.INBOX, ImmutableList.of(hash), CancellationSignal.none()).get();
        assertTrue(bobBox.getMessage(Folder.INBOX, hash, CancellationSignal.none()).get().isFlagged());

        bobBox.markAsUnflagged(Folder.INBOX, ImmutableList.of(hash), CancellationSignal.none()).get();
        stored = bobBox.getMessage(Folder.INBOX, hash, CancellationSignal.none()).get();
        assertFalse(stored.isFlagged());
        assertTrue(stored.isMarkedAsRead());

        assertTrue(failureOf(bobBox.markAsFlagged(Folder.SENT, ImmutableList.of(hash), CancellationSignal.none()))
                instanceof IllegalArgumentException);
    }

    private static String key(Account account) {
        return account.getEmail().getDecentralizedAddress();
    }
}
