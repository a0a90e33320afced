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

package org.eppiej.examples;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.bitcoinj.utils.BriefLogFormatter;
import org.eppiej.core.Account;
import org.eppiej.core.DecMessage;
import org.eppiej.core.EmailAddress;
import org.eppiej.core.Folder;
import org.eppiej.core.Message;
import org.eppiej.core.NetworkType;
import org.eppiej.crypto.DerivationPath;
import org.eppiej.crypto.MasterKey;
import org.eppiej.keys.NoOpNameResolver;
import org.eppiej.keys.NoOpPublicKeyFetcher;
import org.eppiej.keys.PublicKeyService;
import org.eppiej.mailbox.DecMailBox;
import org.eppiej.mailbox.DecMessageProtector;
import org.eppiej.mailbox.EccDecProtector;
import org.eppiej.mailbox.MemoryDecStorage;
import org.eppiej.mailbox.MemoryDecStorageClient;
import org.eppiej.utils.CancellationSignal;

import java.util.List;

/**
 * Restores two master keys from mnemonics, derives an Eppie address for each and sends a message from the first to
 * the second through two in-memory backends.
 *
 * Usage: SendBetweenMailboxes "&lt;sender mnemonic&gt;" "&lt;recipient mnemonic&gt;"
 */
public class SendBetweenMailboxes {

    public static void main(String[] args) throws Exception {
        BriefLogFormatter.init();
        if (args.length < 2) {
            System.out.println("Usage: SendBetweenMailboxes \"<sender mnemonic>\" \"<recipient mnemonic>\"");
            return;
        }

        PublicKeyService publicKeyService = PublicKeyService.createDefault(new NoOpNameResolver(),
                new NoOpPublicKeyFetcher(), new NoOpPublicKeyFetcher());
        List<MemoryDecStorageClient> backends = ImmutableList.of(new MemoryDecStorageClient(), new MemoryDecStorageClient());

        DecMailBox alice = createMailBox(args[0], publicKeyService, backends);
        DecMailBox bob = createMailBox(args[1], publicKeyService, backends);
        System.out.println("Sender:    " + alice.getAccount().getEmail().getAddress());
        System.out.println("Recipient: " + bob.getAccount().getEmail().getAddress());

        Message message = new Message();
        message.addTo(bob.getAccount().getEmail());
        message.setSubject("Hello");
        message.setTextBody("Hello from eppiej");
        alice.sendMessage(message, CancellationSignal.none()).get();

        for (DecMessage received : bob.getMessages(Folder.INBOX, 0, CancellationSignal.none()).get())
            System.out.println(received.getHash() + "  " + received.getMessage().getSubject() + "  "
                    + received.getMessage().getSignatureStatus());
    }

    private static DecMailBox createMailBox(String mnemonic, PublicKeyService publicKeyService,
                                            List<MemoryDecStorageClient> backends) {
        MasterKey masterKey = MasterKey.fromMnemonic(Splitter.on(' ').omitEmptyStrings().splitToList(mnemonic), "");
        MemoryDecStorage storage = new MemoryDecStorage(masterKey);
        String address = publicKeyService.deriveEncoded(masterKey, DerivationPath.forNetwork(NetworkType.EPPIE, 0));
        Account account = new Account(EmailAddress.createDecentralizedAddress(NetworkType.EPPIE, address), 0);
        DecMessageProtector protector = new DecMessageProtector(storage, publicKeyService,
                new EccDecProtector(storage, publicKeyService));
        return new DecMailBox(account, storage, backends, protector, publicKeyService);
    }
}
