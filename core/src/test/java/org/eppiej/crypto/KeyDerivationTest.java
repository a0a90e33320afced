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

package org.eppiej.crypto;

import com.google.common.base.Splitter;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Utils;
import org.bitcoinj.crypto.ChildNumber;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.HDKeyDerivation;
import org.bitcoinj.params.MainNetParams;
import org.eppiej.core.NetworkType;
import org.junit.Before;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class KeyDerivationTest {
    private static final String MNEMONIC = "abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon abandon about";

    private MasterKey masterKey;

    @Before
    public void setup() {
        masterKey = MasterKey.fromSeed(Utils.HEX.decode("000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f"));
    }

    @Test
    public void mnemonicRestoresBip32Root() {
        List<String> words = Splitter.on(' ').splitToList(MNEMONIC);
        MasterKey restored = MasterKey.fromMnemonic(words, "TREZOR");
        assertEquals("xprv9s21ZrQH143K3h3fDYiay8mocZ3afhfULfb5GX8kCBdno77K4HiA15Tg23wpbeF1pLfs1c5SPmYHrEpTuuRhxMwvKDwqdKiGJS9XFKzUsAF",
                restored.getRootKey().serializePrivB58(MainNetParams.get()));
    }

    @Test
    public void invalidMnemonicIsRejected() {
        List<String> words = Splitter.on(' ').splitToList(MNEMONIC.replace("about", "abandon"));
        assertThrows(IllegalArgumentException.class, () -> MasterKey.fromMnemonic(words, ""));
    }

    @Test
    public void shortSeedIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> MasterKey.fromSeed(new byte[8]));
        assertThrows(NullPointerException.class, () -> MasterKey.fromSeed(null));
    }

    @Test
    public void indexPathFollowsBip32() {
        DerivationPath path = DerivationPath.forNetwork(NetworkType.EPPIE, 1);
        DeterministicKey expected = masterKey.getRootKey();
        for (ChildNumber child : path.toChildNumbers())
            expected = HDKeyDerivation.deriveChildKey(expected, child);
        assertEquals(expected.getPrivKey(), KeyDerivation.deriveKey(masterKey, path).getPrivKey());
    }

    @Test
    public void derivationIsDeterministic() {
        DerivationPath path = DerivationPath.of(3630, 0, 10, 0);
        assertArrayEquals(KeyDerivation.deriveKey(masterKey, path).getPrivKeyBytes(),
                KeyDerivation.deriveKey(masterKey, path).getPrivKeyBytes());
        assertArrayEquals(KeyDerivation.deriveKey(masterKey, "bob@example.com").getPubKey(),
                KeyDerivation.deriveKey(masterKey, "bob@example.com").getPubKey());
    }

    @Test
    public void distinctPathsGiveDistinctKeys() {
        Set<String> keys = new HashSet<>();
        for (int account = 0; account < 5; account++)
            assertTrue(keys.add(KeyDerivation.derivePublicKey(masterKey, DerivationPath.of(3630, account, 10, 0)).getPublicKeyAsHex()));
        assertTrue(keys.add(KeyDerivation.derivePublicKey(masterKey, DerivationPath.of(3630, 0, 10, 1)).getPublicKeyAsHex()));
        assertTrue(keys.add(KeyDerivation.derivePublicKey(masterKey, DerivationPath.of(0, 0, 10, 0)).getPublicKeyAsHex()));
        for (String tag : new String[] {"a", "b", "bob@example.com", "Bob@example.com", "bob@example.com "})
            assertTrue(tag, keys.add(KeyDerivation.derivePublicKey(masterKey, DerivationPath.ofTag(tag)).getPublicKeyAsHex()));
    }

    @Test
    public void differentSeedsGiveDifferentKeys() {
        MasterKey other = MasterKey.fromSeed(Utils.HEX.decode("ff0102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f"));
        assertNotEquals(KeyDerivation.deriveKey(masterKey, "tag").getPublicKeyAsHex(),
                KeyDerivation.deriveKey(other, "tag").getPublicKeyAsHex());
    }

    @Test
    public void publicKeyMatchesPrivateKey() {
        DerivationPath path = DerivationPath.ofTag("alice@example.com");
        ECKey key = KeyDerivation.deriveKey(masterKey, path);
        ECKey publicOnly = KeyDerivation.derivePublicKey(masterKey, path);
        assertTrue(key.hasPrivKey());
        assertTrue(key.isCompressed());
        assertFalse(publicOnly.hasPrivKey());
        assertArrayEquals(key.getPubKey(), publicOnly.getPubKey());
    }

    @Test
    public void rejectsBadArguments() {
        assertThrows(NullPointerException.class, () -> KeyDerivation.deriveKey(null, DerivationPath.ofTag("x")));
        assertThrows(NullPointerException.class, () -> KeyDerivation.deriveKey(masterKey, (String) null));
        assertThrows(IllegalArgumentException.class, () -> KeyDerivation.deriveKey(masterKey, ""));
        assertThrows(IllegalArgumentException.class, () -> DerivationPath.of(3630, -1, 10, 0));
        assertThrows(IllegalArgumentException.class, () -> DerivationPath.forNetwork(NetworkType.UNSUPPORTED, 0));
    }

    @Test
    public void pathToString() {
        assertEquals("m/44'/3630'/2'/10/0", DerivationPath.forNetwork(NetworkType.EPPIE, 2).toString());
        assertEquals("tag:bob@example.com", DerivationPath.ofTag("bob@example.com").toString());
        assertEquals(DerivationPath.of(60, 0, 0, 0), DerivationPath.forNetwork(NetworkType.ETHEREUM, 0));
    }
}
