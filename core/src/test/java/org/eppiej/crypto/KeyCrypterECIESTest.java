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

import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Utils;
import org.bitcoinj.crypto.KeyCrypterException;
import org.bouncycastle.crypto.params.KeyParameter;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;

public class KeyCrypterECIESTest {

    ECKey aliceKey;
    ECKey bobKey;

    static String secret = "my little secret is a pony that never sleeps";

    private final KeyCrypterECIES crypter = new KeyCrypterECIES();

    @Before
    public void setup() {
        aliceKey = ECKey.fromPrivate(Utils.HEX.decode("7337920e97ebfe34ee82137a26ef7bd296a3132f3c6494235e1f17820770aa01"));
        bobKey = ECKey.fromPrivate(Utils.HEX.decode("0086b1dd5edf5e19e17e086dbf296d8d697438fb11ef0dd044e186e634d3c99ff7"));
    }

    @Test
    public void keyAgreementIsSymmetric() {
        KeyParameter aliceSide = crypter.deriveKey(aliceKey, ECKey.fromPublicOnly(bobKey.getPubKey()));
        KeyParameter bobSide = crypter.deriveKey(bobKey, ECKey.fromPublicOnly(aliceKey.getPubKey()));
        assertEquals(KeyCrypterECIES.KEY_LENGTH, aliceSide.getKey().length);
        assertArrayEquals(aliceSide.getKey(), bobSide.getKey());
    }

    @Test
    public void testEncryptionAndDecryption() {
        byte[] encrypted = crypter.encrypt(secret.getBytes(StandardCharsets.UTF_8), ECKey.fromPublicOnly(bobKey.getPubKey()));
        assertEquals(KeyCrypterECIES.VERSION, encrypted[0]);
        assertEquals(KeyCrypterECIES.HEADER_LENGTH + secret.length() + 16, encrypted.length);
        assertEquals(secret, new String(crypter.decrypt(encrypted, bobKey), StandardCharsets.UTF_8));
    }

    @Test
    public void encryptionIsRandomized() {
        ECKey recipient = ECKey.fromPublicOnly(bobKey.getPubKey());
        byte[] first = crypter.encrypt(secret.getBytes(StandardCharsets.UTF_8), recipient);
        byte[] second = crypter.encrypt(secret.getBytes(StandardCharsets.UTF_8), recipient);
        assertFalse(java.util.Arrays.equals(first, second));
    }

    @Test
    public void emptyPlaintext() {
        byte[] encrypted = crypter.encrypt(new byte[0], bobKey);
        assertArrayEquals(new byte[0], crypter.decrypt(encrypted, bobKey));
    }

    @Test
    public void wrongKeyFailsAuthentication() {
        byte[] encrypted = crypter.encrypt(secret.getBytes(StandardCharsets.UTF_8), bobKey);
        assertThrows(KeyCrypterException.InvalidCipherText.class, () -> crypter.decrypt(encrypted, aliceKey));
    }

    @Test
    public void tamperedDataFailsAuthentication() {
        byte[] encrypted = crypter.encrypt(secret.getBytes(StandardCharsets.UTF_8), bobKey);
        encrypted[encrypted.length - 1] ^= 0x01;
        assertThrows(KeyCrypterException.InvalidCipherText.class, () -> crypter.decrypt(encrypted, bobKey));
    }

    @Test
    public void malformedDataIsRejected() {
        assertThrows(KeyCrypterException.class, () -> crypter.decrypt(new byte[10], bobKey));
        byte[] encrypted = crypter.encrypt(secret.getBytes(StandardCharsets.UTF_8), bobKey);
        encrypted[0] = 0x02;
        assertThrows(KeyCrypterException.class, () -> crypter.decrypt(encrypted, bobKey));
    }
}
