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

import com.google.common.base.Stopwatch;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Utils;
import org.bitcoinj.crypto.KeyCrypterException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Encrypts byte arrays to a secp256k1 public key. A fresh ephemeral key is agreed with the recipient key through
 * {@link Secp256k1ECDHAgreement}, and the resulting 256 bit secret keys AES-GCM.</p>
 *
 * <p>Output layout: {@code version(1) || ephemeral public key(33) || nonce(12) || ciphertext || tag(16)}. The
 * ephemeral key is authenticated as associated data.</p>
 */
public class KeyCrypterECIES {
    private static final Logger log = LoggerFactory.getLogger(KeyCrypterECIES.class);

    public static final byte VERSION = 0x01;

    /** Key length in bytes. */
    public static final int KEY_LENGTH = 32; // = 256 bits.

    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH_BITS = 128;
    public static final int HEADER_LENGTH = 1 + PublicKeyCodec.COMPRESSED_KEY_LENGTH + NONCE_LENGTH;

    private final SecureRandom secureRandom;

    public KeyCrypterECIES() {
        this.secureRandom = new SecureRandom();
    }

    /**
     * Agrees a symmetric key between {@code privateKey} and {@code publicKey}. Both sides of a conversation get the
     * same key.
     */
    public KeyParameter deriveKey(ECKey privateKey, ECKey publicKey) throws KeyCrypterException {
        checkNotNull(privateKey);
        checkNotNull(publicKey);
        checkArgument(privateKey.hasPrivKey(), "Key agreement needs a private key");
        try {
            final Stopwatch watch = Stopwatch.createStarted();
            Secp256k1ECDHAgreement agreement = new Secp256k1ECDHAgreement();
            agreement.init(new ECPrivateKeyParameters(privateKey.getPrivKey(), ECKey.CURVE));
            BigInteger secret = agreement.calculateAgreement(new ECPublicKeyParameters(publicKey.getPubKeyPoint(), ECKey.CURVE));
            watch.stop();
            log.debug("ECDH key agreement took {}", watch);
            return new KeyParameter(Utils.bigIntegerToBytes(secret, KEY_LENGTH));
        } catch (RuntimeException e) {
            throw new KeyCrypterException("Could not agree a key with the peer public key.", e);
        }
    }

    public byte[] encrypt(byte[] plainBytes, ECKey recipientKey) throws KeyCrypterException {
        checkNotNull(plainBytes);
        checkNotNull(recipientKey);

        ECKey ephemeralKey = new ECKey(secureRandom);
        byte[] ephemeralPublic = ephemeralKey.getPubKey();
        KeyParameter aesKey = deriveKey(ephemeralKey, recipientKey);
        byte[] nonce = new byte[NONCE_LENGTH];
        secureRandom.nextBytes(nonce);
        try {
            GCMBlockCipher cipher = new GCMBlockCipher(new AESEngine());
            cipher.init(true, new AEADParameters(aesKey, TAG_LENGTH_BITS, nonce, ephemeralPublic));
            byte[] out = new byte[HEADER_LENGTH + cipher.getOutputSize(plainBytes.length)];
            out[0] = VERSION;
            System.arraycopy(ephemeralPublic, 0, out, 1, ephemeralPublic.length);
            System.arraycopy(nonce, 0, out, 1 + ephemeralPublic.length, NONCE_LENGTH);
            int length = cipher.processBytes(plainBytes, 0, plainBytes.length, out, HEADER_LENGTH);
            length += cipher.doFinal(out, HEADER_LENGTH + length);
            return Arrays.copyOf(out, HEADER_LENGTH + length);
        } catch (InvalidCipherTextException | RuntimeException e) {
            throw new KeyCrypterException("Could not encrypt bytes.", e);
        }
    }

    /**
     * Decrypt bytes previously encrypted with this class.
     *
     * @throws KeyCrypterException.InvalidCipherText if the data was not encrypted to this key or was modified
     * @throws KeyCrypterException if the data is not in the expected layout
     */
    public byte[] decrypt(byte[] encryptedBytes, ECKey recipientKey) throws KeyCrypterException {
        checkNotNull(encryptedBytes);
        checkNotNull(recipientKey);
        if (encryptedBytes.length < HEADER_LENGTH + TAG_LENGTH_BITS / 8)
            throw new KeyCrypterException("Encrypted data is too short: " + encryptedBytes.length + " bytes");
        if (encryptedBytes[0] != VERSION)
            throw new KeyCrypterException("Unknown encryption version " + encryptedBytes[0]);

        byte[] ephemeralPublic = Arrays.copyOfRange(encryptedBytes, 1, 1 + PublicKeyCodec.COMPRESSED_KEY_LENGTH);
        byte[] nonce = Arrays.copyOfRange(encryptedBytes, 1 + PublicKeyCodec.COMPRESSED_KEY_LENGTH, HEADER_LENGTH);
        ECKey ephemeralKey;
        try {
            ephemeralKey = ECKey.fromPublicOnly(ephemeralPublic);
        } catch (IllegalArgumentException e) {
            throw new KeyCrypterException("Invalid ephemeral key", e);
        }
        KeyParameter aesKey = deriveKey(recipientKey, ephemeralKey);
        try {
            GCMBlockCipher cipher = new GCMBlockCipher(new AESEngine());
            cipher.init(false, new AEADParameters(aesKey, TAG_LENGTH_BITS, nonce, ephemeralPublic));
            int cipherLength = encryptedBytes.length - HEADER_LENGTH;
            byte[] decryptedBytes = new byte[cipher.getOutputSize(cipherLength)];
            int length = cipher.processBytes(encryptedBytes, HEADER_LENGTH, cipherLength, decryptedBytes, 0);
            length += cipher.doFinal(decryptedBytes, length);
            return Arrays.copyOf(decryptedBytes, length);
        } catch (InvalidCipherTextException e) {
            throw new KeyCrypterException.InvalidCipherText("Could not decrypt bytes", e);
        } catch (RuntimeException e) {
            throw new KeyCrypterException("Could not decrypt bytes", e);
        }
    }
}
