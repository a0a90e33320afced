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

import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.HDKeyDerivation;
import org.bitcoinj.crypto.MnemonicCode;
import org.bitcoinj.crypto.MnemonicException;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Root key material of an installation. It is only ever used to derive child keys through {@link KeyDerivation} and
 * has no serialized form; persisting it is the job of the storage that owns it.
 */
public final class MasterKey {
    /** Seeds shorter than this are rejected as too easy to brute force. */
    public static final int MIN_SEED_LENGTH = 16;

    private final DeterministicKey rootKey;

    private MasterKey(DeterministicKey rootKey) {
        this.rootKey = rootKey;
    }

    public static MasterKey fromSeed(byte[] seed) {
        checkNotNull(seed, "seed");
        checkArgument(seed.length >= MIN_SEED_LENGTH, "Seed is too short: %s bytes", seed.length);
        return new MasterKey(HDKeyDerivation.createMasterPrivateKey(seed));
    }

    /**
     * Restores the master key from a BIP39 mnemonic.
     *
     * @throws IllegalArgumentException if the words are not a valid mnemonic
     */
    public static MasterKey fromMnemonic(List<String> words, String passphrase) {
        checkNotNull(words, "words");
        checkNotNull(passphrase, "passphrase");
        MnemonicCode code = MnemonicCode.INSTANCE;
        if (code != null) {
            try {
                code.check(words);
            } catch (MnemonicException e) {
                throw new IllegalArgumentException("Invalid mnemonic: " + e.getClass().getSimpleName(), e);
            }
        }
        return fromSeed(MnemonicCode.toSeed(words, passphrase));
    }

    DeterministicKey getRootKey() {
        return rootKey;
    }

    /** Identifies the master key without revealing it. */
    public int getFingerprint() {
        return rootKey.getFingerprint();
    }

    @Override
    public String toString() {
        return "MasterKey{fingerprint=" + Integer.toHexString(getFingerprint()) + "}";
    }
}
