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
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Utils;
import org.bitcoinj.crypto.ChildNumber;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.HDDerivationException;
import org.bitcoinj.crypto.HDKeyDerivation;
import org.bitcoinj.crypto.HDUtils;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>Deterministic derivation of secp256k1 keys from a {@link MasterKey}.</p>
 *
 * <p>Index paths follow BIP32. Tag paths mix the SHA-256 of the tag into a hardened style step below the root:
 * {@code I = HMAC-SHA512(chainCode, 0x00 || k || SHA256(tag))}, child key {@code (I_L + k) mod n}. Hashing the tag
 * lets any string act as a 256 bit child index.</p>
 */
public final class KeyDerivation {
    private KeyDerivation() { }

    /** Derives the private key at {@code path}. */
    public static ECKey deriveKey(MasterKey masterKey, DerivationPath path) {
        checkNotNull(masterKey, "masterKey");
        checkNotNull(path, "path");
        DeterministicKey root = masterKey.getRootKey();
        if (path.isTagged())
            return deriveTaggedKey(root, path.getTag());
        DeterministicKey key = root;
        for (ChildNumber child : path.toChildNumbers())
            key = HDKeyDerivation.deriveChildKey(key, child);
        return ECKey.fromPrivate(key.getPrivKey());
    }

    /** Derives the key at {@code path} and drops the private part. */
    public static ECKey derivePublicKey(MasterKey masterKey, DerivationPath path) {
        return ECKey.fromPublicOnly(deriveKey(masterKey, path).getPubKey());
    }

    public static ECKey deriveKey(MasterKey masterKey, String tag) {
        return deriveKey(masterKey, DerivationPath.ofTag(tag));
    }

    static ECKey deriveTaggedKey(DeterministicKey parent, String tag) {
        checkState(parent.hasPrivKey(), "Tagged derivation needs a private parent key");
        byte[] parentPrivate = Utils.bigIntegerToBytes(parent.getPrivKey(), 32);
        ByteBuffer data = ByteBuffer.allocate(1 + 32 + 32);
        data.put((byte) 0);
        data.put(parentPrivate);
        data.put(Sha256Hash.hash(tag.getBytes(StandardCharsets.UTF_8)));
        byte[] i = HDUtils.hmacSha512(parent.getChainCode(), data.array());
        checkState(i.length == 64, i.length);
        byte[] il = Arrays.copyOfRange(i, 0, 32);
        Arrays.fill(i, (byte) 0);
        Arrays.fill(parentPrivate, (byte) 0);
        Arrays.fill(data.array(), (byte) 0);

        BigInteger ilInt = new BigInteger(1, il);
        Arrays.fill(il, (byte) 0);
        BigInteger n = ECKey.CURVE.getN();
        if (ilInt.compareTo(n) >= 0)
            throw new HDDerivationException("Illegal derived key: I_L >= n");
        BigInteger k = ilInt.add(parent.getPrivKey()).mod(n);
        if (k.signum() == 0)
            throw new HDDerivationException("Illegal derived key: derived private key equals 0.");
        return ECKey.fromPrivate(k);
    }
}
