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

import org.bitcoinj.core.Sha256Hash;
import org.bouncycastle.crypto.BasicAgreement;
import org.bouncycastle.crypto.CipherParameters;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;

/**
 * ECDH agreement in the style of libsecp256k1's {@code secp256k1_ecdh}: the shared value is
 * {@code SHA256(version || x)} of the shared point, where version is 0x02 or 0x03 depending on the parity of y.
 * The result is always non-negative and fits in 32 bytes.
 */
public class Secp256k1ECDHAgreement implements BasicAgreement {
    private ECPrivateKeyParameters key;

    @Override
    public void init(CipherParameters key) {
        this.key = (ECPrivateKeyParameters) key;
    }

    @Override
    public int getFieldSize() {
        return (key.getParameters().getCurve().getFieldSize() + 7) / 8;
    }

    @Override
    public BigInteger calculateAgreement(CipherParameters pubKey) {
        ECPublicKeyParameters pub = (ECPublicKeyParameters) pubKey;
        ECDomainParameters params = key.getParameters();
        if (!params.equals(pub.getParameters()))
            throw new IllegalStateException("ECDH public key has wrong domain parameters");

        // secp256k1 has cofactor 1, so no cofactor multiplication is needed
        ECPoint q = ECAlgorithms.cleanPoint(params.getCurve(), pub.getQ());
        if (q.isInfinity())
            throw new IllegalStateException("Infinity is not a valid public key for ECDH");

        ECPoint p = q.multiply(key.getD()).normalize();
        if (p.isInfinity())
            throw new IllegalStateException("Infinity is not a valid agreement value for ECDH");

        byte[] x32 = p.getAffineXCoord().getEncoded();
        byte[] y32 = p.getAffineYCoord().getEncoded();
        byte[] x32withVersion = new byte[x32.length + 1];
        x32withVersion[0] = (byte) ((y32[y32.length - 1] & 0x01) | 0x02);
        System.arraycopy(x32, 0, x32withVersion, 1, x32.length);
        return new BigInteger(1, Sha256Hash.hash(x32withVersion));
    }
}
