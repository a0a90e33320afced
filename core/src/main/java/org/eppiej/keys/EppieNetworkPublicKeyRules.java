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

package org.eppiej.keys;

import org.eppiej.core.NetworkType;
import org.eppiej.crypto.PublicKeyCodec;
import org.eppiej.crypto.PublicKeySyntax;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/** Eppie addresses are public key addresses; they are valid when they decode to a point on the curve. */
public class EppieNetworkPublicKeyRules implements NetworkPublicKeyRules {
    private final PublicKeyCodec codec;

    public EppieNetworkPublicKeyRules(PublicKeyCodec codec) {
        this.codec = checkNotNull(codec, "codec");
    }

    @Override
    public NetworkType getNetwork() {
        return NetworkType.EPPIE;
    }

    @Override
    public boolean isSyntacticallyValid(@Nullable String value) {
        return PublicKeySyntax.isValid(value);
    }

    @Override
    public boolean trySemanticValidate(String value) {
        try {
            codec.decode(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
