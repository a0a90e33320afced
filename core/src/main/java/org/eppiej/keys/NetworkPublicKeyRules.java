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

import javax.annotation.Nullable;

/**
 * Validation of the addresses of one network. The syntactic check is cheap and never runs cryptographic code;
 * the semantic check may decode keys or verify checksums and must only be run on syntactically valid input.
 */
public interface NetworkPublicKeyRules {
    NetworkType getNetwork();

    boolean isSyntacticallyValid(@Nullable String value);

    /** Expensive validation. Callers are expected to have checked the syntax first. */
    boolean trySemanticValidate(String value);

    /** Syntax first; the semantic check only runs when the syntax is valid. */
    default boolean tryValidate(@Nullable String value) {
        return isSyntacticallyValid(value) && trySemanticValidate(value);
    }
}
