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

package org.eppiej.core;

/** Outcome of checking the optional sender signature on a received message. */
public enum SignatureStatus {
    /** Signed by the key the sender address resolves to. */
    VERIFIED,
    /** Signed, but the signature or the signer could not be confirmed. */
    UNVERIFIED,
    /** The message carried no signature. */
    ABSENT
}
