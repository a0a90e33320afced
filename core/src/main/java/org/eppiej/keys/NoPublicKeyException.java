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

import org.eppiej.core.DecException;
import org.eppiej.core.EmailAddress;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * No usable public key could be found for an address. This is an expected outcome (for example an unregistered
 * name), not a programming error.
 */
public class NoPublicKeyException extends DecException {
    private final EmailAddress email;
    private final KeyResolution.Status status;

    public NoPublicKeyException(EmailAddress email, KeyResolution.Status status, String message) {
        super(message);
        checkArgument(status != KeyResolution.Status.FOUND, "A found key is not an error");
        this.email = checkNotNull(email);
        this.status = checkNotNull(status);
    }

    public EmailAddress getEmail() {
        return email;
    }

    /** {@link KeyResolution.Status#ABSENT} or {@link KeyResolution.Status#MALFORMED}. */
    public KeyResolution.Status getStatus() {
        return status;
    }
}
