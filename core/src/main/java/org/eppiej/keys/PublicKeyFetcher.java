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

import com.google.common.util.concurrent.ListenableFuture;
import org.eppiej.utils.CancellationSignal;

/**
 * Fetches the public key published for an address of a foreign network, for example from the transactions of a
 * Bitcoin address. The future completes with null when the network knows no key for the address.
 */
public interface PublicKeyFetcher {
    ListenableFuture<String> fetch(String address, CancellationSignal signal);
}
