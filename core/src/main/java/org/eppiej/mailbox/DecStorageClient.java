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

package org.eppiej.mailbox;

import com.google.common.util.concurrent.ListenableFuture;
import org.eppiej.utils.CancellationSignal;

import java.util.List;

/**
 * Client of one content addressed storage backend. Blobs are identified by the lower case hex SHA-256 of their
 * bytes; route entries link a {@link RoutingId} to blob hashes. Any call may fail with a backend specific error.
 */
public interface DecStorageClient {
    /** Stores {@code data} and completes with its hash. */
    ListenableFuture<String> put(byte[] data, CancellationSignal signal);

    /** Publishes the route entry {@code (routingId, hash)}. */
    ListenableFuture<Void> send(String routingId, String hash, CancellationSignal signal);

    /** Hashes published for {@code routingId}. */
    ListenableFuture<List<String>> list(String routingId, CancellationSignal signal);

    ListenableFuture<byte[]> get(String hash, CancellationSignal signal);
}
