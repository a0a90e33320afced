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

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.eppiej.utils.CancellationSignal;

import javax.annotation.concurrent.GuardedBy;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Backend that keeps blobs and route entries in memory. Useful for tests and for running several mailboxes against
 * one shared backend inside a single process.
 */
public class MemoryDecStorageClient implements DecStorageClient {
    private final Object lock = new Object();
    @GuardedBy("lock") private final Map<String, byte[]> blobs = new HashMap<>();
    @GuardedBy("lock") private final Map<String, Set<String>> routes = new HashMap<>();

    @Override
    public ListenableFuture<String> put(byte[] data, CancellationSignal signal) {
        checkNotNull(data, "data");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        String hash = DecMailBox.contentHash(data);
        synchronized (lock) {
            blobs.putIfAbsent(hash, Arrays.copyOf(data, data.length));
        }
        return Futures.immediateFuture(hash);
    }

    @Override
    public ListenableFuture<Void> send(String routingId, String hash, CancellationSignal signal) {
        checkNotNull(routingId, "routingId");
        checkNotNull(hash, "hash");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        synchronized (lock) {
            routes.computeIfAbsent(routingId, id -> new LinkedHashSet<>()).add(hash);
        }
        return Futures.immediateFuture(null);
    }

    @Override
    public ListenableFuture<List<String>> list(String routingId, CancellationSignal signal) {
        checkNotNull(routingId, "routingId");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        synchronized (lock) {
            Set<String> hashes = routes.get(routingId);
            List<String> result = hashes == null ? ImmutableList.<String>of() : ImmutableList.copyOf(hashes);
            return Futures.immediateFuture(result);
        }
    }

    @Override
    public ListenableFuture<byte[]> get(String hash, CancellationSignal signal) {
        checkNotNull(hash, "hash");
        if (signal.isCancelled())
            return Futures.immediateCancelledFuture();
        synchronized (lock) {
            byte[] data = blobs.get(hash);
            if (data == null)
                return Futures.immediateFailedFuture(new NoSuchElementException("Unknown blob " + hash));
            return Futures.immediateFuture(Arrays.copyOf(data, data.length));
        }
    }
}
