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

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import org.eppiej.utils.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One operation issued to every backend at once. The broadcast succeeds with the results of the backends that
 * answered, as long as at least one did; when all of them fail it fails with a {@link TransportException} that wraps
 * the failure seen last.
 */
class BackendBroadcast<T> {
    private static final Logger log = LoggerFactory.getLogger(BackendBroadcast.class);

    private final SettableFuture<List<T>> future = SettableFuture.create();
    private final String operation;
    private final List<DecStorageClient> clients;
    private final Function<DecStorageClient, ListenableFuture<T>> call;
    private final CancellationSignal signal;
    private final DecMailBoxOptions options;

    @GuardedBy("this") private final List<T> results = new ArrayList<>();
    @GuardedBy("this") private int remaining;
    @GuardedBy("this") @Nullable private Throwable lastFailure;

    BackendBroadcast(String operation, List<DecStorageClient> clients, Function<DecStorageClient, ListenableFuture<T>> call,
                     CancellationSignal signal, DecMailBoxOptions options) {
        checkArgument(!clients.isEmpty(), "No backends to broadcast to");
        this.operation = checkNotNull(operation);
        this.clients = clients;
        this.call = checkNotNull(call);
        this.signal = checkNotNull(signal);
        this.options = checkNotNull(options);
    }

    ListenableFuture<List<T>> broadcast() {
        if (signal.isCancelled()) {
            future.cancel(false);
            return future;
        }
        Runnable cancelOnSignal = () -> future.cancel(false);
        signal.addListener(cancelOnSignal);
        future.addListener(() -> signal.removeListener(cancelOnSignal), MoreExecutors.directExecutor());
        synchronized (this) {
            remaining = clients.size();
        }
        log.debug("Broadcasting {} to {} backends", operation, clients.size());
        for (int i = 0; i < clients.size(); i++) {
            final int backend = i;
            Futures.addCallback(invoke(clients.get(i)), new FutureCallback<T>() {
                @Override
                public void onSuccess(@Nullable T result) {
                    completed(backend, result, null);
                }

                @Override
                public void onFailure(Throwable t) {
                    completed(backend, null, t);
                }
            }, MoreExecutors.directExecutor());
        }
        return future;
    }

    private ListenableFuture<T> invoke(DecStorageClient client) {
        ListenableFuture<T> result;
        try {
            result = call.apply(client);
        } catch (RuntimeException e) {
            result = Futures.immediateFailedFuture(e);
        }
        if (options.getCallTimeout() != null)
            result = Futures.withTimeout(result, options.getCallTimeout(), options.getTimeoutExecutor());
        return result;
    }

    private void completed(int backend, @Nullable T result, @Nullable Throwable failure) {
        List<T> successes;
        Throwable last;
        synchronized (this) {
            if (failure == null) {
                results.add(result);
            } else {
                log.warn("{} failed on backend #{}: {}", operation, backend, failure.toString());
                lastFailure = failure;
            }
            if (--remaining > 0)
                return;
            successes = new ArrayList<>(results);
            last = lastFailure;
        }
        if (signal.isCancelled() || (successes.isEmpty() && last instanceof CancellationException)) {
            future.cancel(false);
        } else if (successes.isEmpty()) {
            future.setException(new TransportException("All " + clients.size() + " backends failed to " + operation, last));
        } else {
            log.debug("{} succeeded on {} of {} backends", operation, successes.size(), clients.size());
            future.set(Collections.unmodifiableList(successes));
        }
    }
}
