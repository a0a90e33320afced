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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import org.eppiej.utils.CancellationSignal;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Backend for tests: forwards to a {@link MemoryDecStorageClient}, counts the calls and can be told to fail, hang or
 * report hashes in upper case.
 */
class FakeDecStorageClient implements DecStorageClient {
    enum Mode { OK, FAIL, HANG }

    private final MemoryDecStorageClient backend;

    volatile Mode putMode = Mode.OK;
    volatile Mode sendMode = Mode.OK;
    volatile Mode listMode = Mode.OK;
    volatile Mode getMode = Mode.OK;
    volatile boolean upperCaseListing;

    final AtomicInteger puts = new AtomicInteger();
    final AtomicInteger sends = new AtomicInteger();
    final AtomicInteger lists = new AtomicInteger();
    final AtomicInteger gets = new AtomicInteger();

    FakeDecStorageClient() {
        this(new MemoryDecStorageClient());
    }

    FakeDecStorageClient(MemoryDecStorageClient backend) {
        this.backend = backend;
    }

    MemoryDecStorageClient getBackend() {
        return backend;
    }

    void failAll() {
        putMode = sendMode = listMode = getMode = Mode.FAIL;
    }

    int totalCalls() {
        return puts.get() + sends.get() + lists.get() + gets.get();
    }

    @Override
    public ListenableFuture<String> put(byte[] data, CancellationSignal signal) {
        puts.incrementAndGet();
        return apply(putMode, () -> backend.put(data, signal));
    }

    @Override
    public ListenableFuture<Void> send(String routingId, String hash, CancellationSignal signal) {
        sends.incrementAndGet();
        return apply(sendMode, () -> backend.send(routingId, hash, signal));
    }

    @Override
    public ListenableFuture<List<String>> list(String routingId, CancellationSignal signal) {
        lists.incrementAndGet();
        ListenableFuture<List<String>> listing = apply(listMode, () -> backend.list(routingId, signal));
        if (!upperCaseListing)
            return listing;
        return Futures.transform(listing, hashes -> {
            List<String> upper = new ArrayList<>();
            for (String hash : hashes)
                upper.add(hash.toUpperCase(Locale.ROOT));
            return upper;
        }, MoreExecutors.directExecutor());
    }

    @Override
    public ListenableFuture<byte[]> get(String hash, CancellationSignal signal) {
        gets.incrementAndGet();
        return apply(getMode, () -> backend.get(hash, signal));
    }

    private interface Call<T> {
        ListenableFuture<T> run();
    }

    private static <T> ListenableFuture<T> apply(Mode mode, Call<T> call) {
        switch (mode) {
            case FAIL:
                return Futures.immediateFailedFuture(new IOException("backend unavailable"));
            case HANG:
                return SettableFuture.create();
            default:
                return call.run();
        }
    }
}
