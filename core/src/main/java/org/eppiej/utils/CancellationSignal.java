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

package org.eppiej.utils;

import com.google.common.annotations.VisibleForTesting;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Cooperative cancellation flag that is passed through every asynchronous call. Once cancelled it stays cancelled.
 * Operations check it before touching a backend and fail with {@link CancellationException}.
 */
public final class CancellationSignal {
    private volatile boolean cancelled;
    private final CopyOnWriteArrayList<Runnable> listeners = new CopyOnWriteArrayList<>();

    /** Returns a signal that is never cancelled. Every call creates a fresh instance. */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        if (cancelled)
            return;
        cancelled = true;
        for (Runnable listener : listeners)
            listener.run();
    }

    /** Runs the listener once the signal is cancelled, immediately if it already is. */
    public void addListener(Runnable listener) {
        checkNotNull(listener);
        listeners.add(listener);
        if (cancelled && listeners.remove(listener))
            listener.run();
    }

    /** Forgets a listener that is no longer interested, for example because its operation completed. */
    public void removeListener(Runnable listener) {
        listeners.remove(checkNotNull(listener));
    }

    @VisibleForTesting
    public int getListenerCount() {
        return listeners.size();
    }

    public void throwIfCancelled() throws CancellationException {
        if (cancelled)
            throw new CancellationException("Operation was cancelled");
    }
}
