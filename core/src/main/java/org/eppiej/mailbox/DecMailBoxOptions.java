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

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Settings of a {@link DecMailBox}. The defaults put no limit on backend calls or on the number of messages fetched
 * per receive.
 */
public final class DecMailBoxOptions {
    public static final int UNLIMITED = Integer.MAX_VALUE;

    @Nullable private final Duration callTimeout;
    @Nullable private final ScheduledExecutorService timeoutExecutor;
    private final int maxFetchPerReceive;

    private DecMailBoxOptions(Builder builder) {
        this.callTimeout = builder.callTimeout;
        this.timeoutExecutor = builder.timeoutExecutor;
        this.maxFetchPerReceive = builder.maxFetchPerReceive;
    }

    public static DecMailBoxOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Time after which a single backend call counts as failed, or null for no limit. */
    @Nullable
    public Duration getCallTimeout() {
        return callTimeout;
    }

    @Nullable
    ScheduledExecutorService getTimeoutExecutor() {
        return timeoutExecutor;
    }

    /** Maximum number of new messages downloaded by one receive. The rest are picked up by the next one. */
    public int getMaxFetchPerReceive() {
        return maxFetchPerReceive;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("callTimeout", callTimeout)
                .add("maxFetchPerReceive", maxFetchPerReceive == UNLIMITED ? "unlimited" : maxFetchPerReceive)
                .toString();
    }

    public static final class Builder {
        @Nullable private Duration callTimeout;
        @Nullable private ScheduledExecutorService timeoutExecutor;
        private int maxFetchPerReceive = UNLIMITED;

        private Builder() { }

        /** Fails backend calls that take longer than {@code timeout}; {@code executor} schedules the timeouts. */
        public Builder callTimeout(Duration timeout, ScheduledExecutorService executor) {
            checkNotNull(timeout, "timeout");
            checkArgument(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive: %s", timeout);
            this.callTimeout = timeout;
            this.timeoutExecutor = checkNotNull(executor, "executor");
            return this;
        }

        public Builder maxFetchPerReceive(int maxFetchPerReceive) {
            checkArgument(maxFetchPerReceive > 0, "maxFetchPerReceive must be positive: %s", maxFetchPerReceive);
            this.maxFetchPerReceive = maxFetchPerReceive;
            return this;
        }

        public DecMailBoxOptions build() {
            return new DecMailBoxOptions(this);
        }
    }
}
