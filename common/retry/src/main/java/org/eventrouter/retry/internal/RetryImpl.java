/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventrouter.retry.internal;

import org.eventrouter.retry.Backoff;
import org.eventrouter.retry.MaxAttempts;
import org.eventrouter.retry.RetryStrategy.Retry;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Retry}. Never create this class directly, use {@code RetryStrategy.retry()}.
 */
public class RetryImpl implements Retry {
    private static final BiConsumer<Integer, Throwable> NOOP_ERROR_LISTENER = (__, ___) -> {
    };

    final Backoff backoff;
    final MaxAttempts maxAttempts;
    final Predicate<Throwable> retryPredicate;
    final BiConsumer<Integer, Throwable> errorListener;

    public RetryImpl() {
        this(Backoff.none(), MaxAttempts.infinite(), __ -> true, NOOP_ERROR_LISTENER);
    }

    private RetryImpl(Backoff backoff, MaxAttempts maxAttempts, Predicate<Throwable> retryPredicate, BiConsumer<Integer, Throwable> errorListener) {
        requireNonNull(backoff, Backoff.class.getSimpleName() + " cannot be null");
        requireNonNull(maxAttempts, MaxAttempts.class.getSimpleName() + " cannot be null");
        requireNonNull(retryPredicate, "retryPredicate cannot be null");
        requireNonNull(errorListener, "errorListener cannot be null");
        this.backoff = backoff;
        this.maxAttempts = maxAttempts;
        this.retryPredicate = retryPredicate;
        this.errorListener = errorListener;
    }

    @Override
    public Retry backoff(Backoff backoff) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorListener);
    }

    @Override
    public Retry infiniteAttempts() {
        return new RetryImpl(backoff, MaxAttempts.infinite(), retryPredicate, errorListener);
    }

    @Override
    public Retry maxAttempts(int maxAttempts) {
        return new RetryImpl(backoff, MaxAttempts.limit(maxAttempts), retryPredicate, errorListener);
    }

    @Override
    public Retry retryIf(Predicate<Throwable> retryPredicate) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorListener);
    }

    @Override
    public Retry onError(BiConsumer<Integer, Throwable> errorListener) {
        return new RetryImpl(backoff, maxAttempts, retryPredicate, errorListener);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryImpl)) return false;
        RetryImpl retry = (RetryImpl) o;
        return Objects.equals(backoff, retry.backoff) && Objects.equals(maxAttempts, retry.maxAttempts)
                && Objects.equals(retryPredicate, retry.retryPredicate) && Objects.equals(errorListener, retry.errorListener);
    }

    @Override
    public int hashCode() {
        return Objects.hash(backoff, maxAttempts, retryPredicate, errorListener);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryImpl.class.getSimpleName() + "[", "]")
                .add("backoff=" + backoff)
                .add("maxAttempts=" + maxAttempts)
                .toString();
    }
}
