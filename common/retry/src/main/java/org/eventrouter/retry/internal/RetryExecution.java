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

import org.eventrouter.retry.RetryStrategy;
import org.eventrouter.retry.RetryStrategy.DontRetry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Internal class for executing functions with retry capability. Never use this class directly from your own code!
 */
public class RetryExecution {

    private RetryExecution() {
    }

    public static <T> Supplier<T> executeWithRetry(Supplier<T> supplier, RetryStrategy retryStrategy) {
        if (retryStrategy instanceof DontRetry) {
            return supplier;
        }
        RetryImpl retry = (RetryImpl) retryStrategy;
        return () -> {
            int attempt = 1;
            for (; ; ) {
                try {
                    return supplier.get();
                } catch (RuntimeException e) {
                    retry.errorListener.accept(attempt, e);
                    if (retry.maxAttempts.isExhausted(attempt) || !retry.retryPredicate.test(e)) {
                        throw e;
                    }
                    sleep(retry.backoff.delayAfterAttempt(attempt), e);
                    attempt++;
                }
            }
        };
    }

    private static void sleep(Duration backoff, RuntimeException cause) {
        long millis = backoff.toMillis();
        if (millis <= 0) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cause.addSuppressed(ie);
            throw cause;
        }
    }
}
