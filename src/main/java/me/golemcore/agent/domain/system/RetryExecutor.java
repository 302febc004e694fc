/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.agent.domain.system;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.AgentErrorCode;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.RetryContext;
import me.golemcore.agent.domain.model.RetryPolicy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Runs model calls with bounded retries and exponential backoff.
 *
 * <p>
 * A failure is retried only when the policy is enabled, retries remain and
 * {@link LlmErrorClassifier} reports a retry-eligible kind. The wait before
 * retry {@code n} is {@code min(maxDelay, baseDelay * 2^(n-1))}, replaced by a
 * uniform value in {@code [0, delay]} when jitter is on. A provider
 * {@code Retry-After} hint overrides the computed wait. Backoff sleeps end
 * early on cancellation and no further attempt is made.
 */
@Slf4j
public class RetryExecutor {

    private final RetryPolicy policy;
    private final BackoffSleeper sleeper;
    private final Random random;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, RetryExecutor::sleepWithToken, new Random());
    }

    // Visible for testing
    RetryExecutor(RetryPolicy policy, BackoffSleeper sleeper, Random random) {
        this.policy = policy;
        this.sleeper = sleeper;
        this.random = random;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    /**
     * Executes the operation, blocking until it succeeds, fails terminally or the
     * token is cancelled.
     *
     * @throws CancellationException
     *             if the token was cancelled during a call or a backoff sleep
     * @throws RuntimeException
     *             the last failure of the operation, unwrapped from
     *             {@link CompletionException}
     */
    public <T> T execute(Supplier<CompletableFuture<T>> operation, CancellationToken token,
            RetryListener listener) {
        int maxRetries = maxRetries();
        int attempt = 0;
        while (true) {
            throwIfCancelled(token);
            try {
                return await(operation.get(), token);
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                Throwable failure = LlmErrorClassifier.unwrap(e);
                if (isCancelled(token) || failure instanceof CancellationException) {
                    throw cancellation(failure);
                }
                AgentErrorCode code = LlmErrorClassifier.classify(failure);
                if (attempt < maxRetries && code.isRetryable()) {
                    attempt++;
                    long delayMs = computeDelay(attempt, failure);
                    listener.onRetry(new RetryContext(attempt, maxRetries, delayMs, code, messageOf(failure)));
                    log.warn("[Retry] {} (attempt {}/{}), retrying in {}ms", code, attempt, maxRetries, delayMs);
                    if (!sleeper.sleep(Duration.ofMillis(delayMs), token)) {
                        throw new CancellationException("Cancelled during retry backoff");
                    }
                    continue;
                }
                if (attempt > 0) {
                    log.warn("[Retry] Giving up after {} retries: {}", attempt, messageOf(failure));
                }
                listener.onError(code, messageOf(failure));
                throw asRuntime(failure);
            }
        }
    }

    /**
     * Wraps a stream so that failures raised before the first element are
     * retried under the same rules as {@link #execute}. Errors after the first
     * element are passed through unchanged.
     */
    public <T> Flux<T> executeStream(Supplier<Flux<T>> operation, CancellationToken token,
            RetryListener listener) {
        return Flux.defer(() -> attemptStream(operation, token, listener, 0));
    }

    private <T> Flux<T> attemptStream(Supplier<Flux<T>> operation, CancellationToken token,
            RetryListener listener, int attempt) {
        AtomicBoolean started = new AtomicBoolean(false);
        return Flux.defer(operation)
                .doOnNext(item -> started.set(true))
                .onErrorResume(error -> {
                    if (started.get() || isCancelled(token)) {
                        return Flux.error(error);
                    }
                    Throwable failure = LlmErrorClassifier.unwrap(error);
                    AgentErrorCode code = LlmErrorClassifier.classify(failure);
                    int maxRetries = maxRetries();
                    if (attempt >= maxRetries || !code.isRetryable()) {
                        listener.onError(code, messageOf(failure));
                        return Flux.error(failure);
                    }
                    int next = attempt + 1;
                    long delayMs = computeDelay(next, failure);
                    listener.onRetry(new RetryContext(next, maxRetries, delayMs, code, messageOf(failure)));
                    log.warn("[Retry] Stream {} (attempt {}/{}), retrying in {}ms", code, next, maxRetries,
                            delayMs);
                    Mono<Boolean> cancelled = token != null ? token.whenCancelled().map(c -> false) : Mono.never();
                    return Mono.firstWithSignal(Mono.delay(Duration.ofMillis(delayMs)).map(tick -> true), cancelled)
                            .flatMapMany(proceed -> proceed
                                    ? attemptStream(operation, token, listener, next)
                                    : Flux.<T>error(new CancellationException("Cancelled during retry backoff")));
                });
    }

    long computeDelay(int attempt, Throwable failure) {
        Optional<Duration> retryAfter = LlmErrorClassifier.extractRetryAfter(failure);
        if (retryAfter.isPresent()) {
            return retryAfter.get().toMillis();
        }
        long delay = policy.delayForAttempt(attempt);
        if (policy.isEnableJitter()) {
            return Math.round(random.nextDouble() * delay);
        }
        return delay;
    }

    private int maxRetries() {
        return policy.isEnabled() ? Math.max(0, policy.getMaxRetries()) : 0;
    }

    private static <T> T await(CompletableFuture<T> future, CancellationToken token) {
        if (token != null) {
            token.bind(future);
        }
        return future.join();
    }

    private static boolean isCancelled(CancellationToken token) {
        return token != null && token.isCancelled();
    }

    private static void throwIfCancelled(CancellationToken token) {
        if (isCancelled(token)) {
            throw new CancellationException("Cancelled before model call");
        }
    }

    private static CancellationException cancellation(Throwable cause) {
        if (cause instanceof CancellationException cancellationException) {
            return cancellationException;
        }
        CancellationException exception = new CancellationException("Cancelled during model call");
        exception.initCause(cause);
        return exception;
    }

    private static RuntimeException asRuntime(Throwable failure) {
        if (failure instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        return new CompletionException(failure);
    }

    private static String messageOf(Throwable failure) {
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }

    private static boolean sleepWithToken(Duration duration, CancellationToken token) {
        if (token != null) {
            return token.sleep(duration);
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Waits between attempts.
     */
    @FunctionalInterface
    interface BackoffSleeper {
        /**
         * @return {@code false} if the wait was cut short by cancellation
         */
        boolean sleep(Duration duration, CancellationToken token);
    }
}
