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

package me.golemcore.agent.domain.model;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by every suspension point of one agent
 * run: model calls, tool executions and retry backoff sleeps.
 *
 * <p>
 * Cancellation is one-way. Listeners registered after cancellation run
 * immediately on the registering thread.
 */
@Slf4j
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch cancelledLatch = new CountDownLatch(1);
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final Sinks.One<Boolean> cancelledSink = Sinks.one();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Signals cancellation.
     *
     * @return {@code true} if this call cancelled the token, {@code false} if it
     *         was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        cancelledLatch.countDown();
        cancelledSink.tryEmitValue(Boolean.TRUE);
        for (Listener listener : listeners) {
            listener.fire();
        }
        listeners.clear();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers an action to run once on cancellation.
     */
    public Registration onCancel(Runnable action) {
        Listener listener = new Listener(action);
        listeners.add(listener);
        if (isCancelled()) {
            listener.fire();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Waits for the given duration unless cancelled first.
     *
     * @return {@code true} if the full duration elapsed, {@code false} if the
     *         wait ended because of cancellation or interruption
     */
    public boolean sleep(Duration duration) {
        if (isCancelled()) {
            return false;
        }
        try {
            return !cancelledLatch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Ties a future to this token: cancelling the token cancels the future.
     */
    public <T> CompletableFuture<T> bind(CompletableFuture<T> future) {
        Registration registration = onCancel(() -> future.cancel(true));
        future.whenComplete((value, error) -> registration.close());
        return future;
    }

    /**
     * Emits {@code true} once the token is cancelled. Never completes otherwise.
     */
    public Mono<Boolean> whenCancelled() {
        return cancelledSink.asMono();
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private static final class Listener {
        private final Runnable action;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        private Listener(Runnable action) {
            this.action = action;
        }

        private void fire() {
            if (!fired.compareAndSet(false, true)) {
                return;
            }
            try {
                action.run();
            } catch (RuntimeException e) {
                log.warn("[Cancel] Cancellation listener failed: {}", e.getMessage());
            }
        }
    }
}
