package me.golemcore.agent.domain.system;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.RateLimitException;
import me.golemcore.agent.domain.model.AgentErrorCode;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.LlmProviderException;
import me.golemcore.agent.domain.model.RetryContext;
import me.golemcore.agent.domain.model.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class RetryExecutorTest {

    private static final RetryPolicy NO_JITTER = RetryPolicy.builder()
            .maxRetries(3)
            .baseDelayMs(100)
            .maxDelayMs(10_000)
            .enableJitter(false)
            .build();

    private List<Duration> sleeps;
    private RetryListener listener;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        listener = mock(RetryListener.class);
    }

    private RetryExecutor executor(RetryPolicy policy) {
        return new RetryExecutor(policy, (duration, token) -> {
            sleeps.add(duration);
            return true;
        }, new Random(42));
    }

    private static Supplier<CompletableFuture<String>> failing(AtomicInteger attempts, RuntimeException error) {
        return () -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(error);
        };
    }

    // ==================== Backoff schedule ====================

    @Test
    void shouldAttemptFourTimesWithDoublingDelays() {
        AtomicInteger attempts = new AtomicInteger();
        RateLimitException error = new RateLimitException("limit");

        RuntimeException thrown = assertThrows(RuntimeException.class,
                () -> executor(NO_JITTER).execute(failing(attempts, error), CancellationToken.create(), listener));

        assertSame(error, thrown);
        assertEquals(4, attempts.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400)), sleeps);
        verify(listener, times(3)).onRetry(any(RetryContext.class));
        verify(listener, times(1)).onError(eq(AgentErrorCode.RATE_LIMITED), anyString());
    }

    @Test
    void shouldCapDelayAtMaxDelay() {
        RetryPolicy policy = NO_JITTER.toBuilder().maxRetries(5).maxDelayMs(300).build();
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(RuntimeException.class, () -> executor(policy)
                .execute(failing(attempts, new ConnectExceptionWrapper()), null, listener));

        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(300),
                Duration.ofMillis(300), Duration.ofMillis(300)), sleeps);
    }

    @Test
    void shouldReportAttemptAndDelayBeforeSleeping() {
        AtomicInteger attempts = new AtomicInteger();
        List<RetryContext> contexts = new ArrayList<>();
        RetryListener recording = new RetryListener() {
            @Override
            public void onRetry(RetryContext context) {
                assertEquals(contexts.size(), sleeps.size());
                contexts.add(context);
            }
        };

        assertThrows(RuntimeException.class, () -> executor(NO_JITTER)
                .execute(failing(attempts, new RateLimitException("limit")), null, recording));

        assertEquals(3, contexts.size());
        assertEquals(1, contexts.get(0).attempt());
        assertEquals(100, contexts.get(0).delayMs());
        assertEquals(3, contexts.get(2).attempt());
        assertEquals(400, contexts.get(2).delayMs());
        assertEquals(3, contexts.get(2).maxRetries());
    }

    @Test
    void shouldKeepJitteredDelayWithinComputedBound() {
        RetryExecutor executor = executor(NO_JITTER.toBuilder().enableJitter(true).build());
        RuntimeException error = new RuntimeException("network down");

        for (int attempt = 1; attempt <= 3; attempt++) {
            long delay = executor.computeDelay(attempt, error);
            assertTrue(delay >= 0 && delay <= 100L << (attempt - 1), "delay " + delay);
        }
    }

    @Test
    void shouldPreferRetryAfterHint() {
        AtomicInteger attempts = new AtomicInteger();
        LlmProviderException error = new LlmProviderException(AgentErrorCode.RATE_LIMITED, "limited", 429,
                Duration.ofSeconds(2), null);

        assertThrows(RuntimeException.class,
                () -> executor(NO_JITTER.toBuilder().maxRetries(1).build()).execute(failing(attempts, error),
                        null, listener));

        assertEquals(List.of(Duration.ofSeconds(2)), sleeps);
    }

    // ==================== Eligibility ====================

    @Test
    void shouldReturnValueAfterTransientFailure() {
        AtomicInteger attempts = new AtomicInteger();
        Supplier<CompletableFuture<String>> operation = () -> attempts.incrementAndGet() == 1
                ? CompletableFuture.failedFuture(new RateLimitException("limit"))
                : CompletableFuture.completedFuture("ok");

        String result = executor(NO_JITTER).execute(operation, null, listener);

        assertEquals("ok", result);
        assertEquals(2, attempts.get());
        verify(listener, never()).onError(any(), anyString());
    }

    @Test
    void shouldNotRetryNonRetryableFailure() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(AuthenticationException.class, () -> executor(NO_JITTER)
                .execute(failing(attempts, new AuthenticationException("bad key")), null, listener));

        assertEquals(1, attempts.get());
        assertTrue(sleeps.isEmpty());
        verify(listener, never()).onRetry(any());
        verify(listener).onError(eq(AgentErrorCode.AUTHENTICATION_ERROR), eq("bad key"));
    }

    @Test
    void shouldMakeSingleAttemptWhenDisabled() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(RateLimitException.class, () -> executor(RetryPolicy.disabled())
                .execute(failing(attempts, new RateLimitException("limit")), null, listener));

        assertEquals(1, attempts.get());
        verify(listener, times(1)).onError(eq(AgentErrorCode.RATE_LIMITED), anyString());
    }

    // ==================== Cancellation ====================

    @Test
    void shouldStopWhenBackoffSleepIsCancelled() {
        AtomicInteger attempts = new AtomicInteger();
        CancellationToken token = CancellationToken.create();
        RetryExecutor executor = new RetryExecutor(NO_JITTER, (duration, t) -> {
            t.cancel();
            return false;
        }, new Random());

        assertThrows(CancellationException.class,
                () -> executor.execute(failing(attempts, new RateLimitException("limit")), token, listener));

        assertEquals(1, attempts.get());
        verify(listener, never()).onError(any(), anyString());
    }

    @Test
    void shouldNotStartWhenAlreadyCancelled() {
        AtomicInteger attempts = new AtomicInteger();
        CancellationToken token = CancellationToken.create();
        token.cancel();

        assertThrows(CancellationException.class,
                () -> executor(NO_JITTER).execute(failing(attempts, new RateLimitException("limit")), token,
                        listener));

        assertEquals(0, attempts.get());
    }

    @Test
    void shouldUnblockInFlightCallOnCancel() {
        CancellationToken token = CancellationToken.create();
        CompletableFuture<String> pending = new CompletableFuture<>();
        CompletableFuture.runAsync(() -> {
            sleepQuietly(50);
            token.cancel();
        });

        assertThrows(CancellationException.class,
                () -> executor(NO_JITTER).execute(() -> pending, token, listener));
        assertTrue(pending.isCancelled());
    }

    // ==================== Streams ====================

    @Test
    void shouldRetryStreamFailingBeforeFirstElement() {
        AtomicInteger attempts = new AtomicInteger();
        Supplier<Flux<String>> operation = () -> attempts.incrementAndGet() < 3
                ? Flux.error(new RuntimeException("connection refused"))
                : Flux.just("a", "b");
        RetryExecutor executor = executor(NO_JITTER.toBuilder().baseDelayMs(1).build());

        StepVerifier.create(executor.executeStream(operation, CancellationToken.create(), listener))
                .expectNext("a", "b")
                .verifyComplete();

        assertEquals(3, attempts.get());
        verify(listener, times(2)).onRetry(any(RetryContext.class));
    }

    @Test
    void shouldNotRetryStreamFailingAfterFirstElement() {
        AtomicInteger attempts = new AtomicInteger();
        Supplier<Flux<String>> operation = () -> {
            attempts.incrementAndGet();
            return Flux.just("a").concatWith(Flux.error(new RuntimeException("connection reset")));
        };

        StepVerifier.create(executor(NO_JITTER).executeStream(operation, null, listener))
                .expectNext("a")
                .verifyErrorMessage("connection reset");

        assertEquals(1, attempts.get());
        verify(listener, never()).onRetry(any());
    }

    @Test
    void shouldCancelStreamBackoff() {
        CancellationToken token = CancellationToken.create();
        RetryExecutor executor = executor(NO_JITTER.toBuilder().baseDelayMs(60_000).build());
        Flux<String> flux = executor.executeStream(() -> Flux.error(new RuntimeException("network down")), token,
                listener);

        StepVerifier.create(flux)
                .then(token::cancel)
                .expectError(CancellationException.class)
                .verify(Duration.ofSeconds(5));
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class ConnectExceptionWrapper extends RuntimeException {
        private static final long serialVersionUID = 1L;

        ConnectExceptionWrapper() {
            super(new ConnectException("refused"));
        }
    }
}
