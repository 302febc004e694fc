package me.golemcore.agent.domain.system;

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

import me.golemcore.agent.domain.model.AgentErrorCode;
import me.golemcore.agent.domain.model.AgentErrorResponse;
import me.golemcore.agent.domain.model.LlmProviderException;
import me.golemcore.agent.domain.model.ProviderErrorMetadata;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps model provider failures onto {@link AgentErrorCode}.
 *
 * <p>
 * Structured signals win: an {@link LlmProviderException} code, then JDK
 * exception types, then langchain4j exception types and HTTP status. Only when
 * none of these apply is the exception message matched against known phrases.
 * Message matching is a heuristic; providers word their errors differently.
 */
public final class LlmErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnresolvedModelServerException";
    private static final String CLASS_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private static final List<String> AUTH_PATTERNS = List.of("api key", "authentication", "unauthorized");
    private static final List<String> RATE_LIMIT_PATTERNS = List.of("rate limit", "rate_limit", "429",
            "too many requests");
    private static final List<String> CONTEXT_PATTERNS = List.of("context length", "context window",
            "maximum context", "too long", "token limit");
    private static final List<String> TIMEOUT_PATTERNS = List.of("timeout", "timed out");
    private static final List<String> NETWORK_PATTERNS = List.of("network", "econnrefused", "econnreset",
            "enotfound", "etimedout", "epipe", "socket hang up", "fetch failed", "connection refused", "dns",
            "500", "502", "503", "internal server error", "bad gateway", "service unavailable");

    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");
    private static final Pattern RETRY_AFTER_PATTERN = Pattern
            .compile("retry[-_ ]after\"?\\s*[:=]?\\s*\"?(\\d+)", Pattern.CASE_INSENSITIVE);

    private LlmErrorClassifier() {
    }

    /**
     * Classify a failure by walking its cause chain.
     */
    public static AgentErrorCode classify(Throwable throwable) {
        if (throwable == null) {
            return AgentErrorCode.UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            if (current instanceof LlmProviderException providerException && providerException.getCode() != null) {
                return providerException.getCode();
            }

            AgentErrorCode byType = classifyKnownThrowable(current);
            if (byType != AgentErrorCode.UNKNOWN) {
                return byType;
            }

            AgentErrorCode byMessage = classifyFromMessage(current.getMessage());
            if (byMessage != AgentErrorCode.UNKNOWN) {
                return byMessage;
            }

            current = current.getCause();
        }
        return AgentErrorCode.UNKNOWN;
    }

    public static boolean isRetryable(Throwable throwable) {
        return classify(throwable).isRetryable();
    }

    /**
     * Classify free-form error text.
     */
    public static AgentErrorCode classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return AgentErrorCode.UNKNOWN;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (containsAny(normalized, AUTH_PATTERNS)) {
            return AgentErrorCode.AUTHENTICATION_ERROR;
        }
        if (containsAny(normalized, RATE_LIMIT_PATTERNS)) {
            return AgentErrorCode.RATE_LIMITED;
        }
        if (normalized.contains("model") && normalized.contains("not found")) {
            return AgentErrorCode.MODEL_NOT_FOUND;
        }
        if (containsAny(normalized, CONTEXT_PATTERNS)) {
            return AgentErrorCode.CONTEXT_LENGTH_EXCEEDED;
        }
        if (containsAny(normalized, TIMEOUT_PATTERNS)) {
            return AgentErrorCode.TIMEOUT;
        }
        if (containsAny(normalized, NETWORK_PATTERNS)) {
            return AgentErrorCode.NETWORK_ERROR;
        }
        return AgentErrorCode.UNKNOWN;
    }

    /**
     * Builds the terminal error for a failed model call, with provider metadata.
     */
    public static AgentErrorResponse toErrorResponse(Throwable throwable, String provider, String model) {
        Throwable cause = unwrap(throwable);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return AgentErrorResponse.builder()
                .error(classify(cause))
                .message(message)
                .metadata(ProviderErrorMetadata.builder()
                        .provider(provider)
                        .model(model)
                        .statusCode(extractStatusCode(cause))
                        .retryAfter(extractRetryAfter(cause).orElse(null))
                        .originalError(cause)
                        .build())
                .build();
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Explicit wait requested by the provider, e.g. from a {@code Retry-After}
     * header or a {@code reset_seconds} field in the error body.
     */
    public static Optional<Duration> extractRetryAfter(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);
            if (current instanceof LlmProviderException providerException
                    && providerException.getRetryAfter() != null) {
                return Optional.of(providerException.getRetryAfter());
            }
            String message = current.getMessage();
            if (message != null) {
                Optional<Duration> fromMessage = findSeconds(RESET_SECONDS_PATTERN, message)
                        .or(() -> findSeconds(RETRY_AFTER_PATTERN, message));
                if (fromMessage.isPresent()) {
                    return fromMessage;
                }
            }
            current = current.getCause();
        }
        return Optional.empty();
    }

    /**
     * HTTP status of the failure if any exception in the chain carries one.
     */
    public static Integer extractStatusCode(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);
            if (current instanceof LlmProviderException providerException
                    && providerException.getStatusCode() != null) {
                return providerException.getStatusCode();
            }
            if (CLASS_HTTP_EXCEPTION.equals(current.getClass().getName())) {
                Integer status = readHttpStatusCode(current);
                if (status != null) {
                    return status;
                }
            }
            current = current.getCause();
        }
        return null;
    }

    private static AgentErrorCode classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return AgentErrorCode.ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return AgentErrorCode.TIMEOUT;
        }
        if (throwable instanceof ConnectException
                || throwable instanceof UnknownHostException
                || throwable instanceof SocketException) {
            return AgentErrorCode.NETWORK_ERROR;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return AgentErrorCode.UNKNOWN;
        }

        if (CLASS_RATE_LIMIT_EXCEPTION.equals(className)) {
            return AgentErrorCode.RATE_LIMITED;
        }
        if (CLASS_TIMEOUT_EXCEPTION.equals(className)) {
            return AgentErrorCode.TIMEOUT;
        }
        if (CLASS_AUTHENTICATION_EXCEPTION.equals(className)) {
            return AgentErrorCode.AUTHENTICATION_ERROR;
        }
        if (CLASS_MODEL_NOT_FOUND_EXCEPTION.equals(className)) {
            return AgentErrorCode.MODEL_NOT_FOUND;
        }
        if (CLASS_INTERNAL_SERVER_EXCEPTION.equals(className)
                || CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION.equals(className)
                || CLASS_RETRIABLE_EXCEPTION.equals(className)) {
            return AgentErrorCode.NETWORK_ERROR;
        }
        if (CLASS_HTTP_EXCEPTION.equals(className)) {
            return classifyHttpStatus(readHttpStatusCode(throwable));
        }
        return AgentErrorCode.UNKNOWN;
    }

    private static AgentErrorCode classifyHttpStatus(Integer statusCode) {
        if (statusCode == null) {
            return AgentErrorCode.UNKNOWN;
        }
        if (statusCode == 429) {
            return AgentErrorCode.RATE_LIMITED;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AgentErrorCode.AUTHENTICATION_ERROR;
        }
        if (statusCode == 404) {
            return AgentErrorCode.MODEL_NOT_FOUND;
        }
        if (statusCode == 408 || statusCode == 504) {
            return AgentErrorCode.TIMEOUT;
        }
        if (statusCode >= 500) {
            return AgentErrorCode.NETWORK_ERROR;
        }
        return AgentErrorCode.UNKNOWN;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException e) {
            return null;
        }
        return null;
    }

    private static Optional<Duration> findSeconds(Pattern pattern, String message) {
        Matcher matcher = pattern.matcher(message);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Duration.ofSeconds(Long.parseLong(matcher.group(1))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static boolean containsAny(String text, List<String> patterns) {
        for (String pattern : patterns) {
            if (text.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
