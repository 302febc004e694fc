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

import lombok.Builder;
import lombok.Value;

/**
 * Immutable retry configuration for calls to a model provider.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    int maxRetries = 3;
    @Builder.Default
    long baseDelayMs = 1000;
    @Builder.Default
    long maxDelayMs = 10_000;
    @Builder.Default
    boolean enableJitter = true;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public static RetryPolicy disabled() {
        return RetryPolicy.builder().enabled(false).build();
    }

    /**
     * Exponential backoff before retry number {@code attempt} (1-based), capped at
     * {@link #maxDelayMs}. Jitter is not applied here.
     */
    public long delayForAttempt(int attempt) {
        double exponential = baseDelayMs * Math.pow(2, Math.max(0, attempt - 1));
        return (long) Math.min(maxDelayMs, exponential);
    }
}
