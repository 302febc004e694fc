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

import me.golemcore.agent.domain.model.AgentErrorCode;
import me.golemcore.agent.domain.model.RetryContext;

/**
 * Observer for {@link RetryExecutor}. Retries are reported only through
 * {@link #onRetry}; {@link #onError} fires once when the executor gives up.
 */
public interface RetryListener {

    RetryListener NONE = new RetryListener() {
    };

    /**
     * Called before sleeping ahead of a retry.
     */
    default void onRetry(RetryContext context) {
        // Default no-op
    }

    /**
     * Called once for a failure that will not be retried.
     */
    default void onError(AgentErrorCode code, String message) {
        // Default no-op
    }
}
