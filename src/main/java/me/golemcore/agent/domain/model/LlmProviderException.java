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

import lombok.Getter;

import java.time.Duration;

/**
 * Failure raised by a model provider adapter with an already known error kind.
 */
@Getter
public class LlmProviderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final AgentErrorCode code;
    private final Integer statusCode;
    private final transient Duration retryAfter;

    public LlmProviderException(AgentErrorCode code, String message) {
        this(code, message, null, null, null);
    }

    public LlmProviderException(AgentErrorCode code, String message, Integer statusCode, Duration retryAfter,
            Throwable cause) {
        super(message, cause);
        this.code = code;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }
}
