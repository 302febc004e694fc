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

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of failure kinds surfaced to callers of the agent loop. Model
 * provider failures, tool failures and loop failures all map onto these codes.
 */
public enum AgentErrorCode {

    // Provider errors
    PROVIDER_NOT_CONFIGURED,
    PROVIDER_NOT_SUPPORTED,
    AUTHENTICATION_ERROR,
    RATE_LIMITED,
    MODEL_NOT_FOUND,
    CONTEXT_LENGTH_EXCEEDED,
    NETWORK_ERROR,
    TIMEOUT,
    INVALID_RESPONSE,

    // Tool errors
    VALIDATION_ERROR,
    IO_ERROR,
    CONFIG_ERROR,
    PERMISSION_DENIED,
    NOT_FOUND,
    LLM_ASSIST_REQUIRED,

    // Agent errors
    MAX_ITERATIONS_EXCEEDED,
    TOOL_EXECUTION_ERROR,
    INITIALIZATION_ERROR,
    ABORTED,
    UNKNOWN;

    private static final Set<AgentErrorCode> RETRYABLE = EnumSet.of(RATE_LIMITED, NETWORK_ERROR, TIMEOUT);

    /**
     * Whether a failure of this kind may succeed when the same call is repeated.
     */
    public boolean isRetryable() {
        return RETRYABLE.contains(this);
    }

    public String userFriendlyMessage() {
        return userFriendlyMessage(null);
    }

    /**
     * Human-readable description of this error, naming the provider and model
     * from the metadata when they are known.
     */
    public String userFriendlyMessage(ProviderErrorMetadata metadata) {
        String provider = metadata != null && metadata.getProvider() != null ? metadata.getProvider()
                : "the provider";
        return switch (this) {
        case AUTHENTICATION_ERROR -> "Authentication failed with " + provider + ". Please check your API key.";
        case RATE_LIMITED -> metadata != null && metadata.getRetryAfter() != null
                ? "Rate limited by " + provider + ". Retry after " + metadata.getRetryAfter().toSeconds()
                        + " seconds."
                : "Rate limited by " + provider + ". Please wait before retrying.";
        case MODEL_NOT_FOUND -> metadata != null && metadata.getModel() != null
                ? "Model '" + metadata.getModel() + "' not found on " + provider + "."
                : "The requested model was not found on " + provider + ".";
        case CONTEXT_LENGTH_EXCEEDED -> "Input exceeds the context length limit for " + provider + ".";
        case NETWORK_ERROR -> "Network error connecting to " + provider + ". Please check your connection.";
        case TIMEOUT -> "Request to " + provider + " timed out. Please try again.";
        case PROVIDER_NOT_CONFIGURED -> "Provider '" + provider + "' is not configured. Please check your configuration.";
        case PROVIDER_NOT_SUPPORTED -> "Provider '" + provider + "' is not supported.";
        case INVALID_RESPONSE -> "Received an invalid response from " + provider + ".";
        case MAX_ITERATIONS_EXCEEDED -> "Maximum iterations exceeded. The query may be too complex.";
        case TOOL_EXECUTION_ERROR -> "A tool failed to execute. Please check the tool configuration.";
        case INITIALIZATION_ERROR -> "Agent initialization failed. Please check your configuration.";
        case VALIDATION_ERROR -> "Invalid input parameters provided.";
        case IO_ERROR -> "An I/O error occurred while processing your request.";
        case CONFIG_ERROR -> "Configuration error. Please check your settings.";
        case PERMISSION_DENIED -> "Permission denied for the requested operation.";
        case NOT_FOUND -> "The requested resource was not found.";
        case LLM_ASSIST_REQUIRED -> "The operation requires LLM assistance.";
        case ABORTED -> "The request was cancelled.";
        case UNKNOWN -> "An unexpected error occurred.";
        };
    }
}
