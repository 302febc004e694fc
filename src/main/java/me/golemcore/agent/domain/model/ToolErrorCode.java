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

/**
 * Failure kinds a tool reports in its structured response.
 */
public enum ToolErrorCode {

    VALIDATION_ERROR(AgentErrorCode.VALIDATION_ERROR),
    IO_ERROR(AgentErrorCode.IO_ERROR),
    CONFIG_ERROR(AgentErrorCode.CONFIG_ERROR),
    PERMISSION_DENIED(AgentErrorCode.PERMISSION_DENIED),
    RATE_LIMITED(AgentErrorCode.RATE_LIMITED),
    NOT_FOUND(AgentErrorCode.NOT_FOUND),
    LLM_ASSIST_REQUIRED(AgentErrorCode.LLM_ASSIST_REQUIRED),
    TIMEOUT(AgentErrorCode.TIMEOUT),
    ABORTED(AgentErrorCode.ABORTED),
    UNKNOWN(AgentErrorCode.UNKNOWN);

    private final AgentErrorCode agentErrorCode;

    ToolErrorCode(AgentErrorCode agentErrorCode) {
        this.agentErrorCode = agentErrorCode;
    }

    public AgentErrorCode toAgentErrorCode() {
        return agentErrorCode;
    }
}
