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
 * Normalized outcome of one tool call. {@code content} is what the model sees
 * in the tool-result message; {@code response} is what observers saw.
 */
public record ToolExecutionResult(String name, String id, String content, ToolResponse response) {

    public boolean isCancelled() {
        return response != null && !response.isSuccess() && response.getError() == ToolErrorCode.ABORTED;
    }

    public boolean isSuccess() {
        return response != null && response.isSuccess();
    }
}
