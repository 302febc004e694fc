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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * Structured tool outcome. Serialized to JSON when fed back to the model and
 * passed as-is to tool-end observers.
 *
 * <p>
 * A success carries {@code result} and {@code message}; a failure carries
 * {@code error} and {@code message}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "success", "result", "error", "message" })
public class ToolResponse {

    public static final String EXECUTED_SUCCESSFULLY = "Tool executed successfully";

    boolean success;
    Object result;
    ToolErrorCode error;
    String message;

    public static ToolResponse success(Object result, String message) {
        return new ToolResponse(true, result, null, message);
    }

    public static ToolResponse failure(ToolErrorCode error, String message) {
        return new ToolResponse(false, null, error, message);
    }
}
