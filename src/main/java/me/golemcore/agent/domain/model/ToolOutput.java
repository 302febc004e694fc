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

import java.util.Objects;

/**
 * Value returned by a tool: either plain text handed to the model verbatim, or
 * a structured {@link ToolResponse} from tools that report success and failure
 * explicitly. Exactly one of the two is set.
 */
public final class ToolOutput {

    private final String text;
    private final ToolResponse response;

    private ToolOutput(String text, ToolResponse response) {
        this.text = text;
        this.response = response;
    }

    public static ToolOutput text(String text) {
        return new ToolOutput(Objects.requireNonNull(text, "text"), null);
    }

    public static ToolOutput response(ToolResponse response) {
        return new ToolOutput(null, Objects.requireNonNull(response, "response"));
    }

    public boolean isText() {
        return text != null;
    }

    public String getText() {
        return text;
    }

    public ToolResponse getResponse() {
        return response;
    }

    @Override
    public String toString() {
        return isText() ? "ToolOutput[text]" : "ToolOutput[" + response + "]";
    }
}
