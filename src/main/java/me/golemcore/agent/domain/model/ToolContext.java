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

import java.util.function.BiConsumer;

/**
 * Per-call execution context handed to a tool.
 */
@Value
@Builder
public class ToolContext {

    String sessionId;
    String messageId;
    String callId;
    CancellationToken cancellationToken;
    BiConsumer<String, Object> metadataSink;

    /**
     * Publishes intermediate metadata. Observational only.
     */
    public void emitMetadata(String key, Object value) {
        if (metadataSink != null) {
            metadataSink.accept(key, value);
        }
    }

    public boolean isCancelled() {
        return cancellationToken != null && cancellationToken.isCancelled();
    }
}
