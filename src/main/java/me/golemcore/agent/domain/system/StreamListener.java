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

import me.golemcore.agent.domain.model.TokenUsage;

/**
 * Receives the events of a relayed model stream.
 */
public interface StreamListener {

    /**
     * Called for each non-empty text delta, in order.
     */
    void onChunk(String text);

    /**
     * Called exactly once when the stream completes, fails or is cancelled.
     *
     * @param usage
     *            the last usage snapshot seen on the stream, or {@code null}
     */
    void onEnd(TokenUsage usage);
}
