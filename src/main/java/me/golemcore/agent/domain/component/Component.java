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

package me.golemcore.agent.domain.component;

/**
 * Base interface for pluggable parts of the agent: tools and model providers
 * share this lifecycle contract.
 */
public interface Component {

    /**
     * Returns the type identifier for this component, e.g. {@code "tool"} or
     * {@code "llm"}.
     */
    String getComponentType();

    /**
     * Performs setup. Default implementation does nothing.
     */
    default void initialize() {
        // Default no-op
    }

    /**
     * Releases resources. Default implementation does nothing.
     */
    default void destroy() {
        // Default no-op
    }

    /**
     * Whether the component is enabled. Disabled tools are not registered.
     */
    default boolean isEnabled() {
        return true;
    }
}
