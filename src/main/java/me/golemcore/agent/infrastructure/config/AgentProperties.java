package me.golemcore.agent.infrastructure.config;

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

import lombok.Data;
import me.golemcore.agent.domain.model.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the agent, bound from application.properties.
 *
 * <p>
 * All settings live under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - provider selection, model and per-provider
 * clients</li>
 * <li>{@link RetryProperties} - backoff for model calls</li>
 * <li>{@link LoopProperties} - tool loop limits</li>
 * <li>{@link ToolsProperties} - tool binding and execution deadline</li>
 * <li>{@link CliProperties} - command-line query runner</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private String systemPrompt = "You are a helpful assistant.";
    private LlmProperties llm = new LlmProperties();
    private RetryProperties retry = new RetryProperties();
    private LoopProperties loop = new LoopProperties();
    private ToolsProperties tools = new ToolsProperties();
    private CliProperties cli = new CliProperties();

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private String model = "openai/gpt-4o";
        private Double temperature = 0.7;
        private long requestTimeoutMs = 60_000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
        private boolean supportsFunctionCalling = true;
        private Integer maxTokens;
    }

    @Data
    public static class RetryProperties {
        private boolean enabled = true;
        private int maxRetries = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 10_000;
        private boolean enableJitter = true;

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                    .enabled(enabled)
                    .maxRetries(maxRetries)
                    .baseDelayMs(baseDelayMs)
                    .maxDelayMs(maxDelayMs)
                    .enableJitter(enableJitter)
                    .build();
        }
    }

    @Data
    public static class LoopProperties {
        private int maxIterations = 10;
    }

    @Data
    public static class ToolsProperties {
        private boolean enabled = true;
        private long timeoutMs = 30_000;
    }

    @Data
    public static class CliProperties {
        private boolean enabled = false;
    }
}
