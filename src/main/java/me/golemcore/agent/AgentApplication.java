package me.golemcore.agent;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of GolemCore Agent.
 *
 * <p>
 * GolemCore Agent is an LLM agent orchestration core: it assembles the
 * conversation, calls a model provider, executes the tools the model asks for,
 * feeds their results back and repeats until the model answers.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → QueryCommandRunner
 * Domain Layer       → AgentLoop, ToolLoopSystem, RetryExecutor, StreamRelay
 * Infrastructure     → LLM adapters (langchain4j), configuration
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentApplication.class, args);
    }
}
