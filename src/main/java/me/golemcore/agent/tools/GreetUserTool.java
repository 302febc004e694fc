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

package me.golemcore.agent.tools;

import me.golemcore.agent.domain.component.AgentTool;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolErrorCode;
import me.golemcore.agent.domain.model.ToolOutput;
import me.golemcore.agent.domain.model.ToolResponse;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Greets a user in one of the supported languages.
 *
 * <p>
 * An unsupported language code produces a {@link ToolErrorCode#VALIDATION_ERROR}
 * response instead of an exception, so the model can correct itself.
 */
@Component
public class GreetUserTool implements AgentTool {

    private static final String DEFAULT_LANGUAGE = "en";
    private static final Map<String, String> GREETINGS = new LinkedHashMap<>();

    static {
        GREETINGS.put("en", "Hello");
        GREETINGS.put("es", "¡Hola");
        GREETINGS.put("fr", "Bonjour");
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("greet_user")
                .description("Greet user in different languages (en, es, fr). "
                        + "Returns localized greeting or error if language unsupported.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "name", Map.of(
                                        "type", "string",
                                        "description", "User's name"),
                                "language", Map.of(
                                        "type", "string",
                                        "description", "Language code (en, es, fr)")),
                        "required", List.of("name")))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> arguments, ToolContext context) {
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        String name = String.valueOf(args.getOrDefault("name", ""));
        Object languageArg = args.get("language");
        String language = languageArg != null ? languageArg.toString() : DEFAULT_LANGUAGE;

        String prefix = GREETINGS.get(language);
        if (prefix == null) {
            String supported = String.join(", ", GREETINGS.keySet());
            return CompletableFuture.completedFuture(ToolOutput.response(ToolResponse.failure(
                    ToolErrorCode.VALIDATION_ERROR,
                    "Language '" + language + "' not supported. Use: " + supported)));
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("greeting", prefix + ", " + name + "!");
        result.put("language", language);
        return CompletableFuture.completedFuture(ToolOutput.response(
                ToolResponse.success(result, "Greeted " + name + " in " + language)));
    }
}
