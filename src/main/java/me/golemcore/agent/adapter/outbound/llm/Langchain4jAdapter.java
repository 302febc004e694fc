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

package me.golemcore.agent.adapter.outbound.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.AgentErrorCode;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmProviderException;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.TokenUsage;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Model adapter using the langchain4j library.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>OpenAI and any OpenAI-compatible endpoint (via {@code base-url})
 * <li>Anthropic (Claude models)
 * </ul>
 *
 * <p>
 * Models are addressed as {@code provider/model}, e.g.
 * {@code anthropic/claude-sonnet-4-20250514}. A name without a prefix uses the
 * {@code openai} provider. Clients are created lazily per model and cached.
 *
 * <p>
 * Clients are built with {@code maxRetries(0)}: retries are owned by the agent's
 * retry executor, and langchain4j exceptions are propagated unchanged so that
 * the error classifier sees the original types.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    static final String PROVIDER_ID = "langchain4j";
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final int DEFAULT_ANTHROPIC_MAX_TOKENS = 4096;

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    private final Map<String, ChatModel> chatModels = new ConcurrentHashMap<>();
    private final Map<String, StreamingChatModel> streamingModels = new ConcurrentHashMap<>();

    @Override
    public void initialize() {
        String model = getCurrentModel();
        String provider = providerOf(model);
        if (providerConfig(provider) == null) {
            log.warn("Langchain4j adapter: provider '{}' for model {} is not configured", provider, model);
        } else {
            log.info("Langchain4j adapter initialized with model: {}", model);
        }
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = resolveModel(request);
            ChatModel chatModel = chatModels.computeIfAbsent(model, this::createChatModel);
            List<ChatMessage> messages = convertMessages(request.getMessages());
            List<ToolSpecification> tools = convertTools(request.getTools());

            ChatRequest.Builder chatRequest = ChatRequest.builder().messages(messages);
            if (!tools.isEmpty()) {
                log.trace("Calling LLM with {} tools", tools.size());
                chatRequest.toolSpecifications(tools);
            }
            try {
                return convertResponse(chatModel.chat(chatRequest.build()), model);
            } catch (RuntimeException e) {
                log.debug("LLM chat failed for {}: {}", model, e.getMessage());
                throw e;
            }
        });
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.defer(() -> {
            String model = resolveModel(request);
            StreamingChatModel streamingModel = streamingModels.computeIfAbsent(model, this::createStreamingModel);
            ChatRequest chatRequest = ChatRequest.builder()
                    .messages(convertMessages(request.getMessages()))
                    .build();

            return Flux.create(sink -> streamingModel.chat(chatRequest, new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partialResponse) {
                    sink.next(LlmChunk.builder().text(partialResponse).build());
                }

                @Override
                public void onCompleteResponse(ChatResponse response) {
                    sink.next(LlmChunk.builder()
                            .usage(convertUsage(response.tokenUsage()))
                            .done(true)
                            .build());
                    sink.complete();
                }

                @Override
                public void onError(Throwable error) {
                    sink.error(error);
                }
            }));
        });
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public boolean supportsToolBinding() {
        AgentProperties.ProviderProperties config = providerConfig(providerOf(getCurrentModel()));
        return config != null && config.isSupportsFunctionCalling();
    }

    @Override
    public boolean isAvailable() {
        AgentProperties.ProviderProperties config = providerConfig(providerOf(getCurrentModel()));
        return config != null && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    // ==================== Client creation ====================

    private String resolveModel(LlmRequest request) {
        String model = request.getModel();
        return model != null && !model.isBlank() ? model : getCurrentModel();
    }

    static String providerOf(String model) {
        if (model != null && model.contains("/")) {
            return model.substring(0, model.indexOf('/'));
        }
        return PROVIDER_OPENAI;
    }

    static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    private AgentProperties.ProviderProperties providerConfig(String provider) {
        return properties.getLlm().getProviders().get(provider);
    }

    private AgentProperties.ProviderProperties requireProviderConfig(String provider) {
        AgentProperties.ProviderProperties config = providerConfig(provider);
        if (config == null) {
            throw new LlmProviderException(AgentErrorCode.PROVIDER_NOT_CONFIGURED, "Provider not configured: "
                    + provider + ". Add agent.llm.providers." + provider + ".api-key");
        }
        return config;
    }

    private Duration timeout() {
        return Duration.ofMillis(properties.getLlm().getRequestTimeoutMs());
    }

    private ChatModel createChatModel(String model) {
        String provider = providerOf(model);
        AgentProperties.ProviderProperties config = requireProviderConfig(provider);
        String modelName = stripProviderPrefix(model);
        log.debug("Creating chat model {} for provider {}", modelName, provider);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0)
                    .maxTokens(maxTokens(config))
                    .timeout(timeout());
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            if (properties.getLlm().getTemperature() != null) {
                builder.temperature(properties.getLlm().getTemperature());
            }
            return builder.build();
        }

        // All non-Anthropic providers use the OpenAI-compatible API
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .timeout(timeout());
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getMaxTokens() != null) {
            builder.maxTokens(config.getMaxTokens());
        }
        if (properties.getLlm().getTemperature() != null) {
            builder.temperature(properties.getLlm().getTemperature());
        }
        return builder.build();
    }

    private StreamingChatModel createStreamingModel(String model) {
        String provider = providerOf(model);
        AgentProperties.ProviderProperties config = requireProviderConfig(provider);
        String modelName = stripProviderPrefix(model);
        log.debug("Creating streaming model {} for provider {}", modelName, provider);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicStreamingChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxTokens(maxTokens(config))
                    .timeout(timeout());
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            if (properties.getLlm().getTemperature() != null) {
                builder.temperature(properties.getLlm().getTemperature());
            }
            return builder.build();
        }

        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .timeout(timeout());
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getMaxTokens() != null) {
            builder.maxTokens(config.getMaxTokens());
        }
        if (properties.getLlm().getTemperature() != null) {
            builder.temperature(properties.getLlm().getTemperature());
        }
        return builder.build();
    }

    private static int maxTokens(AgentProperties.ProviderProperties config) {
        return config.getMaxTokens() != null ? config.getMaxTokens() : DEFAULT_ANTHROPIC_MAX_TOKENS;
    }

    // ==================== Conversion ====================

    List<ChatMessage> convertMessages(List<Message> source) {
        List<ChatMessage> messages = new ArrayList<>();
        if (source == null) {
            return messages;
        }
        for (Message msg : source) {
            String content = msg.getContent() != null ? msg.getContent() : "";
            switch (msg.getRole() != null ? msg.getRole() : "") {
            case Message.ROLE_SYSTEM -> messages.add(SystemMessage.from(content));
            case Message.ROLE_USER -> messages.add(UserMessage.from(content));
            case Message.ROLE_ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(convertArgsToJson(tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(content.isBlank()
                            ? AiMessage.from(toolRequests)
                            : AiMessage.from(content, toolRequests));
                } else {
                    messages.add(AiMessage.from(content));
                }
            }
            case Message.ROLE_TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getName(),
                    content));
            default -> {
                log.warn("Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(content));
            }
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(List<ToolDefinition> tools) {
        if (tools == null || tools.isEmpty()) {
            return Collections.emptyList();
        }
        return tools.stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> schemaProperties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            if (schemaProperties != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : schemaProperties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        boolean described = description != null && !description.isBlank();
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }

        switch (type != null ? type : "string") {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) paramSchema.get("items")));
            }
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (described) {
                builder.description(description);
            }
            if (paramSchema.containsKey(SCHEMA_KEY_PROPERTIES)) {
                Map<String, Object> nested = (Map<String, Object>) paramSchema.get(SCHEMA_KEY_PROPERTIES);
                for (Map.Entry<String, Object> entry : nested.entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default -> {
            // string, and fallback for unknown types
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (described) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    LlmResponse convertResponse(ChatResponse response, String model) {
        AiMessage aiMessage = response.aiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> Message.ToolCall.builder()
                            .id(ter.id())
                            .name(ter.name())
                            .arguments(parseJsonArgs(ter.arguments()))
                            .build())
                    .toList();
            log.trace("Parsed {} tool calls from response", toolCalls.size());
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .usage(convertUsage(response.tokenUsage()))
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private static TokenUsage convertUsage(dev.langchain4j.model.output.TokenUsage usage) {
        if (usage == null) {
            return null;
        }
        int input = usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
        int output = usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
        return TokenUsage.of(input, output);
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize tool arguments: {}", e.getMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE_REF);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse tool arguments: {}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
