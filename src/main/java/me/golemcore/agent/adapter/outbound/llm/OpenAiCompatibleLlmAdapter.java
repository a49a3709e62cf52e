package me.golemcore.agent.adapter.outbound.llm;

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

import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.infrastructure.http.FeignClientFactory;
import me.golemcore.agent.port.outbound.LlmPort;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import feign.RetryableException;
import feign.Retryer;
import feign.codec.DecodeException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * {@link LlmPort} for any OpenAI-compatible {@code /chat/completions} endpoint
 * (OpenRouter, LiteLLM, vLLM, ...).
 *
 * <p>
 * Tools are sent in function format; the descriptor's input examples travel
 * as {@code input_examples} next to {@code parameters}. Tool-call arguments
 * that are not valid JSON become an empty argument map. Every failure
 * completes the future with a {@link LlmCallException}.
 */
@Component
@ConditionalOnProperty(prefix = "agent", name = "mode", havingValue = "chat", matchIfMissing = true)
@Slf4j
public class OpenAiCompatibleLlmAdapter implements LlmPort {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final AgentProperties.LlmProperties settings;
    private final ObjectMapper objectMapper;
    private final ChatCompletionsApi client;

    public OpenAiCompatibleLlmAdapter(AgentProperties properties, FeignClientFactory feignClientFactory,
            ObjectMapper objectMapper) {
        this.settings = properties.getLlm();
        this.objectMapper = objectMapper;
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            throw new IllegalStateException("agent.llm.api-key is required in chat mode");
        }
        this.client = feignClientFactory.create(ChatCompletionsApi.class, settings.getBaseUrl(),
                Feign.builder().retryer(Retryer.NEVER_RETRY));
        log.info("[LLM] OpenAI-compatible adapter: {} ({})", settings.getBaseUrl(), settings.getModel());
    }

    @Override
    public String getProviderId() {
        return "openai-compatible";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatCompletionRequest apiRequest = buildRequest(request);
            try {
                return convertResponse(client.chatCompletion(settings.getApiKey(), apiRequest));
            } catch (DecodeException e) {
                throw new LlmCallException(LlmCallException.Kind.DECODE,
                        "Invalid response from model endpoint: " + e.getMessage(), e);
            } catch (RetryableException e) {
                if (e.getCause() instanceof InterruptedIOException) {
                    throw new LlmCallException(LlmCallException.Kind.TIMEOUT, "Model call timed out", e);
                }
                throw new LlmCallException(LlmCallException.Kind.TRANSPORT,
                        "Failed to reach model endpoint: " + e.getMessage(), e);
            } catch (FeignException e) {
                if (e.status() >= 200 && e.status() < 300) {
                    throw new LlmCallException(LlmCallException.Kind.DECODE,
                            "Invalid response from model endpoint: " + e.getMessage(), e);
                }
                throw new LlmCallException(LlmCallException.Kind.HTTP_STATUS, e.status(),
                        "Model endpoint returned HTTP " + e.status(), e);
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return settings.getModel();
    }

    @Override
    public boolean isAvailable() {
        return settings.getBaseUrl() != null && !settings.getBaseUrl().isBlank();
    }

    ChatCompletionRequest buildRequest(LlmRequest request) {
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(request.getModel() != null ? request.getModel() : settings.getModel());
        apiRequest.setTemperature(request.getTemperature());
        apiRequest.setMaxTokens(request.getMaxTokens());

        List<ApiMessage> messages = new ArrayList<>();
        for (Message msg : request.getMessages()) {
            ApiMessage apiMsg = new ApiMessage();
            apiMsg.setRole(msg.getRole());
            apiMsg.setContent(msg.getContent());

            if (msg.hasToolCalls()) {
                apiMsg.setToolCalls(msg.getToolCalls().stream()
                        .map(tc -> {
                            ApiToolCall atc = new ApiToolCall();
                            atc.setId(tc.getId());
                            atc.setType("function");
                            ApiFunction func = new ApiFunction();
                            func.setName(tc.getName());
                            func.setArguments(convertArgsToJson(tc.getArguments()));
                            atc.setFunction(func);
                            return atc;
                        })
                        .toList());
            }
            if (msg.getToolCallId() != null) {
                apiMsg.setToolCallId(msg.getToolCallId());
            }
            messages.add(apiMsg);
        }
        apiRequest.setMessages(messages);

        if (request.getTools() != null && !request.getTools().isEmpty()) {
            apiRequest.setTools(request.getTools().stream()
                    .map(OpenAiCompatibleLlmAdapter::toApiTool)
                    .toList());
        }
        return apiRequest;
    }

    static ApiTool toApiTool(ToolDefinition tool) {
        ApiToolFunction func = new ApiToolFunction();
        func.setName(tool.getName());
        func.setDescription(tool.getDescription() != null ? tool.getDescription() : "");
        func.setParameters(tool.getInputSchema() != null ? tool.getInputSchema() : ToolDefinition.emptySchema());
        if (tool.getInputExamples() != null && !tool.getInputExamples().isEmpty()) {
            func.setInputExamples(tool.getInputExamples());
        }
        ApiTool apiTool = new ApiTool();
        apiTool.setType("function");
        apiTool.setFunction(func);
        return apiTool;
    }

    LlmResponse convertResponse(ChatCompletionResponse apiResponse) {
        if (apiResponse == null || apiResponse.getChoices() == null || apiResponse.getChoices().isEmpty()) {
            throw new LlmCallException(LlmCallException.Kind.DECODE, "Model endpoint returned no choices", null);
        }

        ChatChoice choice = apiResponse.getChoices().get(0);
        ApiMessage message = choice.getMessage() != null ? choice.getMessage() : new ApiMessage();

        List<Message.ToolCall> toolCalls = null;
        if (message.getToolCalls() != null && !message.getToolCalls().isEmpty()) {
            toolCalls = message.getToolCalls().stream()
                    .filter(tc -> tc.getFunction() != null)
                    .map(tc -> Message.ToolCall.builder()
                            .id(tc.getId() != null ? tc.getId() : "call_" + UUID.randomUUID())
                            .name(tc.getFunction().getName())
                            .arguments(parseJsonArgs(tc.getFunction().getArguments()))
                            .build())
                    .toList();
        }

        LlmUsage usage = null;
        if (apiResponse.getUsage() != null) {
            ApiUsage apiUsage = apiResponse.getUsage();
            usage = LlmUsage.builder()
                    .inputTokens(apiUsage.getPromptTokens())
                    .outputTokens(apiUsage.getCompletionTokens())
                    .totalTokens(apiUsage.getTotalTokens())
                    .build();
        }

        return LlmResponse.builder()
                .content(message.getContent())
                .toolCalls(toolCalls)
                .usage(usage)
                .model(apiResponse.getModel())
                .finishReason(choice.getFinishReason())
                .build();
    }

    private String convertArgsToJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Failed to serialize tool arguments: {}", e.getOriginalMessage());
            return "{}";
        }
    }

    private Map<String, Object> parseJsonArgs(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> args = objectMapper.readValue(json, MAP_TYPE_REF);
            return args != null ? args : Collections.emptyMap();
        } catch (JsonProcessingException e) {
            log.warn("[LLM] Unparseable tool arguments, using empty arguments: {}", json);
            return Collections.emptyMap();
        }
    }

    // Feign API interface
    public interface ChatCompletionsApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, ChatCompletionRequest request);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        private double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
        private ApiUsage usage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiMessage {
        private String role;
        private String content;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;
    }

    @Data
    public static class ApiTool {
        private String type;
        private ApiToolFunction function;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiToolFunction {
        private String name;
        private String description;
        private Map<String, Object> parameters;
        @JsonProperty("input_examples")
        private List<Map<String, Object>> inputExamples;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiToolCall {
        private String id;
        private String type;
        private ApiFunction function;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiFunction {
        private String name;
        private String arguments;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiUsage {
        @JsonProperty("prompt_tokens")
        private int promptTokens;
        @JsonProperty("completion_tokens")
        private int completionTokens;
        @JsonProperty("total_tokens")
        private int totalTokens;
    }
}
