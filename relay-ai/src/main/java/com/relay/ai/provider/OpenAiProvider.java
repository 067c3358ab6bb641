package com.relay.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relay.ai.config.AiProperties;
import com.relay.common.dto.AnalysisResult;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * OpenAI 兼容的 Chat Completions API 实现。
 */
@Component
public class OpenAiProvider extends AbstractHttpProvider {

    private final AiProperties properties;

    public OpenAiProvider(OkHttpClient aiHttpClient, AiProperties properties) {
        super(aiHttpClient);
        this.properties = properties;
    }

    @Override
    public String getName() {
        return "openai";
    }

    @Override
    protected AiProperties.ProviderConfig config() {
        return properties.getOpenai();
    }

    @Override
    protected Request buildRequest(AiProperties.ProviderConfig config,
                                   String systemPrompt, String userPrompt) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", config.getModel());
        root.put("max_tokens", config.getMaxTokens());
        root.put("temperature", config.getTemperature());

        ArrayNode messages = root.putArray("messages");
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            ObjectNode systemMsg = messages.addObject();
            systemMsg.put("role", "system");
            systemMsg.put("content", systemPrompt);
        }
        ObjectNode userMsg = messages.addObject();
        userMsg.put("role", "user");
        userMsg.put("content", userPrompt);

        return new Request.Builder()
                .url(config.getBaseUrl() + "/chat/completions")
                .addHeader("Authorization", "Bearer " + config.getApiKey())
                .post(RequestBody.create(objectMapper.writeValueAsString(root), JSON_MEDIA))
                .build();
    }

    @Override
    protected AnalysisResult parseResponse(JsonNode json, AiProperties.ProviderConfig config) {
        String content = json.path("choices").path(0).path("message").path("content").asText();
        if (content.isEmpty()) {
            throw emptyContent();
        }

        JsonNode usage = json.path("usage");
        return AnalysisResult.builder()
                .content(content)
                .inputTokens(usage.path("prompt_tokens").asInt())
                .outputTokens(usage.path("completion_tokens").asInt())
                .model(json.path("model").asText(config.getModel()))
                .provider(getName())
                .build();
    }
}
