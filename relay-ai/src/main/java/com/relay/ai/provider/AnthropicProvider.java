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
 * Anthropic Messages API 实现。
 */
@Component
public class AnthropicProvider extends AbstractHttpProvider {

    private static final String API_VERSION = "2023-06-01";

    private final AiProperties properties;

    public AnthropicProvider(OkHttpClient aiHttpClient, AiProperties properties) {
        super(aiHttpClient);
        this.properties = properties;
    }

    @Override
    public String getName() {
        return "anthropic";
    }

    @Override
    protected AiProperties.ProviderConfig config() {
        return properties.getAnthropic();
    }

    @Override
    protected Request buildRequest(AiProperties.ProviderConfig config,
                                   String systemPrompt, String userPrompt) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", config.getModel());
        root.put("max_tokens", config.getMaxTokens());
        root.put("temperature", config.getTemperature());
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            root.put("system", systemPrompt);
        }

        ArrayNode messages = root.putArray("messages");
        ObjectNode userMsg = messages.addObject();
        userMsg.put("role", "user");
        userMsg.put("content", userPrompt);

        return new Request.Builder()
                .url(config.getBaseUrl() + "/messages")
                .addHeader("x-api-key", config.getApiKey())
                .addHeader("anthropic-version", API_VERSION)
                .post(RequestBody.create(objectMapper.writeValueAsString(root), JSON_MEDIA))
                .build();
    }

    @Override
    protected AnalysisResult parseResponse(JsonNode json, AiProperties.ProviderConfig config) {
        StringBuilder content = new StringBuilder();
        for (JsonNode block : json.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                content.append(block.path("text").asText());
            }
        }
        if (content.length() == 0) {
            throw emptyContent();
        }

        JsonNode usage = json.path("usage");
        return AnalysisResult.builder()
                .content(content.toString())
                .inputTokens(usage.path("input_tokens").asInt())
                .outputTokens(usage.path("output_tokens").asInt())
                .model(json.path("model").asText(config.getModel()))
                .provider(getName())
                .build();
    }
}
