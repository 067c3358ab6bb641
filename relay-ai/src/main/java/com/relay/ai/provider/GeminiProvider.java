package com.relay.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relay.ai.config.AiProperties;
import com.relay.common.dto.AnalysisResult;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Google Gemini generateContent API 实现。
 */
@Component
public class GeminiProvider extends AbstractHttpProvider {

    private final AiProperties properties;

    public GeminiProvider(OkHttpClient aiHttpClient, AiProperties properties) {
        super(aiHttpClient);
        this.properties = properties;
    }

    @Override
    public String getName() {
        return "google";
    }

    @Override
    protected AiProperties.ProviderConfig config() {
        return properties.getGoogle();
    }

    @Override
    protected Request buildRequest(AiProperties.ProviderConfig config,
                                   String systemPrompt, String userPrompt) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            root.putObject("systemInstruction").putArray("parts").addObject().put("text", systemPrompt);
        }

        ObjectNode userContent = root.putArray("contents").addObject();
        userContent.put("role", "user");
        userContent.putArray("parts").addObject().put("text", userPrompt);

        ObjectNode generationConfig = root.putObject("generationConfig");
        generationConfig.put("maxOutputTokens", config.getMaxTokens());
        generationConfig.put("temperature", config.getTemperature());

        return new Request.Builder()
                .url(config.getBaseUrl() + "/models/" + config.getModel() + ":generateContent")
                .addHeader("x-goog-api-key", config.getApiKey())
                .post(RequestBody.create(objectMapper.writeValueAsString(root), JSON_MEDIA))
                .build();
    }

    @Override
    protected AnalysisResult parseResponse(JsonNode json, AiProperties.ProviderConfig config) {
        StringBuilder content = new StringBuilder();
        for (JsonNode part : json.path("candidates").path(0).path("content").path("parts")) {
            content.append(part.path("text").asText());
        }
        if (content.length() == 0) {
            throw emptyContent();
        }

        JsonNode usage = json.path("usageMetadata");
        return AnalysisResult.builder()
                .content(content.toString())
                .inputTokens(usage.path("promptTokenCount").asInt())
                .outputTokens(usage.path("candidatesTokenCount").asInt())
                .model(json.path("modelVersion").asText(config.getModel()))
                .provider(getName())
                .build();
    }
}
