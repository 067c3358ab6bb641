package com.relay.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * AI 模块配置项。
 */
@Data
@ConfigurationProperties(prefix = "relay.ai")
public class AiProperties {

    /** 降级链：按顺序尝试的提供商，第一个为主提供商 */
    private List<String> providers = new ArrayList<>(List.of("anthropic", "openai"));

    /** 是否对每个提供商先按重试策略重试，耗尽后再降级 */
    private boolean retryPerProvider = true;

    /** 单次 API 调用的超时时间（秒） */
    private int requestTimeoutSeconds = 30;

    /** Anthropic 配置 */
    private ProviderConfig anthropic = new ProviderConfig(
            "https://api.anthropic.com/v1", "claude-sonnet-4-20250514");

    /** OpenAI 配置 */
    private ProviderConfig openai = new ProviderConfig(
            "https://api.openai.com/v1", "gpt-4o");

    /** Google Gemini 配置 */
    private ProviderConfig google = new ProviderConfig(
            "https://generativelanguage.googleapis.com/v1beta", "gemini-1.5-pro");

    @Data
    public static class ProviderConfig {
        private String apiKey;
        private String baseUrl;
        private String model;
        private double temperature = 0.3;
        private int maxTokens = 4096;

        public ProviderConfig() {
        }

        public ProviderConfig(String baseUrl, String model) {
            this.baseUrl = baseUrl;
            this.model = model;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
