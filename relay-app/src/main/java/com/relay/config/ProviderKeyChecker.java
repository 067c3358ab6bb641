package com.relay.config;

import com.relay.ai.config.AiProperties;
import com.relay.ai.provider.ProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 应用启动时检查降级链上每个提供商是否配置了 API Key。
 * <p>
 * 配置方式（在 application.yml 中）：
 * relay.ai.openai.api-key=sk-xxx
 * <p>
 * 或通过环境变量：RELAY_AI_OPENAI_API_KEY=sk-xxx
 * <p>
 * 未配置 Key 的提供商仍会留在链上，调用时直接以致命错误失败。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderKeyChecker implements CommandLineRunner {

    private final AiProperties properties;
    private final ProviderRegistry registry;

    @Override
    public void run(String... args) {
        List<String> missing = missingKeys();
        if (missing.isEmpty()) {
            log.info("降级链 {} 上的提供商均已配置 API Key", properties.getProviders());
            return;
        }

        log.warn("==============================================");
        log.warn("  以下 AI 提供商未配置 API Key: {}", missing);
        log.warn("  请在 application.yml 中设置:");
        missing.forEach(name -> log.warn("  relay.ai.{}.api-key: sk-your-key", name));
        log.warn("  或通过环境变量: {}", missing.stream()
                .map(name -> "RELAY_AI_" + name.toUpperCase() + "_API_KEY")
                .collect(Collectors.joining(", ")));
        log.warn("==============================================");

        if (missing.size() == properties.getProviders().size()) {
            log.error("降级链上没有任何可用的提供商，所有分析请求都会失败");
        }
    }

    public List<String> missingKeys() {
        return properties.getProviders().stream()
                .filter(name -> !registry.getProvider(name).isConfigured())
                .collect(Collectors.toList());
    }
}
