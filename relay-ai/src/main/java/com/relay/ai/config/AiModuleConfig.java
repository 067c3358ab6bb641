package com.relay.ai.config;

import com.relay.ai.provider.ProviderRegistry;
import com.relay.ai.router.ProviderRouter;
import com.relay.ai.router.RetryingProvider;
import com.relay.ai.router.RouterChain;
import com.relay.dispatcher.retry.RetryExecutor;
import com.relay.dispatcher.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * AI 模块自动配置。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.relay.ai")
@EnableConfigurationProperties(AiProperties.class)
public class AiModuleConfig {

    @Bean
    public OkHttpClient aiHttpClient(AiProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(10))
                // 整个调用的上限，超时按网络错误处理（可重试）
                .callTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .build();
    }

    @Bean
    public ProviderRouter providerRouter(ProviderRegistry registry, AiProperties properties,
                                         RetryExecutor retryExecutor, RetryPolicy defaultRetryPolicy) {
        RouterChain chain = registry.chainOf(properties.getProviders());
        if (properties.isRetryPerProvider()) {
            chain = chain.map(p -> new RetryingProvider(p, retryExecutor, defaultRetryPolicy));
        }
        log.info("AI 降级链: {}, 单提供商重试: {}", chain.names(), properties.isRetryPerProvider());
        return new ProviderRouter(chain);
    }
}
