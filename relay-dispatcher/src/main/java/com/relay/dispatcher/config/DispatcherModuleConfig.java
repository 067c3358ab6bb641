package com.relay.dispatcher.config;

import com.relay.dispatcher.clock.Clock;
import com.relay.dispatcher.clock.SystemClock;
import com.relay.dispatcher.ratelimit.RateLimiter;
import com.relay.dispatcher.ratelimit.SlidingWindowLimiter;
import com.relay.dispatcher.retry.RetryExecutor;
import com.relay.dispatcher.retry.RetryPolicy;
import com.relay.dispatcher.retry.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 调度模块自动配置。
 * <p>
 * 限流器为纯内存实现，只适合单实例部署。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.relay.dispatcher")
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherModuleConfig {

    @Bean
    public Clock relayClock() {
        return SystemClock.instance();
    }

    @Bean
    public RateLimiter slidingWindowLimiter(Clock clock, DispatcherProperties properties) {
        log.info("使用内存滑动窗口限流器: {} 次 / {} 秒",
                properties.getRequestsPerMinute(), properties.getRateLimitWindowSeconds());
        return new SlidingWindowLimiter(clock,
                properties.getRequestsPerMinute(), properties.getRateLimitWindowSeconds());
    }

    @Bean
    public RetryPolicy defaultRetryPolicy(DispatcherProperties properties) {
        RetryPolicy policy = RetryPolicy.builder()
                .maxRetries(properties.getRetryMaxRetries())
                .baseDelay(seconds(properties.getRetryBaseDelaySeconds()))
                .maxDelay(seconds(properties.getRetryMaxDelaySeconds()))
                .jitter(properties.isJitterEnabled())
                .build();
        log.info("默认重试策略: 最多重试 {} 次, 基础延迟 {}, 最大延迟 {}, 抖动 {}, 最坏累计等待 {}",
                policy.getMaxRetries(), policy.getBaseDelay(), policy.getMaxDelay(),
                policy.isJitter(), policy.backoffPolicy().maxTotalDelay(policy.getMaxRetries()));
        return policy;
    }

    @Bean
    public Sleeper retrySleeper() {
        return Sleeper.delayed();
    }

    @Bean
    public RetryExecutor retryExecutor(Sleeper sleeper, RetryPolicy defaultRetryPolicy) {
        return new RetryExecutor(sleeper, defaultRetryPolicy);
    }

    private static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000));
    }
}
