package com.relay.dispatcher.ratelimit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 定时任务：回收限流器中窗口已过期的调用方，防止调用方数量很大时内存无限增长。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleEntryCleanupScheduler {

    private final RateLimiter rateLimiter;

    @Scheduled(fixedDelayString = "${relay.dispatcher.cleanup-interval-seconds:60}", timeUnit = TimeUnit.SECONDS)
    public void cleanup() {
        int removed = rateLimiter.cleanupStaleEntries();
        if (removed > 0) {
            log.info("限流器清理: 移除 {} 个过期调用方，当前跟踪 {} 个", removed, rateLimiter.trackedKeys());
        }
    }
}
