package com.relay.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 调度模块配置项：准入限流与重试策略。
 */
@Data
@ConfigurationProperties(prefix = "relay.dispatcher")
public class DispatcherProperties {

    /** 每个调用方在窗口内允许的最大请求数 */
    private int requestsPerMinute = 60;

    /** 滑动窗口大小（秒） */
    private int rateLimitWindowSeconds = 60;

    /** 过期调用方的清理间隔（秒） */
    private int cleanupIntervalSeconds = 60;

    /** 单个操作失败后的最大重试次数（不含首次调用） */
    private int retryMaxRetries = 3;

    /** 首次重试前的等待时间（秒），之后每次翻倍 */
    private double retryBaseDelaySeconds = 1.0;

    /** 单次重试等待时间上限（秒） */
    private double retryMaxDelaySeconds = 60.0;

    /** 是否给退避时间加随机抖动，避免大量请求同时重试 */
    private boolean jitterEnabled = true;
}
