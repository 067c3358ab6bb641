package com.relay.common.exception;

/**
 * 上游提供商返回 429。属于可重试错误，额外带上上游建议的等待秒数（未给出时为 null）。
 */
public class UpstreamRateLimitedException extends RetryableProviderException {

    private final Long retryAfterSeconds;

    public UpstreamRateLimitedException(String provider, Long retryAfterSeconds, String message) {
        super("UPSTREAM_RATE_LIMITED", provider, 429, message, null);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
