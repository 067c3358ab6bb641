package com.relay.common.exception;

/**
 * 调用方超出限流配额。以 HTTP 429 返回，本层不会自动重试，调用方应按 Retry-After 退避。
 */
public class RateLimitExceededException extends RelayException {

    private final int limit;
    private final long resetEpochSeconds;
    private final long retryAfterSeconds;

    public RateLimitExceededException(int limit, long resetEpochSeconds, long retryAfterSeconds) {
        super("RATE_LIMITED", "请求过于频繁，请 " + retryAfterSeconds + " 秒后再试");
        this.limit = limit;
        this.resetEpochSeconds = resetEpochSeconds;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getLimit() {
        return limit;
    }

    public long getResetEpochSeconds() {
        return resetEpochSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
