package com.relay.dispatcher.ratelimit;

import com.relay.common.exception.RateLimitExceededException;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次准入判断的结果。
 */
@Value
@Builder
public class AdmissionDecision {

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";
    public static final String HEADER_RETRY_AFTER = "Retry-After";

    boolean allowed;

    /** 窗口内允许的最大请求数 */
    int limit;

    /** 本次之后窗口内剩余的名额，拒绝时为 0 */
    int remaining;

    /** 窗口内最早一条记录过期的时间（epoch 秒，向上取整） */
    long resetEpochSeconds;

    /** 拒绝时建议调用方等待的秒数（至少 1），准入时为 0 */
    long retryAfterSeconds;

    /**
     * 响应头，顺序固定。拒绝时额外带上 Retry-After。
     */
    public Map<String, String> toHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HEADER_LIMIT, String.valueOf(limit));
        headers.put(HEADER_REMAINING, String.valueOf(remaining));
        headers.put(HEADER_RESET, String.valueOf(resetEpochSeconds));
        if (!allowed) {
            headers.put(HEADER_RETRY_AFTER, String.valueOf(retryAfterSeconds));
        }
        return headers;
    }

    public RateLimitExceededException toException() {
        return new RateLimitExceededException(limit, resetEpochSeconds, retryAfterSeconds);
    }
}
