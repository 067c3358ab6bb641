package com.relay.ai.provider;

import com.relay.common.exception.FatalProviderException;
import com.relay.common.exception.ProviderException;
import com.relay.common.exception.RetryableProviderException;
import com.relay.common.exception.UpstreamRateLimitedException;
import com.relay.common.util.TextUtils;

/**
 * 把上游 HTTP 错误响应翻译成统一的异常分类。
 * <ul>
 *   <li>429：上游限流，可重试</li>
 *   <li>408 / 5xx（含 Anthropic 的 529 过载）：瞬时故障，可重试</li>
 *   <li>401 / 403：鉴权失败，致命</li>
 *   <li>其余 4xx：请求本身有问题，致命</li>
 * </ul>
 */
public final class ProviderErrors {

    private static final int MAX_BODY_IN_MESSAGE = 200;

    private ProviderErrors() {
    }

    public static ProviderException fromStatus(String provider, int statusCode, String body, String retryAfter) {
        String detail = provider + " API 返回错误: " + statusCode
                + (body == null || body.isBlank() ? "" : " - " + TextUtils.truncate(body, MAX_BODY_IN_MESSAGE));

        if (statusCode == 429) {
            return new UpstreamRateLimitedException(provider, parseRetryAfter(retryAfter), detail);
        }
        if (statusCode == 408 || statusCode >= 500) {
            return new RetryableProviderException(provider, statusCode, detail);
        }
        if (statusCode == 401 || statusCode == 403) {
            return new FatalProviderException(provider, statusCode, provider + " 鉴权失败，请检查 API Key: " + statusCode);
        }
        return new FatalProviderException(provider, statusCode, detail);
    }

    /**
     * 解析 Retry-After 头（只支持秒数形式），无法解析时返回 null。
     */
    static Long parseRetryAfter(String retryAfter) {
        if (retryAfter == null || retryAfter.isBlank()) {
            return null;
        }
        try {
            return Math.max(0, Long.parseLong(retryAfter.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
