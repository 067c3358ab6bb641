package com.relay.web.interceptor;

import com.relay.web.config.WebProperties;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 确定限流使用的调用方标识：优先取 API Key 请求头，其次客户端地址，都没有时为 "unknown"。
 */
@Component
@RequiredArgsConstructor
public class CallerKeyResolver {

    static final String UNKNOWN = "unknown";

    private final WebProperties properties;

    public String resolve(HttpServletRequest request) {
        String apiKey = request.getHeader(properties.getApiKeyHeader());
        if (apiKey != null && !apiKey.isBlank()) {
            return apiKey.trim();
        }
        String remoteAddr = request.getRemoteAddr();
        if (remoteAddr != null && !remoteAddr.isBlank()) {
            return remoteAddr;
        }
        return UNKNOWN;
    }
}
