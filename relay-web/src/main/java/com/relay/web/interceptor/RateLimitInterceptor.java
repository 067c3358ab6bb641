package com.relay.web.interceptor;

import com.relay.dispatcher.ratelimit.AdmissionDecision;
import com.relay.dispatcher.ratelimit.RateLimiter;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 请求准入拦截器。
 * <p>
 * 准入的请求带上 X-RateLimit-* 响应头；超出配额时抛出
 * {@link com.relay.common.exception.RateLimitExceededException}，由全局异常处理器转成 429。
 */
@Component
@RequiredArgsConstructor
public class RateLimitInterceptor implements HandlerInterceptor {

    private final RateLimiter rateLimiter;
    private final CallerKeyResolver callerKeyResolver;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // 异步结果回派时拦截器会再执行一次，此时已经准入过
        if (request.getDispatcherType() == DispatcherType.ASYNC) {
            return true;
        }

        AdmissionDecision decision = rateLimiter.admit(callerKeyResolver.resolve(request));
        if (!decision.isAllowed()) {
            // 429 的响应头由异常处理器统一写出
            throw decision.toException();
        }
        decision.toHeaders().forEach(response::setHeader);
        return true;
    }
}
