package com.relay.web.controller;

import com.relay.common.dto.ApiResponse;
import com.relay.common.exception.AllProvidersFailedException;
import com.relay.common.exception.FatalProviderException;
import com.relay.common.exception.RateLimitExceededException;
import com.relay.common.exception.RelayException;
import com.relay.common.exception.RetryableProviderException;
import com.relay.common.exception.UpstreamRateLimitedException;
import com.relay.common.util.ExceptionUtils;
import com.relay.dispatcher.ratelimit.AdmissionDecision;
import com.relay.web.dto.ProviderFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * 全局异常处理器。
 * <ul>
 *   <li>限流：429，带 X-RateLimit-* 与 Retry-After</li>
 *   <li>所有提供商失败：503，data 中列出每个提供商的失败原因</li>
 *   <li>提供商致命错误：502；可重试错误：503</li>
 *   <li>其他业务异常：400</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleRateLimited(RateLimitExceededException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(AdmissionDecision.HEADER_LIMIT, String.valueOf(e.getLimit()))
                .header(AdmissionDecision.HEADER_REMAINING, "0")
                .header(AdmissionDecision.HEADER_RESET, String.valueOf(e.getResetEpochSeconds()))
                .header(AdmissionDecision.HEADER_RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
                .body(ApiResponse.error(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(AllProvidersFailedException.class)
    public ResponseEntity<ApiResponse<List<ProviderFailure>>> handleAllProvidersFailed(AllProvidersFailedException e) {
        List<ProviderFailure> failures = e.getAttempts().stream()
                .map(ProviderFailure::of)
                .collect(Collectors.toList());
        log.error("AI 服务不可用: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error(e.getErrorCode(), "AI 服务暂时不可用，请稍后重试", failures));
    }

    @ExceptionHandler(FatalProviderException.class)
    public ResponseEntity<ApiResponse<Void>> handleFatalProvider(FatalProviderException e) {
        log.error("AI 提供商 {} 返回不可恢复的错误: {}", e.getProvider(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ApiResponse.error(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(RetryableProviderException.class)
    public ResponseEntity<ApiResponse<Void>> handleRetryableProvider(RetryableProviderException e) {
        log.warn("AI 提供商 {} 暂时不可用: {}", e.getProvider(), e.getMessage());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE);
        if (e instanceof UpstreamRateLimitedException) {
            Long retryAfter = ((UpstreamRateLimitedException) e).getRetryAfterSeconds();
            if (retryAfter != null) {
                builder.header(AdmissionDecision.HEADER_RETRY_AFTER, String.valueOf(Math.max(1, retryAfter)));
            }
        }
        return builder.body(ApiResponse.error(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(RelayException.class)
    public ResponseEntity<ApiResponse<Void>> handleRelayException(RelayException e) {
        log.warn("业务异常: [{}] {}", e.getErrorCode(), e.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(ApiResponse.error("INVALID_REQUEST", "请求体格式错误"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFound(NoResourceFoundException e) {
        log.debug("资源未找到: {}", e.getResourcePath());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error("NOT_FOUND", "资源不存在"));
    }

    /**
     * 异步链路上抛出的异常会被包成 CompletionException，解包后按实际类型处理。
     */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<? extends ApiResponse<?>> handleCompletion(CompletionException e) {
        Throwable cause = ExceptionUtils.unwrap(e);
        if (cause instanceof RateLimitExceededException) {
            return handleRateLimited((RateLimitExceededException) cause);
        }
        if (cause instanceof AllProvidersFailedException) {
            return handleAllProvidersFailed((AllProvidersFailedException) cause);
        }
        if (cause instanceof FatalProviderException) {
            return handleFatalProvider((FatalProviderException) cause);
        }
        if (cause instanceof RetryableProviderException) {
            return handleRetryableProvider((RetryableProviderException) cause);
        }
        if (cause instanceof RelayException) {
            return handleRelayException((RelayException) cause);
        }
        return internalError(cause);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception e) {
        return internalError(e);
    }

    private ResponseEntity<ApiResponse<Void>> internalError(Throwable e) {
        log.error("系统异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("SYSTEM_ERROR", "系统内部错误，请稍后重试"));
    }
}
