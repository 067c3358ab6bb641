package com.relay.common.exception;

/**
 * 瞬时性提供商故障（网络异常、超时、上游 5xx）。按重试策略重试，耗尽后由路由器降级到下一个提供商。
 */
public class RetryableProviderException extends ProviderException {

    public RetryableProviderException(String provider, String message) {
        this("PROVIDER_RETRYABLE", provider, null, message, null);
    }

    public RetryableProviderException(String provider, String message, Throwable cause) {
        this("PROVIDER_RETRYABLE", provider, null, message, cause);
    }

    public RetryableProviderException(String provider, int statusCode, String message) {
        this("PROVIDER_RETRYABLE", provider, statusCode, message, null);
    }

    protected RetryableProviderException(String errorCode, String provider, Integer statusCode,
                                         String message, Throwable cause) {
        super(errorCode, provider, statusCode, message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.RETRYABLE;
    }
}
