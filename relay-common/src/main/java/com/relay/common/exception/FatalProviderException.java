package com.relay.common.exception;

/**
 * 不可恢复的提供商错误（鉴权失败、请求非法、响应无法解析、未配置 API Key）。
 * 不在同一个提供商上重试，但路由器仍会降级到下一个提供商。
 */
public class FatalProviderException extends ProviderException {

    public FatalProviderException(String provider, String message) {
        super("PROVIDER_FATAL", provider, null, message, null);
    }

    public FatalProviderException(String provider, String message, Throwable cause) {
        super("PROVIDER_FATAL", provider, null, message, cause);
    }

    public FatalProviderException(String provider, int statusCode, String message) {
        super("PROVIDER_FATAL", provider, statusCode, message, null);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.FATAL;
    }
}
