package com.relay.common.exception;

/**
 * AI 提供商调用异常的公共父类，携带提供商名称、分类和（可选的）上游 HTTP 状态码。
 */
public abstract class ProviderException extends RelayException implements ErrorKind.Classified {

    private final String provider;
    private final Integer statusCode;

    protected ProviderException(String errorCode, String provider, Integer statusCode,
                                String message, Throwable cause) {
        super(errorCode, message, cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public String getProvider() {
        return provider;
    }

    /**
     * 上游返回的 HTTP 状态码，网络层失败时为 null。
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
