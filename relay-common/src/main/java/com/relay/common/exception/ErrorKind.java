package com.relay.common.exception;

import com.relay.common.util.ExceptionUtils;

/**
 * 异常分类：决定一次失败是否值得在同一个提供商上重试。
 * <p>
 * 分类由提供商适配层在边界处填充（见 {@link ProviderException}），
 * 重试逻辑只认这个标签，不依赖任何具体 SDK 的异常体系。是否降级由路由器另行判断。
 */
public enum ErrorKind {

    /** 瞬时故障：网络错误、上游 5xx、上游限流等，可重试 */
    RETRYABLE,

    /** 致命错误：参数错误、鉴权失败、编程错误，不重试 */
    FATAL;

    /**
     * 对任意异常分类。会先剥掉 {@code CompletionException} 等包装层；
     * 未携带分类的异常一律视为 {@link #FATAL}。
     */
    public static ErrorKind of(Throwable error) {
        Throwable cause = ExceptionUtils.unwrap(error);
        if (cause instanceof Classified classified) {
            return classified.getKind();
        }
        return FATAL;
    }

    public static boolean isRetryable(Throwable error) {
        return of(error) == RETRYABLE;
    }

    /**
     * 携带 {@link ErrorKind} 的异常。
     */
    public interface Classified {
        ErrorKind getKind();
    }
}
