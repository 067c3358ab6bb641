package com.relay.common.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 异常工具类。
 */
public final class ExceptionUtils {

    private ExceptionUtils() {
    }

    /**
     * 剥掉异步编排产生的包装层（{@link CompletionException} / {@link ExecutionException}），返回真实异常。
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
