package com.relay.dispatcher.retry;

import com.relay.common.exception.ErrorKind;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 重试策略，启动时创建后不再修改。
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    /** 最大重试次数（不含首次调用），0 表示不重试 */
    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(60);

    @Builder.Default
    boolean jitter = true;

    /** 判断异常是否值得重试，默认按 {@link ErrorKind} 分类 */
    @Builder.Default
    Predicate<Throwable> retryable = ErrorKind::isRetryable;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public boolean isRetryable(Throwable error) {
        return retryable.test(error);
    }

    public BackoffPolicy backoffPolicy() {
        return new BackoffPolicy(baseDelay, maxDelay, jitter);
    }
}
