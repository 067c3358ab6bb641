package com.relay.dispatcher.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 指数退避：第 n 次重试（从 0 开始）前等待 {@code min(baseDelay * 2^n, maxDelay)}。
 * <p>
 * 开启抖动时再乘以 [0.5, 1.5) 内的随机系数，打散同时失败的请求的重试时间点。
 */
public final class BackoffPolicy {

    private static final double JITTER_MIN = 0.5;
    private static final double JITTER_MAX = 1.5;

    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final boolean jitter;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, boolean jitter) {
        this(baseDelay, maxDelay, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random 返回 [0, 1) 均匀分布随机数的来源，测试中可固定
     */
    public BackoffPolicy(Duration baseDelay, Duration maxDelay, boolean jitter, DoubleSupplier random) {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay 不能为负");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay 不能小于 baseDelay");
        }
        this.baseDelayMillis = baseDelay.toMillis();
        this.maxDelayMillis = maxDelay.toMillis();
        this.jitter = jitter;
        this.random = random;
    }

    /**
     * 第 attempt 次重试前的等待时间。
     */
    public Duration delayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt 不能为负");
        }
        double delay = cappedDelay(attempt);
        if (jitter) {
            delay *= JITTER_MIN + random.getAsDouble() * (JITTER_MAX - JITTER_MIN);
        }
        return Duration.ofMillis(Math.round(delay));
    }

    /**
     * 重试 maxRetries 次的最坏累计等待时间：封顶几何级数之和，开启抖动时按最大系数估算。
     */
    public Duration maxTotalDelay(int maxRetries) {
        double total = 0;
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            total += cappedDelay(attempt);
        }
        if (jitter) {
            total *= JITTER_MAX;
        }
        return Duration.ofMillis(Math.round(total));
    }

    private double cappedDelay(int attempt) {
        return Math.min(baseDelayMillis * Math.pow(2, attempt), maxDelayMillis);
    }
}
