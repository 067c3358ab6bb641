package com.relay.dispatcher.retry;

import com.relay.common.util.ExceptionUtils;
import com.relay.common.util.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 带指数退避的异步重试执行器。
 * <p>
 * 执行规则：
 * <ul>
 *   <li>成功立即返回，不做任何等待</li>
 *   <li>不可重试的异常立即失败，不重试</li>
 *   <li>可重试的异常按 {@link BackoffPolicy} 等待后再次调用，超过 maxRetries 后以最后一次的异常失败</li>
 * </ul>
 * 被重试的操作必须是幂等的，由调用方保证。
 * <p>
 * 取消返回的 Future 会同时取消正在进行的调用或退避等待，之后不再发起任何尝试。
 */
@Slf4j
public class RetryExecutor {

    private final Sleeper sleeper;
    private final RetryPolicy defaultPolicy;

    public RetryExecutor(Sleeper sleeper, RetryPolicy defaultPolicy) {
        this.sleeper = sleeper;
        this.defaultPolicy = defaultPolicy;
    }

    public RetryPolicy getDefaultPolicy() {
        return defaultPolicy;
    }

    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> operation) {
        return execute("operation", operation, defaultPolicy);
    }

    public <T> CompletableFuture<T> execute(Supplier<? extends CompletionStage<T>> operation,
                                            RetryPolicy policy) {
        return execute("operation", operation, policy);
    }

    /**
     * @param name      日志中使用的操作名
     * @param operation 每次调用都发起一次新的异步操作
     * @param policy    重试策略
     */
    public <T> CompletableFuture<T> execute(String name,
                                            Supplier<? extends CompletionStage<T>> operation,
                                            RetryPolicy policy) {
        CompletableFuture<T> result = new CompletableFuture<>();
        AtomicReference<Future<?>> pending = new AtomicReference<>();

        // 调用方取消时，把当前进行中的调用 / 等待一并取消
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                Future<?> current = pending.get();
                if (current != null) {
                    current.cancel(true);
                }
            }
        });

        attempt(new Run<>(name, operation, policy, policy.backoffPolicy(), result, pending), 0);
        return result;
    }

    private <T> void attempt(Run<T> run, int attempt) {
        if (run.result.isDone()) {
            return;
        }

        CompletableFuture<T> call;
        try {
            call = run.operation.get().toCompletableFuture();
        } catch (Exception e) {
            call = CompletableFuture.failedFuture(e);
        }
        track(run, call);

        call.whenComplete((value, error) -> {
            if (error == null) {
                run.result.complete(value);
                return;
            }
            Throwable cause = ExceptionUtils.unwrap(error);

            if (run.result.isDone()) {
                return;
            }
            if (!run.policy.isRetryable(cause)) {
                log.debug("{} 遇到不可重试的异常，直接失败: {}", run.name, TextUtils.describe(cause));
                run.result.completeExceptionally(cause);
                return;
            }
            if (attempt >= run.policy.getMaxRetries()) {
                log.error("{} 重试耗尽 (共尝试 {} 次): {}",
                        run.name, attempt + 1, TextUtils.truncate(TextUtils.describe(cause), 200));
                run.result.completeExceptionally(cause);
                return;
            }

            Duration delay = run.backoff.delayFor(attempt);
            log.warn("{} 第 {}/{} 次重试，等待 {} ms: {}", run.name, attempt + 1,
                    run.policy.getMaxRetries(), delay.toMillis(),
                    TextUtils.truncate(TextUtils.describe(cause), 200));

            CompletableFuture<Void> sleep = sleeper.sleep(delay);
            track(run, sleep);
            sleep.whenComplete((ignored, sleepError) -> {
                if (sleepError != null) {
                    run.result.completeExceptionally(ExceptionUtils.unwrap(sleepError));
                    return;
                }
                attempt(run, attempt + 1);
            });
        });
    }

    /**
     * 记录当前进行中的 Future；若调用方已经取消，立即取消它。
     */
    private <T> void track(Run<T> run, Future<?> current) {
        run.pending.set(current);
        if (run.result.isCancelled()) {
            current.cancel(true);
        }
    }

    private static final class Run<T> {
        private final String name;
        private final Supplier<? extends CompletionStage<T>> operation;
        private final RetryPolicy policy;
        private final BackoffPolicy backoff;
        private final CompletableFuture<T> result;
        private final AtomicReference<Future<?>> pending;

        private Run(String name, Supplier<? extends CompletionStage<T>> operation, RetryPolicy policy,
                    BackoffPolicy backoff, CompletableFuture<T> result, AtomicReference<Future<?>> pending) {
            this.name = name;
            this.operation = operation;
            this.policy = policy;
            this.backoff = backoff;
            this.result = result;
            this.pending = pending;
        }
    }
}
