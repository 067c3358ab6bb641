package com.relay.dispatcher.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * 非阻塞等待。返回的 Future 在指定时间后完成；取消它即放弃本次等待。
 */
@FunctionalInterface
public interface Sleeper {

    CompletableFuture<Void> sleep(Duration duration);

    /**
     * 基于 {@link CompletableFuture#delayedExecutor} 的实现，等待期间不占用线程。
     */
    static Sleeper delayed() {
        return duration -> CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(duration.toMillis(), TimeUnit.MILLISECONDS));
    }
}
