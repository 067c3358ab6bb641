package com.relay.dispatcher.ratelimit;

import com.relay.common.util.TextUtils;
import com.relay.dispatcher.clock.Clock;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于内存的滑动窗口限流器。
 * <p>
 * 每个调用方维护一个时间戳队列和一把独立的锁：
 * <ul>
 *   <li>同一调用方的 admit 通过该锁完全串行化，"读计数-判断-追加"不会交错，不存在两个请求同时看到最后一个名额的情况</li>
 *   <li>不同调用方各用各的锁，互不阻塞</li>
 * </ul>
 * 条目在首次 admit 时懒创建，由 {@link #cleanupStaleEntries()} 定期回收。
 * 每个条目带引用计数，计数只在 {@link ConcurrentHashMap#compute} 内修改，
 * 因此清理时不会删掉一把仍被持有或等待中的锁。
 * <p>
 * 注意：
 * <ul>
 *   <li>仅适用于单进程部署，多实例需要共享的外部计数存储</li>
 *   <li>请求通过准入后即占用名额，即使随后被取消也不会归还</li>
 * </ul>
 */
@Slf4j
public class SlidingWindowLimiter implements RateLimiter {

    private final Clock clock;
    private final int limit;
    private final long windowMillis;

    /** callerKey -> 时间戳队列 + 锁 */
    private final Map<String, WindowEntry> windows = new ConcurrentHashMap<>();

    public SlidingWindowLimiter(Clock clock, int limit, int windowSeconds) {
        if (clock == null) {
            throw new IllegalArgumentException("clock 不能为空");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit 必须大于 0");
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds 必须大于 0");
        }
        this.clock = clock;
        this.limit = limit;
        this.windowMillis = windowSeconds * 1000L;
    }

    @Override
    public AdmissionDecision admit(String callerKey) {
        if (callerKey == null) {
            throw new IllegalArgumentException("callerKey 不能为空");
        }

        WindowEntry entry = retain(callerKey);
        try {
            entry.lock.lock();
            try {
                return decide(callerKey, entry);
            } finally {
                entry.lock.unlock();
            }
        } finally {
            release(callerKey, entry);
        }
    }

    /** 必须在持有 entry.lock 时调用 */
    private AdmissionDecision decide(String callerKey, WindowEntry entry) {
        long now = clock.nowMillis();
        entry.purgeUpTo(now - windowMillis);

        int count = entry.timestamps.size();
        boolean allowed = count < limit;
        if (allowed) {
            entry.timestamps.addLast(now);
        }

        long resetMillis = entry.timestamps.peekFirst() + windowMillis;
        int remaining = allowed ? limit - count - 1 : 0;
        long retryAfterSeconds = allowed ? 0 : Math.max(1, ceilSeconds(resetMillis - now));

        if (!allowed) {
            log.warn("调用方 {} 已达速率限制 ({}/{})，{} 秒后重置",
                    TextUtils.mask(callerKey), count, limit, retryAfterSeconds);
        }

        return AdmissionDecision.builder()
                .allowed(allowed)
                .limit(limit)
                .remaining(remaining)
                .resetEpochSeconds(ceilSeconds(resetMillis))
                .retryAfterSeconds(retryAfterSeconds)
                .build();
    }

    @Override
    public int cleanupStaleEntries() {
        long cutoff = clock.nowMillis() - windowMillis;
        int removed = 0;

        for (String key : windows.keySet()) {
            boolean[] stale = {false};
            windows.computeIfPresent(key, (k, entry) -> {
                // 仍有调用方持有或等待这把锁，跳过
                if (entry.refs > 0 || !entry.lock.tryLock()) {
                    return entry;
                }
                try {
                    entry.purgeUpTo(cutoff);
                    if (entry.timestamps.isEmpty()) {
                        stale[0] = true;
                        return null;
                    }
                    return entry;
                } finally {
                    entry.lock.unlock();
                }
            });
            if (stale[0]) {
                removed++;
            }
        }

        if (removed > 0) {
            log.debug("限流器清理完成，移除 {} 个过期调用方，剩余 {}", removed, windows.size());
        }
        return removed;
    }

    @Override
    public int trackedKeys() {
        return windows.size();
    }

    public int getLimit() {
        return limit;
    }

    /**
     * 取出（必要时创建）条目并增加引用计数，原子完成。
     */
    private WindowEntry retain(String callerKey) {
        return windows.compute(callerKey, (k, existing) -> {
            WindowEntry entry = existing != null ? existing : new WindowEntry();
            entry.refs++;
            return entry;
        });
    }

    private void release(String callerKey, WindowEntry entry) {
        windows.computeIfPresent(callerKey, (k, current) -> {
            if (current == entry) {
                current.refs--;
            }
            return current;
        });
    }

    private static long ceilSeconds(long millis) {
        return Math.floorDiv(millis + 999, 1000);
    }

    private static final class WindowEntry {

        /** 已准入请求的时间戳，按时间升序。仅在持有 lock 时读写 */
        private final Deque<Long> timestamps = new ArrayDeque<>();

        private final ReentrantLock lock = new ReentrantLock();

        /** 正在使用该条目的调用数。仅在 windows.compute 内读写 */
        private int refs;

        private void purgeUpTo(long cutoff) {
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
                timestamps.pollFirst();
            }
        }
    }
}
