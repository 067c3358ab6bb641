package com.relay.dispatcher.ratelimit;

/**
 * 调用方准入控制接口。
 * <p>
 * 当前只有单进程的 {@link SlidingWindowLimiter} 实现；多实例部署需要共享的外部计数存储，不在本模块范围内。
 */
public interface RateLimiter {

    /**
     * 判断调用方本次请求是否准入。准入时会占用当前窗口内的一个名额。
     *
     * @param callerKey 调用方标识（API Key 或 IP）
     * @return 准入结果及响应头所需的配额信息
     */
    AdmissionDecision admit(String callerKey);

    /**
     * 清理窗口内已无记录的调用方，返回被清理的 Key 数量。
     */
    int cleanupStaleEntries();

    /**
     * 当前跟踪的调用方数量。
     */
    int trackedKeys();
}
