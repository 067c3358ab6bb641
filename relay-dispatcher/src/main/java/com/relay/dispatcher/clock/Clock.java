package com.relay.dispatcher.clock;

/**
 * 时间源。限流器通过注入时间源获取当前时间，测试中可替换为手动时钟。
 */
public interface Clock {

    /**
     * 当前时间（epoch 毫秒）。
     */
    long nowMillis();
}
