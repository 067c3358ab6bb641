package com.relay.dispatcher.clock;

/**
 * 系统时钟，基于 {@link System#currentTimeMillis()}。
 */
public final class SystemClock implements Clock {

    private static final SystemClock INSTANCE = new SystemClock();

    private SystemClock() {
    }

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowMillis() {
        return System.currentTimeMillis();
    }
}
