package com.relay.common.exception;

import lombok.Value;

/**
 * 一次提供商尝试的失败记录。
 */
@Value
public class ProviderAttempt {

    /** 提供商名称 */
    String provider;

    /** 该提供商最终抛出的异常（已剥掉包装层） */
    Throwable error;
}
