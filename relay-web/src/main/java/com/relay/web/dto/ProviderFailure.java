package com.relay.web.dto;

import com.relay.common.exception.ProviderAttempt;
import com.relay.common.exception.RelayException;
import com.relay.common.util.TextUtils;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 降级链上某个提供商的失败摘要。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProviderFailure {

    private String provider;
    private String errorCode;
    private String message;

    public static ProviderFailure of(ProviderAttempt attempt) {
        Throwable error = attempt.getError();
        String code = error instanceof RelayException
                ? ((RelayException) error).getErrorCode()
                : error.getClass().getSimpleName();
        return new ProviderFailure(attempt.getProvider(), code, TextUtils.truncate(error.getMessage(), 200));
    }
}
