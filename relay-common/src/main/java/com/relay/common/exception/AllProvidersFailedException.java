package com.relay.common.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 降级链上的所有提供商都失败了。按尝试顺序携带每个提供商的失败原因，便于排查。
 */
public class AllProvidersFailedException extends RelayException {

    private final List<ProviderAttempt> attempts;

    public AllProvidersFailedException(List<ProviderAttempt> attempts) {
        super("ALL_PROVIDERS_FAILED", describe(attempts),
                attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).getError());
        this.attempts = List.copyOf(attempts);
    }

    public List<ProviderAttempt> getAttempts() {
        return attempts;
    }

    private static String describe(List<ProviderAttempt> attempts) {
        return "所有 AI 提供商均调用失败: " + attempts.stream()
                .map(ProviderAttempt::getProvider)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
