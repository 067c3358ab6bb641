package com.relay.ai.provider;

import com.relay.ai.router.RouterChain;
import com.relay.common.exception.RelayException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AI 提供商注册表，按名称查找 Provider 并组装降级链。
 */
@Component
@RequiredArgsConstructor
public class ProviderRegistry {

    private final List<ProviderHandle> providers;

    /**
     * 根据名称获取指定的提供商（不区分大小写）。
     */
    public ProviderHandle getProvider(String providerName) {
        return providers.stream()
                .filter(p -> p.getName().equalsIgnoreCase(providerName))
                .findFirst()
                .orElseThrow(() -> new RelayException("PROVIDER_NOT_FOUND",
                        "未找到 AI 提供商: " + providerName + "，可选: " + availableNames()));
    }

    /**
     * 按给定顺序组装降级链。
     */
    public RouterChain chainOf(List<String> providerNames) {
        return RouterChain.of(providerNames.stream()
                .map(this::getProvider)
                .collect(Collectors.toList()));
    }

    public List<String> availableNames() {
        return providers.stream().map(ProviderHandle::getName).collect(Collectors.toList());
    }
}
