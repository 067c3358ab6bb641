package com.relay.ai.router;

import com.relay.ai.provider.ProviderHandle;

import java.util.Iterator;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * 有序、非空、不可变的提供商降级链，第一个为主提供商。
 */
public final class RouterChain implements Iterable<ProviderHandle> {

    private final List<ProviderHandle> providers;

    private RouterChain(List<ProviderHandle> providers) {
        this.providers = providers;
    }

    /**
     * @throws IllegalArgumentException 列表为空时
     */
    public static RouterChain of(List<? extends ProviderHandle> providers) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("降级链至少需要一个提供商");
        }
        return new RouterChain(List.copyOf(providers));
    }

    public static RouterChain of(ProviderHandle... providers) {
        return of(List.of(providers));
    }

    public ProviderHandle get(int index) {
        return providers.get(index);
    }

    public int size() {
        return providers.size();
    }

    public List<String> names() {
        return providers.stream().map(ProviderHandle::getName).collect(Collectors.toList());
    }

    /**
     * 返回每个提供商都经过 mapper 包装后的新链，顺序不变。
     */
    public RouterChain map(UnaryOperator<ProviderHandle> mapper) {
        return of(providers.stream().map(mapper).collect(Collectors.toList()));
    }

    @Override
    public Iterator<ProviderHandle> iterator() {
        return providers.iterator();
    }

    @Override
    public String toString() {
        return "RouterChain" + names();
    }
}
