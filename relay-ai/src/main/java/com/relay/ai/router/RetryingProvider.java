package com.relay.ai.router;

import com.relay.ai.provider.ProviderHandle;
import com.relay.common.dto.AnalysisResult;
import com.relay.dispatcher.retry.RetryExecutor;
import com.relay.dispatcher.retry.RetryPolicy;

import java.util.concurrent.CompletableFuture;

/**
 * 给单个提供商加上重试的装饰器。
 * <p>
 * 与 {@link ProviderRouter} 组合后的效果是：瞬时故障先在当前提供商上重试几次，
 * 持续失败才降级到下一个提供商。
 */
public class RetryingProvider implements ProviderHandle {

    private final ProviderHandle delegate;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy policy;

    public RetryingProvider(ProviderHandle delegate, RetryExecutor retryExecutor, RetryPolicy policy) {
        this.delegate = delegate;
        this.retryExecutor = retryExecutor;
        this.policy = policy;
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public CompletableFuture<AnalysisResult> analyze(String systemPrompt, String userPrompt) {
        return retryExecutor.execute(delegate.getName(),
                () -> delegate.analyze(systemPrompt, userPrompt), policy);
    }

    @Override
    public boolean isConfigured() {
        return delegate.isConfigured();
    }

    public ProviderHandle getDelegate() {
        return delegate;
    }
}
