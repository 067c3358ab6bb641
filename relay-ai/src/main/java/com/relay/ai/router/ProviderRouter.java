package com.relay.ai.router;

import com.relay.ai.provider.ProviderHandle;
import com.relay.common.dto.AnalysisResult;
import com.relay.common.exception.AllProvidersFailedException;
import com.relay.common.exception.ProviderAttempt;
import com.relay.common.exception.ProviderException;
import com.relay.common.util.ExceptionUtils;
import com.relay.common.util.TextUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * 多提供商降级路由。
 * <p>
 * 按降级链顺序逐个尝试，严格串行，不会并发探测多个提供商：
 * <ul>
 *   <li>成功：立即返回，不再尝试后续提供商</li>
 *   <li>提供商边界上的失败（{@link ProviderException}：网络错误、任意非 2xx 响应、上游限流、未配置 API Key）：
 *       记录后尝试下一个</li>
 *   <li>其他失败（参数错误、编程错误）：立即抛出，不再尝试后续提供商</li>
 * </ul>
 * 是否降级与是否重试是两件事：4xx 不值得在同一个提供商上重试，但换一个提供商可能成功。
 * 全部失败时抛出 {@link AllProvidersFailedException}，按顺序携带每个提供商的失败原因。
 * <p>
 * 路由器本身不做重试；需要"先重试再降级"时用 {@link RetryingProvider} 包装链上的提供商。
 */
@Slf4j
public class ProviderRouter {

    private static final int MAX_ERROR_LOG_LENGTH = 200;

    private final RouterChain chain;
    private final Predicate<Throwable> recoverable;

    public ProviderRouter(RouterChain chain) {
        this(chain, ProviderRouter::isProviderFailure);
    }

    /**
     * @param recoverable 判断某个失败是否触发降级
     */
    public ProviderRouter(RouterChain chain, Predicate<Throwable> recoverable) {
        if (chain == null) {
            throw new IllegalArgumentException("chain 不能为空");
        }
        this.chain = chain;
        this.recoverable = recoverable;
    }

    public RouterChain getChain() {
        return chain;
    }

    /**
     * 默认的降级判断：失败来自提供商边界。
     */
    public static boolean isProviderFailure(Throwable error) {
        return ExceptionUtils.unwrap(error) instanceof ProviderException;
    }

    /**
     * 使用降级链分析。取消返回的 Future 会中止当前提供商的调用，且不再尝试后续提供商。
     *
     * @param userPrompt   用户提示词
     * @param systemPrompt 系统提示词，可为空
     */
    public CompletableFuture<AnalysisResult> analyze(String userPrompt, String systemPrompt) {
        CompletableFuture<AnalysisResult> result = new CompletableFuture<>();
        AtomicReference<CompletableFuture<AnalysisResult>> inFlight = new AtomicReference<>();

        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                CompletableFuture<AnalysisResult> current = inFlight.get();
                if (current != null) {
                    current.cancel(true);
                }
            }
        });

        tryProvider(0, userPrompt, systemPrompt, new ArrayList<>(), result, inFlight);
        return result;
    }

    private void tryProvider(int index, String userPrompt, String systemPrompt,
                             List<ProviderAttempt> attempts,
                             CompletableFuture<AnalysisResult> result,
                             AtomicReference<CompletableFuture<AnalysisResult>> inFlight) {
        if (result.isDone()) {
            return;
        }
        ProviderHandle provider = chain.get(index);
        log.info("尝试 AI 提供商 [{}/{}]: {}", index + 1, chain.size(), provider.getName());

        CompletableFuture<AnalysisResult> call;
        try {
            call = provider.analyze(systemPrompt, userPrompt);
        } catch (Exception e) {
            call = CompletableFuture.failedFuture(e);
        }
        inFlight.set(call);
        if (result.isCancelled()) {
            call.cancel(true);
        }

        call.whenComplete((analysis, error) -> {
            if (error == null) {
                log.info("AI 提供商 {} 调用成功: inputTokens={}, outputTokens={}",
                        provider.getName(), analysis.getInputTokens(), analysis.getOutputTokens());
                result.complete(analysis);
                return;
            }
            Throwable cause = ExceptionUtils.unwrap(error);
            if (result.isDone()) {
                return;
            }
            if (!recoverable.test(cause)) {
                log.warn("AI 提供商 {} 调用出现非提供商错误，停止降级: {}", provider.getName(),
                        TextUtils.truncate(TextUtils.describe(cause), MAX_ERROR_LOG_LENGTH));
                result.completeExceptionally(cause);
                return;
            }

            attempts.add(new ProviderAttempt(provider.getName(), cause));
            if (index + 1 < chain.size()) {
                log.warn("AI 提供商 {} 调用失败，降级到 {}: {}", provider.getName(),
                        chain.get(index + 1).getName(),
                        TextUtils.truncate(TextUtils.describe(cause), MAX_ERROR_LOG_LENGTH));
                tryProvider(index + 1, userPrompt, systemPrompt, attempts, result, inFlight);
                return;
            }

            log.error("所有 AI 提供商均调用失败: providers={}, lastError={}", chain.names(),
                    TextUtils.truncate(TextUtils.describe(cause), MAX_ERROR_LOG_LENGTH));
            result.completeExceptionally(new AllProvidersFailedException(attempts));
        });
    }
}
