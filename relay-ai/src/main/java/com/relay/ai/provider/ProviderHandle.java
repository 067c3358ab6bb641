package com.relay.ai.provider;

import com.relay.common.dto.AnalysisResult;

import java.util.concurrent.CompletableFuture;

/**
 * AI 推理提供商接口。
 * <p>
 * 实现方负责把各自的原生错误翻译成统一分类：
 * {@link com.relay.common.exception.RetryableProviderException} 或
 * {@link com.relay.common.exception.FatalProviderException}。
 * 重试执行器依赖这个分类决定是否重试；路由器对任何提供商异常都会降级。
 */
public interface ProviderHandle {

    /**
     * 提供商名称，如 anthropic / openai / google。
     */
    String getName();

    /**
     * 异步发起一次分析请求。取消返回的 Future 会中止底层 HTTP 调用。
     *
     * @param systemPrompt 系统提示词，可为空
     * @param userPrompt   用户提示词
     */
    CompletableFuture<AnalysisResult> analyze(String systemPrompt, String userPrompt);

    /**
     * 是否具备发起调用所需的配置（如 API Key）。未配置的提供商仍可留在降级链上，调用时直接失败。
     */
    default boolean isConfigured() {
        return true;
    }
}
