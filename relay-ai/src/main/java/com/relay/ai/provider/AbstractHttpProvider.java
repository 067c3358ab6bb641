package com.relay.ai.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.ai.config.AiProperties;
import com.relay.common.dto.AnalysisResult;
import com.relay.common.exception.FatalProviderException;
import com.relay.common.exception.ProviderException;
import com.relay.common.exception.RetryableProviderException;
import com.relay.common.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * 基于 OkHttp 异步调用的提供商公共实现。
 * <p>
 * 子类只负责拼装请求和解析响应；网络错误、HTTP 状态码到异常分类的翻译、取消传播都在这里统一处理。
 */
@Slf4j
public abstract class AbstractHttpProvider implements ProviderHandle {

    protected static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    protected final OkHttpClient httpClient;
    protected final ObjectMapper objectMapper = new ObjectMapper();

    protected AbstractHttpProvider(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * 当前提供商的配置。
     */
    protected abstract AiProperties.ProviderConfig config();

    /**
     * 构建 HTTP 请求。
     */
    protected abstract Request buildRequest(AiProperties.ProviderConfig config,
                                            String systemPrompt, String userPrompt) throws IOException;

    /**
     * 解析成功响应。内容为空或结构不符时抛出 {@link FatalProviderException}。
     */
    protected abstract AnalysisResult parseResponse(JsonNode json, AiProperties.ProviderConfig config);

    @Override
    public boolean isConfigured() {
        return config().hasApiKey();
    }

    @Override
    public CompletableFuture<AnalysisResult> analyze(String systemPrompt, String userPrompt) {
        AiProperties.ProviderConfig config = config();
        if (!config.hasApiKey()) {
            return CompletableFuture.failedFuture(
                    new FatalProviderException(getName(), getName() + " 未配置 API Key"));
        }

        Request request;
        try {
            request = buildRequest(config, systemPrompt, userPrompt);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                    new FatalProviderException(getName(), "构建请求体失败", e));
        }

        log.debug("{} 发起请求: model={}, maxTokens={}", getName(), config.getModel(), config.getMaxTokens());
        return send(request, config);
    }

    private CompletableFuture<AnalysisResult> send(Request request, AiProperties.ProviderConfig config) {
        CompletableFuture<AnalysisResult> future = new CompletableFuture<>();
        Call call = httpClient.newCall(request);

        // 调用方取消时中止 HTTP 请求
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                call.cancel();
            }
        });

        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException e) {
                if (future.isDone()) {
                    return;
                }
                future.completeExceptionally(new RetryableProviderException(getName(),
                        "调用 " + getName() + " API 时发生网络错误: " + TextUtils.describe(e), e));
            }

            @Override
            public void onResponse(Call okCall, Response response) {
                try (response) {
                    ResponseBody responseBody = response.body();
                    String body = responseBody != null ? responseBody.string() : "";

                    if (!response.isSuccessful()) {
                        log.error("{} API 调用失败: {} - {}", getName(), response.code(),
                                TextUtils.truncate(body, 500));
                        future.completeExceptionally(ProviderErrors.fromStatus(
                                getName(), response.code(), body, response.header("Retry-After")));
                        return;
                    }

                    AnalysisResult result = parseResponse(objectMapper.readTree(body), config);
                    log.debug("{} 响应: inputTokens={}, outputTokens={}, 长度 {} 字符", getName(),
                            result.getInputTokens(), result.getOutputTokens(), result.getContent().length());
                    future.complete(result);

                } catch (ProviderException e) {
                    future.completeExceptionally(e);
                } catch (JsonProcessingException e) {
                    future.completeExceptionally(new FatalProviderException(getName(),
                            getName() + " 返回了无法解析的响应", e));
                } catch (IOException e) {
                    future.completeExceptionally(new RetryableProviderException(getName(),
                            "读取 " + getName() + " 响应时发生网络错误: " + TextUtils.describe(e), e));
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                }
            }
        });
        return future;
    }

    protected FatalProviderException emptyContent() {
        return new FatalProviderException(getName(), getName() + " API 返回空内容");
    }
}
