package com.relay.web.controller;

import com.relay.ai.pricing.CostCalculator;
import com.relay.ai.router.ProviderRouter;
import com.relay.common.dto.ApiResponse;
import com.relay.common.exception.InvalidRequestException;
import com.relay.web.dto.AnalyzeRequest;
import com.relay.web.dto.AnalyzeResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * AI 分析 REST API 控制器。
 * <p>
 * 请求先经过限流拦截器，再交给 {@link ProviderRouter} 按降级链调用。结果异步返回，
 * 等待上游期间不占用 Servlet 线程。
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalyzeController {

    private final ProviderRouter providerRouter;
    private final CostCalculator costCalculator;

    /**
     * 分析一段文本。
     *
     * @param request userPrompt 必填，systemPrompt 可选
     */
    @PostMapping("/analyze")
    public CompletableFuture<ApiResponse<AnalyzeResponse>> analyze(@RequestBody AnalyzeRequest request) {
        if (request.getUserPrompt() == null || request.getUserPrompt().isBlank()) {
            throw new InvalidRequestException("userPrompt 不能为空");
        }

        log.info("收到分析请求: userPrompt {} 字符, systemPrompt {}",
                request.getUserPrompt().length(), request.getSystemPrompt() != null ? "已提供" : "无");

        return providerRouter.analyze(request.getUserPrompt(), request.getSystemPrompt())
                .thenApply(result -> {
                    AnalyzeResponse response = AnalyzeResponse.of(result, costCalculator.estimate(result));
                    log.info("分析完成: provider={}, model={}, totalTokens={}, 估算费用 ${}",
                            response.getProvider(), response.getModel(),
                            response.getTotalTokens(), response.getEstimatedCostUsd());
                    return ApiResponse.ok(response);
                });
    }
}
