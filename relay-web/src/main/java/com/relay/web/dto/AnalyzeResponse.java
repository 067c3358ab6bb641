package com.relay.web.dto;

import com.relay.common.dto.AnalysisResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 分析结果，附带 token 用量和费用估算。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeResponse {

    private String content;
    private String provider;
    private String model;
    private int inputTokens;
    private int outputTokens;
    private int totalTokens;

    /** 估算费用（美元） */
    private BigDecimal estimatedCostUsd;

    public static AnalyzeResponse of(AnalysisResult result, BigDecimal estimatedCostUsd) {
        return AnalyzeResponse.builder()
                .content(result.getContent())
                .provider(result.getProvider())
                .model(result.getModel())
                .inputTokens(result.getInputTokens())
                .outputTokens(result.getOutputTokens())
                .totalTokens(result.getTotalTokens())
                .estimatedCostUsd(estimatedCostUsd)
                .build();
    }
}
