package com.relay.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AI 提供商的统一分析结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {

    /** 模型输出的文本 */
    private String content;

    /** 输入 Token 数 */
    private int inputTokens;

    /** 输出 Token 数 */
    private int outputTokens;

    /** 实际使用的模型 */
    private String model;

    /** 提供商: anthropic / openai / google */
    private String provider;

    @JsonIgnore
    public int getTotalTokens() {
        return inputTokens + outputTokens;
    }
}
