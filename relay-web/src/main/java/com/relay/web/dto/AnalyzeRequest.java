package com.relay.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 分析请求。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequest {

    /** 系统提示词（可选） */
    private String systemPrompt;

    /** 用户提示词 */
    private String userPrompt;
}
