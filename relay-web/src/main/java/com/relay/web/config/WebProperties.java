package com.relay.web.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Web 模块配置项。
 */
@Data
@ConfigurationProperties(prefix = "relay.web")
public class WebProperties {

    /** 标识调用方的请求头，缺失时退回客户端地址 */
    private String apiKeyHeader = "X-API-Key";

    /** 需要限流的路径（Ant 风格） */
    private List<String> rateLimitedPaths = new ArrayList<>(List.of("/api/**"));
}
