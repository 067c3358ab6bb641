package com.relay.web.controller;

import com.relay.ai.router.ProviderRouter;
import com.relay.common.dto.ApiResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 健康检查。路径不在 /api 下，不受限流拦截器影响，也不会调用任何上游提供商。
 */
@RestController
public class HealthController {

    private final ProviderRouter providerRouter;
    private final String version;

    public HealthController(ProviderRouter providerRouter,
                            @Value("${relay.version:1.0.0}") String version) {
        this.providerRouter = providerRouter;
        this.version = version;
    }

    @GetMapping("/health")
    public ApiResponse<Map<String, Object>> health() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", "healthy");
        data.put("version", version);
        data.put("providers", providerRouter.getChain().names());
        return ApiResponse.ok(data);
    }
}
