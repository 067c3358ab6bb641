package com.relay.web.controller;

import com.relay.ai.pricing.CostCalculator;
import com.relay.ai.router.ProviderRouter;
import com.relay.common.dto.AnalysisResult;
import com.relay.common.exception.AllProvidersFailedException;
import com.relay.common.exception.FatalProviderException;
import com.relay.common.exception.ProviderAttempt;
import com.relay.common.exception.RetryableProviderException;
import com.relay.common.exception.UpstreamRateLimitedException;
import com.relay.dispatcher.ratelimit.SlidingWindowLimiter;
import com.relay.web.config.WebProperties;
import com.relay.web.filter.RequestIdFilter;
import com.relay.web.interceptor.CallerKeyResolver;
import com.relay.web.interceptor.RateLimitInterceptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AnalyzeControllerTest {

    private static final long NOW_MILLIS = 1_700_000_000_000L;
    private static final String BODY = "{\"systemPrompt\":\"你是测试分析助手\",\"userPrompt\":\"为什么这个测试失败了？\"}";

    @Mock
    private ProviderRouter providerRouter;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        SlidingWindowLimiter limiter = new SlidingWindowLimiter(() -> NOW_MILLIS, 2, 60);
        RateLimitInterceptor interceptor = new RateLimitInterceptor(limiter, new CallerKeyResolver(new WebProperties()));

        mockMvc = MockMvcBuilders.standaloneSetup(new AnalyzeController(providerRouter, new CostCalculator()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addInterceptors(interceptor)
                .addFilters(new RequestIdFilter())
                .build();
    }

    @Test
    void successfulAnalysisCarriesUsageCostAndRateLimitHeaders() throws Exception {
        when(providerRouter.analyze(eq("为什么这个测试失败了？"), eq("你是测试分析助手")))
                .thenReturn(CompletableFuture.completedFuture(AnalysisResult.builder()
                        .content("断言写反了")
                        .provider("openai")
                        .model("gpt-4o")
                        .inputTokens(1000)
                        .outputTokens(500)
                        .build()));

        MvcResult started = perform("caller-key-1")
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(header().string("X-RateLimit-Limit", "2"))
                .andExpect(header().string("X-RateLimit-Remaining", "1"))
                .andExpect(header().string("X-RateLimit-Reset", "1700000060"))
                .andExpect(header().doesNotExist("Retry-After"))
                .andExpect(header().exists(RequestIdFilter.HEADER))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.content").value("断言写反了"))
                .andExpect(jsonPath("$.data.provider").value("openai"))
                .andExpect(jsonPath("$.data.totalTokens").value(1500))
                .andExpect(jsonPath("$.data.estimatedCostUsd").isNumber());
    }

    @Test
    void exhaustedCallerGets429WithRetryAfter() throws Exception {
        when(providerRouter.analyze(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(AnalysisResult.builder().content("ok").build()));

        perform("caller-key-2").andExpect(request().asyncStarted());
        perform("caller-key-2").andExpect(request().asyncStarted());

        perform("caller-key-2")
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("X-RateLimit-Limit", "2"))
                .andExpect(header().string("X-RateLimit-Remaining", "0"))
                .andExpect(header().string("X-RateLimit-Reset", "1700000060"))
                .andExpect(header().string("Retry-After", "60"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("RATE_LIMITED"));
    }

    @Test
    void callersAreLimitedIndependently() throws Exception {
        when(providerRouter.analyze(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(AnalysisResult.builder().content("ok").build()));

        perform("caller-a").andExpect(request().asyncStarted());
        perform("caller-a").andExpect(request().asyncStarted());

        perform("caller-b")
                .andExpect(request().asyncStarted())
                .andExpect(header().string("X-RateLimit-Remaining", "1"));
    }

    @Test
    void blankPromptIsRejectedWithoutCallingProviders() throws Exception {
        mockMvc.perform(post("/api/v1/analyze")
                        .header("X-API-Key", "caller-key-3")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userPrompt\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(header().string("X-RateLimit-Remaining", "1"))
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        verify(providerRouter, never()).analyze(any(), any());
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    void allProvidersFailedIsServiceUnavailableWithAttempts() throws Exception {
        AllProvidersFailedException failure = new AllProvidersFailedException(List.of(
                new ProviderAttempt("anthropic", new RetryableProviderException("anthropic", 529, "overloaded")),
                new ProviderAttempt("openai", new UpstreamRateLimitedException("openai", 30L, "429"))));
        when(providerRouter.analyze(any(), any())).thenReturn(CompletableFuture.failedFuture(failure));

        MvcResult started = perform("caller-key-4").andExpect(request().asyncStarted()).andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("ALL_PROVIDERS_FAILED"))
                .andExpect(jsonPath("$.data[0].provider").value("anthropic"))
                .andExpect(jsonPath("$.data[0].errorCode").value("PROVIDER_RETRYABLE"))
                .andExpect(jsonPath("$.data[1].provider").value("openai"))
                .andExpect(jsonPath("$.data[1].errorCode").value("UPSTREAM_RATE_LIMITED"));
    }

    @Test
    void fatalProviderErrorIsBadGateway() throws Exception {
        when(providerRouter.analyze(any(), any())).thenReturn(CompletableFuture.failedFuture(
                new FatalProviderException("anthropic", 401, "anthropic 鉴权失败，请检查 API Key: 401")));

        MvcResult started = perform("caller-key-5").andExpect(request().asyncStarted()).andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("PROVIDER_FATAL"));
    }

    private ResultActions perform(String apiKey) throws Exception {
        return mockMvc.perform(post("/api/v1/analyze")
                .header("X-API-Key", apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY));
    }
}
