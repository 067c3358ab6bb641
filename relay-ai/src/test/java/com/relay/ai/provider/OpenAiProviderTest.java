package com.relay.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.ai.config.AiProperties;
import com.relay.common.dto.AnalysisResult;
import com.relay.common.exception.ErrorKind;
import com.relay.common.exception.FatalProviderException;
import com.relay.common.exception.RetryableProviderException;
import com.relay.common.exception.UpstreamRateLimitedException;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiProviderTest {

    private static final String OK_BODY = "{"
            + "\"model\":\"gpt-4o-2024-08-06\","
            + "\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"根因是超时\"}}],"
            + "\"usage\":{\"prompt_tokens\":120,\"completion_tokens\":30}"
            + "}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private AiProperties properties;
    private OpenAiProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        properties = new AiProperties();
        properties.getOpenai().setBaseUrl(server.url("/v1").toString());
        properties.getOpenai().setApiKey("sk-test-openai-key");

        OkHttpClient client = new OkHttpClient.Builder().callTimeout(Duration.ofSeconds(5)).build();
        provider = new OpenAiProvider(client, properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void successfulResponseIsParsedWithUsage() throws Exception {
        server.enqueue(new MockResponse().setBody(OK_BODY));

        AnalysisResult result = provider.analyze("你是测试分析助手", "分析这个失败").get(5, TimeUnit.SECONDS);

        assertThat(result.getContent()).isEqualTo("根因是超时");
        assertThat(result.getInputTokens()).isEqualTo(120);
        assertThat(result.getOutputTokens()).isEqualTo(30);
        assertThat(result.getModel()).isEqualTo("gpt-4o-2024-08-06");
        assertThat(result.getProvider()).isEqualTo("openai");

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test-openai-key");

        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o");
        assertThat(body.path("messages").path(0).path("role").asText()).isEqualTo("system");
        assertThat(body.path("messages").path(1).path("content").asText()).isEqualTo("分析这个失败");
    }

    @Test
    void serverErrorIsRetryable() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("upstream unavailable"));

        Throwable error = failureOf(provider.analyze(null, "hi"));

        assertThat(error).isInstanceOf(RetryableProviderException.class);
        assertThat(((RetryableProviderException) error).getStatusCode()).isEqualTo(503);
        assertThat(((RetryableProviderException) error).getProvider()).isEqualTo("openai");
        assertThat(error.getMessage()).contains("503").contains("upstream unavailable");
    }

    @Test
    void tooManyRequestsCarriesRetryAfter() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "7"));

        Throwable error = failureOf(provider.analyze(null, "hi"));

        assertThat(error).isInstanceOf(UpstreamRateLimitedException.class);
        assertThat(((UpstreamRateLimitedException) error).getRetryAfterSeconds()).isEqualTo(7L);
        assertThat(ErrorKind.of(error)).isEqualTo(ErrorKind.RETRYABLE);
    }

    @Test
    void authenticationFailureIsFatal() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"invalid api key\"}"));

        Throwable error = failureOf(provider.analyze(null, "hi"));

        assertThat(error).isInstanceOf(FatalProviderException.class);
        assertThat(((FatalProviderException) error).getStatusCode()).isEqualTo(401);
    }

    @Test
    void malformedBodyIsFatal() {
        server.enqueue(new MockResponse().setBody("<html>not json</html>"));

        assertThat(failureOf(provider.analyze(null, "hi"))).isInstanceOf(FatalProviderException.class);
    }

    @Test
    void emptyContentIsFatal() {
        server.enqueue(new MockResponse().setBody("{\"choices\":[{\"message\":{\"content\":\"\"}}]}"));

        assertThat(failureOf(provider.analyze(null, "hi")))
                .isInstanceOf(FatalProviderException.class)
                .hasMessageContaining("空内容");
    }

    @Test
    void droppedConnectionIsRetryable() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

        assertThat(failureOf(provider.analyze(null, "hi"))).isInstanceOf(RetryableProviderException.class);
    }

    @Test
    void missingApiKeyFailsWithoutNetworkCall() {
        properties.getOpenai().setApiKey("  ");

        Throwable error = failureOf(provider.analyze(null, "hi"));

        assertThat(error).isInstanceOf(FatalProviderException.class).hasMessageContaining("API Key");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void configuredStateFollowsApiKey() {
        assertThat(provider.isConfigured()).isTrue();

        properties.getOpenai().setApiKey("");

        assertThat(provider.isConfigured()).isFalse();
    }

    static Throwable failureOf(CompletableFuture<?> future) {
        return future.handle((result, error) -> error)
                .orTimeout(5, TimeUnit.SECONDS)
                .join();
    }
}
