package com.relay.ai.provider;

import com.relay.common.exception.ErrorKind;
import com.relay.common.exception.FatalProviderException;
import com.relay.common.exception.RetryableProviderException;
import com.relay.common.exception.UpstreamRateLimitedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderErrorsTest {

    @ParameterizedTest
    @CsvSource({
            "408, RETRYABLE",
            "429, RETRYABLE",
            "500, RETRYABLE",
            "502, RETRYABLE",
            "529, RETRYABLE",
            "400, FATAL",
            "401, FATAL",
            "403, FATAL",
            "404, FATAL",
            "422, FATAL"
    })
    void statusCodeDeterminesKind(int status, ErrorKind expected) {
        assertThat(ErrorKind.of(ProviderErrors.fromStatus("openai", status, "", null))).isEqualTo(expected);
    }

    @Test
    void typesMatchCategory() {
        assertThat(ProviderErrors.fromStatus("openai", 429, "", "3")).isInstanceOf(UpstreamRateLimitedException.class);
        assertThat(ProviderErrors.fromStatus("openai", 503, "", null)).isInstanceOf(RetryableProviderException.class);
        assertThat(ProviderErrors.fromStatus("openai", 401, "", null)).isInstanceOf(FatalProviderException.class);
    }

    @Test
    void longBodyIsTruncatedInMessage() {
        String body = "x".repeat(1000);

        assertThat(ProviderErrors.fromStatus("openai", 500, body, null).getMessage().length()).isLessThan(300);
    }

    @Test
    void retryAfterParsing() {
        assertThat(ProviderErrors.parseRetryAfter("12")).isEqualTo(12L);
        assertThat(ProviderErrors.parseRetryAfter(" 5 ")).isEqualTo(5L);
        assertThat(ProviderErrors.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT")).isNull();
        assertThat(ProviderErrors.parseRetryAfter(null)).isNull();
    }
}
