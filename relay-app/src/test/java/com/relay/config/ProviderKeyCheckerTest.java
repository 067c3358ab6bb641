package com.relay.config;

import com.relay.ai.config.AiProperties;
import com.relay.ai.provider.ProviderHandle;
import com.relay.ai.provider.ProviderRegistry;
import com.relay.common.exception.RelayException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProviderKeyCheckerTest {

    private final AiProperties properties = new AiProperties();

    @Test
    void reportsUnconfiguredProvidersInChainOrder() {
        ProviderRegistry registry = new ProviderRegistry(List.of(
                handle("anthropic", true), handle("openai", false), handle("google", false)));
        properties.setProviders(List.of("google", "anthropic", "openai"));

        assertThat(new ProviderKeyChecker(properties, registry).missingKeys()).containsExactly("google", "openai");
    }

    @Test
    void newProviderNeedsNoChangeHere() {
        ProviderRegistry registry = new ProviderRegistry(List.of(handle("mistral", false)));
        properties.setProviders(List.of("Mistral"));

        assertThat(new ProviderKeyChecker(properties, registry).missingKeys()).containsExactly("Mistral");
    }

    @Test
    void unknownProviderNameFailsThroughRegistry() {
        ProviderRegistry registry = new ProviderRegistry(List.of(handle("anthropic", true)));
        properties.setProviders(List.of("anthropic", "cohere"));

        assertThatThrownBy(() -> new ProviderKeyChecker(properties, registry).missingKeys())
                .isInstanceOf(RelayException.class)
                .hasMessageContaining("cohere");
    }

    @Test
    void runToleratesEmptyResult() {
        ProviderRegistry registry = new ProviderRegistry(List.of(handle("anthropic", true)));
        properties.setProviders(List.of("anthropic"));

        ProviderKeyChecker checker = new ProviderKeyChecker(properties, registry);
        checker.run();

        assertThat(checker.missingKeys()).isEmpty();
    }

    private static ProviderHandle handle(String name, boolean configured) {
        ProviderHandle handle = mock(ProviderHandle.class);
        when(handle.getName()).thenReturn(name);
        when(handle.isConfigured()).thenReturn(configured);
        return handle;
    }
}
