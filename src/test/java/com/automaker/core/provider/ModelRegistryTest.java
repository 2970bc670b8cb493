package com.automaker.core.provider;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelRegistryTest {

    @Test
    void aliasesExpandToConcreteIds() {
        assertEquals("claude-opus-4-5-20251101", ModelRegistry.resolve("opus").modelId());
        assertEquals("claude-haiku-4-5", ModelRegistry.resolve("Haiku").modelId());
        ResolvedModel codex = ModelRegistry.resolve("codex");
        assertEquals("gpt-5-codex", codex.modelId());
        assertEquals(ModelFamily.CODEX, codex.family());
        assertEquals("codex", codex.requested());
    }

    @Test
    void concreteIdsAreClassifiedByPrefix() {
        assertEquals(ModelFamily.CLAUDE, ModelRegistry.familyOf("claude-sonnet-4-20250514"));
        assertEquals(ModelFamily.CODEX, ModelRegistry.familyOf("gpt-5"));
        assertEquals(ModelFamily.CODEX, ModelRegistry.familyOf("o3-mini"));
        assertEquals(ModelFamily.CODEX, ModelRegistry.familyOf("codex-mini-latest"));
    }

    @Test
    void unknownModelIsAConfigurationError() {
        var ex = assertThrows(ProviderConfigurationException.class, () -> ModelRegistry.resolve("llama-3"));
        assertEquals(ProviderConfigurationException.CONFIGURATION, ex.getErrorType());
        assertTrue(ex.getMessage().contains("llama-3"));
    }

    @Test
    void blankModelIsRejected() {
        assertThrows(ProviderConfigurationException.class, () -> ModelRegistry.resolve(" "));
        assertThrows(ProviderConfigurationException.class, () -> ModelRegistry.resolve(null));
    }

    @Test
    void onlyClaudeModelsSupportThinking() {
        assertTrue(ModelRegistry.resolve("sonnet").supportsThinking());
        assertFalse(ModelRegistry.resolve("gpt-5").supportsThinking());
    }
}
