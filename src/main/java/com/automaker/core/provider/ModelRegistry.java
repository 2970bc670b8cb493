package com.automaker.core.provider;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Expands model aliases and classifies model ids by vendor family.
 */
public final class ModelRegistry {

    private static final Map<String, String> CLAUDE_ALIASES = Map.of(
            "haiku", "claude-haiku-4-5",
            "sonnet", "claude-sonnet-4-20250514",
            "opus", "claude-opus-4-5-20251101");

    private static final Map<String, String> CODEX_ALIASES = Map.of(
            "codex", "gpt-5-codex");

    private static final Pattern CODEX_ID = Pattern.compile("^(gpt-|o\\d|codex-).*");

    private ModelRegistry() {}

    /**
     * @throws ProviderConfigurationException if the id is blank or matches no known family
     */
    public static ResolvedModel resolve(String modelOrAlias) {
        if (modelOrAlias == null || modelOrAlias.isBlank()) {
            throw new ProviderConfigurationException("No model configured",
                    ProviderConfigurationException.CONFIGURATION);
        }
        String key = modelOrAlias.trim().toLowerCase(Locale.ROOT);
        if (CLAUDE_ALIASES.containsKey(key)) {
            return new ResolvedModel(modelOrAlias, CLAUDE_ALIASES.get(key), ModelFamily.CLAUDE);
        }
        if (CODEX_ALIASES.containsKey(key)) {
            return new ResolvedModel(modelOrAlias, CODEX_ALIASES.get(key), ModelFamily.CODEX);
        }
        return new ResolvedModel(modelOrAlias, modelOrAlias.trim(), familyOf(key));
    }

    /**
     * Family of a concrete model id: {@code claude-*} is Claude; {@code gpt-*}, {@code o<digit>*}
     * and {@code codex-*} are Codex.
     */
    public static ModelFamily familyOf(String modelId) {
        String id = modelId.toLowerCase(Locale.ROOT);
        if (id.startsWith("claude-")) {
            return ModelFamily.CLAUDE;
        }
        if (CODEX_ID.matcher(id).matches()) {
            return ModelFamily.CODEX;
        }
        throw new ProviderConfigurationException("Unknown model '" + modelId
                + "': expected a claude-* or gpt-*/o*/codex-* model id, or one of the aliases haiku, sonnet, opus, codex",
                ProviderConfigurationException.CONFIGURATION);
    }
}
