package com.automaker.core.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Selects the provider for a feature from its model (and optional explicit provider), and
 * rejects model ids that belong to a different vendor family than the chosen provider.
 */
public class AgentProviderFactory {

    private static final Logger log = LoggerFactory.getLogger(AgentProviderFactory.class);

    private final Map<String, AgentProvider> providersByName;
    private final String defaultModel;

    public AgentProviderFactory(List<AgentProvider> providers, String defaultModel) {
        this.providersByName = providers.stream()
                .collect(Collectors.toMap(AgentProvider::name, Function.identity()));
        this.defaultModel = defaultModel;
    }

    /** A provider paired with the model it will run. */
    public record Selection(AgentProvider provider, ResolvedModel model) {}

    /**
     * @param providerName explicit provider name, or null to derive it from the model family
     * @param model        model id or alias, or null for the configured default
     * @throws ProviderConfigurationException for unknown models or providers, or a family mismatch
     */
    public Selection select(String providerName, String model) {
        ResolvedModel resolved = ModelRegistry.resolve(model == null || model.isBlank() ? defaultModel : model);
        AgentProvider provider;
        if (providerName != null && !providerName.isBlank()) {
            provider = providersByName.get(providerName.trim().toLowerCase(Locale.ROOT));
            if (provider == null) {
                throw new ProviderConfigurationException(
                        "Unknown provider '%s'; available: %s".formatted(providerName, providersByName.keySet()),
                        ProviderConfigurationException.CONFIGURATION);
            }
        } else {
            provider = providersByName.get(resolved.family().providerName());
            if (provider == null) {
                throw new ProviderConfigurationException(
                        "No provider registered for %s models".formatted(resolved.family()),
                        ProviderConfigurationException.CONFIGURATION);
            }
        }
        validateFamily(provider, resolved);
        log.debug("Selected provider {} for model {}", provider.name(), resolved.modelId());
        return new Selection(provider, resolved);
    }

    /**
     * @throws ProviderConfigurationException when the model belongs to another provider's family
     */
    public static void validateFamily(AgentProvider provider, ResolvedModel model) {
        if (provider.family() != model.family()) {
            throw new ProviderConfigurationException(
                    "Invalid model configuration: %s provider cannot use %s model '%s'. Check the feature's model setting."
                            .formatted(provider.name(), model.family().providerName(), model.modelId()),
                    ProviderConfigurationException.CONFIGURATION);
        }
    }

    public List<AgentProvider> getProviders() {
        return List.copyOf(providersByName.values());
    }
}
