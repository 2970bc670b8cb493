package com.automaker.core.provider;

import java.util.stream.Stream;

/**
 * Uniform interface over code-generation backends.
 * <p>
 * The returned stream is lazy, finite and single-use. It stops producing once the request's
 * cancellation token is observed cancelled, and reports backend failures (including
 * authentication failures) as {@link AgentMessage.Type#ERROR} messages rather than throwing
 * from iteration. Callers must close the stream.
 */
public interface AgentProvider {

    /** Provider name used in configuration and on features, e.g. "claude". */
    String name();

    ModelFamily family();

    /**
     * @throws ProviderConfigurationException if the backend cannot be started at all
     */
    Stream<AgentMessage> execute(AgentRequest request);

    /** Whether the backend looks usable, for health reporting. */
    boolean isAvailable();
}
