package me.golemcore.gateway.domain.model;

/**
 * Declared feature support of a provider adapter.
 *
 * @param reasoningParameter
 *            wire name of the reasoning parameter, {@code null} when
 *            {@code reasoningKind} is {@link ReasoningParameterKind#NONE}
 */
public record ProviderCapabilities(
        boolean streaming,
        boolean toolCalls,
        boolean thinking,
        ReasoningParameterKind reasoningKind,
        String reasoningParameter) {

    public static ProviderCapabilities withoutThinking() {
        return new ProviderCapabilities(true, true, false, ReasoningParameterKind.NONE, null);
    }
}
