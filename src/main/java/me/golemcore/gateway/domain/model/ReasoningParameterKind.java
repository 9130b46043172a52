package me.golemcore.gateway.domain.model;

/**
 * Shape of the reasoning/thinking parameter a provider accepts.
 */
public enum ReasoningParameterKind {
    /** Integer token budget. */
    BUDGET_TOKENS,
    /** Discrete effort level such as low/medium/high. */
    EFFORT_LEVEL,
    /** Boolean flag that switches thinking on. */
    ENABLE_FLAG,
    NONE
}
