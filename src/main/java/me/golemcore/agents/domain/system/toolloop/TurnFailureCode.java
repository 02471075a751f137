package me.golemcore.agents.domain.system.toolloop;

/** Reasons a turn ends without a final answer. */
public enum TurnFailureCode {
    PROVIDER_UNAVAILABLE, PROVIDER_ERROR, MAX_ITERATIONS_EXCEEDED, CANCELLED, CONTEXT_ERROR
}
