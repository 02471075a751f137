package me.golemcore.agents.domain.system.toolloop;

/**
 * Phases of a single conversation turn.
 *
 * <pre>
 * BUILD_CONTEXT -> CALL_PROVIDER -> PARSE_RESPONSE -> FINALIZE
 *                                         |
 *                                         +-> EXECUTE_TOOLS -> APPEND_RESULTS -> BUILD_CONTEXT
 * </pre>
 */
public enum TurnState {
    BUILD_CONTEXT, CALL_PROVIDER, PARSE_RESPONSE, EXECUTE_TOOLS, APPEND_RESULTS, FINALIZE
}
