package me.golemcore.agents.domain.context;

/**
 * Invalid context configuration or unknown strategy name.
 */
public class ContextStrategyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ContextStrategyException(String message) {
        super(message);
    }

    public ContextStrategyException(String message, Throwable cause) {
        super(message, cause);
    }
}
