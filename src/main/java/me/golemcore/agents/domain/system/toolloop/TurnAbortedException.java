package me.golemcore.agents.domain.system.toolloop;

import me.golemcore.agents.domain.model.ToolCallResult;
import lombok.Getter;

import java.util.List;

/**
 * A turn stopped before producing a final answer.
 *
 * <p>
 * Carries the tool-call results executed before the abort so callers can show
 * partial progress. Messages produced by the aborted turn are not persisted
 * when history is written atomically.
 */
@Getter
public class TurnAbortedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final TurnFailureCode code;
    private final int iterations;
    private final transient List<ToolCallResult> partialResults;

    public TurnAbortedException(TurnFailureCode code, String message, int iterations,
            List<ToolCallResult> partialResults) {
        this(code, message, iterations, partialResults, null);
    }

    public TurnAbortedException(TurnFailureCode code, String message, int iterations,
            List<ToolCallResult> partialResults, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.iterations = iterations;
        this.partialResults = partialResults != null ? List.copyOf(partialResults) : List.of();
    }
}
