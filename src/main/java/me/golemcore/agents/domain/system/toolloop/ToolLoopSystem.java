package me.golemcore.agents.domain.system.toolloop;

/**
 * Runs the provider -> tools -> provider loop of a single conversation turn.
 */
public interface ToolLoopSystem {

    /**
     * @throws TurnAbortedException
     *             if the turn ends without a final answer
     */
    ChatTurnResult processTurn(ChatTurnRequest request);
}
