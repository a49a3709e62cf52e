package me.golemcore.agent.domain.system.toolloop;

/**
 * Outcome of one user turn.
 *
 * @param outcome
 *            how the turn ended
 * @param llmCalls
 *            model calls made during the turn, including a failed one
 * @param toolExecutions
 *            tool calls executed (successful or not)
 * @param finalText
 *            assistant text for {@link Outcome#COMPLETED}, otherwise null
 * @param error
 *            failure description for {@link Outcome#ROLLED_BACK}, otherwise
 *            null
 * @param totalTokens
 *            tokens reported by the provider across all calls of the turn
 */
public record ToolLoopTurnResult(Outcome outcome,int llmCalls,int toolExecutions,String finalText,String error,long totalTokens){

public enum Outcome {
    /** The model answered without requesting tools. */
    COMPLETED,
    /** The call ceiling was reached while the model still requested tools. */
    CEILING_REACHED,
    /** A model call failed; the conversation was restored to the turn start. */
    ROLLED_BACK
}

public boolean completed(){return outcome==Outcome.COMPLETED;}}
