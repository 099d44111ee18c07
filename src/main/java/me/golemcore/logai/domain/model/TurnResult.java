package me.golemcore.logai.domain.model;

/**
 * Outcome of one user turn.
 *
 * @param reason
 *            how the turn ended
 * @param subReason
 *            detail for {@link TerminationReason#FATAL_ERROR}: {@code cancelled},
 *            {@code provider_unavailable}, {@code invalid_request} or
 *            {@code turn_in_progress}; {@code null} otherwise
 * @param answer
 *            user-facing text
 * @param llmCalls
 *            number of model invocations in the turn
 * @param toolCalls
 *            number of tool dispatches in the turn, retries included
 */
public record TurnResult(TerminationReason reason, String subReason, String answer, int llmCalls, int toolCalls) {

    public static final String CANCELLED = "cancelled";
    public static final String PROVIDER_UNAVAILABLE = "provider_unavailable";
    public static final String INVALID_REQUEST = "invalid_request";
    public static final String TURN_IN_PROGRESS = "turn_in_progress";

    public static TurnResult answered(String answer, int llmCalls, int toolCalls) {
        return new TurnResult(TerminationReason.ANSWERED, null, answer, llmCalls, toolCalls);
    }

    public static TurnResult fatal(String subReason, String answer, int llmCalls, int toolCalls) {
        return new TurnResult(TerminationReason.FATAL_ERROR, subReason, answer, llmCalls, toolCalls);
    }

    public boolean isAnswered() {
        return reason == TerminationReason.ANSWERED;
    }

    public boolean isCancelled() {
        return reason == TerminationReason.FATAL_ERROR && CANCELLED.equals(subReason);
    }
}
