package me.golemcore.logai.domain.model;

/**
 * Point-in-time counters of one conversation's tool loop.
 *
 * @param retries
 *            automatic re-dispatches with a widened window
 * @param retriesExhausted
 *            tool calls that stayed empty after the last widening
 * @param nudges
 *            corrective prompts after an announced but missing tool call
 * @param capHits
 *            turns stopped by the tool call limit
 * @param mergedCalls
 *            duplicate tool calls answered from another call of the same step
 */
public record ToolLoopStats(long retries, long retriesExhausted, long nudges, long capHits, long mergedCalls) {
}
