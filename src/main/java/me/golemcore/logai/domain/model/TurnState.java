package me.golemcore.logai.domain.model;

/**
 * Orchestrator states within a turn.
 */
public enum TurnState {
    IDLE,
    AWAITING_MODEL,
    TOOL_REQUESTED,
    FINAL_ANSWER,
    TERMINATED
}
