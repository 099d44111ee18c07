package me.golemcore.logai.domain.model;

/**
 * How a turn ended.
 */
public enum TerminationReason {
    ANSWERED,
    ITERATION_CAP_EXCEEDED,
    RETRY_ATTEMPTS_EXHAUSTED,
    FATAL_ERROR
}
