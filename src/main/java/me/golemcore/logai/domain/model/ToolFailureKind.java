package me.golemcore.logai.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The remote log store could not be reached or answered with a server error.
     */
    REMOTE_UNAVAILABLE,

    /**
     * The remote log store kept throttling after in-adapter backoff. Never treated
     * as an empty result.
     */
    RATE_LIMITED,

    /**
     * Tool arguments could not be parsed or were rejected by the remote store. The
     * model can correct these.
     */
    INVALID_PARAMETERS,

    /**
     * The requested log group, or every group matching a prefix, does not exist.
     */
    SCOPE_NOT_FOUND,

    /**
     * The call was never dispatched because the turn ran out of tool iterations.
     */
    NOT_EXECUTED,

    /**
     * Tool execution failed during runtime for any other reason.
     */
    EXECUTION_FAILED
}
