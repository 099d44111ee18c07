package me.golemcore.logai.domain.model;

/**
 * Kind of retrieval performed against the log store.
 */
public enum OperationKind {

    /** List log groups, optionally narrowed by a name prefix. No time window. */
    ENUMERATE,

    /** Read events from a single, exactly named log group. */
    FETCH,

    /** Read events across every log group matching one or more prefixes. */
    SEARCH
}
