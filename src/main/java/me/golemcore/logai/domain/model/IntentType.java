package me.golemcore.logai.domain.model;

/**
 * Kinds of stated-but-unexecuted intentions recognized in model text.
 */
public enum IntentType {
    SEARCH_LOGS,
    LIST_GROUPS,
    EXPAND_TIME,
    CHANGE_FILTER,
    ANALYZE
}
