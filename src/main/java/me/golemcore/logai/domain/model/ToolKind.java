package me.golemcore.logai.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of tools exposed to the model. Each tool maps to exactly one
 * retrieval operation.
 */
public enum ToolKind {

    LIST_LOG_GROUPS("list_log_groups", OperationKind.ENUMERATE),
    FETCH_LOGS("fetch_logs", OperationKind.FETCH),
    SEARCH_LOGS("search_logs", OperationKind.SEARCH);

    private final String toolName;
    private final OperationKind operation;

    ToolKind(String toolName, OperationKind operation) {
        this.toolName = toolName;
        this.operation = operation;
    }

    public String getToolName() {
        return toolName;
    }

    public OperationKind getOperation() {
        return operation;
    }

    public static Optional<ToolKind> fromToolName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> kind.toolName.equals(name))
                .findFirst();
    }
}
