package me.golemcore.logai.domain.model;

public enum ToolCallStatus {
    PENDING, RUNNING, SUCCEEDED, FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
