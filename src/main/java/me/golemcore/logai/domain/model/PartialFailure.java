package me.golemcore.logai.domain.model;

/**
 * Marker for one failed branch of a multi-scope search whose other branches
 * succeeded.
 */
public record PartialFailure(String scope, ToolFailureKind kind, String message) {
}
