package me.golemcore.logai.domain.model;

/**
 * Provider and model a conversation talks to. Passed explicitly when a
 * conversation is created; never read from global state mid-turn.
 */
public record ModelSelection(String provider, String model, Double temperature) {

    public static final String PROVIDER_OPENAI = "openai";
    public static final String PROVIDER_ANTHROPIC = "anthropic";
    public static final String PROVIDER_OLLAMA = "ollama";

    public ModelSelection {
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("provider is required");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model is required");
        }
        provider = provider.trim().toLowerCase(java.util.Locale.ROOT);
    }
}
