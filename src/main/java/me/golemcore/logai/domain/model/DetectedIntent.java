package me.golemcore.logai.domain.model;

/**
 * The model said it would do something without calling a tool.
 *
 * @param type
 *            what it said it would do
 * @param confidence
 *            rule confidence in [0, 1]
 * @param triggerPhrase
 *            the matched text
 * @param suggestedAction
 *            hint naming the tool that carries out the intention
 */
public record DetectedIntent(IntentType type, double confidence, String triggerPhrase, String suggestedAction) {
}
