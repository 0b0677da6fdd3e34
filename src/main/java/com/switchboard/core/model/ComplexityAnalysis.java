package com.switchboard.core.model;

import java.util.List;

/**
 * Result of deciding whether a request needs the agent path.
 *
 * @param needsAgent      true routes the request to the sandboxed agent
 * @param reason          one of the {@code ComplexityReason} values, a model-stated reason,
 *                        or a {@code conservative_default:} prefixed failure cause
 * @param matchedKeywords complexity phrases found, in keyword-list order, without duplicates
 * @param hasImages       whether any message carries an image part
 * @param imageCount      number of image parts across all messages
 * @param textPreview     first 100 characters of the classified text; for logging only
 */
public record ComplexityAnalysis(
    boolean needsAgent,
    String reason,
    List<String> matchedKeywords,
    boolean hasImages,
    int imageCount,
    String textPreview
) {

    public static final int PREVIEW_LENGTH = 100;

    public ComplexityAnalysis {
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
        textPreview = preview(textPreview);
    }

    public ComplexityAnalysis withDecision(boolean agent, String newReason) {
        return new ComplexityAnalysis(agent, newReason, matchedKeywords, hasImages, imageCount, textPreview);
    }

    public static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH);
    }
}
