package com.switchboard.core.stream;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips terminal escape codes and drops diagnostic lines that agent CLIs
 * print around their real output.
 */
public final class NoiseFilter {

    private static final Pattern ANSI = Pattern.compile("\\x1b\\[[0-9;?]*[A-Za-z]");
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x08\\x0b\\x0c\\x0e-\\x1f]");
    private static final Pattern BLANK_RUNS = Pattern.compile("\\n{3,}");

    private static final List<Pattern> DENYLIST = List.of(
            Pattern.compile("^Added .+ to the chat\\.?$"),
            Pattern.compile("^Applied edit to .+"),
            Pattern.compile("^Aider v\\d.*"),
            Pattern.compile("^(Main|Weak|Editor) model: .+"),
            Pattern.compile("^Git repo: .+"),
            Pattern.compile("^Repo-map: .+"),
            Pattern.compile("^Use /help .+"),
            Pattern.compile("^Warning: Input is not a terminal.*"),
            Pattern.compile("^Warning: Output is not a terminal.*"),
            Pattern.compile("^\\[preflight] .+"));

    private static final String THINKING_MARKER = "► **THINKING**";
    private static final String ANSWER_MARKER = "► **ANSWER**";

    private NoiseFilter() {} // utility class

    public static String stripAnsi(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = ANSI.matcher(text).replaceAll("").replace("\r", "");
        return CONTROL.matcher(cleaned).replaceAll("");
    }

    public static boolean isNoise(String line) {
        String stripped = stripAnsi(line).strip();
        if (stripped.equals(THINKING_MARKER) || stripped.equals(ANSWER_MARKER)) {
            return true;
        }
        for (Pattern pattern : DENYLIST) {
            if (pattern.matcher(stripped).matches()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Removes noise lines and anything between a thinking marker and the next
     * answer marker from multi-line console output.
     */
    public static String clean(String text) {
        var kept = new ArrayList<String>();
        boolean inThinking = false;
        for (String line : stripAnsi(text).split("\n", -1)) {
            String stripped = line.strip();
            if (stripped.equals(THINKING_MARKER)) {
                inThinking = true;
                continue;
            }
            if (stripped.equals(ANSWER_MARKER)) {
                inThinking = false;
                continue;
            }
            if (inThinking || isNoise(stripped)) {
                continue;
            }
            kept.add(line);
        }
        return BLANK_RUNS.matcher(String.join("\n", kept).strip()).replaceAll("\n\n");
    }
}
