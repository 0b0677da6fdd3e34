package com.switchboard.core.classify;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic text heuristics used by {@link ComplexityClassifier}.
 * <p>
 * All matching is case-insensitive and side-effect free, so identical input
 * always yields identical output.
 */
public final class ComplexityKeywords {

    /**
     * Phrases that indicate tool use: code execution, media generation,
     * web/API access or file operations. List order is the order matches are reported in.
     */
    static final List<String> COMPLEXITY_KEYWORDS = List.of(
            // code and execution
            "write code", "write a program", "create a script", "generate code", "create a file",
            "build", "implement", "develop", "debug", "fix the bug", "refactor", "run tests",
            "run this code", "run the code", "execute", "compile", "deploy", "install",
            "analyze this codebase", "update the code",
            // media generation
            "generate image", "generate an image", "create image", "create an image", "create picture",
            "make a picture", "draw", "image of", "picture of", "illustration of", "photo of", "render",
            "text to speech", "generate audio", "create audio", "read aloud", "tts",
            "generate video", "create video", "make a video", "animate",
            // web, browser and API
            "search the web", "search online", "research", "find information", "look up",
            "what is the latest", "current news", "recent developments",
            "take a screenshot", "take screenshot", "call the api", "curl",
            // files and data
            "download", "fetch", "scrape", "extract data", "convert file", "save to file"
    );

    /**
     * Short or ambiguous tokens that must match as whole words so that e.g.
     * "drawer" or "rebuilding" do not count.
     */
    private static final Set<String> WORD_BOUNDARY_KEYWORDS = Set.of(
            "build", "draw", "render", "tts", "curl", "fetch", "animate", "install", "debug", "research");

    private static final Map<String, Pattern> BOUNDARY_PATTERNS = new LinkedHashMap<>();

    static {
        for (String keyword : WORD_BOUNDARY_KEYWORDS) {
            BOUNDARY_PATTERNS.put(keyword, Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b"));
        }
    }

    private static final Pattern GENERATION_VERB =
            Pattern.compile("\\b(generate|create|make|produce|render)\\b");

    private static final Pattern MEDIA_NOUN = Pattern.compile(
            "\\b(image|picture|photo|illustration|drawing|audio|voice|speech|sound|video|animation|clip)s?\\b");

    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"']+|www\\.[^\\s<>\"']+");

    private static final Pattern INTERACTION_VERB = Pattern.compile(
            "\\b(test|check|visit|open|browse|verify|screenshot|load|fetch|scrape|interact"
                    + "|click|submit|form|login|log in|sign in|api|endpoint|navigate)\\b");

    private static final List<String> IMAGE_TOOL_TRIGGERS = List.of(
            "search for", "find more", "look up", "write code", "execute", "run this",
            "compare with", "fetch", "download");

    /**
     * Verbs that make a short message potentially non-trivial.
     */
    private static final Pattern COMPLEXITY_ADJACENT_VERB = Pattern.compile(
            "\\b(generate|create|make|build|write|run|execute|search|find|open|visit|download|fetch"
                    + "|install|test|check|analy[sz]e|deploy|draw|render|scrape|browse|click|compile|code)\\b");

    /**
     * Words that tie a question to live or recent facts, which only a
     * verified route can answer reliably.
     */
    private static final Pattern TIME_SENSITIVE = Pattern.compile(
            "\\b(latest|current(ly)?|today|tonight|tomorrow|yesterday|right now|this (week|month|year)"
                    + "|last night|news|headlines?|prices?|stocks?|exchange rate|weather|forecast"
                    + "|scores?|won|winner|results?|live|recent(ly)?|trending|election)\\b");

    static final Set<String> TRIVIAL_GREETINGS = Set.of(
            "hello", "hi", "hey", "hi there", "hello there",
            "good morning", "good afternoon", "good evening",
            "thanks", "thank you");

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ComplexityKeywords() {} // utility class

    /**
     * Complexity phrases present in {@code text}, in keyword-list order, without duplicates.
     */
    public static List<String> matchComplexity(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        var matched = new ArrayList<String>();
        for (String keyword : COMPLEXITY_KEYWORDS) {
            if (!matched.contains(keyword) && matchesKeyword(lower, keyword)) {
                matched.add(keyword);
            }
        }
        return matched;
    }

    /**
     * A generation verb together with a media noun, e.g. "make me a short video".
     */
    public static boolean isMultimodalRequest(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return GENERATION_VERB.matcher(lower).find() && MEDIA_NOUN.matcher(lower).find();
    }

    public static boolean containsUrl(String text) {
        return text != null && URL.matcher(text).find();
    }

    /**
     * A URL alongside a verb that implies visiting or driving it.
     */
    public static boolean hasUrlInteraction(String text) {
        if (!containsUrl(text)) {
            return false;
        }
        String withoutUrls = URL.matcher(text).replaceAll(" ").toLowerCase(Locale.ROOT);
        return INTERACTION_VERB.matcher(withoutUrls).find();
    }

    /**
     * Whether an attached image needs tools beyond plain vision to answer.
     */
    public static boolean needsToolsForImages(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return IMAGE_TOOL_TRIGGERS.stream().anyMatch(lower::contains);
    }

    public static boolean hasComplexityAdjacentVerb(String text) {
        return text != null && COMPLEXITY_ADJACENT_VERB.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    public static boolean isTimeSensitive(String text) {
        return text != null && TIME_SENSITIVE.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    public static boolean isTrivialGreeting(String text) {
        return TRIVIAL_GREETINGS.contains(normalize(text));
    }

    /**
     * Lower-cases, strips punctuation and collapses whitespace.
     */
    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String stripped = NON_ALPHANUMERIC.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
        return WHITESPACE.matcher(stripped.trim()).replaceAll(" ");
    }

    /**
     * Rough token estimate: whitespace-separated words times 1.3.
     */
    public static int estimateTokens(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        int words = WHITESPACE.split(text.trim()).length;
        return (int) (words * 1.3);
    }

    private static boolean matchesKeyword(String lowerText, String keyword) {
        Pattern pattern = BOUNDARY_PATTERNS.get(keyword);
        if (pattern != null) {
            return pattern.matcher(lowerText).find();
        }
        return lowerText.contains(keyword);
    }
}
