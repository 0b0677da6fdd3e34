package com.switchboard.core.classify;

/**
 * Fixed reason labels recorded on a {@link com.switchboard.core.model.ComplexityAnalysis}.
 * Model-stated reasons and {@link #CONSERVATIVE_DEFAULT} prefixed causes are the only other values.
 */
public final class ComplexityReason {

    public static final String ALWAYS_USE_AGENT = "always_use_agent";
    public static final String EMPTY_MESSAGES = "empty_messages";
    public static final String NO_USER_MESSAGE = "no_user_message";
    public static final String GENERATION_FLAGS = "generation_flags";
    public static final String KEYWORD_MATCH = "keyword_match";
    public static final String MULTIMODAL_REQUEST = "multimodal_request";
    public static final String URL_INTERACTION = "url_interaction";
    public static final String IMAGE_WITH_TOOLS = "image_with_tools";
    public static final String TOKEN_THRESHOLD = "token_threshold";
    public static final String TRIVIAL = "trivial";
    public static final String LLM_DECISION = "llm_decision";
    public static final String CONSERVATIVE_DEFAULT = "conservative_default";

    private ComplexityReason() {}

    public static String conservativeDefault(String cause) {
        return CONSERVATIVE_DEFAULT + ": " + cause;
    }
}
