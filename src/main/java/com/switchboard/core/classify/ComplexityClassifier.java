package com.switchboard.core.classify;

import com.switchboard.core.llm.ClassificationClient;
import com.switchboard.core.llm.ClassificationException;
import com.switchboard.core.model.ChatMessage;
import com.switchboard.core.model.ChatRequest;
import com.switchboard.core.model.ComplexityAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Decides whether a request needs the sandboxed agent or can be answered by a
 * single model call.
 * <p>
 * Deterministic checks run first and are authoritative when they fire. Anything
 * they leave undecided, apart from trivially short messages, is verified by one
 * bounded call to the auxiliary model. Every failure of that call resolves to
 * the agent path.
 */
@Component
public class ComplexityClassifier {

    private static final Logger log = LoggerFactory.getLogger(ComplexityClassifier.class);

    static final String SYSTEM_PROMPT = """
            You decide whether a user request needs an agent sandbox with tools, or can be
            answered directly by a language model.

            The agent sandbox is needed for:
            - Image, video or audio generation ("generate an image of...", "create a video...")
            - Code execution ("run this code", "execute...")
            - Web search or current information ("search for...", "find the latest...")
            - Visiting, testing or interacting with websites and APIs
            - File operations ("download...", "save to file...")
            - Any task requiring external tools or APIs

            A direct answer is sufficient for:
            - General conversation and questions
            - Explanations and summaries
            - Simple math without code
            - Writing assistance without execution

            Respond with valid JSON matching the schema provided.
            """;

    private static final int PROMPT_TEXT_LIMIT = 500;

    private final ClassificationClient classificationClient;
    private final Duration verificationTimeout;
    private final int trivialMaxChars;
    private final int tokenThreshold;
    private final boolean alwaysUseAgent;

    public ComplexityClassifier(ClassificationClient classificationClient, ClassifierProperties properties) {
        this.classificationClient = classificationClient;
        this.verificationTimeout = properties.getVerificationTimeout();
        this.trivialMaxChars = properties.getTrivialMaxChars();
        this.tokenThreshold = properties.getTokenThreshold();
        this.alwaysUseAgent = properties.isAlwaysUseAgent();
    }

    public ComplexityAnalysis classify(ChatRequest request) {
        ComplexityAnalysis analysis = decide(request);
        log.info("Complexity decision: needsAgent={} reason='{}' keywords={} images={} preview='{}'",
                analysis.needsAgent(), analysis.reason(), analysis.matchedKeywords(),
                analysis.imageCount(), analysis.textPreview());
        return analysis;
    }

    private ComplexityAnalysis decide(ChatRequest request) {
        int imageCount = request.imageCount();
        boolean hasImages = imageCount > 0;
        String text = request.lastUserText();
        var base = new ComplexityAnalysis(false, "", List.of(), hasImages, imageCount, text);

        if (alwaysUseAgent) {
            return base.withDecision(true, ComplexityReason.ALWAYS_USE_AGENT);
        }
        if (request.messages().isEmpty()) {
            return base.withDecision(false, ComplexityReason.EMPTY_MESSAGES);
        }
        if (request.lastUserMessage().isEmpty()) {
            return base.withDecision(false, ComplexityReason.NO_USER_MESSAGE);
        }
        List<String> flagReasons = request.generationFlags().reasons();
        if (!flagReasons.isEmpty()) {
            return base.withDecision(true,
                    ComplexityReason.GENERATION_FLAGS + ": " + String.join(", ", flagReasons));
        }

        List<String> keywords = ComplexityKeywords.matchComplexity(text);
        var analysis = new ComplexityAnalysis(false, "", keywords, hasImages, imageCount, text);
        if (!keywords.isEmpty()) {
            return analysis.withDecision(true, ComplexityReason.KEYWORD_MATCH);
        }
        if (ComplexityKeywords.isMultimodalRequest(text)) {
            return analysis.withDecision(true, ComplexityReason.MULTIMODAL_REQUEST);
        }
        if (ComplexityKeywords.hasUrlInteraction(text)) {
            return analysis.withDecision(true, ComplexityReason.URL_INTERACTION);
        }
        if (hasImages && ComplexityKeywords.needsToolsForImages(text)) {
            return analysis.withDecision(true, ComplexityReason.IMAGE_WITH_TOOLS);
        }
        int estimatedTokens = request.messages().stream()
                .map(ChatMessage::text)
                .mapToInt(ComplexityKeywords::estimateTokens)
                .sum();
        if (estimatedTokens > tokenThreshold) {
            return analysis.withDecision(true, ComplexityReason.TOKEN_THRESHOLD);
        }
        if (isTrivial(text)) {
            return analysis.withDecision(false, ComplexityReason.TRIVIAL);
        }
        return verify(analysis, text);
    }

    private boolean isTrivial(String text) {
        if (ComplexityKeywords.isTrivialGreeting(text)) {
            return true;
        }
        String trimmed = text.strip();
        return !trimmed.isEmpty()
                && trimmed.length() <= trivialMaxChars
                && !ComplexityKeywords.containsUrl(trimmed)
                && !ComplexityKeywords.hasComplexityAdjacentVerb(trimmed)
                && !ComplexityKeywords.isTimeSensitive(trimmed);
    }

    private ComplexityAnalysis verify(ComplexityAnalysis analysis, String text) {
        String prompt = text.length() > PROMPT_TEXT_LIMIT ? text.substring(0, PROMPT_TEXT_LIMIT) : text;
        try {
            AgentVerdict verdict = classificationClient.decide(
                    SYSTEM_PROMPT, "User request: " + prompt, AgentVerdict.class, verificationTimeout);
            if (verdict.needsAgent() == null) {
                log.warn("Verification verdict missing needsAgent, defaulting to agent path");
                return analysis.withDecision(true, ComplexityReason.conservativeDefault("malformed_decision"));
            }
            String reason = verdict.reason() == null || verdict.reason().isBlank()
                    ? ComplexityReason.LLM_DECISION
                    : verdict.reason().strip();
            return analysis.withDecision(verdict.needsAgent(), reason);
        } catch (ClassificationException e) {
            log.warn("Verification call failed ({}): {}; defaulting to agent path", e.cause(), e.getMessage());
            return analysis.withDecision(true, ComplexityReason.conservativeDefault(e.cause()));
        } catch (RuntimeException e) {
            log.warn("Verification call failed unexpectedly: {}; defaulting to agent path", e.toString());
            return analysis.withDecision(true,
                    ComplexityReason.conservativeDefault(e.getClass().getSimpleName()));
        }
    }
}
