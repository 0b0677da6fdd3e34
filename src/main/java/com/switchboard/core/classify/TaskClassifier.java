package com.switchboard.core.classify;

import com.switchboard.core.llm.ClassificationClient;
import com.switchboard.core.llm.ClassificationException;
import com.switchboard.core.model.ChatRequest;
import com.switchboard.core.model.TaskCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Picks the model family that should answer a fast-path request.
 */
@Component
public class TaskClassifier {

    private static final Logger log = LoggerFactory.getLogger(TaskClassifier.class);

    static final String SYSTEM_PROMPT = """
            You are a request router. Classify the user's request into exactly one task type:
            - simple_text: greetings, short factual questions, small talk
            - general_text: explanations, summaries, general knowledge, advice
            - math_reasoning: math problems, proofs, logic puzzles, step-by-step calculation
            - programming: writing, reviewing or explaining code, algorithms, debugging
            - creative: stories, poems, roleplay, brainstorming, creative writing
            - vision: questions about attached images

            Give a confidence between 0.0 and 1.0.
            Respond with valid JSON matching the schema provided.
            """;

    /**
     * Words that make a short message worth a real classification.
     */
    private static final Pattern COMPLEX_VOCABULARY = Pattern.compile(
            "\\b(writ(e|es|ing|ten)|creat(e|es|ing)|implement(s|ing)?|cod(e|es|ing)|functions?|class(es)?"
                    + "|prove|proof|solve|calculat(e|ion)|equations?|story|stories|roleplay|explain"
                    + "|analy[sz]e|compare|design|build(ing)?)\\b");

    private static final int PROMPT_TEXT_LIMIT = 2000;
    private static final double DEFAULT_CONFIDENCE = 0.7;

    public record Result(TaskCategory category, double confidence) {}

    static final Result VISION = new Result(TaskCategory.VISION, 1.0);
    static final Result SIMPLE = new Result(TaskCategory.SIMPLE_TEXT, 0.8);
    static final Result FALLBACK = new Result(TaskCategory.GENERAL_TEXT, 0.5);

    private final ClassificationClient classificationClient;
    private final Duration taskTimeout;
    private final int simpleMaxChars;

    public TaskClassifier(ClassificationClient classificationClient, ClassifierProperties properties) {
        this.classificationClient = classificationClient;
        this.taskTimeout = properties.getTaskTimeout();
        this.simpleMaxChars = properties.getSimpleMaxChars();
    }

    public Result classifyTask(ChatRequest request) {
        if (request.hasImages()) {
            return VISION;
        }
        String text = request.lastUserText();
        if (text.strip().length() < simpleMaxChars && !hasComplexVocabulary(text)) {
            return SIMPLE;
        }
        String prompt = text.length() > PROMPT_TEXT_LIMIT ? text.substring(0, PROMPT_TEXT_LIMIT) : text;
        try {
            TaskVerdict verdict = classificationClient.decide(SYSTEM_PROMPT, prompt, TaskVerdict.class, taskTimeout);
            TaskCategory category = TaskCategory.fromWireName(verdict.taskType());
            if (category == TaskCategory.UNKNOWN || category == TaskCategory.VISION) {
                // no image in the request, so a vision verdict is as unusable as an unknown one
                log.warn("Task classifier returned unusable type '{}', using {}", verdict.taskType(), FALLBACK);
                return FALLBACK;
            }
            double confidence = verdict.confidence() == null
                    ? DEFAULT_CONFIDENCE
                    : Math.max(0.0, Math.min(1.0, verdict.confidence()));
            log.info("Task category: {} ({})", category.wireName(), String.format(Locale.ROOT, "%.2f", confidence));
            return new Result(category, confidence);
        } catch (ClassificationException e) {
            log.warn("Task classification failed ({}): {}", e.cause(), e.getMessage());
            return FALLBACK;
        } catch (RuntimeException e) {
            log.warn("Task classification failed unexpectedly: {}", e.toString());
            return FALLBACK;
        }
    }

    private static boolean hasComplexVocabulary(String text) {
        return COMPLEX_VOCABULARY.matcher(text.toLowerCase(Locale.ROOT)).find();
    }
}
