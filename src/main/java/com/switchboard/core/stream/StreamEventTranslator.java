package com.switchboard.core.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.switchboard.core.routing.ChainExhaustedException;
import com.switchboard.core.routing.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Translates one upstream event at a time into canonical {@link StreamEvent}s.
 * <p>
 * Pure and synchronous: all request state lives in the owned
 * {@link NormalizerState}, so the translator can be driven by any pull loop
 * and tested without a scheduler. One instance serves exactly one request.
 * Once a terminal event has been returned every further call returns nothing.
 * <p>
 * Agents that only print to the console still answer: their {@code output}
 * lines stream as reasoning and, if no content arrived by the end, are
 * replayed as the answer.
 */
public class StreamEventTranslator {

    private static final Logger log = LoggerFactory.getLogger(StreamEventTranslator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String DONE_SENTINEL = "[DONE]";
    static final String NO_OUTPUT_ANSWER = "Agent completed without output.";
    private static final int MAX_DELTA_DEPTH = 6;
    private static final int TOOL_OUTPUT_LIMIT = 500;

    private final NormalizerState state;
    private final Duration heartbeatProgressAfter;
    private final Clock clock;

    public StreamEventTranslator() {
        this(Duration.ofSeconds(10), Clock.systemUTC());
    }

    public StreamEventTranslator(Duration heartbeatProgressAfter, Clock clock) {
        this.heartbeatProgressAfter = heartbeatProgressAfter;
        this.clock = clock;
        this.state = new NormalizerState(clock.instant());
    }

    public NormalizerState state() {
        return state;
    }

    public List<StreamEvent> translate(UpstreamEvent event) {
        if (state.isFinished()) {
            return List.of();
        }
        List<StreamEvent> translated = event.isRaw() ? translateLine(event.raw()) : translateJson(event.json());
        return accept(translated);
    }

    /**
     * Called when the upstream source completes. Synthesizes
     * {@code Done("incomplete")} if no terminal event was seen.
     */
    public List<StreamEvent> close() {
        if (state.isFinished()) {
            return List.of();
        }
        log.warn("Upstream closed without a terminal event after {}",
                Duration.between(state.startedAt(), clock.instant()));
        var out = new ArrayList<StreamEvent>(2);
        String console = state.consoleOutput();
        if (!state.emittedContent() && !console.isBlank()) {
            out.add(new StreamEvent.ContentDelta(console));
        }
        out.add(new StreamEvent.Done(StreamEvent.Done.INCOMPLETE));
        return accept(out);
    }

    /**
     * Called when the upstream source fails. Idle timeouts degrade to
     * {@code Done("incomplete")}; everything else becomes one {@code Error}.
     */
    public List<StreamEvent> fail(Throwable error) {
        if (state.isFinished()) {
            return List.of();
        }
        StreamEvent terminal;
        if (error instanceof TimeoutException) {
            log.warn("Upstream silent too long, closing stream as incomplete");
            terminal = new StreamEvent.Done(StreamEvent.Done.INCOMPLETE);
        } else if (error instanceof ChainExhaustedException exhausted) {
            terminal = new StreamEvent.Error("chain_exhausted", exhausted.getMessage());
        } else if (error instanceof UpstreamException upstream) {
            terminal = new StreamEvent.Error(upstream.kind().label(), upstream.getMessage());
        } else {
            log.error("Stream failed: {}", error.toString());
            terminal = new StreamEvent.Error("stream_error", String.valueOf(error.getMessage()));
        }
        return accept(List.of(terminal));
    }

    // --- raw lines ---

    private List<StreamEvent> translateLine(String line) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        if (DONE_SENTINEL.equals(trimmed)) {
            state.markParsed();
            return List.of(new StreamEvent.Done(StreamEvent.Done.STOP));
        }
        if (NoiseFilter.isNoise(trimmed)) {
            log.trace("Dropped noise line: {}", trimmed);
            return List.of();
        }
        if (!trimmed.startsWith("{")) {
            log.debug("Skipping non-JSON upstream line: {}", abbreviate(trimmed));
            return List.of();
        }
        try {
            return translateJson(MAPPER.readTree(trimmed));
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed upstream event: {} ({})", abbreviate(trimmed), e.getOriginalMessage());
            return List.of();
        }
    }

    // --- JSON events ---

    private List<StreamEvent> translateJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            log.debug("Skipping non-object upstream event");
            return List.of();
        }
        state.markParsed();
        String type = node.path("type").asText("");

        if ("agent-output".equals(type) && node.has("data")) {
            return translateJson(node.get("data"));
        }
        if ("stream_event".equals(type) && node.has("event")) {
            return translateJson(node.get("event"));
        }

        if (node.path("choices").isArray()) {
            return chunkDelta(node);
        }

        return switch (type) {
            case "result" -> result(node);
            case "assistant" -> assistantMessage(node);
            case "user" -> toolResults(node);
            case "system" -> systemMessage(node);
            case "status" -> reasoningLine(node.path("message").asText(""));
            case "output" -> consoleOutput(node);
            case "files-update" -> filesUpdate(node);
            case "heartbeat" -> heartbeat(node);
            case "error" -> List.of(new StreamEvent.Error("agent_error",
                    firstText(node, "error", "message").orElse("Agent reported an error")));
            case "complete" -> complete(node);
            default -> untypedEvent(node, type);
        };
    }

    /**
     * Direct token delta first, then a nested {@code delta.text}, then a bare
     * {@code result} payload.
     */
    private List<StreamEvent> untypedEvent(JsonNode node, String type) {
        var direct = new ArrayList<StreamEvent>();
        addDeltaFields(node, direct);
        if (!direct.isEmpty()) {
            return direct;
        }
        var nested = nestedDelta(node, 0);
        if (!nested.isEmpty()) {
            return nested;
        }
        if (node.path("result").isTextual()) {
            return result(node);
        }
        log.debug("Skipping unrecognized upstream event type '{}'", type);
        return List.of();
    }

    /**
     * An OpenAI chunk: {@code choices[0].delta} plus an optional {@code finish_reason}.
     * Role-only and keep-alive chunks translate to nothing.
     */
    private List<StreamEvent> chunkDelta(JsonNode node) {
        var out = new ArrayList<StreamEvent>();
        if (node.path("choices").isEmpty()) {
            return out;
        }
        JsonNode choice = node.path("choices").get(0);
        addDeltaFields(choice.has("delta") ? choice.path("delta") : choice.path("message"), out);
        JsonNode finish = choice.path("finish_reason");
        if (finish.isTextual() && !finish.asText().isBlank()) {
            out.add(new StreamEvent.Done(finish.asText()));
        }
        return out;
    }

    private void addDeltaFields(JsonNode node, List<StreamEvent> out) {
        JsonNode reasoning = node.has("reasoning_content") ? node.path("reasoning_content") : node.path("reasoning");
        if (reasoning.isTextual() && !reasoning.asText().isEmpty()) {
            out.add(new StreamEvent.ReasoningDelta(reasoning.asText()));
        }
        JsonNode content = node.path("content");
        if (content.isTextual() && !content.asText().isEmpty()) {
            state.markIncrementalDelta();
            out.add(new StreamEvent.ContentDelta(content.asText()));
        }
    }

    /**
     * Finds a {@code delta.text} or {@code delta.thinking} anywhere in the event.
     */
    private List<StreamEvent> nestedDelta(JsonNode node, int depth) {
        if (depth > MAX_DELTA_DEPTH || node == null || !node.isContainerNode()) {
            return List.of();
        }
        JsonNode delta = node.path("delta");
        if (delta.isObject()) {
            if (delta.path("text").isTextual()) {
                state.markIncrementalDelta();
                return List.of(new StreamEvent.ContentDelta(delta.path("text").asText()));
            }
            if (delta.path("thinking").isTextual()) {
                return List.of(new StreamEvent.ReasoningDelta(delta.path("thinking").asText()));
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            var child = fields.next().getValue();
            if (child.isObject()) {
                var found = nestedDelta(child, depth + 1);
                if (!found.isEmpty()) {
                    return found;
                }
            }
        }
        return List.of();
    }

    private List<StreamEvent> result(JsonNode node) {
        String text = node.path("result").asText("");
        if (node.path("is_error").asBoolean(false)) {
            return List.of(new StreamEvent.Error("agent_error", text.isBlank() ? "Agent run failed" : text));
        }
        String finishReason = "error_max_turns".equals(node.path("subtype").asText())
                ? StreamEvent.Done.LENGTH
                : StreamEvent.Done.STOP;
        var out = new ArrayList<StreamEvent>(2);
        if (!state.emittedContent() && !text.isBlank()) {
            out.add(new StreamEvent.ContentDelta(text));
        }
        out.add(new StreamEvent.Done(finishReason));
        return out;
    }

    private List<StreamEvent> assistantMessage(JsonNode node) {
        var out = new ArrayList<StreamEvent>();
        if (node.path("content").isTextual()) {
            addDeltaFields(node, out);
            return out;
        }
        for (JsonNode block : node.path("message").path("content")) {
            switch (block.path("type").asText("")) {
                case "text" -> {
                    String text = block.path("text").asText("");
                    if (!state.sawIncrementalDelta() && !text.isBlank()) {
                        out.add(new StreamEvent.ContentDelta(text));
                    }
                }
                case "thinking" -> {
                    String thinking = block.path("thinking").asText("");
                    if (!thinking.isBlank()) {
                        out.add(new StreamEvent.ReasoningDelta(thinking));
                    }
                }
                case "tool_use" -> out.add(new StreamEvent.ReasoningDelta(
                        "Using tool: " + block.path("name").asText("unknown") + "\n"));
                default -> { }
            }
        }
        return out;
    }

    private List<StreamEvent> toolResults(JsonNode node) {
        var out = new ArrayList<StreamEvent>();
        for (JsonNode block : node.path("message").path("content")) {
            if (!"tool_result".equals(block.path("type").asText())) {
                continue;
            }
            JsonNode content = block.path("content");
            String text = content.isTextual() ? content.asText() : joinTextParts(content);
            text = NoiseFilter.stripAnsi(text).strip();
            if (!text.isEmpty()) {
                out.add(new StreamEvent.ReasoningDelta("Tool output: " + abbreviate(text, TOOL_OUTPUT_LIMIT) + "\n"));
            }
        }
        return out;
    }

    private List<StreamEvent> systemMessage(JsonNode node) {
        if ("init".equals(node.path("subtype").asText())) {
            String model = node.path("model").asText("");
            return reasoningLine(model.isBlank() ? "Agent session started" : "Agent session started (" + model + ")");
        }
        return reasoningLine(node.path("message").asText(""));
    }

    private List<StreamEvent> consoleOutput(JsonNode node) {
        String text = NoiseFilter.clean(firstText(node, "text", "data", "output").orElse(""));
        if (!text.isBlank()) {
            state.appendConsoleOutput(text.strip());
        }
        return reasoningLine(text);
    }

    private List<StreamEvent> filesUpdate(JsonNode node) {
        var files = new ArrayList<String>();
        for (JsonNode file : node.path("files")) {
            files.add(file.isTextual() ? file.asText() : file.path("path").asText(""));
        }
        files.removeIf(String::isBlank);
        return files.isEmpty() ? List.of() : reasoningLine("Files changed: " + String.join(", ", files));
    }

    private List<StreamEvent> heartbeat(JsonNode node) {
        if (state.emittedContent()) {
            return List.of();
        }
        long elapsed = node.path("elapsed").isNumber()
                ? node.path("elapsed").asLong()
                : Duration.between(state.startedAt(), clock.instant()).toSeconds();
        if (elapsed <= heartbeatProgressAfter.toSeconds()) {
            return List.of();
        }
        return reasoningLine("Agent working... (" + elapsed + "s)");
    }

    private List<StreamEvent> complete(JsonNode node) {
        int exitCode = node.path("exitCode").asInt(0);
        boolean success = node.has("success") ? node.path("success").asBoolean() : exitCode == 0;
        if (success) {
            if (state.emittedContent()) {
                return List.of(new StreamEvent.Done(StreamEvent.Done.STOP));
            }
            String console = state.consoleOutput();
            return List.of(new StreamEvent.ContentDelta(console.isBlank() ? NO_OUTPUT_ANSWER : console),
                    new StreamEvent.Done(StreamEvent.Done.STOP));
        }
        String detail = firstText(node, "error", "message").orElse("Agent exited with code " + exitCode);
        return List.of(new StreamEvent.Error("agent_failed", detail));
    }

    // --- bookkeeping ---

    /**
     * Applies the emitted events to the state and cuts everything after the
     * first terminal event.
     */
    private List<StreamEvent> accept(List<StreamEvent> events) {
        var out = new ArrayList<StreamEvent>(events.size());
        for (StreamEvent event : events) {
            if (event == null) {
                continue;
            }
            if (event instanceof StreamEvent.ContentDelta delta) {
                if (delta.text().isEmpty()) {
                    continue;
                }
                state.markContentEmitted();
            }
            out.add(event);
            if (event.isTerminal()) {
                state.finish(event);
                break;
            }
        }
        return out;
    }

    private static List<StreamEvent> reasoningLine(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return List.of(new StreamEvent.ReasoningDelta(text.endsWith("\n") ? text : text + "\n"));
    }

    private static Optional<String> firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (value.isTextual() && !value.asText().isBlank()) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }

    private static String joinTextParts(JsonNode parts) {
        var texts = new ArrayList<String>();
        for (JsonNode part : parts) {
            if (part.path("text").isTextual()) {
                texts.add(part.path("text").asText());
            }
        }
        return String.join("\n", texts);
    }

    private static String abbreviate(String text) {
        return abbreviate(text, 200);
    }

    private static String abbreviate(String text, int limit) {
        return text.length() <= limit ? text : text.substring(0, limit) + "...";
    }
}
