package com.switchboard.core.stream;

/**
 * Canonical unit of the response stream delivered to callers.
 * <p>
 * A stream carries any number of {@link ContentDelta} and {@link ReasoningDelta}
 * events followed by exactly one {@link Done} or {@link Error}.
 */
public interface StreamEvent {

    default boolean isTerminal() {
        return false;
    }

    /** Visible answer text. */
    record ContentDelta(String text) implements StreamEvent {}

    /** Intermediate thinking, tool and progress text, surfaced separately from the answer. */
    record ReasoningDelta(String text) implements StreamEvent {}

    record Done(String finishReason) implements StreamEvent {

        public static final String STOP = "stop";
        public static final String LENGTH = "length";
        public static final String INCOMPLETE = "incomplete";

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    /**
     * @param kind short machine-readable label, e.g. {@code chain_exhausted}
     */
    record Error(String kind, String message) implements StreamEvent {

        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
