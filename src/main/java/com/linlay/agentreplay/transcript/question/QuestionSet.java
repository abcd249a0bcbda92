package com.linlay.agentreplay.transcript.question;

import java.util.List;
import java.util.Optional;

/**
 * Structured arguments of an interactive-question tool call.
 */
public record QuestionSet(List<Question> questions, String context) {

    public QuestionSet {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }

    public Optional<Question> findByText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return questions.stream().filter(question -> question.question().equals(text)).findFirst();
    }

    public record Question(
            String id,
            String question,
            List<Option> options,
            SelectionMode mode,
            boolean allowOther,
            String otherPlaceholder
    ) {
        public Question {
            requireNonBlank(id, "id");
            requireNonBlank(question, "question");
            options = options == null ? List.of() : List.copyOf(options);
            mode = mode == null ? SelectionMode.SINGLE : mode;
        }
    }

    /**
     * @param value submitted value, the label is used when absent
     */
    public record Option(String label, String value, String description) {
        public Option {
            requireNonBlank(label, "label");
        }

        public String effectiveValue() {
            return value == null ? label : value;
        }
    }

    public enum SelectionMode {
        SINGLE,
        MULTI;

        public static SelectionMode parse(String raw) {
            if (raw != null && "multi".equalsIgnoreCase(raw.trim())) {
                return MULTI;
            }
            return SINGLE;
        }
    }

    private static void requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be null or blank");
        }
    }
}
