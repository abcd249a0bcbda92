package com.linlay.agentreplay.transcript.question;

import java.util.List;

/**
 * @param selectedValues chosen option values, empty for a custom answer or no selection
 * @param otherValue     free-form answer given through the "other" input
 */
public record QuestionAnswer(String questionId, List<String> selectedValues, String otherValue) {

    public QuestionAnswer {
        if (questionId == null || questionId.isBlank()) {
            throw new IllegalArgumentException("questionId must not be null or blank");
        }
        selectedValues = selectedValues == null ? List.of() : List.copyOf(selectedValues);
    }

    public boolean hasAnswer() {
        return !selectedValues.isEmpty() || (otherValue != null && !otherValue.isEmpty());
    }
}
