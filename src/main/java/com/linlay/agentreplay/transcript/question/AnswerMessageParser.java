package com.linlay.agentreplay.transcript.question;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the user message that answers an interactive question:
 * <pre>
 * [Answers to your questions]
 *
 * **Which colors?**
 * Answer: Red, Blue
 * </pre>
 * An answer line is either {@code [Other] <text>}, {@code (no selection)} or a comma-separated
 * list of option values.
 */
public class AnswerMessageParser {

    public static final String DEFAULT_MARKER = "[Answers to your questions]";

    static final String OTHER_PREFIX = "[Other]";
    static final String NO_SELECTION = "(no selection)";

    private static final Logger log = LoggerFactory.getLogger(AnswerMessageParser.class);
    private static final Pattern HEADER = Pattern.compile("^\\*\\*(.+)\\*\\*$");
    private static final String ANSWER_PREFIX = "Answer:";

    private final String marker;

    public AnswerMessageParser(String marker) {
        this.marker = marker == null || marker.isBlank() ? DEFAULT_MARKER : marker;
    }

    public AnswerMessageParser() {
        this(DEFAULT_MARKER);
    }

    public boolean isAnswerMessage(String content) {
        return content != null && content.contains(marker);
    }

    /**
     * Number of question sections in an answer message, whether or not they parse.
     */
    public int countSections(String content) {
        return sections(content).size();
    }

    /**
     * Answers keyed by question id, in the order they appear in the message. Sections whose
     * header matches no question and sections without an answer line are dropped.
     */
    public Map<String, QuestionAnswer> parse(String content, QuestionSet questionSet) {
        Map<String, QuestionAnswer> answers = new LinkedHashMap<>();
        if (!isAnswerMessage(content) || questionSet == null) {
            return answers;
        }
        for (Section section : sections(content)) {
            Optional<QuestionSet.Question> question = questionSet.findByText(section.header());
            if (question.isEmpty()) {
                log.debug("Drop answer for unknown question '{}'", section.header());
                continue;
            }
            if (section.answerLine() == null) {
                log.debug("Drop question '{}' without answer line", section.header());
                continue;
            }
            answers.put(question.get().id(), toAnswer(question.get().id(), section.answerLine()));
        }
        return answers;
    }

    QuestionAnswer toAnswer(String questionId, String value) {
        String trimmed = value.trim();
        if (trimmed.startsWith(OTHER_PREFIX)) {
            return new QuestionAnswer(questionId, List.of(), trimmed.substring(OTHER_PREFIX.length()).trim());
        }
        if (NO_SELECTION.equals(trimmed)) {
            return new QuestionAnswer(questionId, List.of(), null);
        }
        List<String> selected = new ArrayList<>();
        for (String part : trimmed.split(",")) {
            String item = part.trim();
            if (!item.isEmpty()) {
                selected.add(item);
            }
        }
        return new QuestionAnswer(questionId, selected, null);
    }

    private List<Section> sections(String content) {
        List<Section> sections = new ArrayList<>();
        if (!isAnswerMessage(content)) {
            return sections;
        }
        String body = content.substring(content.indexOf(marker) + marker.length());
        String header = null;
        String answerLine = null;
        for (String rawLine : body.split("\\R")) {
            String line = rawLine.trim();
            Matcher matcher = HEADER.matcher(line);
            if (matcher.matches()) {
                if (header != null) {
                    sections.add(new Section(header, answerLine));
                }
                header = matcher.group(1).trim();
                answerLine = null;
            } else if (header != null && answerLine == null && line.startsWith(ANSWER_PREFIX)) {
                answerLine = line.substring(ANSWER_PREFIX.length());
            }
        }
        if (header != null) {
            sections.add(new Section(header, answerLine));
        }
        return sections;
    }

    private record Section(String header, String answerLine) {
    }
}
