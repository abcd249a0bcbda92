package com.linlay.agentreplay.transcript.question;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.linlay.agentreplay.event.JsonNodes.array;
import static com.linlay.agentreplay.event.JsonNodes.bool;
import static com.linlay.agentreplay.event.JsonNodes.text;

/**
 * Reads the serialized arguments of an interactive-question tool call.
 * Questions or options missing their required text are dropped one by one; a set with no
 * usable question is treated as unparseable. A question without an id gets {@code q<position>}, and
 * an option given as a bare string uses that string as both label and value.
 */
public class QuestionArgumentsParser {

    private static final Logger log = LoggerFactory.getLogger(QuestionArgumentsParser.class);
    private static final String GENERATED_ID_PREFIX = "q";

    private final ObjectMapper objectMapper;

    public QuestionArgumentsParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public Optional<QuestionSet> parse(String arguments) {
        if (!StringUtils.hasText(arguments)) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(arguments);
        } catch (Exception ex) {
            log.warn("Cannot parse question arguments: {}", ex.getMessage());
            return Optional.empty();
        }
        JsonNode questionsNode = array(root, "questions");
        if (questionsNode == null) {
            return Optional.empty();
        }

        List<QuestionSet.Question> questions = new ArrayList<>();
        int position = 0;
        for (JsonNode node : questionsNode) {
            String id = text(node, "id");
            if (!StringUtils.hasText(id)) {
                id = GENERATED_ID_PREFIX + position;
            }
            position++;
            try {
                questions.add(new QuestionSet.Question(
                        id,
                        text(node, "question"),
                        parseOptions(node),
                        QuestionSet.SelectionMode.parse(text(node, "mode")),
                        Boolean.TRUE.equals(bool(node, "allowOther")),
                        text(node, "otherPlaceholder")
                ));
            } catch (IllegalArgumentException ex) {
                log.debug("Drop malformed question entry: {}", ex.getMessage());
            }
        }
        if (questions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new QuestionSet(questions, text(root, "context")));
    }

    private List<QuestionSet.Option> parseOptions(JsonNode question) {
        JsonNode optionsNode = array(question, "options");
        if (optionsNode == null) {
            return List.of();
        }
        List<QuestionSet.Option> options = new ArrayList<>();
        for (JsonNode node : optionsNode) {
            if (node.isTextual()) {
                if (StringUtils.hasText(node.asText())) {
                    options.add(new QuestionSet.Option(node.asText(), node.asText(), null));
                }
                continue;
            }
            String label = text(node, "label");
            if (!StringUtils.hasText(label)) {
                continue;
            }
            options.add(new QuestionSet.Option(label, text(node, "value"), text(node, "description")));
        }
        return options;
    }
}
