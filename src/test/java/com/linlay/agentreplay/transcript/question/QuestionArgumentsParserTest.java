package com.linlay.agentreplay.transcript.question;

import org.junit.jupiter.api.Test;

import static com.linlay.agentreplay.TestEvents.MAPPER;
import static org.assertj.core.api.Assertions.assertThat;

class QuestionArgumentsParserTest {

    private final QuestionArgumentsParser parser = new QuestionArgumentsParser(MAPPER);

    @Test
    void shouldParseQuestionsAndOptions() {
        QuestionSet set = parser.parse("""
                {"questions":[
                  {"id":"q1","question":"Pick one","mode":"multi","allowOther":true,"otherPlaceholder":"Type here",
                   "options":[{"label":"Alpha","value":"a","description":"first"},{"label":"Beta"},{"value":"orphan"}]},
                  {"id":"q2","question":"Confirm?"},
                  {"id":"q3"}
                ],"context":"Setup"}
                """).orElseThrow();

        assertThat(set.context()).isEqualTo("Setup");
        assertThat(set.questions()).extracting(QuestionSet.Question::id).containsExactly("q1", "q2");

        QuestionSet.Question first = set.questions().get(0);
        assertThat(first.mode()).isEqualTo(QuestionSet.SelectionMode.MULTI);
        assertThat(first.allowOther()).isTrue();
        assertThat(first.otherPlaceholder()).isEqualTo("Type here");
        assertThat(first.options()).extracting(QuestionSet.Option::effectiveValue).containsExactly("a", "Beta");
        assertThat(set.questions().get(1).mode()).isEqualTo(QuestionSet.SelectionMode.SINGLE);
    }

    @Test
    void shouldAssignPositionalIdsAndAcceptPlainStringOptions() {
        QuestionSet set = parser.parse("""
                {"questions":[
                  {"question":"Pick one","options":["A","B",""]},
                  {"id":"named","question":"Confirm?"},
                  {"question":"Why?"}
                ]}
                """).orElseThrow();

        assertThat(set.questions()).extracting(QuestionSet.Question::id).containsExactly("q0", "named", "q2");
        assertThat(set.questions().get(0).options()).containsExactly(
                new QuestionSet.Option("A", "A", null),
                new QuestionSet.Option("B", "B", null)
        );
    }

    @Test
    void shouldRejectUnusableArguments() {
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("{not json")).isEmpty();
        assertThat(parser.parse("{\"questions\":[]}")).isEmpty();
        assertThat(parser.parse("{\"questions\":[{\"id\":\"q1\"}]}")).isEmpty();
    }
}
