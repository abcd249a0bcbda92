package com.linlay.agentreplay.index;

import org.junit.jupiter.api.Test;

import static com.linlay.agentreplay.TestEvents.decode;
import static com.linlay.agentreplay.TestEvents.deleted;
import static com.linlay.agentreplay.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIndexBuilderTest {

    private final CorrelationIndexBuilder builder = new CorrelationIndexBuilder();

    @Test
    void shouldIndexCallsResultsAndDeletions() {
        CorrelationIndex index = builder.build(decode(
                event("c1", "tool.call", 1, "{'toolCallId':'t1','name':'Read','arguments':{'path':'a'},'turn':2}"),
                event("r1", "tool.result", 2, "{'toolCallId':'t1','content':'data','isError':false,'duration':12}"),
                deleted("d1", 3, "m9")
        ));

        assertThat(index.toolCall("t1")).contains(new ToolCallDetails("c1", "t1", "Read", "{\"path\":\"a\"}", 2));
        ToolResultDetails result = index.toolResult("t1").orElseThrow();
        assertThat(result.content()).isEqualTo("data");
        assertThat(result.durationMs()).isEqualTo(12L);
        assertThat(result.error()).isFalse();
        assertThat(index.isDeleted("m9")).isTrue();
        assertThat(index.isDeleted("c1")).isFalse();
    }

    @Test
    void shouldExcludeEntriesWhoseEventIsTombstonedLater() {
        CorrelationIndex index = builder.build(decode(
                event("c1", "tool.call", 1, "{'toolCallId':'t1','name':'Read'}"),
                event("r1", "tool.result", 2, "{'toolCallId':'t1','content':'data'}"),
                deleted("d1", 3, "r1")
        ));

        assertThat(index.toolCall("t1")).isPresent();
        assertThat(index.toolResult("t1")).isEmpty();
    }

    @Test
    void shouldLetLaterDuplicatesOverwrite() {
        CorrelationIndex index = builder.build(decode(
                event("r1", "tool.result", 1, "{'toolCallId':'t1','content':'first'}"),
                event("r2", "tool.result", 2, "{'toolCallId':'t1','content':'second','isError':true}")
        ));

        assertThat(index.toolResult("t1").orElseThrow().content()).isEqualTo("second");
        assertThat(index.toolResult("t1").orElseThrow().error()).isTrue();
    }

    @Test
    void shouldKeepLatestReasoningLevelAmongLiveEvents() {
        CorrelationIndex index = builder.build(decode(
                event("l1", "config.reasoning_level", 1, "{'previousLevel':'low','newLevel':'medium'}"),
                event("l2", "config.reasoning_level", 2, "{'previousLevel':'medium','newLevel':'high'}"),
                deleted("d1", 3, "l2")
        ));

        assertThat(index.latestReasoningLevel()).isEqualTo("medium");
    }

    @Test
    void shouldBuildEmptyIndexFromEmptyInput() {
        CorrelationIndex index = builder.build(decode());

        assertThat(index.toolCalls()).isEmpty();
        assertThat(index.latestReasoningLevel()).isNull();
    }
}
