package com.linlay.agentreplay.transcript;

import com.linlay.agentreplay.event.ArgumentsFormatter;
import com.linlay.agentreplay.event.ContentBlock;
import com.linlay.agentreplay.index.CorrelationIndex;
import com.linlay.agentreplay.index.CorrelationIndexBuilder;
import org.junit.jupiter.api.Test;

import static com.linlay.agentreplay.TestEvents.MAPPER;
import static com.linlay.agentreplay.TestEvents.decode;
import static com.linlay.agentreplay.TestEvents.event;
import static com.linlay.agentreplay.TestEvents.json;
import static org.assertj.core.api.Assertions.assertThat;

class ToolUseMergerTest {

    private final ToolUseMerger merger = new ToolUseMerger(new ArgumentsFormatter(MAPPER));

    @Test
    void shouldFallBackToBlockDataWithoutCorrelatedEvents() {
        ContentBlock.ToolUse block = new ContentBlock.ToolUse("x", "Grep", json("{'pattern':'foo','path':'src'}"));

        MessageContent.ToolUse merged = merger.merge(block, CorrelationIndex.EMPTY, 4);

        assertThat(merged.status()).isEqualTo(ToolStatus.RUNNING);
        assertThat(merged.toolName()).isEqualTo("Grep");
        assertThat(merged.arguments()).isEqualTo("{\"path\":\"src\",\"pattern\":\"foo\"}");
        assertThat(merged.result()).isNull();
        assertThat(merged.durationMs()).isNull();
        assertThat(merged.turn()).isEqualTo(4);
    }

    @Test
    void shouldUseUnknownNameAndEmptyArgumentsAsLastResort() {
        MessageContent.ToolUse merged = merger.merge(new ContentBlock.ToolUse("x", null, null), CorrelationIndex.EMPTY, 1);

        assertThat(merged.toolName()).isEqualTo("Unknown");
        assertThat(merged.arguments()).isEqualTo("{}");
    }

    @Test
    void shouldPreferCallEventAndReportResult() {
        CorrelationIndex index = new CorrelationIndexBuilder().build(decode(
                event("c1", "tool.call", 1, "{'toolCallId':'t1','name':'Bash','arguments':'{\\'cmd\\':\\'ls\\'}','turn':7}"),
                event("r1", "tool.result", 2, "{'toolCallId':'t1','content':'','durationMs':40}"),
                event("c2", "tool.call", 3, "{'toolCallId':'t2','name':'Bash'}"),
                event("r2", "tool.result", 4, "{'toolCallId':'t2','content':'boom','isError':true}")
        ));

        MessageContent.ToolUse first = merger.merge(new ContentBlock.ToolUse("t1", "Other", json("{'ignored':1}")), index, 1);
        MessageContent.ToolUse second = merger.merge(new ContentBlock.ToolUse("t2", null, json("{'cmd':'pwd'}")), index, 1);

        assertThat(first.toolName()).isEqualTo("Bash");
        assertThat(first.arguments()).isEqualTo("{\"cmd\":\"ls\"}");
        assertThat(first.status()).isEqualTo(ToolStatus.SUCCESS);
        assertThat(first.result()).isEqualTo("(no output)");
        assertThat(first.durationMs()).isEqualTo(40L);
        assertThat(first.turn()).isEqualTo(7);

        assertThat(second.status()).isEqualTo(ToolStatus.ERROR);
        assertThat(second.result()).isEqualTo("boom");
        assertThat(second.arguments()).isEqualTo("{\"cmd\":\"pwd\"}");
    }
}
