package com.linlay.agentreplay.service;

import com.linlay.agentreplay.event.SessionEvent;
import com.linlay.agentreplay.transcript.MessageContent;
import com.linlay.agentreplay.transcript.ToolStatus;
import com.linlay.agentreplay.transcript.TranscriptMessage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.linlay.agentreplay.TestEvents.MAPPER;
import static com.linlay.agentreplay.TestEvents.assistant;
import static com.linlay.agentreplay.TestEvents.deleted;
import static com.linlay.agentreplay.TestEvents.event;
import static com.linlay.agentreplay.TestEvents.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionReplayServiceTest {

    private final SessionReplayService service = SessionReplayService.withDefaults(MAPPER);

    @Test
    void shouldReplayDeterministically() {
        List<SessionEvent> events = List.of(
                event("s1", "session.start", 1, "{'model':'m-1'}"),
                user("u1", 2, "List files"),
                event("a1", "message.assistant", 3, "{'content':[{'type':'text','text':'Sure'},"
                        + "{'type':'tool_use','id':'t1','name':'Bash','input':{'cmd':'ls','cwd':'/'}}],"
                        + "'turn':1,'tokenUsage':{'inputTokens':100,'outputTokens':50}}"),
                event("c1", "tool.call", 4, "{'toolCallId':'t1','name':'Bash','arguments':{'cwd':'/','cmd':'ls'}}"),
                event("r1", "tool.result", 5, "{'toolCallId':'t1','content':'a.txt'}"),
                event("m1", "metadata.update", 6, "{'key':'a','newValue':1}")
        );

        ReplayResult first = service.replay(events, false);
        ReplayResult second = service.replay(events, false);

        assertThat(second.messages()).isEqualTo(first.messages());
        assertThat(second.snapshot().getTotalTokenUsage()).isEqualTo(first.snapshot().getTotalTokenUsage());
        assertThat(second.snapshot().getCustomData()).isEqualTo(first.snapshot().getCustomData());
        assertThat(first.messages()).hasSize(3);
    }

    @Test
    void shouldProduceSameResultRegardlessOfInputOrderWhenSorting() {
        List<SessionEvent> events = new ArrayList<>(List.of(
                user("u1", 1, "one"),
                assistant("a1", 2, "[{'type':'text','text':'two'}]"),
                user("u2", 3, "three")
        ));
        List<TranscriptMessage> ordered = service.transcript(events, false);
        Collections.reverse(events);

        assertThat(service.transcript(events, false)).isEqualTo(ordered);
    }

    @Test
    void shouldHideTombstonedTurnAndItsToolOutput() {
        List<SessionEvent> events = List.of(
                user("u1", 1, "run it"),
                assistant("a1", 2, "[{'type':'tool_use','id':'t1','name':'Bash','input':{}}]"),
                event("c1", "tool.call", 3, "{'toolCallId':'t1','name':'Bash'}"),
                event("r1", "tool.result", 4, "{'toolCallId':'t1','content':'secret'}"),
                assistant("a2", 5, "[{'type':'tool_use','id':'t1','name':'Bash','input':{}}]"),
                deleted("d1", 6, "a1"),
                deleted("d2", 7, "r1")
        );

        ReplayResult result = service.replay(events, false);

        assertThat(result.messages()).extracting(TranscriptMessage::eventId).containsExactly("u1", "a2");
        MessageContent.ToolUse tool = (MessageContent.ToolUse) result.messages().get(1).content();
        assertThat(tool.status()).isEqualTo(ToolStatus.RUNNING);
        assertThat(tool.result()).isNull();
    }

    @Test
    void shouldKeepPresortedForkOrderWithOverlappingSequences() {
        List<SessionEvent> parent = List.of(
                event("p1", "parent", "message.user", 1, "2025-01-01T10:00:01Z", "{'content':'parent one'}"),
                event("p2", "parent", "message.user", 2, "2025-01-01T10:00:02Z", "{'content':'parent two'}")
        );
        List<SessionEvent> fork = List.of(
                event("f0", "fork", "session.fork", 0, "2025-01-01T11:00:00Z", "{'sourceSessionId':'parent','sourceEventId':'p2'}"),
                event("f1", "fork", "message.user", 1, "2025-01-01T11:00:01Z", "{'content':'fork one'}")
        );
        List<SessionEvent> stitched = new ArrayList<>(parent);
        stitched.addAll(fork);

        ReplayResult presorted = service.replay(stitched, true);
        ReplayResult ancestry = service.replayAncestry(List.of(parent, fork), false);
        ReplayResult resorted = service.replay(stitched, false);

        assertThat(presorted.messages()).extracting(TranscriptMessage::eventId).containsExactly("p1", "p2", "f1");
        assertThat(ancestry.messages()).isEqualTo(presorted.messages());
        assertThat(resorted.messages()).extracting(TranscriptMessage::eventId).containsExactly("p1", "f1", "p2");
        assertThat(presorted.snapshot().getForkSourceEventId()).isEqualTo("p2");
        assertThat(presorted.snapshot().getLastEventId()).isEqualTo("f1");
    }

    @Test
    void shouldReplayJsonAndSkipUnknownEvents() {
        ReplayResult result = service.replayJson("""
                {"events":[
                  {"id":"e1","sessionId":"s","type":"message.user","timestamp":"2025-01-01T10:00:00Z","sequence":1,"payload":{"content":"hello"}},
                  {"id":"e2","sessionId":"s","type":"plugin.custom","timestamp":"2025-01-01T10:00:01Z","sequence":2,"payload":{}},
                  {"id":"e3","sessionId":"s","type":"message.assistant","timestamp":"2025-01-01T10:00:02Z","sequence":3,
                   "payload":{"content":[{"type":"text","text":"hi"}],"tokenUsage":{"inputTokens":5,"outputTokens":2}}}
                ]}
                """, false);

        assertThat(result.messages()).extracting(TranscriptMessage::eventId).containsExactly("e1", "e3");
        assertThat(result.snapshot().getOutputTokens()).isEqualTo(2);
        assertThat(result.snapshot().getEventCount()).isEqualTo(2);
    }

    @Test
    void shouldRejectNullEvents() {
        assertThatThrownBy(() -> service.replay(null, false)).isInstanceOf(NullPointerException.class);
    }
}
