package com.linlay.agentreplay.event;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.linlay.agentreplay.TestEvents.MAPPER;
import static org.assertj.core.api.Assertions.assertThat;

class SessionEventReaderTest {

    private final SessionEventReader reader = new SessionEventReader(MAPPER);

    @Test
    void shouldReadJsonArray() {
        List<SessionEvent> events = reader.read("""
                [
                  {"id":"e1","sessionId":"s1","workspaceId":"w1","type":"session.start","timestamp":"2025-01-01T10:00:00Z","sequence":1,"payload":{"model":"m1"}},
                  {"id":"e2","parentId":"e1","sessionId":"s1","workspaceId":"w1","type":"message.user","timestamp":"2025-01-01T10:00:01Z","sequence":2,"payload":{"content":"hi"}}
                ]
                """);

        assertThat(events).extracting(SessionEvent::id).containsExactly("e1", "e2");
        assertThat(events.get(1).parentId()).isEqualTo("e1");
        assertThat(events.get(1).payload().get("content").asText()).isEqualTo("hi");
    }

    @Test
    void shouldReadHistoryEnvelopeAndStringPayloads() {
        List<SessionEvent> events = reader.read("""
                {"events":[
                  {"id":"e1","sessionId":"s1","type":"message.user","createdAt":"2025-01-01T10:00:00Z","seq":4,"payload":"{\\"content\\":\\"cached\\"}"}
                ],"hasMore":false}
                """);

        assertThat(events).hasSize(1);
        SessionEvent event = events.get(0);
        assertThat(event.sequence()).isEqualTo(4);
        assertThat(event.timestamp()).isEqualTo("2025-01-01T10:00:00Z");
        assertThat(event.payload().get("content").asText()).isEqualTo("cached");
    }

    @Test
    void shouldReadJsonLinesAndSkipBrokenEntries() {
        List<SessionEvent> events = reader.read("""
                {"id":"e1","type":"message.user","sequence":1,"payload":{"content":"a"}}
                not json at all
                {"type":"message.user","sequence":2,"payload":{"content":"no id"}}

                {"id":"e3","type":"message.user","sequence":3,"payload":{"content":"c"}}
                """);

        assertThat(events).extracting(SessionEvent::id).containsExactly("e1", "e3");
    }

    @Test
    void shouldReturnEmptyListForBlankInput() {
        assertThat(reader.read("  ")).isEmpty();
        assertThat(reader.read(null)).isEmpty();
    }
}
