package com.linlay.agentreplay.transcript;

import com.linlay.agentreplay.event.DecodedEvent;
import com.linlay.agentreplay.event.EventPayload;
import com.linlay.agentreplay.index.CorrelationIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Second pass over an ordered event sequence producing the display transcript.
 * <p>
 * Tombstoned events are skipped. Tool call and result events never render on their own; they are
 * consumed through the tool_use blocks of the turn that issued them.
 */
public class TranscriptReconstructor {

    private static final Logger log = LoggerFactory.getLogger(TranscriptReconstructor.class);

    private final EventMessageFormatter eventMessageFormatter;
    private final ContentBlockInterleaver contentBlockInterleaver;

    public TranscriptReconstructor(EventMessageFormatter eventMessageFormatter, ContentBlockInterleaver contentBlockInterleaver) {
        this.eventMessageFormatter = Objects.requireNonNull(eventMessageFormatter, "eventMessageFormatter must not be null");
        this.contentBlockInterleaver = Objects.requireNonNull(contentBlockInterleaver, "contentBlockInterleaver must not be null");
    }

    public List<TranscriptMessage> reconstruct(List<DecodedEvent> orderedEvents, CorrelationIndex index) {
        Objects.requireNonNull(orderedEvents, "orderedEvents must not be null");
        Objects.requireNonNull(index, "index must not be null");

        ReconstructionContext context = ReconstructionContext.of(orderedEvents, index);
        List<TranscriptMessage> messages = new ArrayList<>();
        for (DecodedEvent event : orderedEvents) {
            if (index.isDeleted(event.id()) || !event.type().rendersAsMessage()) {
                continue;
            }
            if (event.payload() instanceof EventPayload.AssistantMessage turn) {
                messages.addAll(contentBlockInterleaver.expand(event, turn, context));
            } else {
                eventMessageFormatter.format(event).ifPresent(messages::add);
            }
        }
        log.debug("Reconstructed {} messages from {} events", messages.size(), orderedEvents.size());
        return List.copyOf(messages);
    }
}
