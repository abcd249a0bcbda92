package com.linlay.agentreplay.state;

import com.linlay.agentreplay.event.DecodedEvent;
import com.linlay.agentreplay.event.EventPayload;
import com.linlay.agentreplay.index.CorrelationIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Folds an ordered event sequence into a {@link SessionSnapshot}.
 * <p>
 * Cumulative token totals only grow from generative-turn events. The context-window figure is
 * overwritten by each turn since it measures current occupancy. Turn-boundary markers move the
 * turn counter and nothing else: their usage repeats what the turn event already reported.
 */
public class SessionStateReducer {

    private static final Logger log = LoggerFactory.getLogger(SessionStateReducer.class);

    public SessionSnapshot reduce(List<DecodedEvent> orderedEvents, CorrelationIndex index) {
        Objects.requireNonNull(orderedEvents, "orderedEvents must not be null");
        Objects.requireNonNull(index, "index must not be null");

        SessionSnapshot snapshot = new SessionSnapshot();
        snapshot.setReasoningLevel(index.latestReasoningLevel());
        for (DecodedEvent event : orderedEvents) {
            if (index.isDeleted(event.id())) {
                continue;
            }
            apply(snapshot, event);
            snapshot.recordEvent(event.id(), event.timestamp());
        }
        log.debug("Reduced {} events: turn={}, outputTokens={}", snapshot.getEventCount(),
                snapshot.getCurrentTurn(), snapshot.getOutputTokens());
        return snapshot;
    }

    private void apply(SessionSnapshot snapshot, DecodedEvent event) {
        EventPayload payload = event.payload();
        Instant timestamp = event.timestamp();

        if (payload instanceof EventPayload.AssistantMessage turn) {
            snapshot.addTokenUsage(turn.tokenUsage());
            Long contextWindow = turn.effectiveContextWindowTokens();
            if (contextWindow != null) {
                snapshot.setContextWindowTokens(contextWindow);
            }
            snapshot.advanceTurn(turn.turn());
            if (turn.model() != null) {
                snapshot.setLastModel(turn.model());
            }
        } else if (payload instanceof EventPayload.TurnStart turnStart) {
            snapshot.advanceTurn(turnStart.turn());
        } else if (payload instanceof EventPayload.TurnEnd turnEnd) {
            snapshot.advanceTurn(turnEnd.turn());
        } else if (payload instanceof EventPayload.SessionStart start) {
            snapshot.setCurrentModel(start.model());
            snapshot.setInitialModel(start.model());
            snapshot.setWorkingDirectory(start.workingDirectory());
            snapshot.setTitle(start.title());
            snapshot.setStartTime(timestamp);
            start.tags().forEach(snapshot::addTag);
        } else if (payload instanceof EventPayload.SessionEnd end) {
            snapshot.setEndTime(timestamp);
            snapshot.setEndReason(end.reason());
        } else if (payload instanceof EventPayload.SessionFork fork) {
            snapshot.setForkSource(fork.sourceSessionId(), fork.sourceEventId());
        } else if (payload instanceof EventPayload.SessionBranch branch) {
            snapshot.setBranchName(branch.name());
        } else if (payload instanceof EventPayload.ModelSwitch modelSwitch) {
            snapshot.setCurrentModel(modelSwitch.newModel());
        } else if (payload instanceof EventPayload.FileRead read) {
            snapshot.addFileRead(read);
        } else if (payload instanceof EventPayload.FileWrite write) {
            snapshot.addFileWrite(write);
        } else if (payload instanceof EventPayload.FileEdit edit) {
            snapshot.addFileEdit(edit);
        } else if (payload instanceof EventPayload.WorktreeAcquired acquired) {
            snapshot.acquireWorktree(acquired.path(), acquired.branch());
        } else if (payload instanceof EventPayload.WorktreeReleased) {
            snapshot.releaseWorktree();
        } else if (payload instanceof EventPayload.WorktreeCommit commit) {
            snapshot.addCommit(commit);
        } else if (payload instanceof EventPayload.WorktreeMerged merged) {
            snapshot.addMerge(merged);
        } else if (payload instanceof EventPayload.CompactBoundary boundary) {
            snapshot.addCompactionBoundary(boundary);
        } else if (payload instanceof EventPayload.CompactSummary summary) {
            snapshot.addCompactionSummary(summary);
        } else if (payload instanceof EventPayload.ContextCleared cleared) {
            snapshot.setContextWindowTokens(cleared.tokensAfter());
            snapshot.incrementClearedCount();
        } else if (payload instanceof EventPayload.SkillAdded skill) {
            snapshot.addSkill(skill.skillName());
        } else if (payload instanceof EventPayload.SkillRemoved skill) {
            snapshot.removeSkill(skill.skillName());
        } else if (payload instanceof EventPayload.MetadataUpdate update) {
            snapshot.putCustomData(update.key(), update.newValue(), timestamp);
        } else if (payload instanceof EventPayload.MetadataTag tag) {
            if (tag.action() == EventPayload.TagAction.ADD) {
                snapshot.addTag(tag.tag());
            } else {
                snapshot.removeTag(tag.tag());
            }
        }
    }
}
