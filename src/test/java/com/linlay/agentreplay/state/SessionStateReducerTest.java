package com.linlay.agentreplay.state;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.agentreplay.event.DecodedEvent;
import com.linlay.agentreplay.event.SessionEvent;
import com.linlay.agentreplay.event.TokenUsage;
import com.linlay.agentreplay.index.CorrelationIndexBuilder;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.linlay.agentreplay.TestEvents.decode;
import static com.linlay.agentreplay.TestEvents.deleted;
import static com.linlay.agentreplay.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStateReducerTest {

    private final SessionStateReducer reducer = new SessionStateReducer();

    @Test
    void shouldNotDoubleCountTurnEndUsage() {
        SessionSnapshot before = reduce(
                event("a0", "message.assistant", 1, "{'content':[],'turn':1,'tokenUsage':{'inputTokens':10,'outputTokens':5}}")
        );
        SessionSnapshot after = reduce(
                event("a0", "message.assistant", 1, "{'content':[],'turn':1,'tokenUsage':{'inputTokens':10,'outputTokens':5}}"),
                event("a1", "message.assistant", 2, "{'content':[],'turn':2,'tokenUsage':{'inputTokens':100,'outputTokens':50}}"),
                event("t1", "stream.turn_end", 3, "{'turn':2,'tokenUsage':{'inputTokens':100,'outputTokens':50}}")
        );

        assertThat(after.getOutputTokens() - before.getOutputTokens()).isEqualTo(50);
        assertThat(after.getInputTokens()).isEqualTo(110);
        assertThat(after.getCurrentTurn()).isEqualTo(2);
    }

    @Test
    void shouldOverwriteContextWindowAndAccumulateTotals() {
        SessionSnapshot snapshot = reduce(
                event("a1", "message.assistant", 1, "{'content':[],'turn':1,"
                        + "'tokenUsage':{'inputTokens':1000,'outputTokens':200,'cacheReadTokens':300,'cacheCreationTokens':50}}"),
                event("a2", "message.assistant", 2, "{'content':[],'turn':2,'tokenUsage':{'inputTokens':400,'outputTokens':100},"
                        + "'normalizedUsage':{'contextWindowTokens':5200}}"),
                event("s1", "stream.turn_start", 3, "{'turnNumber':5}")
        );

        assertThat(snapshot.getTotalTokenUsage()).isEqualTo(new TokenUsage(1400, 300, 300, 50));
        assertThat(snapshot.getContextWindowTokens()).isEqualTo(5200L);
        assertThat(snapshot.getCurrentTurn()).isEqualTo(5);
    }

    @Test
    void shouldSetContextWindowFromClearedEvent() {
        SessionSnapshot snapshot = reduce(
                event("a1", "message.assistant", 1, "{'content':[],'tokenUsage':{'inputTokens':9000,'outputTokens':10}}"),
                event("c1", "context.cleared", 2, "{'tokensBefore':9000,'tokensAfter':0}")
        );

        assertThat(snapshot.getContextWindowTokens()).isZero();
        assertThat(snapshot.getClearedCount()).isEqualTo(1);
        assertThat(snapshot.getInputTokens()).isEqualTo(9000);
    }

    @Test
    void shouldTrackSessionModelAndReasoningLevel() {
        SessionSnapshot snapshot = reduce(
                event("s1", "session.start", 1, "{'model':'m-1','workingDirectory':'/repo','title':'Fix bug','tags':['wip']}"),
                event("a1", "message.assistant", 2, "{'content':[],'model':'m-1'}"),
                event("m1", "config.model_switch", 3, "{'previousModel':'m-1','newModel':'m-2'}"),
                event("r1", "config.reasoning_level", 4, "{'previousLevel':'low','newLevel':'high'}"),
                event("b1", "session.branch", 5, "{'branchId':'br1','name':'experiment'}"),
                event("f1", "session.fork", 6, "{'sourceSessionId':'parent','sourceEventId':'p9'}"),
                event("e1", "session.end", 7, "{'reason':'completed'}")
        );

        assertThat(snapshot.getCurrentModel()).isEqualTo("m-2");
        assertThat(snapshot.getInitialModel()).isEqualTo("m-1");
        assertThat(snapshot.getLastModel()).isEqualTo("m-1");
        assertThat(snapshot.getReasoningLevel()).isEqualTo("high");
        assertThat(snapshot.getWorkingDirectory()).isEqualTo("/repo");
        assertThat(snapshot.getTitle()).isEqualTo("Fix bug");
        assertThat(snapshot.getTags()).containsExactly("wip");
        assertThat(snapshot.getBranchName()).isEqualTo("experiment");
        assertThat(snapshot.getForkSourceSessionId()).isEqualTo("parent");
        assertThat(snapshot.getForkSourceEventId()).isEqualTo("p9");
        assertThat(snapshot.getStartTime()).isEqualTo(Instant.parse("2025-01-01T10:00:01Z"));
        assertThat(snapshot.getEndTime()).isEqualTo(Instant.parse("2025-01-01T10:00:07Z"));
        assertThat(snapshot.getEndReason()).isEqualTo("completed");
    }

    @Test
    void shouldRecordFileAndWorktreeActivityWithoutValidation() {
        SessionSnapshot snapshot = reduce(
                event("f1", "file.read", 1, "{'path':'a.txt','lines':{'start':1,'end':20}}"),
                event("f2", "file.edit", 2, "{'path':'never-read.txt','oldString':'x','newString':'y'}"),
                event("f3", "file.write", 3, "{'path':'a.txt','contentHash':'h1','size':12}"),
                event("w1", "worktree.acquired", 4, "{'path':'/wt/1','branch':'feature','baseCommit':'abc'}"),
                event("w2", "worktree.commit", 5, "{'hash':'def','message':'wip','filesChanged':['a.txt']}"),
                event("w3", "worktree.merged", 6, "{'sourceBranch':'feature','targetBranch':'main','mergeCommit':'123'}"),
                event("w4", "worktree.released", 7, "{'deleted':true}")
        );

        assertThat(snapshot.getFileReads()).hasSize(1);
        assertThat(snapshot.getFileReads().get(0).linesEnd()).isEqualTo(20);
        assertThat(snapshot.getModifiedFiles()).containsExactly("a.txt", "never-read.txt");
        assertThat(snapshot.getTouchedFiles()).containsExactly("a.txt", "never-read.txt");
        assertThat(snapshot.isWorktreeAcquired()).isFalse();
        assertThat(snapshot.getWorktreePath()).isEqualTo("/wt/1");
        assertThat(snapshot.getCommits()).extracting(commit -> commit.commitHash()).containsExactly("def");
        assertThat(snapshot.getMerges()).hasSize(1);
    }

    @Test
    void shouldTrackCompactionSkillsMetadataAndTags() {
        SessionSnapshot snapshot = reduce(
                event("c1", "compact.boundary", 1, "{'range':{'from':'e1','to':'e9'},'originalTokens':10000,'compactedTokens':2000}"),
                event("c2", "compact.summary", 2, "{'summary':'Refactored parser','boundaryEventId':'c1'}"),
                event("k1", "skill.added", 3, "{'skillName':'pdf'}"),
                event("k2", "skill.added", 4, "{'skillName':'xlsx'}"),
                event("k3", "skill.removed", 5, "{'skillName':'pdf'}"),
                event("m1", "metadata.update", 6, "{'key':'priority','newValue':{'level':2}}"),
                event("t1", "metadata.tag", 7, "{'action':'add','tag':'review'}"),
                event("t2", "metadata.tag", 8, "{'action':'add','tag':'review'}"),
                event("t3", "metadata.tag", 9, "{'action':'add','tag':'urgent'}"),
                event("t4", "metadata.tag", 10, "{'action':'remove','tag':'review'}")
        );

        assertThat(snapshot.getCompactionCount()).isEqualTo(1);
        assertThat(snapshot.getTokensSaved()).isEqualTo(8000);
        assertThat(snapshot.getCompactionSummaries()).hasSize(1);
        assertThat(snapshot.getSkills()).containsExactly("xlsx");
        assertThat(snapshot.getCustomData().get("priority").get("level").asInt()).isEqualTo(2);
        assertThat(snapshot.getLastUpdated()).isEqualTo(Instant.parse("2025-01-01T10:00:06Z"));
        assertThat(snapshot.getTags()).containsExactly("urgent");
        assertThat(snapshot.getEventCount()).isEqualTo(10);
        assertThat(snapshot.getLastEventId()).isEqualTo("t4");
    }

    @Test
    void shouldIgnoreTombstonedContributions() {
        SessionSnapshot snapshot = reduce(
                event("a1", "message.assistant", 1, "{'content':[],'tokenUsage':{'inputTokens':100,'outputTokens':50}}"),
                event("a2", "message.assistant", 2, "{'content':[],'tokenUsage':{'inputTokens':10,'outputTokens':5}}"),
                event("t1", "metadata.tag", 3, "{'action':'add','tag':'hidden'}"),
                deleted("d1", 4, "a1"),
                deleted("d2", 5, "t1")
        );

        assertThat(snapshot.getOutputTokens()).isEqualTo(5);
        assertThat(snapshot.getInputTokens()).isEqualTo(10);
        assertThat(snapshot.getTags()).isEmpty();
    }

    @Test
    void shouldExposeReadOnlyViews() {
        SessionSnapshot snapshot = reduce(event("t1", "metadata.tag", 1, "{'action':'add','tag':'a'}"));

        List<String> tags = snapshot.getTags();
        assertThatThrownBy(() -> tags.add("b"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldDetachCustomDataFromEventPayload() {
        List<DecodedEvent> decoded = decode(event("m1", "metadata.update", 1, "{'key':'priority','newValue':{'level':2}}"));
        SessionSnapshot first = reducer.reduce(decoded, new CorrelationIndexBuilder().build(decoded));

        ((ObjectNode) first.getCustomData().get("priority")).put("level", 99);
        SessionSnapshot second = reducer.reduce(decoded, new CorrelationIndexBuilder().build(decoded));

        assertThat(second.getCustomData().get("priority").get("level").asInt()).isEqualTo(2);
    }

    private SessionSnapshot reduce(SessionEvent... events) {
        List<DecodedEvent> decoded = decode(events);
        return reducer.reduce(decoded, new CorrelationIndexBuilder().build(decoded));
    }
}
