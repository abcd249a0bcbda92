package com.linlay.agentreplay.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.agentreplay.event.EventPayload;
import com.linlay.agentreplay.event.TokenUsage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregated session state. Created fresh by {@link SessionStateReducer} for every replay and
 * mutated only while the reducer folds events; callers see read-only views.
 */
public class SessionSnapshot {

    private long inputTokens;
    private long outputTokens;
    private long cacheReadTokens;
    private long cacheCreationTokens;
    private Long contextWindowTokens;
    private int currentTurn;

    private String currentModel;
    private String initialModel;
    private String lastModel;
    private String reasoningLevel;

    private String title;
    private String workingDirectory;
    private Instant startTime;
    private Instant endTime;
    private String endReason;
    private String forkSourceSessionId;
    private String forkSourceEventId;
    private String branchName;

    private final List<EventPayload.FileRead> fileReads = new ArrayList<>();
    private final List<EventPayload.FileWrite> fileWrites = new ArrayList<>();
    private final List<EventPayload.FileEdit> fileEdits = new ArrayList<>();

    private boolean worktreeAcquired;
    private String worktreePath;
    private String worktreeBranch;
    private final List<EventPayload.WorktreeCommit> commits = new ArrayList<>();
    private final List<EventPayload.WorktreeMerged> merges = new ArrayList<>();

    private final List<EventPayload.CompactBoundary> compactionBoundaries = new ArrayList<>();
    private final List<EventPayload.CompactSummary> compactionSummaries = new ArrayList<>();
    private int clearedCount;

    private final List<String> skills = new ArrayList<>();
    private final Map<String, JsonNode> customData = new LinkedHashMap<>();
    private Instant lastUpdated;
    private final List<String> tags = new ArrayList<>();

    private int eventCount;
    private String lastEventId;
    private Instant lastTimestamp;

    SessionSnapshot() {
    }

    public long getInputTokens() {
        return inputTokens;
    }

    public long getOutputTokens() {
        return outputTokens;
    }

    public long getCacheReadTokens() {
        return cacheReadTokens;
    }

    public long getCacheCreationTokens() {
        return cacheCreationTokens;
    }

    public TokenUsage getTotalTokenUsage() {
        return new TokenUsage(inputTokens, outputTokens, cacheReadTokens, cacheCreationTokens);
    }

    /**
     * Occupancy of the context window after the latest turn, {@code null} before the first turn.
     */
    public Long getContextWindowTokens() {
        return contextWindowTokens;
    }

    public int getCurrentTurn() {
        return currentTurn;
    }

    public String getCurrentModel() {
        return currentModel;
    }

    public String getInitialModel() {
        return initialModel;
    }

    public String getLastModel() {
        return lastModel;
    }

    public String getReasoningLevel() {
        return reasoningLevel;
    }

    public String getTitle() {
        return title;
    }

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public String getEndReason() {
        return endReason;
    }

    public String getForkSourceSessionId() {
        return forkSourceSessionId;
    }

    public String getForkSourceEventId() {
        return forkSourceEventId;
    }

    public String getBranchName() {
        return branchName;
    }

    public List<EventPayload.FileRead> getFileReads() {
        return Collections.unmodifiableList(fileReads);
    }

    public List<EventPayload.FileWrite> getFileWrites() {
        return Collections.unmodifiableList(fileWrites);
    }

    public List<EventPayload.FileEdit> getFileEdits() {
        return Collections.unmodifiableList(fileEdits);
    }

    /**
     * Distinct written or edited paths in first-seen order.
     */
    public List<String> getModifiedFiles() {
        Set<String> paths = new LinkedHashSet<>();
        fileWrites.forEach(write -> paths.add(write.path()));
        fileEdits.forEach(edit -> paths.add(edit.path()));
        return List.copyOf(paths);
    }

    /**
     * Distinct read, written or edited paths in first-seen order.
     */
    public List<String> getTouchedFiles() {
        Set<String> paths = new LinkedHashSet<>();
        fileReads.forEach(read -> paths.add(read.path()));
        paths.addAll(getModifiedFiles());
        return List.copyOf(paths);
    }

    public boolean isWorktreeAcquired() {
        return worktreeAcquired;
    }

    public String getWorktreePath() {
        return worktreePath;
    }

    public String getWorktreeBranch() {
        return worktreeBranch;
    }

    public List<EventPayload.WorktreeCommit> getCommits() {
        return Collections.unmodifiableList(commits);
    }

    public List<EventPayload.WorktreeMerged> getMerges() {
        return Collections.unmodifiableList(merges);
    }

    public List<EventPayload.CompactBoundary> getCompactionBoundaries() {
        return Collections.unmodifiableList(compactionBoundaries);
    }

    public List<EventPayload.CompactSummary> getCompactionSummaries() {
        return Collections.unmodifiableList(compactionSummaries);
    }

    public int getCompactionCount() {
        return compactionBoundaries.size();
    }

    public long getTokensSaved() {
        long saved = 0;
        for (EventPayload.CompactBoundary boundary : compactionBoundaries) {
            saved += Math.max(0, boundary.originalTokens() - boundary.compactedTokens());
        }
        return saved;
    }

    public int getClearedCount() {
        return clearedCount;
    }

    public List<String> getSkills() {
        return Collections.unmodifiableList(skills);
    }

    public Map<String, JsonNode> getCustomData() {
        return Collections.unmodifiableMap(customData);
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public int getEventCount() {
        return eventCount;
    }

    public String getLastEventId() {
        return lastEventId;
    }

    public Instant getLastTimestamp() {
        return lastTimestamp;
    }

    void addTokenUsage(TokenUsage usage) {
        if (usage == null) {
            return;
        }
        inputTokens += usage.inputTokens();
        outputTokens += usage.outputTokens();
        cacheReadTokens += usage.cacheReadTokens();
        cacheCreationTokens += usage.cacheCreationTokens();
    }

    void setContextWindowTokens(Long contextWindowTokens) {
        this.contextWindowTokens = contextWindowTokens;
    }

    void advanceTurn(int turn) {
        currentTurn = Math.max(currentTurn, turn);
    }

    void setCurrentModel(String currentModel) {
        this.currentModel = currentModel;
    }

    void setInitialModel(String initialModel) {
        this.initialModel = initialModel;
    }

    void setLastModel(String lastModel) {
        this.lastModel = lastModel;
    }

    void setReasoningLevel(String reasoningLevel) {
        this.reasoningLevel = reasoningLevel;
    }

    void setTitle(String title) {
        this.title = title;
    }

    void setWorkingDirectory(String workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    void setEndReason(String endReason) {
        this.endReason = endReason;
    }

    void setForkSource(String sessionId, String eventId) {
        this.forkSourceSessionId = sessionId;
        this.forkSourceEventId = eventId;
    }

    void setBranchName(String branchName) {
        this.branchName = branchName;
    }

    void addFileRead(EventPayload.FileRead read) {
        fileReads.add(read);
    }

    void addFileWrite(EventPayload.FileWrite write) {
        fileWrites.add(write);
    }

    void addFileEdit(EventPayload.FileEdit edit) {
        fileEdits.add(edit);
    }

    void acquireWorktree(String path, String branch) {
        worktreeAcquired = true;
        worktreePath = path;
        worktreeBranch = branch;
    }

    void releaseWorktree() {
        worktreeAcquired = false;
    }

    void addCommit(EventPayload.WorktreeCommit commit) {
        commits.add(commit);
    }

    void addMerge(EventPayload.WorktreeMerged merge) {
        merges.add(merge);
    }

    void addCompactionBoundary(EventPayload.CompactBoundary boundary) {
        compactionBoundaries.add(boundary);
    }

    void addCompactionSummary(EventPayload.CompactSummary summary) {
        compactionSummaries.add(summary);
    }

    void incrementClearedCount() {
        clearedCount++;
    }

    void addSkill(String skill) {
        if (!skills.contains(skill)) {
            skills.add(skill);
        }
    }

    void removeSkill(String skill) {
        skills.remove(skill);
    }

    void putCustomData(String key, JsonNode value, Instant updatedAt) {
        // snapshot values never alias event payload nodes
        customData.put(key, value == null ? null : value.deepCopy());
        if (updatedAt != null) {
            lastUpdated = updatedAt;
        }
    }

    void addTag(String tag) {
        if (!tags.contains(tag)) {
            tags.add(tag);
        }
    }

    void removeTag(String tag) {
        tags.remove(tag);
    }

    void recordEvent(String eventId, Instant timestamp) {
        eventCount++;
        lastEventId = eventId;
        if (timestamp != null) {
            lastTimestamp = timestamp;
        }
    }
}
