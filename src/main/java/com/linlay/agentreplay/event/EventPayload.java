package com.linlay.agentreplay.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public sealed interface EventPayload permits
        EventPayload.SessionStart,
        EventPayload.SessionEnd,
        EventPayload.SessionFork,
        EventPayload.SessionBranch,
        EventPayload.UserMessage,
        EventPayload.AssistantMessage,
        EventPayload.SystemMessage,
        EventPayload.MessageDeleted,
        EventPayload.ToolCall,
        EventPayload.ToolResult,
        EventPayload.ModelSwitch,
        EventPayload.ReasoningLevel,
        EventPayload.AgentError,
        EventPayload.ToolError,
        EventPayload.ProviderError,
        EventPayload.Interrupted,
        EventPayload.ContextCleared,
        EventPayload.CompactBoundary,
        EventPayload.CompactSummary,
        EventPayload.SkillAdded,
        EventPayload.SkillRemoved,
        EventPayload.FileRead,
        EventPayload.FileWrite,
        EventPayload.FileEdit,
        EventPayload.WorktreeAcquired,
        EventPayload.WorktreeCommit,
        EventPayload.WorktreeMerged,
        EventPayload.WorktreeReleased,
        EventPayload.MetadataUpdate,
        EventPayload.MetadataTag,
        EventPayload.TurnStart,
        EventPayload.TurnEnd {

    record SessionStart(
            String workingDirectory,
            String model,
            String provider,
            String title,
            List<String> tags
    ) implements EventPayload {
        public SessionStart {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }
    }

    record SessionEnd(String reason, String summary) implements EventPayload {
    }

    record SessionFork(String sourceSessionId, String sourceEventId, String name) implements EventPayload {
        public SessionFork {
            requireNonBlank(sourceSessionId, "sourceSessionId");
            requireNonBlank(sourceEventId, "sourceEventId");
        }
    }

    record SessionBranch(String branchId, String name, String description) implements EventPayload {
        public SessionBranch {
            requireNonBlank(branchId, "branchId");
            requireNonBlank(name, "name");
        }
    }

    /**
     * @param toolResultContext the message only carries tool results fed back to the model
     */
    record UserMessage(
            String content,
            boolean toolResultContext,
            int turn,
            Integer imageCount,
            List<String> skills
    ) implements EventPayload {
        public UserMessage {
            requireNonNull(content, "content");
            skills = skills == null ? List.of() : List.copyOf(skills);
        }
    }

    record AssistantMessage(
            List<ContentBlock> content,
            int turn,
            TokenUsage tokenUsage,
            Long contextWindowTokens,
            String stopReason,
            Long latencyMs,
            String model,
            Boolean hasThinking,
            Boolean interrupted
    ) implements EventPayload {
        public AssistantMessage {
            content = content == null ? List.of() : List.copyOf(content);
        }

        /**
         * Normalized context-window figure for this turn, falling back to the usage sum when the
         * producer did not record one.
         */
        public Long effectiveContextWindowTokens() {
            if (contextWindowTokens != null) {
                return contextWindowTokens;
            }
            return tokenUsage == null ? null : tokenUsage.contextWindowTokens();
        }
    }

    record SystemMessage(String content, String source) implements EventPayload {
        public SystemMessage {
            requireNonNull(content, "content");
        }
    }

    record MessageDeleted(String targetEventId, String targetType, String reason) implements EventPayload {
        public MessageDeleted {
            requireNonBlank(targetEventId, "targetEventId");
        }
    }

    record ToolCall(String toolCallId, String name, String arguments, int turn) implements EventPayload {
        public ToolCall {
            requireNonBlank(toolCallId, "toolCallId");
            requireNonBlank(name, "name");
        }
    }

    record ToolResult(
            String toolCallId,
            String content,
            boolean error,
            Long durationMs,
            Boolean truncated,
            List<String> affectedFiles,
            String name,
            String arguments
    ) implements EventPayload {
        public ToolResult {
            requireNonBlank(toolCallId, "toolCallId");
            content = content == null ? "" : content;
            affectedFiles = affectedFiles == null ? List.of() : List.copyOf(affectedFiles);
        }
    }

    record ModelSwitch(String previousModel, String newModel, String reason) implements EventPayload {
        public ModelSwitch {
            requireNonNull(previousModel, "previousModel");
            newModel = newModel == null ? "" : newModel;
        }
    }

    record ReasoningLevel(String previousLevel, String newLevel) implements EventPayload {
    }

    record AgentError(String error, String code, boolean recoverable) implements EventPayload {
        public AgentError {
            requireNonNull(error, "error");
        }
    }

    record ToolError(String toolName, String toolCallId, String error, String code) implements EventPayload {
        public ToolError {
            requireNonNull(toolName, "toolName");
            requireNonNull(toolCallId, "toolCallId");
            requireNonNull(error, "error");
        }
    }

    record ProviderError(
            String provider,
            String error,
            String code,
            boolean retryable,
            Long retryAfter
    ) implements EventPayload {
        public ProviderError {
            requireNonNull(provider, "provider");
            requireNonNull(error, "error");
        }
    }

    record Interrupted(Integer turn) implements EventPayload {
    }

    record ContextCleared(long tokensBefore, long tokensAfter) implements EventPayload {
    }

    record CompactBoundary(
            String rangeFrom,
            String rangeTo,
            long originalTokens,
            long compactedTokens
    ) implements EventPayload {
        public CompactBoundary {
            requireNonNull(rangeFrom, "range.from");
            requireNonNull(rangeTo, "range.to");
        }
    }

    record CompactSummary(
            String summary,
            String boundaryEventId,
            List<String> keyDecisions,
            List<String> filesModified
    ) implements EventPayload {
        public CompactSummary {
            requireNonNull(summary, "summary");
            requireNonNull(boundaryEventId, "boundaryEventId");
            keyDecisions = keyDecisions == null ? List.of() : List.copyOf(keyDecisions);
            filesModified = filesModified == null ? List.of() : List.copyOf(filesModified);
        }
    }

    record SkillAdded(String skillName) implements EventPayload {
        public SkillAdded {
            requireNonBlank(skillName, "skillName");
        }
    }

    record SkillRemoved(String skillName) implements EventPayload {
        public SkillRemoved {
            requireNonBlank(skillName, "skillName");
        }
    }

    record FileRead(String path, Integer linesStart, Integer linesEnd) implements EventPayload {
        public FileRead {
            requireNonBlank(path, "path");
        }
    }

    record FileWrite(String path, String contentHash, long size) implements EventPayload {
        public FileWrite {
            requireNonBlank(path, "path");
            requireNonNull(contentHash, "contentHash");
        }
    }

    record FileEdit(String path, String oldString, String newString, String diff) implements EventPayload {
        public FileEdit {
            requireNonBlank(path, "path");
            requireNonNull(oldString, "oldString");
            requireNonNull(newString, "newString");
        }
    }

    record WorktreeAcquired(String path, String branch, String baseCommit, boolean isolated) implements EventPayload {
        public WorktreeAcquired {
            requireNonBlank(path, "path");
            requireNonBlank(branch, "branch");
            requireNonNull(baseCommit, "baseCommit");
        }
    }

    record WorktreeCommit(
            String commitHash,
            String message,
            List<String> filesChanged,
            Integer insertions,
            Integer deletions
    ) implements EventPayload {
        public WorktreeCommit {
            requireNonBlank(commitHash, "commitHash");
            requireNonNull(message, "message");
            filesChanged = filesChanged == null ? List.of() : List.copyOf(filesChanged);
        }
    }

    record WorktreeMerged(
            String sourceBranch,
            String targetBranch,
            String mergeCommit,
            String strategy
    ) implements EventPayload {
        public WorktreeMerged {
            requireNonBlank(sourceBranch, "sourceBranch");
            requireNonBlank(targetBranch, "targetBranch");
            requireNonBlank(mergeCommit, "mergeCommit");
        }
    }

    record WorktreeReleased(String finalCommit, boolean deleted, boolean branchPreserved) implements EventPayload {
    }

    record MetadataUpdate(String key, JsonNode previousValue, JsonNode newValue) implements EventPayload {
        public MetadataUpdate {
            requireNonBlank(key, "key");
        }
    }

    record MetadataTag(TagAction action, String tag) implements EventPayload {
        public MetadataTag {
            requireNonNull(action, "action");
            requireNonBlank(tag, "tag");
        }
    }

    record TurnStart(int turn) implements EventPayload {
    }

    record TurnEnd(int turn, TokenUsage tokenUsage) implements EventPayload {
    }

    enum TagAction {
        ADD,
        REMOVE;

        public static TagAction parse(String raw) {
            if (raw == null) {
                return null;
            }
            return switch (raw.trim().toLowerCase()) {
                case "add" -> ADD;
                case "remove" -> REMOVE;
                default -> null;
            };
        }
    }

    private static void requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be null or blank");
        }
    }

    private static void requireNonNull(Object value, String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
    }
}
