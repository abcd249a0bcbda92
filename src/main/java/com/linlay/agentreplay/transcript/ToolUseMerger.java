package com.linlay.agentreplay.transcript;

import com.linlay.agentreplay.event.ArgumentsFormatter;
import com.linlay.agentreplay.event.ContentBlock;
import com.linlay.agentreplay.index.CorrelationIndex;
import com.linlay.agentreplay.index.ToolCallDetails;
import com.linlay.agentreplay.index.ToolResultDetails;

import java.util.Objects;

/**
 * Merges a tool_use content block with its correlated call and result events into one display
 * unit. Call event data wins over block data; either may be missing.
 */
public class ToolUseMerger {

    public static final String DEFAULT_UNKNOWN_TOOL_NAME = "Unknown";
    public static final String DEFAULT_EMPTY_RESULT = "(no output)";

    private final ArgumentsFormatter argumentsFormatter;
    private final String unknownToolName;
    private final String emptyResultPlaceholder;

    public ToolUseMerger(ArgumentsFormatter argumentsFormatter, String unknownToolName, String emptyResultPlaceholder) {
        this.argumentsFormatter = Objects.requireNonNull(argumentsFormatter, "argumentsFormatter must not be null");
        this.unknownToolName = unknownToolName == null ? DEFAULT_UNKNOWN_TOOL_NAME : unknownToolName;
        this.emptyResultPlaceholder = emptyResultPlaceholder == null ? DEFAULT_EMPTY_RESULT : emptyResultPlaceholder;
    }

    public ToolUseMerger(ArgumentsFormatter argumentsFormatter) {
        this(argumentsFormatter, DEFAULT_UNKNOWN_TOOL_NAME, DEFAULT_EMPTY_RESULT);
    }

    public MessageContent.ToolUse merge(ContentBlock.ToolUse block, CorrelationIndex index, int eventTurn) {
        ToolCallDetails call = index.toolCall(block.id()).orElse(null);
        ToolResultDetails result = index.toolResult(block.id()).orElse(null);

        ToolStatus status;
        String resultContent;
        if (result == null) {
            status = ToolStatus.RUNNING;
            resultContent = null;
        } else {
            status = result.error() ? ToolStatus.ERROR : ToolStatus.SUCCESS;
            resultContent = result.content().isEmpty() ? emptyResultPlaceholder : result.content();
        }

        return new MessageContent.ToolUse(
                block.id(),
                resolveName(block, index),
                resolveArguments(block, call),
                status,
                resultContent,
                result == null ? null : result.durationMs(),
                call == null ? eventTurn : call.turn()
        );
    }

    public String resolveName(ContentBlock.ToolUse block, CorrelationIndex index) {
        ToolCallDetails call = index.toolCall(block.id()).orElse(null);
        if (call != null && call.name() != null) {
            return call.name();
        }
        if (block.name() != null && !block.name().isBlank()) {
            return block.name();
        }
        return unknownToolName;
    }

    /**
     * Call event arguments when recorded, otherwise the block's input in canonical form.
     */
    public String resolveArguments(ContentBlock.ToolUse block, CorrelationIndex index) {
        return resolveArguments(block, index.toolCall(block.id()).orElse(null));
    }

    private String resolveArguments(ContentBlock.ToolUse block, ToolCallDetails call) {
        if (call != null && call.arguments() != null) {
            return call.arguments();
        }
        return argumentsFormatter.formatOrEmpty(block.input());
    }
}
