package com.linlay.agentreplay.event;

import com.fasterxml.jackson.databind.JsonNode;

public sealed interface ContentBlock permits
        ContentBlock.Text,
        ContentBlock.Thinking,
        ContentBlock.ToolUse,
        ContentBlock.Unsupported {

    record Text(String text) implements ContentBlock {
        public Text {
            text = text == null ? "" : text;
        }
    }

    record Thinking(String text) implements ContentBlock {
        public Thinking {
            text = text == null ? "" : text;
        }
    }

    record ToolUse(String id, String name, JsonNode input) implements ContentBlock {
        public ToolUse {
            if (id == null) {
                throw new IllegalArgumentException("id must not be null");
            }
        }
    }

    record Unsupported(String type) implements ContentBlock {
    }
}
