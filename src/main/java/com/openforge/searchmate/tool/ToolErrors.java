package com.openforge.searchmate.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collection;

/**
 * Builders for the JSON error payloads returned to the model in place of a
 * tool result. They are content for the conversation, not exceptions.
 */
public final class ToolErrors {

    private ToolErrors() {
    }

    public static String unknownTool(ObjectMapper mapper, String name, Collection<String> available) {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", "Unknown tool: " + name);
        available.forEach(node.putArray("available_tools")::add);
        return write(mapper, node);
    }

    public static String invalidArguments(ObjectMapper mapper, String message, String rawArguments) {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", "Invalid arguments JSON: " + message);
        node.put("arguments", rawArguments);
        return write(mapper, node);
    }

    public static String executionFailed(ObjectMapper mapper, String name, String message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", "Tool execution failed: " + message);
        node.put("function", name);
        return write(mapper, node);
    }

    static String write(ObjectMapper mapper, ObjectNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // an ObjectNode of plain strings always serializes
            throw new IllegalStateException("Failed to serialize tool error payload", e);
        }
    }
}
