package com.openforge.searchmate.llm.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * One turn of the conversation context sent to the reasoning service.
 *
 * Roles:
 *   "system"    : fixed instructions, conventionally the first turn
 *   "user"      : human question
 *   "assistant" : model reply; carries tool_calls when it asks for a lookup
 *   "tool"      : result of one tool call, correlated by tool_call_id
 *
 * Turns are values. A context is extended by copying the list and appending,
 * never by editing a turn in place.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,

        /** Text content. Null for assistant turns that only carry tool_calls. */
        String content,

        /** Present only on assistant turns that request tool use. */
        List<ToolCall> toolCalls,

        /** Present only on tool turns; the id of the ToolCall this answers. */
        String toolCallId
) {

    public static final String ROLE_SYSTEM    = "system";
    public static final String ROLE_USER      = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL      = "tool";

    public Message {
        toolCalls = toolCalls == null ? null : List.copyOf(toolCalls);
    }

    public static Message system(String content) {
        return Message.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).build();
    }

    /** Assistant turn that replays a tool decision, optional preamble text included. */
    public static Message assistantToolCalls(String content, List<ToolCall> toolCalls) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).toolCalls(toolCalls).build();
    }

    public static Message toolResult(String toolCallId, String result) {
        return Message.builder().role(ROLE_TOOL).toolCallId(toolCallId).content(result).build();
    }

    @JsonIgnore
    public boolean isUser() {
        return ROLE_USER.equals(role);
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
