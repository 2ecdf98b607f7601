package com.openforge.searchmate.llm.model;

/**
 * A tool invocation requested by the reasoning service.
 *
 * Immutable: the orchestrator replays it verbatim in the assistant turn and
 * answers it with a tool turn carrying the same id.
 */
public record ToolCall(
        String id,
        String type,
        FunctionCallResult function
) {

    public static ToolCall function(String id, String name, String arguments) {
        return new ToolCall(id, "function", new FunctionCallResult(name, arguments));
    }

    /** Name of the requested capability, or null when the model sent no function block. */
    public String name() {
        return function == null ? null : function.name();
    }

    /** Raw JSON argument string exactly as the model produced it. */
    public String arguments() {
        return function == null ? null : function.arguments();
    }
}
