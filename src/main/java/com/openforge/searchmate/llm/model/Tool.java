package com.openforge.searchmate.llm.model;

/**
 * One entry of the "tools" array offered to the model:
 * { "type": "function", "function": { "name", "description", "parameters" } }
 */
public record Tool(
        String type,
        ToolFunction function
) {
    public static Tool ofFunction(ToolFunction function) {
        return new Tool("function", function);
    }
}
