package com.openforge.searchmate.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.searchmate.llm.model.ToolFunction;

/**
 * A function the reasoning service may ask to have invoked.
 *
 * The definition is fixed for the life of the process. Whatever execute()
 * returns goes back to the model verbatim as the content of a tool turn.
 * Implementations may throw; the registry turns any exception into an
 * error payload the model can read.
 */
public interface Capability {

    ToolFunction definition();

    /**
     * @param arguments decoded JSON object of arguments, never null
     * @return text for the tool turn, usually JSON
     */
    String execute(JsonNode arguments);

    default String name() {
        return definition().name();
    }
}
