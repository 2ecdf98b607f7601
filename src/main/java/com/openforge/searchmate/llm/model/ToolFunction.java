package com.openforge.searchmate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Static declaration of a capability: name, description and the JSON Schema
 * of its parameters. Kept as a JsonNode so the schema goes out verbatim.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolFunction(
        String name,
        String description,
        JsonNode parameters
) {}
