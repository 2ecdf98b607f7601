package com.openforge.searchmate.llm.model;

/**
 * The "function" block of a tool call.
 *
 * arguments is kept as the raw JSON string so it can be echoed back to the
 * model byte for byte; decoding happens in the CapabilityRegistry.
 *
 *   name      = "search_internet"
 *   arguments = "{\"query\":\"latest JDK release\",\"search_type\":\"news\"}"
 */
public record FunctionCallResult(
        String name,
        String arguments
) {}
