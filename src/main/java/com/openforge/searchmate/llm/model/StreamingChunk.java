package com.openforge.searchmate.llm.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One SSE data frame of a streamed completion:
 *
 *   data: {"id":"chatcmpl-1","choices":[{"index":0,"delta":{"content":"Hel"}}]}
 *   ...
 *   data: [DONE]
 *
 * Only content deltas are read. Streams are never opened with tools declared,
 * so tool-call deltas do not occur. A provider that fails after the stream
 * has started sends an error frame instead:
 *
 *   data: {"error":{"message":"server overloaded","type":"server_error"}}
 */
public record StreamingChunk(
        String id,
        String model,
        List<ChunkChoice> choices,
        JsonNode error
) {

    public boolean hasError() {
        return error != null && !error.isNull() && !error.isMissingNode();
    }

    /** The error frame's message, or the raw error node when it has none. */
    public String errorMessage() {
        if (!hasError()) return null;
        JsonNode message = error.path("message");
        return message.isTextual() ? message.asText() : error.toString();
    }

    /** Content of the first choice's delta, or null for role-only and final frames. */
    public String contentDelta() {
        if (choices == null || choices.isEmpty()) return null;
        DeltaMessage delta = choices.get(0).delta();
        return delta == null ? null : delta.content();
    }

    public record ChunkChoice(
            int index,
            DeltaMessage delta,
            String finishReason
    ) {}

    public record DeltaMessage(
            String role,
            String content
    ) {}
}
