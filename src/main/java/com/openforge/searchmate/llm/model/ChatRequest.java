package com.openforge.searchmate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Request body for an OpenAI-compatible /chat/completions endpoint.
 *
 * stream is left null for blocking calls and set to true by LlmClient when
 * incremental delivery is requested. A request never carries both tools and
 * stream=true.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<Tool> tools,
        String toolChoice,
        Double temperature,
        Boolean stream
) {

    public static ChatRequest of(String model, double temperature, List<Message> messages) {
        return ChatRequest.builder()
                .model(model)
                .messages(messages)
                .temperature(temperature)
                .build();
    }

    public static ChatRequest withTools(String model, double temperature,
                                        List<Message> messages, List<Tool> tools) {
        return ChatRequest.builder()
                .model(model)
                .messages(messages)
                .tools(tools)
                .toolChoice("auto")
                .temperature(temperature)
                .build();
    }

    public boolean declaresTools() {
        return tools != null && !tools.isEmpty();
    }
}
