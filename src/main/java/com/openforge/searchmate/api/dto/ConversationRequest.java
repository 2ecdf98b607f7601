package com.openforge.searchmate.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.searchmate.llm.model.Message;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request body for POST /api/assistant/chat: the whole conversation, the
 * latest user turn last.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ConversationRequest(

        @NotEmpty(message = "messages must not be empty")
        List<@Valid TurnDto> messages
) {

    public List<Message> toMessages() {
        return messages.stream().map(TurnDto::toMessage).toList();
    }
}
