package com.openforge.searchmate.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.searchmate.llm.model.Message;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request body for POST /api/assistant/ask and /search.
 *
 * @param query   the question; blank is allowed and gets a fixed reply
 * @param history optional earlier turns, oldest first
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record AskRequest(

        @Size(max = 4000, message = "query must not exceed 4000 characters")
        String query,

        List<@Valid TurnDto> history
) {

    public List<Message> historyMessages() {
        return history == null ? List.of() : history.stream().map(TurnDto::toMessage).toList();
    }
}
