package com.openforge.searchmate.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.searchmate.llm.model.Message;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * A stored conversation turn as sent by API clients. Only plain text turns
 * are accepted; tool turns never leave the pipeline.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record TurnDto(

        @NotBlank
        @Pattern(regexp = "system|user|assistant", message = "role must be system, user or assistant")
        String role,

        String content
) {

    public Message toMessage() {
        return Message.builder().role(role).content(content).build();
    }
}
