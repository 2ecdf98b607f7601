package com.openforge.searchmate.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Reasoning-service provider configuration, bound from "assistant.llm":
 *
 * assistant:
 *   llm:
 *     name: openai
 *     base-url: https://api.openai.com/v1
 *     api-key: ${OPENAI_API_KEY}
 *     model: gpt-4.1
 *     temperature: 0
 *     timeout-seconds: 120
 */
@ConfigurationProperties(prefix = "assistant.llm")
public record LlmProperties(
        @DefaultValue("openai") String name,
        @DefaultValue("https://api.openai.com/v1") String baseUrl,
        String apiKey,
        @DefaultValue("gpt-4.1") String model,
        @DefaultValue("0") double temperature,
        @DefaultValue("120") int timeoutSeconds
) {}
