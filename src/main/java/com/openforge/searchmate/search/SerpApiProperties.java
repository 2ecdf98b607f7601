package com.openforge.searchmate.search;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * SerpAPI configuration, bound from "assistant.search.serpapi".
 * A blank api-key leaves search disabled.
 */
@ConfigurationProperties(prefix = "assistant.search.serpapi")
public record SerpApiProperties(
        @DefaultValue("true") boolean enabled,
        String apiKey,
        @DefaultValue("https://serpapi.com") String baseUrl,
        @DefaultValue("us") String country,
        @DefaultValue("en") String language,
        @DefaultValue("30") int timeoutSeconds
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
