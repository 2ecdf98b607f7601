package com.openforge.searchmate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.searchmate.search.SearchCapability;
import com.openforge.searchmate.search.SerpApiClient;
import com.openforge.searchmate.search.SerpApiProperties;
import com.openforge.searchmate.tool.CapabilityRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;

/**
 * Builds the capability registry. search_internet is registered only when
 * SerpAPI is enabled and has a key. Without it the assistant still starts
 * and answers without search.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SerpApiProperties.class)
public class CapabilityConfig {

    @Bean
    public CapabilityRegistry capabilityRegistry(ObjectMapper objectMapper,
                                                 ExecutorService capabilityExecutor,
                                                 HttpClient httpClient,
                                                 SerpApiProperties serpApiProperties) {
        CapabilityRegistry registry = new CapabilityRegistry(objectMapper, capabilityExecutor);

        if (!serpApiProperties.enabled()) {
            log.info("[Capabilities] Internet search disabled by configuration");
            return registry;
        }
        try {
            SerpApiClient provider = new SerpApiClient(httpClient, objectMapper, serpApiProperties);
            registry.register(new SearchCapability(provider, objectMapper));
        } catch (IllegalStateException e) {
            log.warn("[Capabilities] Internet search unavailable, continuing without it: {}", e.getMessage());
        }
        return registry;
    }
}
