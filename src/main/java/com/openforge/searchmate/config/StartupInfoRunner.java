package com.openforge.searchmate.config;

import com.openforge.searchmate.llm.LlmProperties;
import com.openforge.searchmate.search.SerpApiProperties;
import com.openforge.searchmate.tool.CapabilityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs a startup summary once the context is ready. API keys are masked.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final LlmProperties      llmProperties;
    private final SerpApiProperties  serpApiProperties;
    private final CapabilityRegistry capabilityRegistry;
    private final Environment        env;

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Searchmate  -  Startup Summary              ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Reasoning service                                       ║
                ║    Provider       : {}  [{}]  key={}
                ║    Endpoint       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Capabilities                                            ║
                ║    Registered     : {}
                ║    SerpAPI        : enabled={}  key={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                llmProperties.name(),
                llmProperties.model(),
                maskKey(llmProperties.apiKey()),
                llmProperties.baseUrl(),

                capabilityRegistry.isEmpty() ? "(none, answering without search)" : capabilityRegistry.names(),
                serpApiProperties.enabled(),
                maskKey(serpApiProperties.apiKey())
        );
    }

    /**
     * First 6 chars + "..." + last 4 chars, or "(not set)".
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
