package com.openforge.searchmate.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.searchmate.llm.model.ChatRequest;
import com.openforge.searchmate.llm.model.ChatResponse;
import com.openforge.searchmate.llm.model.StreamingChunk;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Stateless HTTP transport for an OpenAI-compatible /chat/completions endpoint.
 *
 *  chat()    : blocking, returns the whole response (used for tool decisions
 *              and one-shot answers).
 *  stream()  : SSE, returns a lazy Stream of content deltas. Lines are read
 *              from the connection only as the caller pulls fragments, and
 *              closing the Stream releases the connection.
 *
 * No retries here; callers decide what a failure means.
 */
@Slf4j
public class LlmClient {

    private static final String SSE_DATA_PREFIX = "data: ";
    private static final String SSE_DONE        = "data: [DONE]";
    private static final int    ERROR_BODY_LINES = 20;

    private final HttpClient    httpClient;
    private final ObjectMapper  objectMapper;
    private final LlmProperties config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Blocking chat completion. Tools may be declared.
     *
     * @throws LlmRateLimitException on HTTP 429
     * @throws LlmException          on any other transport or provider failure
     */
    public ChatResponse chat(ChatRequest request) {
        String requestBody = serialize(request.toBuilder().stream(null).build());
        log.debug("[LlmClient:{}] → chat POST tools={} body-length={}",
                config.name(), request.declaresTools(), requestBody.length());

        HttpResponse<String> httpResponse = send(buildHttpRequest(requestBody, false),
                HttpResponse.BodyHandlers.ofString());
        return parseFullResponse(httpResponse);
    }

    /**
     * Streaming chat completion. The request must not declare tools: a model
     * cannot reliably interleave partial text with tool requests.
     *
     * Opening the stream (status check) happens eagerly; an error while reading
     * surfaces as LlmException from the consuming call.
     */
    public Stream<String> stream(ChatRequest request) {
        if (request.declaresTools()) {
            throw new IllegalArgumentException(
                    "Streaming requests must not declare tools (provider [%s])".formatted(config.name()));
        }
        String requestBody = serialize(request.toBuilder().stream(true).build());
        log.debug("[LlmClient:{}] → stream POST body-length={}", config.name(), requestBody.length());

        HttpResponse<Stream<String>> httpResponse = send(buildHttpRequest(requestBody, true),
                HttpResponse.BodyHandlers.ofLines());

        int status = httpResponse.statusCode();
        if (status < 200 || status >= 300) {
            String bodySnippet;
            try (Stream<String> lines = httpResponse.body()) {
                bodySnippet = lines == null ? "" : lines.limit(ERROR_BODY_LINES).collect(Collectors.joining("\n"));
            }
            throw statusError(status, bodySnippet);
        }

        Stream<String> lines = httpResponse.body();
        return guardReads(lines)
                .takeWhile(line -> !SSE_DONE.equals(line))
                .filter(line -> line.startsWith(SSE_DATA_PREFIX))
                .map(this::parseContentDelta)
                .filter(content -> content != null && !content.isEmpty());
    }

    public String providerName() {
        return config.name();
    }

    public String modelName() {
        return config.model();
    }

    public double temperature() {
        return config.temperature();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body, boolean streaming) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .header("Accept", streaming ? "text/event-stream" : "application/json")
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            return httpClient.send(request, handler);
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]".formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while calling provider [%s]".formatted(config.name()), e);
        }
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status < 200 || status >= 300) throw statusError(status, body);

        ChatResponse parsed;
        try {
            parsed = objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new LlmException(
                    "Failed to parse response from provider [%s]".formatted(config.name()), e);
        }
        if (parsed == null || parsed.choices() == null || parsed.choices().isEmpty()
                || parsed.choices().get(0).message() == null) {
            throw new LlmException(
                    "Provider [%s] returned no message: %s".formatted(config.name(), body));
        }
        return parsed;
    }

    private LlmException statusError(int status, String body) {
        if (status == 429) {
            return new LlmRateLimitException("Rate-limited by provider [%s].".formatted(config.name()));
        }
        return new LlmException("Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, body));
    }

    private String parseContentDelta(String line) {
        String json = line.substring(SSE_DATA_PREFIX.length());
        StreamingChunk chunk;
        try {
            chunk = objectMapper.readValue(json, StreamingChunk.class);
        } catch (JsonProcessingException e) {
            log.warn("[LlmClient:{}] Skipping unparsable SSE frame: {}", config.name(), json);
            return null;
        }
        if (chunk == null) {
            return null;
        }
        if (chunk.hasError()) {
            throw new LlmException("Provider [%s] failed mid-stream: %s"
                    .formatted(config.name(), chunk.errorMessage()));
        }
        return chunk.contentDelta();
    }

    /** Re-throws read failures of the line stream as LlmException, keeping its close hook. */
    private Stream<String> guardReads(Stream<String> lines) {
        Iterator<String> source = lines.iterator();
        Iterator<String> guarded = new Iterator<>() {
            @Override
            public boolean hasNext() {
                try {
                    return source.hasNext();
                } catch (UncheckedIOException e) {
                    throw new LlmException("Stream from provider [%s] broke".formatted(config.name()), e);
                }
            }

            @Override
            public String next() {
                try {
                    return source.next();
                } catch (UncheckedIOException e) {
                    throw new LlmException("Stream from provider [%s] broke".formatted(config.name()), e);
                }
            }
        };
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(guarded, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(lines::close);
    }

    private String serialize(ChatRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize request", e);
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    /** Any transport or provider-side failure of the reasoning service. */
    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
