package com.openforge.searchmate.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Google results through SerpAPI's /search.json endpoint.
 *
 * Web searches read "organic_results" (source = displayed_link); news
 * searches add tbm=nws and read "news_results" (source = publisher). The
 * provider caps a page at 10 results.
 */
@Slf4j
public class SerpApiClient implements SearchProvider {

    static final int MAX_RESULTS = 10;

    private final HttpClient        httpClient;
    private final ObjectMapper      objectMapper;
    private final SerpApiProperties config;

    public SerpApiClient(HttpClient httpClient, ObjectMapper objectMapper, SerpApiProperties config) {
        if (!config.hasApiKey()) {
            throw new IllegalStateException("SerpAPI key is not configured (assistant.search.serpapi.api-key)");
        }
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── SearchProvider ───────────────────────────────────────────────────────

    @Override
    public List<SearchResult> search(String query, int count) throws SearchProviderException {
        JsonNode body = get(query, count, false);
        List<SearchResult> results = new ArrayList<>();
        for (JsonNode hit : body.path("organic_results")) {
            String link = hit.path("link").asText("");
            results.add(new SearchResult(
                    hit.path("title").asText(""),
                    link,
                    hit.path("snippet").asText(""),
                    hit.path("displayed_link").asText(link)));
        }
        log.debug("[SerpApi] web query='{}' → {} result(s)", query, results.size());
        return results;
    }

    @Override
    public List<SearchResult> searchNews(String query, int count) throws SearchProviderException {
        JsonNode body = get(query, count, true);
        List<SearchResult> results = new ArrayList<>();
        for (JsonNode hit : body.path("news_results")) {
            JsonNode source = hit.path("source");
            results.add(new SearchResult(
                    hit.path("title").asText(""),
                    hit.path("link").asText(""),
                    hit.path("snippet").asText(""),
                    source.isObject() ? source.path("name").asText("") : source.asText("")));
        }
        log.debug("[SerpApi] news query='{}' → {} result(s)", query, results.size());
        return results;
    }

    /**
     * Runs one web search per query. A query that fails maps to an empty list
     * so the rest of the batch is still usable.
     */
    public Map<String, List<SearchResult>> searchMany(List<String> queries, int resultsPerQuery) {
        Map<String, List<SearchResult>> all = new LinkedHashMap<>();
        for (String query : queries) {
            try {
                all.put(query, search(query, resultsPerQuery));
            } catch (SearchProviderException e) {
                log.warn("[SerpApi] Search for '{}' failed: {}", query, e.getMessage());
                all.put(query, List.of());
            }
        }
        return all;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private JsonNode get(String query, int count, boolean news) throws SearchProviderException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(buildUri(query, count, news))
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SearchProviderException("SerpAPI request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchProviderException("SerpAPI request interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new SearchProviderException("SerpAPI returned HTTP %d: %s".formatted(status, response.body()));
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(response.body());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SearchProviderException("SerpAPI returned an unreadable response", e);
        }
        if (body == null || !body.isObject()) {
            throw new SearchProviderException("SerpAPI returned an unreadable response");
        }
        if (body.hasNonNull("error")) {
            throw new SearchProviderException("SerpAPI error: " + body.get("error").asText());
        }
        return body;
    }

    URI buildUri(String query, int count, boolean news) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("api_key", config.apiKey());
        params.put("num", String.valueOf(Math.min(count, MAX_RESULTS)));
        params.put("gl", config.country());
        params.put("hl", config.language());
        if (news) {
            params.put("tbm", "nws");
        }
        String queryString = params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        return URI.create(config.baseUrl() + "/search.json?" + queryString);
    }
}
