package com.openforge.searchmate.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.searchmate.llm.model.ToolFunction;
import com.openforge.searchmate.tool.Capability;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * The "search_internet" capability: a web or news lookup whose results are
 * handed back to the model as compact JSON.
 *
 * Provider failures are returned as an error payload naming the query and
 * mode, never thrown.
 */
@Slf4j
public class SearchCapability implements Capability {

    public static final String NAME = "search_internet";

    static final String PARAM_QUERY       = "query";
    static final String PARAM_SEARCH_TYPE = "search_type";
    static final String PARAM_NUM_RESULTS = "num_results";

    static final int DEFAULT_RESULTS = 5;
    static final int MIN_RESULTS     = 1;
    static final int MAX_RESULTS     = 10;

    private static final String DESCRIPTION =
            "Search the internet for current information about any topic. Use this when you need "
            + "up-to-date information, facts, news, or data that you don't have in your training.";

    private static final String PARAMETERS_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "query": {
                  "type": "string",
                  "description": "The search query to find information about"
                },
                "search_type": {
                  "type": "string",
                  "enum": ["web", "news"],
                  "description": "Type of search - 'web' for general search, 'news' for recent news",
                  "default": "web"
                },
                "num_results": {
                  "type": "integer",
                  "description": "Number of results to return (1-10)",
                  "minimum": 1,
                  "maximum": 10,
                  "default": 5
                }
              },
              "required": ["query"]
            }
            """;

    private final SearchProvider provider;
    private final ObjectMapper   objectMapper;
    private final ToolFunction   definition;

    public SearchCapability(SearchProvider provider, ObjectMapper objectMapper) {
        this.provider     = provider;
        this.objectMapper = objectMapper;
        this.definition   = new ToolFunction(NAME, DESCRIPTION, parseSchema(objectMapper));
    }

    @Override
    public ToolFunction definition() {
        return definition;
    }

    @Override
    public String execute(JsonNode arguments) {
        String     query = arguments.path(PARAM_QUERY).asText("").trim();
        SearchMode mode  = SearchMode.fromWire(arguments.path(PARAM_SEARCH_TYPE).asText(null));
        int        count = clamp(arguments.path(PARAM_NUM_RESULTS).asInt(DEFAULT_RESULTS));

        if (query.isEmpty()) {
            return failure("query must not be blank", query, mode);
        }

        try {
            List<SearchResult> results = mode == SearchMode.NEWS
                    ? provider.searchNews(query, count)
                    : provider.search(query, count);
            log.info("[Search] {} query='{}' → {} result(s)", mode.wireValue(), query, results.size());
            return success(query, mode, results);
        } catch (SearchProviderException | RuntimeException e) {
            log.warn("[Search] {} query='{}' failed: {}", mode.wireValue(), query, e.getMessage());
            return failure(e.getMessage(), query, mode);
        }
    }

    // ── Serialization ────────────────────────────────────────────────────────

    private String success(String query, SearchMode mode, List<SearchResult> results) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(PARAM_QUERY, query);
        node.put(PARAM_SEARCH_TYPE, mode.wireValue());
        node.put(PARAM_NUM_RESULTS, results.size());
        ArrayNode array = node.putArray("results");
        for (SearchResult result : results) {
            array.addObject()
                    .put("title", result.title())
                    .put("url", result.link())
                    .put("snippet", result.snippet())
                    .put("source", result.source());
        }
        return write(node, true);
    }

    private String failure(String message, String query, SearchMode mode) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("error", "Search failed: " + message);
        node.put(PARAM_QUERY, query);
        node.put(PARAM_SEARCH_TYPE, mode.wireValue());
        return write(node, false);
    }

    private String write(ObjectNode node, boolean pretty) {
        try {
            return pretty
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                    : objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize search payload", e);
        }
    }

    private static int clamp(int count) {
        return Math.max(MIN_RESULTS, Math.min(MAX_RESULTS, count));
    }

    private static JsonNode parseSchema(ObjectMapper objectMapper) {
        try {
            return objectMapper.readTree(PARAMETERS_SCHEMA);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to build search_internet schema", e);
        }
    }
}
