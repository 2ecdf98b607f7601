package com.openforge.searchmate.search;

/**
 * One provider hit. Lives only long enough to be serialized into a tool turn.
 * source falls back to the link when the provider does not name one.
 */
public record SearchResult(
        String title,
        String link,
        String snippet,
        String source
) {
    public SearchResult {
        title   = title   == null ? "" : title;
        link    = link    == null ? "" : link;
        snippet = snippet == null ? "" : snippet;
        source  = source == null || source.isBlank() ? link : source;
    }
}
