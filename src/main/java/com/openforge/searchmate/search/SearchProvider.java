package com.openforge.searchmate.search;

import java.util.List;

/**
 * Boundary to an external search backend. Results come back in the
 * provider's relevance order; callers must not re-sort them.
 */
public interface SearchProvider {

    List<SearchResult> search(String query, int count) throws SearchProviderException;

    List<SearchResult> searchNews(String query, int count) throws SearchProviderException;
}
