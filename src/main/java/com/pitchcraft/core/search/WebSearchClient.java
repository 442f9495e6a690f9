package com.pitchcraft.core.search;

import java.util.List;

/**
 * Looks up short text snippets for a query. Implementations never throw;
 * an unreachable or failing provider yields an empty list.
 */
public interface WebSearchClient {

    List<String> search(String query);

    boolean isEnabled();
}
