package com.tessera.search.query;

/**
 * Query of a search without words. Only rules that do not need a query graph
 * (sort, asc, desc, boost) rank placeholder searches.
 */
public enum PlaceholderQuery {
    INSTANCE;

    @Override
    public String toString() {
        return "placeholder";
    }
}
