package com.tessera.search.logger;

/**
 * Logger that ignores every event. Searching with it is the same as searching
 * without a logger.
 */
public final class DefaultSearchLogger<Q> implements SearchLogger<Q> {

    @SuppressWarnings("rawtypes")
    private static final DefaultSearchLogger INSTANCE = new DefaultSearchLogger<>();

    private DefaultSearchLogger() {
    }

    @SuppressWarnings("unchecked")
    public static <Q> SearchLogger<Q> instance() {
        return (SearchLogger<Q>) INSTANCE;
    }
}
