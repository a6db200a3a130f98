package com.tessera.search.query;

import com.tessera.search.context.SearchContext;

import java.util.List;

/**
 * Derives the term matching two or three consecutive query words written as one,
 * such as {@code "sun flower"} indexed as {@code sunflower}.
 */
@FunctionalInterface
public interface NgramDeriver {

    /** Never derives ngrams. */
    NgramDeriver NONE = (ctx, words) -> null;

    /**
     * @param words the consecutive query terms, none of them a phrase
     * @return the ngram term, or null if the merged word is not worth a node
     */
    QueryTerm derive(SearchContext ctx, List<QueryTerm> words);
}
