package com.tessera.search.query;

import java.util.Objects;

/**
 * A term subset placed in the query.
 *
 * @param termSubset the admissible derivations
 * @param positions  word positions covered in the query
 * @param termIds    ids of the original query terms covered; longer than one for ngrams
 */
public record LocatedQueryTermSubset(QueryTermSubset termSubset, IntRange positions, IntRange termIds) {

    public LocatedQueryTermSubset {
        Objects.requireNonNull(termSubset, "termSubset cannot be null");
        Objects.requireNonNull(positions, "positions cannot be null");
        Objects.requireNonNull(termIds, "termIds cannot be null");
    }

    /**
     * Extra cost carried by an ngram: matching one merged word instead of
     * {@code n} query words costs {@code n - 1}.
     */
    public int ngramBaseCost() {
        return termIds.length() - 1;
    }

    public LocatedQueryTermSubset withTermSubset(QueryTermSubset subset) {
        return new LocatedQueryTermSubset(subset, positions, termIds);
    }
}
