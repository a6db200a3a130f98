package com.tessera.search.query;

import com.tessera.search.interner.Interned;

import java.util.Objects;

/**
 * A query term together with the word positions it covers in the query.
 */
public record LocatedQueryTerm(Interned<QueryTerm> value, IntRange positions) {

    public LocatedQueryTerm {
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(positions, "positions cannot be null");
    }
}
