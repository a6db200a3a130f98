package com.tessera.search.graph.criteria;

import com.tessera.search.query.LocatedQueryTermSubset;

/** Documents containing the term. */
public record WordsCondition(LocatedQueryTermSubset term) {
}
