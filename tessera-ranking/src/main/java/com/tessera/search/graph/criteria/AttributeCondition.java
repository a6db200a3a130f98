package com.tessera.search.graph.criteria;

import com.tessera.search.query.LocatedQueryTermSubset;

/**
 * Documents containing the term with exactly {@code nbrTypos} typos, ranked afterwards
 * by the fields the term occurs in.
 */
public record AttributeCondition(LocatedQueryTermSubset term, int nbrTypos) {
}
