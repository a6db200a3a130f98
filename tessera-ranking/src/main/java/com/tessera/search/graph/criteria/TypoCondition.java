package com.tessera.search.graph.criteria;

import com.tessera.search.query.LocatedQueryTermSubset;

/**
 * Documents containing the term with exactly {@code nbrTypos} typos.
 *
 * @param term the term, restricted to the derivations of that typo level
 */
public record TypoCondition(LocatedQueryTermSubset term, int nbrTypos) {
}
