package com.tessera.search.query;

import com.tessera.search.context.SearchContext;

import java.util.List;

/**
 * Turns the text of a query into located query terms. The terms are pushed into the
 * request's term interner.
 */
public interface QueryTermBuilder {

    /**
     * @return the terms in query order; empty if the query has no searchable word
     */
    List<LocatedQueryTerm> build(SearchContext ctx, String query);
}
