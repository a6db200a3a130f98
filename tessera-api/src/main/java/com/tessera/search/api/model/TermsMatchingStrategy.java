package com.tessera.search.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How many query words a document must contain to be a candidate.
 */
public enum TermsMatchingStrategy {

    /**
     * Drop the query words from the end, one position at a time, until documents match.
     * Phrases and mandatory words are never dropped.
     */
    @JsonProperty("last")
    LAST,

    /** Every query word must be present. */
    @JsonProperty("all")
    ALL
}
