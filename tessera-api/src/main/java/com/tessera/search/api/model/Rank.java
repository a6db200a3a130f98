package com.tessera.search.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Position of a bucket among the buckets a ranking rule can produce.
 *
 * <p>{@code maxRank} is the best rank and scores 1; rank 0 scores 0.
 *
 * @param rank    ordinal rank, higher is better
 * @param maxRank best possible rank, at least 1
 */
public record Rank(
    @JsonProperty("rank") int rank,
    @JsonProperty("max_rank") int maxRank
) implements Serializable {

    public Rank {
        if (maxRank < 1) {
            throw new IllegalArgumentException("maxRank must be >= 1: " + maxRank);
        }
        if (rank < 0 || rank > maxRank) {
            throw new IllegalArgumentException(String.format("rank must be in [0, %d]: %d", maxRank, rank));
        }
    }

    public double localScore() {
        return (double) rank / maxRank;
    }

    /**
     * Combines the rank of an outer rule with the rank of the rule that split its bucket.
     * Every inner rank of a better outer rank scores above every inner rank of a worse one.
     */
    public static Rank merge(Rank outer, Rank inner) {
        long rank = (long) Math.max(outer.rank - 1, 0) * inner.maxRank + inner.rank;
        long maxRank = (long) outer.maxRank * inner.maxRank;
        if (maxRank > Integer.MAX_VALUE) {
            // keeps the ordering; only the precision of deep rule chains is lost
            double scale = (double) Integer.MAX_VALUE / maxRank;
            return new Rank((int) Math.floor(rank * scale), Integer.MAX_VALUE);
        }
        return new Rank((int) rank, (int) maxRank);
    }
}
