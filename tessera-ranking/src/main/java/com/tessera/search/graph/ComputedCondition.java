package com.tessera.search.graph;

import com.tessera.search.query.LocatedQueryTermSubset;
import org.roaringbitmap.RoaringBitmap;

/**
 * Resolved documents of a condition, restricted to the universe it was last computed
 * or narrowed for.
 */
public final class ComputedCondition {

    private final RoaringBitmap docids;
    private long universeLen;
    private final LocatedQueryTermSubset startTermSubset;
    private final LocatedQueryTermSubset endTermSubset;

    private ComputedCondition(RoaringBitmap docids, long universeLen,
                              LocatedQueryTermSubset startTermSubset, LocatedQueryTermSubset endTermSubset) {
        this.docids = docids;
        this.universeLen = universeLen;
        this.startTermSubset = startTermSubset;
        this.endTermSubset = endTermSubset;
    }

    /**
     * @param docids          documents matching the condition, not modified
     * @param universe        universe the condition is resolved for
     * @param startTermSubset term the edge leaves from; null for edges leaving the start node
     * @param endTermSubset   term the edge leads to
     */
    public static ComputedCondition of(RoaringBitmap docids, RoaringBitmap universe,
                                       LocatedQueryTermSubset startTermSubset,
                                       LocatedQueryTermSubset endTermSubset) {
        return new ComputedCondition(RoaringBitmap.and(docids, universe), universe.getLongCardinality(),
            startTermSubset, endTermSubset);
    }

    public RoaringBitmap docids() {
        return docids;
    }

    public long universeLen() {
        return universeLen;
    }

    public LocatedQueryTermSubset startTermSubset() {
        return startTermSubset;
    }

    public LocatedQueryTermSubset endTermSubset() {
        return endTermSubset;
    }

    /** Restricts the docids to a smaller universe. */
    void narrow(RoaringBitmap universe) {
        docids.and(universe);
        universeLen = universe.getLongCardinality();
    }
}
