package com.tessera.search.query;

import org.roaringbitmap.RoaringBitmap;

/**
 * Node of a {@link QueryGraph}: the start or end sentinel, a located term subset,
 * or a deleted slot. Node ids are positions in the graph's node list and stay
 * stable when nodes are deleted.
 */
public final class QueryNode {

    public enum Kind { START, END, TERM, DELETED }

    private Kind kind;
    private LocatedQueryTermSubset term;
    private final RoaringBitmap predecessors;
    private final RoaringBitmap successors;

    private QueryNode(Kind kind, LocatedQueryTermSubset term, RoaringBitmap predecessors, RoaringBitmap successors) {
        this.kind = kind;
        this.term = term;
        this.predecessors = predecessors;
        this.successors = successors;
    }

    static QueryNode start() {
        return new QueryNode(Kind.START, null, new RoaringBitmap(), new RoaringBitmap());
    }

    static QueryNode end() {
        return new QueryNode(Kind.END, null, new RoaringBitmap(), new RoaringBitmap());
    }

    static QueryNode term(LocatedQueryTermSubset term) {
        return new QueryNode(Kind.TERM, term, new RoaringBitmap(), new RoaringBitmap());
    }

    QueryNode copy() {
        return new QueryNode(kind, term, predecessors.clone(), successors.clone());
    }

    void markDeleted() {
        kind = Kind.DELETED;
        term = null;
        predecessors.clear();
        successors.clear();
    }

    public Kind kind() {
        return kind;
    }

    public boolean isTerm() {
        return kind == Kind.TERM;
    }

    public boolean isDeleted() {
        return kind == Kind.DELETED;
    }

    /** The located term subset; null unless this is a term node. */
    public LocatedQueryTermSubset term() {
        return term;
    }

    /** Predecessor node ids. Mutated only by the owning graph. */
    public RoaringBitmap predecessors() {
        return predecessors;
    }

    public RoaringBitmap successors() {
        return successors;
    }

    @Override
    public String toString() {
        return kind == Kind.TERM ? "TERM" + term.positions() : kind.name();
    }
}
