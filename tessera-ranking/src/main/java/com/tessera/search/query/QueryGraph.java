/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.query;

import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.UserErrorException;
import com.tessera.search.context.SearchContext;
import com.tessera.search.interner.Interned;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Directed acyclic graph of the alternative interpretations of a query.
 *
 * <p>Every path from {@link #ROOT} to {@link #END} is one reading of the query: a
 * sequence of term nodes that covers the query words, where consecutive words may
 * be merged into ngram nodes. Node ids are stable; removed nodes leave
 * {@link QueryNode.Kind#DELETED} slots.
 *
 * <p>Ranking rules never mutate the graph they receive. They work on {@link #copy()}s.
 */
public final class QueryGraph {

    public static final int ROOT = 0;
    public static final int END = 1;

    private final List<QueryNode> nodes;

    private QueryGraph(List<QueryNode> nodes) {
        this.nodes = nodes;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // CONSTRUCTION
    // ════════════════════════════════════════════════════════════════════════════════

    /**
     * Builds the graph of a query. Each term gets a node; two and three consecutive
     * terms also get an ngram node when {@code ngramDeriver} produces one. Quoted
     * phrases are mandatory.
     *
     * @throws UserErrorException with {@link ErrorCode#QUERY_TOO_COMPLEX} if the graph
     *                            exceeds the configured node limit
     */
    public static QueryGraph fromQuery(SearchContext ctx, List<LocatedQueryTerm> terms, NgramDeriver ngramDeriver) {
        List<QueryNode> nodes = new ArrayList<>();
        nodes.add(QueryNode.start());
        nodes.add(QueryNode.end());
        QueryGraph graph = new QueryGraph(nodes);

        List<Integer> prev2 = List.of();
        List<Integer> prev1 = List.of();
        List<Integer> prev0 = List.of(ROOT);

        for (int termIdx = 0; termIdx < terms.size(); termIdx++) {
            LocatedQueryTerm term = terms.get(termIdx);
            List<Integer> newNodes = new ArrayList<>();

            boolean quoted = ctx.term(term.value()).originalPhrase() != null;
            int node = graph.addTermNode(new LocatedQueryTermSubset(
                QueryTermSubset.full(term.value()).withMandatory(quoted), term.positions(),
                IntRange.single(termIdx)));
            newNodes.add(node);
            for (int prev : prev0) {
                graph.link(prev, node);
            }

            if (!prev1.isEmpty()) {
                int ngram = graph.addNgramNode(ctx, terms, termIdx - 1, termIdx, ngramDeriver);
                if (ngram >= 0) {
                    newNodes.add(ngram);
                    for (int prev : prev1) {
                        graph.link(prev, ngram);
                    }
                }
            }
            if (!prev2.isEmpty()) {
                int ngram = graph.addNgramNode(ctx, terms, termIdx - 2, termIdx, ngramDeriver);
                if (ngram >= 0) {
                    newNodes.add(ngram);
                    for (int prev : prev2) {
                        graph.link(prev, ngram);
                    }
                }
            }

            prev2 = prev1;
            prev1 = prev0;
            prev0 = newNodes;
        }
        for (int prev : prev0) {
            graph.link(prev, END);
        }

        int limit = ctx.config().getMaxQueryGraphNodes();
        if (nodes.size() > limit) {
            throw new UserErrorException(ErrorCode.QUERY_TOO_COMPLEX, String.format(
                "The query is too complex: its graph needs %d nodes, the limit is %d", nodes.size(), limit));
        }
        return graph;
    }

    private int addNgramNode(SearchContext ctx, List<LocatedQueryTerm> terms, int first, int last,
                             NgramDeriver ngramDeriver) {
        List<QueryTerm> words = new ArrayList<>(last - first + 1);
        for (int i = first; i <= last; i++) {
            LocatedQueryTerm term = terms.get(i);
            if (i > first && terms.get(i - 1).positions().end() + 1 != term.positions().start()) {
                return -1;
            }
            QueryTerm value = ctx.term(term.value());
            if (value.originalPhrase() != null) {
                return -1;
            }
            words.add(value);
        }
        QueryTerm ngram = ngramDeriver.derive(ctx, words);
        if (ngram == null) {
            return -1;
        }
        Interned<QueryTerm> interned = ctx.addTerm(ngram);
        IntRange positions = new IntRange(terms.get(first).positions().start(), terms.get(last).positions().end());
        return addTermNode(new LocatedQueryTermSubset(QueryTermSubset.full(interned), positions,
            new IntRange(first, last)));
    }

    private int addTermNode(LocatedQueryTermSubset term) {
        nodes.add(QueryNode.term(term));
        return nodes.size() - 1;
    }

    private void link(int from, int to) {
        nodes.get(from).successors().add(to);
        nodes.get(to).predecessors().add(from);
    }

    public QueryGraph copy() {
        List<QueryNode> copied = new ArrayList<>(nodes.size());
        for (QueryNode node : nodes) {
            copied.add(node.copy());
        }
        return new QueryGraph(copied);
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // ACCESSORS
    // ════════════════════════════════════════════════════════════════════════════════

    /** Number of node slots, deleted ones included. */
    public int size() {
        return nodes.size();
    }

    public QueryNode node(int id) {
        return nodes.get(id);
    }

    public List<QueryNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /** Ids of the live term nodes, in id order. */
    public List<Integer> termNodes() {
        List<Integer> ids = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).isTerm()) {
                ids.add(i);
            }
        }
        return ids;
    }

    // ════════════════════════════════════════════════════════════════════════════════
    // REMOVAL
    // ════════════════════════════════════════════════════════════════════════════════

    /** Deletes the nodes after linking each of their predecessors to each of their successors. */
    public void removeNodesKeepEdges(RoaringBitmap ids) {
        for (int id : ids) {
            QueryNode node = nodes.get(id);
            if (node.isDeleted()) {
                continue;
            }
            RoaringBitmap preds = node.predecessors().clone();
            RoaringBitmap succs = node.successors().clone();
            for (int pred : preds) {
                nodes.get(pred).successors().remove(id);
                for (int succ : succs) {
                    link(pred, succ);
                }
            }
            for (int succ : succs) {
                nodes.get(succ).predecessors().remove(id);
            }
            node.markDeleted();
        }
    }

    /**
     * Order in which the terms matching strategy {@code last} drops words: groups of
     * node ids, the group holding the last query word first.
     *
     * <p>Phrases and mandatory terms are never dropped. When no term is mandatory, the
     * first word is kept too, so the last group is omitted. Ngram nodes are dropped
     * with the earliest word they cover.
     */
    public List<RoaringBitmap> removalOrderForTermsMatchingStrategyLast(SearchContext ctx) {
        int firstTermIdx = Integer.MAX_VALUE;
        int lastTermIdx = 0;
        for (QueryNode node : nodes) {
            if (node.isTerm()) {
                firstTermIdx = Math.min(firstTermIdx, node.term().termIds().start());
                lastTermIdx = Math.max(lastTermIdx, node.term().termIds().end());
            }
        }
        if (firstTermIdx >= lastTermIdx) {
            return List.of();
        }

        Map<Integer, RoaringBitmap> byCost = new TreeMap<>();
        boolean atLeastOneMandatoryTerm = false;
        for (int i = 0; i < nodes.size(); i++) {
            QueryNode node = nodes.get(i);
            if (!node.isTerm()) {
                continue;
            }
            QueryTermSubset subset = node.term().termSubset();
            if (subset.isMandatory()) {
                atLeastOneMandatoryTerm = true;
                continue;
            }
            int cost = 0;
            IntRange termIds = node.term().termIds();
            for (int id = termIds.start(); id <= termIds.end(); id++) {
                cost = Math.max(cost, 1 + lastTermIdx - id);
            }
            byCost.computeIfAbsent(cost, c -> new RoaringBitmap()).add(i);
        }

        List<RoaringBitmap> order = new ArrayList<>(byCost.values());
        if (!atLeastOneMandatoryTerm && !order.isEmpty()) {
            order.remove(order.size() - 1);
        }
        return order;
    }

    public String description(SearchContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            QueryNode node = nodes.get(i);
            if (node.isDeleted()) {
                continue;
            }
            sb.append(i).append(' ');
            sb.append(node.isTerm() ? node.term().termSubset().description(ctx) : node.kind().name());
            sb.append(" -> ").append(node.successors()).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "QueryGraph" + nodes;
    }
}
