/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.logger;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.InternalErrorException;
import com.tessera.search.rules.RankingRule;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Logger recording every event of a search, for debugging relevance.
 *
 * <p>Events can be exported as JSON with {@link #toJson()}. Bitmaps are recorded as
 * sorted id lists, truncated to {@link #MAX_RECORDED_IDS} ids.
 */
public final class DetailedSearchLogger<Q> implements SearchLogger<Q> {

    static final int MAX_RECORDED_IDS = 100;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * One recorded event.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Event(
        @JsonProperty("type") String type,
        @JsonProperty("rule_index") Integer ruleIndex,
        @JsonProperty("rule") String rule,
        @JsonProperty("universe_size") Long universeSize,
        @JsonProperty("bucket_size") Long bucketSize,
        @JsonProperty("docids") List<Integer> docids,
        @JsonProperty("detail") String detail
    ) {}

    private final List<Event> events = new ArrayList<>();

    @Override
    public void initialQuery(Q query) {
        events.add(new Event("initial_query", null, null, null, null, null, String.valueOf(query)));
    }

    @Override
    public void queryForInitialUniverse(Q query) {
        events.add(new Event("query_for_universe", null, null, null, null, null, String.valueOf(query)));
    }

    @Override
    public void initialUniverse(RoaringBitmap universe) {
        events.add(new Event("initial_universe", null, null, universe.getLongCardinality(), null,
            ids(universe), null));
    }

    @Override
    public void rankingRules(List<RankingRule<Q>> rules) {
        String ids = rules.stream().map(RankingRule::id).collect(Collectors.joining(", "));
        events.add(new Event("ranking_rules", null, null, null, null, null, ids));
    }

    @Override
    public void startIterationRankingRule(int ruleIndex, RankingRule<Q> rule, Q query, RoaringBitmap universe) {
        events.add(new Event("start_iteration", ruleIndex, rule.id(), universe.getLongCardinality(), null, null,
            String.valueOf(query)));
    }

    @Override
    public void nextBucketRankingRule(int ruleIndex, RankingRule<Q> rule, RoaringBitmap universe,
                                      RoaringBitmap bucket) {
        events.add(new Event("next_bucket", ruleIndex, rule.id(), universe.getLongCardinality(),
            bucket.getLongCardinality(), ids(bucket), null));
    }

    @Override
    public void skipBucketRankingRule(int ruleIndex, RankingRule<Q> rule, RoaringBitmap bucket) {
        events.add(new Event("skip_bucket", ruleIndex, rule.id(), null, bucket.getLongCardinality(),
            ids(bucket), null));
    }

    @Override
    public void endIterationRankingRule(int ruleIndex, RankingRule<Q> rule, RoaringBitmap universe) {
        events.add(new Event("end_iteration", ruleIndex, rule.id(), universe.getLongCardinality(), null, null,
            null));
    }

    @Override
    public void addToResults(List<Integer> docids) {
        events.add(new Event("add_to_results", null, null, null, (long) docids.size(), List.copyOf(docids), null));
    }

    @Override
    public void logInternalState(String ruleId, Supplier<?> state) {
        events.add(new Event("internal_state", null, ruleId, null, null, null, String.valueOf(state.get())));
    }

    public List<Event> events() {
        return Collections.unmodifiableList(events);
    }

    /** Events recorded for one type, in order. */
    public List<Event> events(String type) {
        return events.stream().filter(e -> e.type().equals(type)).collect(Collectors.toList());
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(events);
        } catch (JsonProcessingException e) {
            throw new InternalErrorException(ErrorCode.INTERNAL, "Failed to serialize search events", e);
        }
    }

    private static List<Integer> ids(RoaringBitmap bitmap) {
        List<Integer> ids = new ArrayList<>();
        for (int id : bitmap) {
            if (ids.size() == MAX_RECORDED_IDS) {
                break;
            }
            ids.add(id);
        }
        return ids;
    }
}
