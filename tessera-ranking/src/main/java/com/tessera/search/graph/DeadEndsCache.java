package com.tessera.search.graph;

import com.tessera.search.interner.Interned;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;

/**
 * Prefix tree of conditions recording which condition cannot follow which path
 * prefix, because the documents of the prefix and of the condition are disjoint.
 *
 * <p>The root's forbidden set holds conditions that are empty on their own.
 *
 * @param <C> condition type of the criterion
 */
public final class DeadEndsCache<C> {

    private final List<Interned<C>> conditions = new ArrayList<>();
    private final List<DeadEndsCache<C>> next = new ArrayList<>();
    private final RoaringBitmap forbidden = new RoaringBitmap();

    public void forbidCondition(Interned<C> condition) {
        forbidden.add(condition.index());
    }

    public void forbidConditionAfterPrefix(List<Interned<C>> prefix, Interned<C> condition) {
        DeadEndsCache<C> cursor = this;
        for (Interned<C> step : prefix) {
            DeadEndsCache<C> child = cursor.advance(step);
            if (child == null) {
                child = new DeadEndsCache<>();
                cursor.conditions.add(step);
                cursor.next.add(child);
            }
            cursor = child;
        }
        cursor.forbidden.add(condition.index());
    }

    /**
     * Conditions forbidden right after {@code prefix}, or null if nothing was ever
     * recorded below this prefix.
     */
    public RoaringBitmap forbiddenConditionsAfterPrefix(List<Interned<C>> prefix) {
        DeadEndsCache<C> cursor = this;
        for (Interned<C> step : prefix) {
            cursor = cursor.advance(step);
            if (cursor == null) {
                return null;
            }
        }
        return cursor.forbidden.clone();
    }

    /** Union of the conditions forbidden after every prefix of {@code path}, the empty prefix included. */
    public RoaringBitmap forbiddenConditionsForAllPrefixesUpTo(List<Interned<C>> path) {
        RoaringBitmap all = forbidden.clone();
        DeadEndsCache<C> cursor = this;
        for (Interned<C> step : path) {
            cursor = cursor.advance(step);
            if (cursor == null) {
                break;
            }
            all.or(cursor.forbidden);
        }
        return all;
    }

    private DeadEndsCache<C> advance(Interned<C> condition) {
        int idx = conditions.indexOf(condition);
        return idx < 0 ? null : next.get(idx);
    }
}
