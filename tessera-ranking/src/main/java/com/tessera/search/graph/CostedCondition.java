package com.tessera.search.graph;

/**
 * A condition produced by an edge builder, with the cost of the edge carrying it.
 * A null condition stands for an unconditional edge.
 */
public record CostedCondition<C>(int cost, C condition) {

    public static <C> CostedCondition<C> of(int cost, C condition) {
        return new CostedCondition<>(cost, condition);
    }
}
