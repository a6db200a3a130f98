package com.tessera.search.filter;

import com.tessera.search.api.index.IndexSnapshot;
import org.roaringbitmap.RoaringBitmap;

import java.util.Objects;

/**
 * A parsed filter expression, ready to be evaluated against any snapshot.
 *
 * @param expression the source text
 * @param root       the parsed tree
 */
public record Filter(String expression, FilterNode root) {

    public Filter {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(root, "root cannot be null");
    }

    public static Filter parse(String expression) {
        return new Filter(expression.trim(), FilterParser.parse(expression));
    }

    /** Documents of {@code index} matching this filter; the returned bitmap is owned by the caller. */
    public RoaringBitmap evaluate(IndexSnapshot index) {
        return new FilterEvaluator(index).evaluate(root);
    }
}
