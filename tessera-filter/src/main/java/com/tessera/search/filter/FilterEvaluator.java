package com.tessera.search.filter;

import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.api.exceptions.UserErrorException;
import com.tessera.search.api.index.InMemoryIndex;
import com.tessera.search.api.index.IndexSnapshot;
import org.roaringbitmap.RoaringBitmap;

import java.util.NavigableMap;
import java.util.Objects;

/**
 * Resolves a {@link FilterNode} tree to the documents it matches.
 *
 * <p>Equality matches both the string facet (case-insensitive) and, when the value
 * parses as a number, the number facet. Range operators only apply to numbers.
 * {@code !=} and {@code NOT} complement within every document of the index.
 */
public final class FilterEvaluator {

    private final IndexSnapshot index;

    public FilterEvaluator(IndexSnapshot index) {
        this.index = Objects.requireNonNull(index, "index cannot be null");
    }

    public RoaringBitmap evaluate(FilterNode node) {
        if (node instanceof FilterNode.Or or) {
            RoaringBitmap docids = new RoaringBitmap();
            for (FilterNode child : or.children()) {
                docids.or(evaluate(child));
            }
            return docids;
        }
        if (node instanceof FilterNode.And and) {
            RoaringBitmap docids = null;
            for (FilterNode child : and.children()) {
                RoaringBitmap childDocids = evaluate(child);
                if (docids == null) {
                    docids = childDocids;
                } else {
                    docids.and(childDocids);
                }
                if (docids.isEmpty()) {
                    break;
                }
            }
            return docids == null ? new RoaringBitmap() : docids;
        }
        if (node instanceof FilterNode.Not not) {
            return RoaringBitmap.andNot(index.documentIds(), evaluate(not.child()));
        }
        if (node instanceof FilterNode.Comparison comparison) {
            return evaluateComparison(comparison);
        }
        if (node instanceof FilterNode.Between between) {
            checkFilterable(between.field());
            return numberRange(between.field(),
                parseNumber(between.field(), between.low()), true,
                parseNumber(between.field(), between.high()), true);
        }
        if (node instanceof FilterNode.In in) {
            checkFilterable(in.field());
            RoaringBitmap docids = new RoaringBitmap();
            for (String value : in.values()) {
                docids.or(equalDocids(in.field(), value));
            }
            return docids;
        }
        if (node instanceof FilterNode.Exists exists) {
            checkFilterable(exists.field());
            return index.fieldExistsDocids(exists.field()).clone();
        }
        throw new IllegalArgumentException("Unsupported filter node: " + node.getClass().getName());
    }

    private RoaringBitmap evaluateComparison(FilterNode.Comparison comparison) {
        String field = comparison.field();
        checkFilterable(field);
        String value = comparison.value();
        return switch (comparison.operator()) {
            case EQUAL -> equalDocids(field, value);
            case NOT_EQUAL -> RoaringBitmap.andNot(index.documentIds(), equalDocids(field, value));
            case GREATER_THAN -> numberRange(field, parseNumber(field, value), false, Double.POSITIVE_INFINITY, true);
            case GREATER_THAN_OR_EQUAL -> numberRange(field, parseNumber(field, value), true, Double.POSITIVE_INFINITY, true);
            case LOWER_THAN -> numberRange(field, Double.NEGATIVE_INFINITY, true, parseNumber(field, value), false);
            case LOWER_THAN_OR_EQUAL -> numberRange(field, Double.NEGATIVE_INFINITY, true, parseNumber(field, value), true);
        };
    }

    private RoaringBitmap equalDocids(String field, String value) {
        RoaringBitmap docids = new RoaringBitmap();
        RoaringBitmap strings = index.stringFacetDocids(field).get(InMemoryIndex.normalizeFacet(value));
        if (strings != null) {
            docids.or(strings);
        }
        Double number = tryParseNumber(value);
        if (number != null) {
            RoaringBitmap numbers = index.numberFacetDocids(field).get(number);
            if (numbers != null) {
                docids.or(numbers);
            }
        }
        return docids;
    }

    private RoaringBitmap numberRange(String field, double low, boolean lowInclusive, double high, boolean highInclusive) {
        RoaringBitmap docids = new RoaringBitmap();
        if (low > high) {
            return docids;
        }
        NavigableMap<Double, RoaringBitmap> range =
            index.numberFacetDocids(field).subMap(low, lowInclusive, high, highInclusive);
        for (RoaringBitmap bitmap : range.values()) {
            docids.or(bitmap);
        }
        return docids;
    }

    private void checkFilterable(String field) {
        if (!index.filterableFields().contains(field)) {
            throw new UserErrorException(ErrorCode.ATTRIBUTE_NOT_FILTERABLE,
                String.format("Attribute `%s` is not filterable. Available filterable attributes are: %s",
                    field, index.filterableFields()));
        }
    }

    private static double parseNumber(String field, String value) {
        Double number = tryParseNumber(value);
        if (number == null) {
            throw new UserErrorException(ErrorCode.INVALID_FILTER,
                String.format("Value `%s` of field `%s` is not a valid number", value, field));
        }
        return number;
    }

    private static Double tryParseNumber(String value) {
        try {
            double number = Double.parseDouble(value.trim());
            return Double.isFinite(number) ? number : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
