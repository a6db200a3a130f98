/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.filter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Abstract syntax tree of a parsed filter expression.
 *
 * <p>Nodes are immutable records, so two filters parsed from equivalent text compare
 * equal. {@link #toString()} renders a fully parenthesized form for logs.
 */
public interface FilterNode {

    record Or(List<FilterNode> children) implements FilterNode {
        public Or {
            children = List.copyOf(children);
        }

        @Override
        public String toString() {
            return children.stream().map(FilterNode::toString).collect(Collectors.joining(" OR ", "(", ")"));
        }
    }

    record And(List<FilterNode> children) implements FilterNode {
        public And {
            children = List.copyOf(children);
        }

        @Override
        public String toString() {
            return children.stream().map(FilterNode::toString).collect(Collectors.joining(" AND ", "(", ")"));
        }
    }

    record Not(FilterNode child) implements FilterNode {
        @Override
        public String toString() {
            return "NOT " + child;
        }
    }

    /** {@code field <op> value}. */
    record Comparison(String field, ComparisonOperator operator, String value) implements FilterNode {
        @Override
        public String toString() {
            return field + " " + operator.symbol() + " " + value;
        }
    }

    /** {@code field low TO high}, both bounds inclusive. */
    record Between(String field, String low, String high) implements FilterNode {
        @Override
        public String toString() {
            return field + " " + low + " TO " + high;
        }
    }

    /** {@code field IN [a, b, c]}. */
    record In(String field, List<String> values) implements FilterNode {
        public In {
            values = List.copyOf(values);
        }

        @Override
        public String toString() {
            return field + " IN " + values;
        }
    }

    /** {@code field EXISTS}. */
    record Exists(String field) implements FilterNode {
        @Override
        public String toString() {
            return field + " EXISTS";
        }
    }
}
