/*
 * Copyright (c) 2025 Tessera Search
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.search.filter;

import com.tessera.search.api.exceptions.ErrorCode;
import com.tessera.search.filter.FilterLexer.Token;
import com.tessera.search.filter.FilterLexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser of the filter language.
 *
 * <pre>
 * filter     = expression EOF
 * expression = or
 * or         = and ("OR" and)*
 * and        = not ("AND" not)*
 * not        = "NOT" not | primary
 * primary    = "(" expression ")" | condition
 * condition  = value ( "=" | "!=" | "&gt;" | "&gt;=" | "&lt;" | "&lt;=" ) value
 *            | value value "TO" value
 *            | value "IN" "[" value ("," value)* ","? "]"
 *            | value "NOT" "IN" "[" ... "]"
 *            | value "EXISTS"
 *            | value "NOT" "EXISTS"
 * </pre>
 *
 * <p>Keywords are case-insensitive. Nesting deeper than {@link #MAX_FILTER_DEPTH} is
 * rejected so that hostile input cannot exhaust the stack.
 */
public final class FilterParser {

    public static final int MAX_FILTER_DEPTH = 200;

    private final List<Token> tokens;
    private int index;

    private FilterParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses an expression.
     *
     * @throws FilterParseException if the expression is blank or malformed
     */
    public static FilterNode parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new FilterParseException("Filter expression is empty", 0);
        }
        FilterParser parser = new FilterParser(FilterLexer.tokenize(expression));
        FilterNode node = parser.parseOr(0);
        Token trailing = parser.peek();
        if (trailing.type() != TokenType.EOF) {
            throw new FilterParseException(
                String.format("Unexpected `%s`, expected `AND`, `OR` or end of filter", trailing.text()),
                trailing.position());
        }
        return node;
    }

    private FilterNode parseOr(int depth) {
        checkDepth(depth);
        List<FilterNode> children = new ArrayList<>();
        children.add(parseAnd(depth));
        while (peek().isKeyword("OR")) {
            index++;
            children.add(parseAnd(depth));
        }
        return children.size() == 1 ? children.get(0) : new FilterNode.Or(children);
    }

    private FilterNode parseAnd(int depth) {
        List<FilterNode> children = new ArrayList<>();
        children.add(parseNot(depth));
        while (peek().isKeyword("AND")) {
            index++;
            children.add(parseNot(depth));
        }
        return children.size() == 1 ? children.get(0) : new FilterNode.And(children);
    }

    private FilterNode parseNot(int depth) {
        if (peek().isKeyword("NOT")) {
            index++;
            checkDepth(depth + 1);
            return new FilterNode.Not(parseNot(depth + 1));
        }
        return parsePrimary(depth);
    }

    private FilterNode parsePrimary(int depth) {
        Token token = peek();
        if (token.type() == TokenType.LEFT_PAREN) {
            index++;
            FilterNode inner = parseOr(depth + 1);
            expect(TokenType.RIGHT_PAREN, "`)`");
            return inner;
        }
        return parseCondition();
    }

    private FilterNode parseCondition() {
        Token fieldToken = next();
        if (!fieldToken.isValue()) {
            throw new FilterParseException(
                String.format("Expected a field name but found `%s`", describe(fieldToken)), fieldToken.position());
        }
        String field = fieldToken.text();
        Token token = peek();

        if (token.isKeyword("EXISTS")) {
            index++;
            return new FilterNode.Exists(field);
        }
        if (token.isKeyword("NOT")) {
            index++;
            Token negated = next();
            if (negated.isKeyword("EXISTS")) {
                return new FilterNode.Not(new FilterNode.Exists(field));
            }
            if (negated.isKeyword("IN")) {
                return new FilterNode.Not(parseInValues(field));
            }
            throw new FilterParseException(
                String.format("Expected `EXISTS` or `IN` after `%s NOT`", field), negated.position());
        }
        if (token.isKeyword("IN")) {
            index++;
            return parseInValues(field);
        }
        if (token.type() == TokenType.OPERATOR) {
            index++;
            Token value = next();
            if (!value.isValue()) {
                throw new FilterParseException(
                    String.format("Expected a value after `%s %s`", field, token.text()), value.position());
            }
            return new FilterNode.Comparison(field, ComparisonOperator.fromSymbol(token.text()), value.text());
        }
        if (token.isValue()) {
            index++;
            Token to = next();
            if (!to.isKeyword("TO")) {
                throw new FilterParseException(
                    String.format("Expected `TO` after `%s %s`", field, token.text()), to.position());
            }
            Token high = next();
            if (!high.isValue()) {
                throw new FilterParseException("Expected a value after `TO`", high.position());
            }
            return new FilterNode.Between(field, token.text(), high.text());
        }
        throw new FilterParseException(
            String.format("Was expecting an operation `=`, `!=`, `>=`, `>`, `<=`, `<`, `IN`, `NOT IN`, `TO`, "
                + "`EXISTS` or `NOT EXISTS` after `%s` but found `%s`", field, describe(token)),
            token.position());
    }

    private FilterNode parseInValues(String field) {
        expect(TokenType.LEFT_BRACKET, "`[`");
        List<String> values = new ArrayList<>();
        while (peek().type() != TokenType.RIGHT_BRACKET) {
            Token value = next();
            if (!value.isValue()) {
                throw new FilterParseException(
                    String.format("Expected a value in `%s IN [...]` but found `%s`", field, describe(value)),
                    value.position());
            }
            values.add(value.text());
            if (peek().type() == TokenType.COMMA) {
                index++;
            } else if (peek().type() != TokenType.RIGHT_BRACKET) {
                throw new FilterParseException("Expected `,` or `]`", peek().position());
            }
        }
        index++;
        return new FilterNode.In(field, values);
    }

    private void checkDepth(int depth) {
        if (depth > MAX_FILTER_DEPTH) {
            throw new FilterParseException(ErrorCode.FILTER_TOO_DEEP,
                "The filter exceeded the maximum depth limit of " + MAX_FILTER_DEPTH, peek().position());
        }
    }

    private Token expect(TokenType type, String description) {
        Token token = next();
        if (token.type() != type) {
            throw new FilterParseException(
                String.format("Expected %s but found `%s`", description, describe(token)), token.position());
        }
        return token;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.type() != TokenType.EOF) {
            index++;
        }
        return token;
    }

    private static String describe(Token token) {
        return token.type() == TokenType.EOF ? "end of filter" : token.text();
    }
}
