package com.tessera.search.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits a filter expression into tokens.
 *
 * <p>Words run until whitespace or one of {@code ( ) [ ] , = ! < >}. Quoted values use
 * single or double quotes; a backslash escapes the quote character. Keywords are
 * recognized case-insensitively, and only when unquoted.
 */
final class FilterLexer {

    enum TokenType {
        WORD, QUOTED, LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, COMMA, OPERATOR, EOF
    }

    record Token(TokenType type, String text, int position) {

        boolean isKeyword(String keyword) {
            return type == TokenType.WORD && text.toUpperCase(Locale.ROOT).equals(keyword);
        }

        boolean isValue() {
            return type == TokenType.WORD || type == TokenType.QUOTED;
        }
    }

    private final String input;
    private int position;

    private FilterLexer(String input) {
        this.input = input;
    }

    static List<Token> tokenize(String input) {
        return new FilterLexer(input).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (position >= input.length()) {
                tokens.add(new Token(TokenType.EOF, "", position));
                return tokens;
            }
            char c = input.charAt(position);
            int start = position;
            switch (c) {
                case '(' -> tokens.add(single(TokenType.LEFT_PAREN));
                case ')' -> tokens.add(single(TokenType.RIGHT_PAREN));
                case '[' -> tokens.add(single(TokenType.LEFT_BRACKET));
                case ']' -> tokens.add(single(TokenType.RIGHT_BRACKET));
                case ',' -> tokens.add(single(TokenType.COMMA));
                case '=' -> tokens.add(single(TokenType.OPERATOR));
                case '!', '<', '>' -> {
                    position++;
                    if (position < input.length() && input.charAt(position) == '=') {
                        position++;
                    } else if (c == '!') {
                        throw new FilterParseException("Expected `=` after `!`", start);
                    }
                    tokens.add(new Token(TokenType.OPERATOR, input.substring(start, position), start));
                }
                case '"', '\'' -> tokens.add(quoted(c));
                default -> tokens.add(word());
            }
        }
    }

    private Token single(TokenType type) {
        Token token = new Token(type, String.valueOf(input.charAt(position)), position);
        position++;
        return token;
    }

    private Token quoted(char quote) {
        int start = position;
        position++;
        StringBuilder value = new StringBuilder();
        while (position < input.length()) {
            char c = input.charAt(position);
            if (c == '\\' && position + 1 < input.length() && input.charAt(position + 1) == quote) {
                value.append(quote);
                position += 2;
            } else if (c == quote) {
                position++;
                return new Token(TokenType.QUOTED, value.toString(), start);
            } else {
                value.append(c);
                position++;
            }
        }
        throw new FilterParseException("Missing closing quote " + quote, start);
    }

    private Token word() {
        int start = position;
        while (position < input.length() && !isDelimiter(input.charAt(position))) {
            position++;
        }
        return new Token(TokenType.WORD, input.substring(start, position), start);
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || "()[],=!<>\"'".indexOf(c) >= 0;
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }
}
