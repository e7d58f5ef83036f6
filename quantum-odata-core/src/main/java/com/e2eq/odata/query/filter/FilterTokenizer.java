package com.e2eq.odata.query.filter;

import com.e2eq.odata.error.ODataException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a raw {@code $filter} expression into {@link FilterToken}s after checking that
 * parentheses balance and quoted strings are closed.
 */
final class FilterTokenizer {

    private final String input;
    private int pos;

    FilterTokenizer(String input) {
        this.input = input;
    }

    List<FilterToken> tokenize() {
        validateStructure(input);
        List<FilterToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new FilterToken(FilterToken.Type.EOF, "", pos));
                return tokens;
            }
            char c = input.charAt(pos);
            int start = pos;
            if (c == '(') {
                pos++;
                tokens.add(new FilterToken(FilterToken.Type.OPEN_PAREN, "(", start));
            } else if (c == ')') {
                pos++;
                tokens.add(new FilterToken(FilterToken.Type.CLOSE_PAREN, ")", start));
            } else if (c == ',') {
                pos++;
                tokens.add(new FilterToken(FilterToken.Type.COMMA, ",", start));
            } else if (c == '\'') {
                tokens.add(readString());
            } else if (Character.isDigit(c) || ((c == '-' || c == '+') && nextIsDigit())) {
                tokens.add(readNumber());
            } else if (isIdentifierStart(c)) {
                tokens.add(readIdentifier());
            } else {
                throw ODataException.invalidFilter(
                        "Invalid $filter expression: Unexpected character '" + c + "' at position " + pos + ".");
            }
        }
    }

    /**
     * Rejects a {@code )} without opener, unclosed openers and unterminated quotes. An unescaped
     * single quote toggles quoting; {@code \'} does not.
     */
    static void validateStructure(String filter) {
        int depth = 0;
        boolean inQuotes = false;
        int quoteStart = -1;

        for (int i = 0; i < filter.length(); i++) {
            char c = filter.charAt(i);
            if (c == '\'' && (i == 0 || filter.charAt(i - 1) != '\\')) {
                inQuotes = !inQuotes;
                if (inQuotes) {
                    quoteStart = i;
                }
                continue;
            }
            if (inQuotes) {
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw ODataException.invalidFilter("Invalid $filter expression: Mismatched parentheses. "
                            + "Found closing ')' without matching opening '(' at position " + i + ".");
                }
            }
        }

        if (inQuotes) {
            throw ODataException.invalidFilter(
                    "Invalid $filter expression: Unclosed quoted string starting at position " + quoteStart + ".");
        }
        if (depth != 0) {
            throw ODataException.invalidFilter("Invalid $filter expression: Mismatched parentheses. "
                    + depth + " unclosed opening parenthesis(es).");
        }
    }

    private FilterToken readString() {
        int start = pos;
        pos++; // opening quote
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\\' && pos + 1 < input.length() && input.charAt(pos + 1) == '\'') {
                sb.append('\'');
                pos += 2;
            } else if (c == '\'') {
                if (pos + 1 < input.length() && input.charAt(pos + 1) == '\'') {
                    // OData doubles quotes inside literals
                    sb.append('\'');
                    pos += 2;
                } else {
                    pos++;
                    return new FilterToken(FilterToken.Type.STRING, sb.toString(), start);
                }
            } else {
                sb.append(c);
                pos++;
            }
        }
        throw ODataException.invalidFilter(
                "Invalid $filter expression: Unclosed quoted string starting at position " + start + ".");
    }

    private FilterToken readNumber() {
        int start = pos;
        pos++;
        boolean seenDot = false;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isDigit(c)) {
                pos++;
            } else if (c == '.' && !seenDot && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1))) {
                seenDot = true;
                pos++;
            } else {
                break;
            }
        }
        return new FilterToken(FilterToken.Type.NUMBER, input.substring(start, pos), start);
    }

    private FilterToken readIdentifier() {
        int start = pos;
        while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
            pos++;
        }
        return new FilterToken(FilterToken.Type.IDENTIFIER, input.substring(start, pos), start);
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private boolean nextIsDigit() {
        return pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1));
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '/' || c == '$';
    }
}
