package com.e2eq.odata.query.filter;

/**
 * Lexical token of a {@code $filter} expression. {@code position} is the zero based offset in the
 * raw expression.
 */
record FilterToken(Type type, String text, int position) {

    enum Type {
        IDENTIFIER,
        STRING,
        NUMBER,
        OPEN_PAREN,
        CLOSE_PAREN,
        COMMA,
        EOF
    }

    boolean is(Type expected) {
        return type == expected;
    }

    /** Case-sensitive keyword match, used for {@code and}, {@code or} and {@code not}. */
    boolean isKeyword(String keyword) {
        return type == Type.IDENTIFIER && text.equals(keyword);
    }

    String describe() {
        return type == Type.EOF ? "end of expression" : "'" + text + "' at position " + position;
    }
}
