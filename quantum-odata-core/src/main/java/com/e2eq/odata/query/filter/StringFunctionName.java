package com.e2eq.odata.query.filter;

import java.util.Arrays;
import java.util.Optional;

public enum StringFunctionName {
    CONTAINS("contains", "$contains"),
    STARTSWITH("startswith", "$startsWith"),
    ENDSWITH("endswith", "$endsWith");

    private final String token;
    private final String symbol;

    StringFunctionName(String token, String symbol) {
        this.token = token;
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static Optional<StringFunctionName> fromToken(String token) {
        return Arrays.stream(values())
                .filter(f -> f.token.equalsIgnoreCase(token))
                .findFirst();
    }
}
