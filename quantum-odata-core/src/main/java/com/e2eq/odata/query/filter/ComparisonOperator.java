package com.e2eq.odata.query.filter;

import java.util.Arrays;
import java.util.Optional;

public enum ComparisonOperator {
    EQ("eq", "$eq"),
    NE("ne", "$ne"),
    GT("gt", "$gt"),
    GE("ge", "$gte"),
    LT("lt", "$lt"),
    LE("le", "$lte");

    private final String token;
    private final String symbol;

    ComparisonOperator(String token, String symbol) {
        this.token = token;
        this.symbol = symbol;
    }

    /** The internal operator symbol, e.g. {@code $gte}. */
    public String getSymbol() {
        return symbol;
    }

    public static Optional<ComparisonOperator> fromToken(String token) {
        return Arrays.stream(values())
                .filter(op -> op.token.equalsIgnoreCase(token))
                .findFirst();
    }
}
