package com.e2eq.odata.query.filter;

public enum LogicalOperator {
    AND("$and"),
    OR("$or");

    private final String symbol;

    LogicalOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
