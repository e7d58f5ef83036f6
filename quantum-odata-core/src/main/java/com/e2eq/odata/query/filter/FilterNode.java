package com.e2eq.odata.query.filter;

import java.util.List;

/**
 * Generic boolean filter tree handed to the data engine.
 */
public interface FilterNode {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitComparison(Comparison node);
        R visitLogical(Logical node);
        R visitNot(Not node);
        R visitStringFunction(StringFunction node);
        R visitIn(In node);
    }

    /** {@code field operator value}; value is a String, Long, Double, Boolean or null. */
    record Comparison(String field, ComparisonOperator operator, Object value) implements FilterNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComparison(this);
        }
    }

    record Logical(LogicalOperator operator, List<FilterNode> operands) implements FilterNode {
        public Logical {
            operands = List.copyOf(operands);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLogical(this);
        }
    }

    record Not(FilterNode operand) implements FilterNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }

    record StringFunction(StringFunctionName name, String field, String argument) implements FilterNode {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStringFunction(this);
        }
    }

    /**
     * Membership test. Never produced by the parser; the expand orchestrator uses it to fetch
     * related records by identifier.
     */
    record In(String field, List<Object> values) implements FilterNode {
        public In {
            values = List.copyOf(values);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIn(this);
        }
    }

    static FilterNode and(List<FilterNode> operands) {
        return operands.size() == 1 ? operands.get(0) : new Logical(LogicalOperator.AND, operands);
    }

    static FilterNode or(List<FilterNode> operands) {
        return operands.size() == 1 ? operands.get(0) : new Logical(LogicalOperator.OR, operands);
    }
}
