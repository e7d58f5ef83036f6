package com.e2eq.odata.memory;

import com.e2eq.odata.query.filter.FilterNode;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates a {@link FilterNode} against one record. String functions ignore case; numbers of
 * different types compare by value; ordering comparisons involving null are false.
 */
class InMemoryFilterEvaluator implements FilterNode.Visitor<Boolean> {

    private final Map<String, Object> record;

    InMemoryFilterEvaluator(Map<String, Object> record) {
        this.record = record;
    }

    static boolean matches(FilterNode filter, Map<String, Object> record) {
        return filter == null || filter.accept(new InMemoryFilterEvaluator(record));
    }

    @Override
    public Boolean visitComparison(FilterNode.Comparison node) {
        Object actual = record.get(node.field());
        Object expected = node.value();
        switch (node.operator()) {
            case EQ:
                return valueEquals(actual, expected);
            case NE:
                return !valueEquals(actual, expected);
            default:
                if (actual == null || expected == null) {
                    return false;
                }
                Integer cmp = compare(actual, expected);
                if (cmp == null) {
                    return false;
                }
                switch (node.operator()) {
                    case GT:
                        return cmp > 0;
                    case GE:
                        return cmp >= 0;
                    case LT:
                        return cmp < 0;
                    case LE:
                        return cmp <= 0;
                    default:
                        return false;
                }
        }
    }

    @Override
    public Boolean visitLogical(FilterNode.Logical node) {
        switch (node.operator()) {
            case AND:
                for (FilterNode operand : node.operands()) {
                    if (!operand.accept(this)) {
                        return false;
                    }
                }
                return true;
            case OR:
                for (FilterNode operand : node.operands()) {
                    if (operand.accept(this)) {
                        return true;
                    }
                }
                return false;
            default:
                throw new IllegalStateException("Unknown logical operator " + node.operator());
        }
    }

    @Override
    public Boolean visitNot(FilterNode.Not node) {
        return !node.operand().accept(this);
    }

    @Override
    public Boolean visitStringFunction(FilterNode.StringFunction node) {
        Object actual = record.get(node.field());
        if (actual == null || node.argument() == null) {
            return false;
        }
        String value = String.valueOf(actual).toLowerCase(Locale.ROOT);
        String argument = node.argument().toLowerCase(Locale.ROOT);
        switch (node.name()) {
            case CONTAINS:
                return value.contains(argument);
            case STARTSWITH:
                return value.startsWith(argument);
            case ENDSWITH:
                return value.endsWith(argument);
            default:
                return false;
        }
    }

    @Override
    public Boolean visitIn(FilterNode.In node) {
        Object actual = record.get(node.field());
        if (actual == null) {
            return false;
        }
        String key = String.valueOf(actual);
        for (Object candidate : node.values()) {
            if (candidate != null && key.equals(String.valueOf(candidate))) {
                return true;
            }
        }
        return false;
    }

    static boolean valueEquals(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number && b instanceof Number) {
            return toDecimal(a).compareTo(toDecimal(b)) == 0;
        }
        if (a instanceof Boolean || b instanceof Boolean) {
            return String.valueOf(a).equalsIgnoreCase(String.valueOf(b));
        }
        return Objects.equals(a, b) || String.valueOf(a).equals(String.valueOf(b));
    }

    /**
     * Compares numbers by value and everything else by string form; null when either side is
     * null.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static Integer compare(Object a, Object b) {
        if (a == null || b == null) {
            return null;
        }
        if (a instanceof Number && b instanceof Number) {
            return toDecimal(a).compareTo(toDecimal(b));
        }
        if (a instanceof Comparable && a.getClass().isInstance(b)) {
            return ((Comparable) a).compareTo(b);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    private static BigDecimal toDecimal(Object number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(number.toString());
    }
}
