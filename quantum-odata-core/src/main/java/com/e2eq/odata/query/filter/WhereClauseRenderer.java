package com.e2eq.odata.query.filter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link FilterNode} as the generic Mongo-style where clause, e.g.
 * {@code {price: {$gt: 100}}} or {@code {$and: [..]}}.
 */
public class WhereClauseRenderer implements FilterNode.Visitor<Map<String, Object>> {

    public static Map<String, Object> render(FilterNode node) {
        return node == null ? Map.of() : node.accept(new WhereClauseRenderer());
    }

    @Override
    public Map<String, Object> visitComparison(FilterNode.Comparison node) {
        Map<String, Object> condition = new LinkedHashMap<>();
        condition.put(node.operator().getSymbol(), node.value());
        return single(node.field(), condition);
    }

    @Override
    public Map<String, Object> visitLogical(FilterNode.Logical node) {
        List<Map<String, Object>> rendered = new ArrayList<>();
        for (FilterNode operand : node.operands()) {
            rendered.add(operand.accept(this));
        }
        return single(node.operator().getSymbol(), rendered);
    }

    @Override
    public Map<String, Object> visitNot(FilterNode.Not node) {
        return single("$not", node.operand().accept(this));
    }

    @Override
    public Map<String, Object> visitStringFunction(FilterNode.StringFunction node) {
        return single(node.field(), single(node.name().getSymbol(), node.argument()));
    }

    @Override
    public Map<String, Object> visitIn(FilterNode.In node) {
        return single(node.field(), single("$in", node.values()));
    }

    private static Map<String, Object> single(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return map;
    }
}
