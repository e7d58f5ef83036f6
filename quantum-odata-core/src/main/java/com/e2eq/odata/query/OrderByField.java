package com.e2eq.odata.query;

import lombok.Value;

import java.util.Locale;

/**
 * One {@code $orderby} segment.
 */
@Value
public class OrderByField {
    public enum Direction {
        ASC,
        DESC
    }

    String fieldName;
    Direction direction;

    public static OrderByField asc(String fieldName) {
        return new OrderByField(fieldName, Direction.ASC);
    }

    public static OrderByField desc(String fieldName) {
        return new OrderByField(fieldName, Direction.DESC);
    }

    @Override
    public String toString() {
        return fieldName + " " + direction.name().toLowerCase(Locale.ROOT);
    }
}
