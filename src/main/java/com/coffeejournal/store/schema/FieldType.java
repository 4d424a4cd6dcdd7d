package com.coffeejournal.store.schema;

import java.util.List;
import java.util.Map;

/** JSON value kinds a field may hold. */
public enum FieldType {
    INTEGER,
    NUMBER,
    STRING,
    BOOLEAN,
    ARRAY,
    OBJECT;

    public boolean accepts(Object value) {
        return switch (this) {
            case INTEGER -> value instanceof Number n && isWhole(n);
            case NUMBER -> value instanceof Number;
            case STRING -> value instanceof String;
            case BOOLEAN -> value instanceof Boolean;
            case ARRAY -> value instanceof List<?>;
            case OBJECT -> value instanceof Map<?, ?>;
        };
    }

    private static boolean isWhole(Number n) {
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        if (n instanceof java.math.BigDecimal bd) {
            return bd.stripTrailingZeros().scale() <= 0;
        }
        return true;
    }
}
