package com.fourpaws.backend.global.attribute;

import java.util.List;

public enum AttributeKind {
    STRING,
    NUMBER,
    INTEGER,
    BOOLEAN,
    LIST;

    boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof Short;
            case BOOLEAN -> value instanceof Boolean;
            case LIST -> value instanceof List<?> list && list.stream().allMatch(AttributeKind::isScalar);
        };
    }

    static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }
}
