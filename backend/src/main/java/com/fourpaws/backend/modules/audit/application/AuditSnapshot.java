package com.fourpaws.backend.modules.audit.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the flat field maps stored in {@code audit_log.data_snapshot}. Values other than
 * strings, numbers and booleans are stored by their {@code toString()} form.
 */
public final class AuditSnapshot {

    private AuditSnapshot() {
    }

    public static Map<String, Object> of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must be key/value pairs");
        }
        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            snapshot.put(String.valueOf(keyValues[i]), normalize(keyValues[i + 1]));
        }
        return snapshot;
    }

    private static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), normalize(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(AuditSnapshot::normalize).toList();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        return value.toString();
    }
}
