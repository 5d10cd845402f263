package com.fourpaws.backend.global.attribute;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;

/**
 * Boundary validation for the open key/value columns (animal attributes, person flags,
 * application forms). Values are limited to scalars and flat lists of scalars; a closed schema
 * additionally restricts the keys and the kind stored under each key.
 */
public final class AttributeSchema {

    private static final Pattern KEY_PATTERN = Pattern.compile("[a-zA-Z][a-zA-Z0-9_]{0,63}");
    private static final int MAX_ENTRIES = 64;
    private static final int MAX_STRING_LENGTH = 2000;

    private final String name;
    private final Map<String, AttributeKind> fields;
    private final boolean open;

    private AttributeSchema(String name, Map<String, AttributeKind> fields, boolean open) {
        this.name = name;
        this.fields = fields;
        this.open = open;
    }

    public static AttributeSchema open(String name) {
        return new AttributeSchema(name, Map.of(), true);
    }

    public static AttributeSchema closed(String name, Map<String, AttributeKind> fields) {
        return new AttributeSchema(name, Map.copyOf(fields), false);
    }

    public Map<String, Object> validate(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return new LinkedHashMap<>();
        }
        if (raw.size() > MAX_ENTRIES) {
            throw invalid("too many entries");
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (key == null || !KEY_PATTERN.matcher(key).matches()) {
                throw invalid("invalid key '" + key + "'");
            }
            if (value == null) {
                continue;
            }
            AttributeKind expected = fields.get(key);
            if (expected == null) {
                if (!open) {
                    throw invalid("unknown key '" + key + "'");
                }
                if (!AttributeKind.isScalar(value) && !AttributeKind.LIST.accepts(value)) {
                    throw invalid("unsupported value for '" + key + "'");
                }
            } else if (!expected.accepts(value)) {
                throw invalid("'" + key + "' must be " + expected.name().toLowerCase());
            }
            if (value instanceof String text && text.length() > MAX_STRING_LENGTH) {
                throw invalid("'" + key + "' is too long");
            }
            normalized.put(key, value instanceof List<?> list ? List.copyOf(list) : value);
        }
        return normalized;
    }

    public Map<String, AttributeKind> fields() {
        return Collections.unmodifiableMap(fields);
    }

    private ProblemException invalid(String reason) {
        return new ProblemException(ErrorCode.INVALID_ATTRIBUTES, name + ": " + reason);
    }
}
