package com.fourpaws.backend.modules.person.domain;

import java.util.Map;

import com.fourpaws.backend.global.attribute.AttributeKind;
import com.fourpaws.backend.global.attribute.AttributeSchema;

public final class PersonFlags {

    public static final String DO_NOT_ADOPT = "doNotAdopt";
    public static final String AVAILABLE = "available";
    public static final String MAX_CAPACITY = "maxCapacity";

    public static final AttributeSchema SCHEMA = AttributeSchema.closed("flags", Map.of(
            DO_NOT_ADOPT, AttributeKind.BOOLEAN,
            AVAILABLE, AttributeKind.BOOLEAN,
            MAX_CAPACITY, AttributeKind.INTEGER
    ));

    private PersonFlags() {
    }
}
