package com.fourpaws.backend.modules.tenant.domain;

public enum UserStatus {
    ACTIVE,
    DISABLED
}
