package com.fourpaws.backend.modules.tenant.domain;

public enum AuthorizationDecision {
    ALLOWED,
    DENIED;

    public boolean isAllowed() {
        return this == ALLOWED;
    }
}
