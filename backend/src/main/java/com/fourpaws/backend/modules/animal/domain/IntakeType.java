package com.fourpaws.backend.modules.animal.domain;

public enum IntakeType {
    STRAY,
    OWNER_SURRENDER,
    TRANSFER_IN,
    CONFISCATION,
    BORN_IN_CARE
}
