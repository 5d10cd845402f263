package com.fourpaws.backend.modules.person.domain;

public enum PersonType {
    ADOPTER,
    FOSTER,
    VOLUNTEER,
    DONOR,
    STAFF
}
