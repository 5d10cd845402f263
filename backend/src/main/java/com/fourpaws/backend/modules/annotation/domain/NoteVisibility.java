package com.fourpaws.backend.modules.annotation.domain;

public enum NoteVisibility {
    STAFF_ONLY,
    PORTAL_VISIBLE
}
