package com.fourpaws.backend.modules.animal.domain;

public enum OutcomeType {
    ADOPTION(true),
    TRANSFER(true),
    RETURN_TO_OWNER(true),
    EUTHANASIA(false);

    private final boolean liveRelease;

    OutcomeType(boolean liveRelease) {
        this.liveRelease = liveRelease;
    }

    public boolean isLiveRelease() {
        return liveRelease;
    }
}
