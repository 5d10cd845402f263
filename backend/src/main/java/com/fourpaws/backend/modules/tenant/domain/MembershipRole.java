package com.fourpaws.backend.modules.tenant.domain;

/**
 * Organization roles ordered by rank. VOLUNTEER and FOSTER share a rank.
 */
public enum MembershipRole {
    READONLY(0),
    VOLUNTEER(1),
    FOSTER(1),
    STAFF(2),
    ADMIN(3);

    private final int rank;

    MembershipRole(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean satisfies(MembershipRole required) {
        return rank >= required.rank;
    }
}
