package com.fourpaws.backend.modules.animal.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Animal lifecycle states. Terminal states accept no further transition and always have
 * exactly one {@link Outcome}.
 */
public enum AnimalStatus {
    AVAILABLE(false, null),
    HOLD(false, null),
    FOSTERED(false, null),
    ADOPTED(true, OutcomeType.ADOPTION),
    TRANSFERRED(true, OutcomeType.TRANSFER),
    RETURNED_TO_OWNER(true, OutcomeType.RETURN_TO_OWNER),
    EUTHANIZED(true, OutcomeType.EUTHANASIA);

    private static final Set<AnimalStatus> TERMINAL = EnumSet.of(ADOPTED, TRANSFERRED, RETURNED_TO_OWNER, EUTHANIZED);

    private final boolean terminal;
    private final OutcomeType outcomeType;

    AnimalStatus(boolean terminal, OutcomeType outcomeType) {
        this.terminal = terminal;
        this.outcomeType = outcomeType;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public OutcomeType getOutcomeType() {
        return outcomeType;
    }

    public Set<AnimalStatus> allowedTargets() {
        return switch (this) {
            case AVAILABLE -> with(EnumSet.of(HOLD, FOSTERED));
            case HOLD -> with(EnumSet.of(AVAILABLE, FOSTERED));
            case FOSTERED -> EnumSet.of(AVAILABLE, HOLD, ADOPTED);
            default -> EnumSet.noneOf(AnimalStatus.class);
        };
    }

    public boolean canTransitionTo(AnimalStatus target) {
        return allowedTargets().contains(target);
    }

    public static Set<AnimalStatus> terminalStates() {
        return EnumSet.copyOf(TERMINAL);
    }

    private static Set<AnimalStatus> with(EnumSet<AnimalStatus> targets) {
        targets.addAll(TERMINAL);
        return targets;
    }
}
