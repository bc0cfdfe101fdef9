package uk.gegc.examforge.features.paper.domain.model;

import java.util.Set;

/**
 * Allowed status transitions within one paper lineage. An approved paper never goes back to
 * draft; editing it forks a new lineage instead.
 */
public enum PaperStateMachine {
    DRAFT(Set.of(PaperStatus.APPROVED)),
    APPROVED(Set.of());

    private final Set<PaperStatus> allowedTransitions;

    PaperStateMachine(Set<PaperStatus> allowedTransitions) {
        this.allowedTransitions = allowedTransitions;
    }

    public boolean canTransitionTo(PaperStatus targetStatus) {
        if (targetStatus == null) {
            return false;
        }
        return allowedTransitions.contains(targetStatus);
    }

    public static boolean isValidTransition(PaperStatus from, PaperStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return PaperStateMachine.valueOf(from.name()).canTransitionTo(to);
    }
}
