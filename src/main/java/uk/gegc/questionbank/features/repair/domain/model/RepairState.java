package uk.gegc.questionbank.features.repair.domain.model;

import java.util.List;

public enum RepairState {
    CLEARING,
    REBUILDING,
    VERIFYING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public static List<RepairState> unfinished() {
        return List.of(CLEARING, REBUILDING, VERIFYING);
    }
}
