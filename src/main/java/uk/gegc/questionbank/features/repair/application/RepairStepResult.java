package uk.gegc.questionbank.features.repair.application;

public enum RepairStepResult {
    /** A page was committed and more work remains. */
    CONTINUE,
    /** The run reached a terminal state. */
    FINISHED,
    /** Cancellation was requested; the run stays resumable. */
    CANCELLED
}
