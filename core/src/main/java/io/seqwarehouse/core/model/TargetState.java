package io.seqwarehouse.core.model;

/**
 * Per-target aggregation state. {@code PENDING → FOUND | NOT_FOUND | AMBIGUOUS → COPIED | SKIPPED
 * | FAILED}. Terminal states: COPIED, SKIPPED, FAILED and NOT_FOUND.
 */
public enum TargetState {
    PENDING,
    FOUND,
    NOT_FOUND,
    AMBIGUOUS,
    COPIED,
    SKIPPED,
    FAILED;

    public boolean isTerminal() {
        return this == COPIED || this == SKIPPED || this == FAILED || this == NOT_FOUND;
    }
}
