package io.seqwarehouse.core.model;

/** Outcome of matching a target descriptor against a directory tree. */
public enum ResolutionStatus {
    FOUND,
    NOT_FOUND,
    AMBIGUOUS
}
