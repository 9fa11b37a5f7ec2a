package io.seqwarehouse.core.model;

/** Outcome of copying one file. */
public enum CopyStatus {
    COPIED,
    ALREADY_PRESENT,
    FAILED
}
