package io.seqwarehouse.core.model;

/** Whether a target's expected path designates a file or a folder. */
public enum PathType {
    FILE,
    FOLDER
}
