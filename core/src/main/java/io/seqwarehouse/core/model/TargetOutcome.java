package io.seqwarehouse.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of aggregating one target (and, nested, its subfolders).
 *
 * @param name        target name (subfolders are reported as {@code parent/child})
 * @param state       terminal state
 * @param copyRoot    source directory the copy was taken from, {@code null} if none
 * @param destination destination directory
 * @param files       every file handled
 * @param detail      explanation for NOT_FOUND, AMBIGUOUS or FAILED outcomes
 */
public record TargetOutcome(
        String name, TargetState state, Path copyRoot, Path destination, List<FileCopy> files, String detail) {

    public TargetOutcome {
        files = List.copyOf(files);
    }

    public long count(CopyStatus status) {
        return files.stream().filter(file -> file.status() == status).count();
    }
}
