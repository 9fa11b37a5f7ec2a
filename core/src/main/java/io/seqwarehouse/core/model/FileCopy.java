package io.seqwarehouse.core.model;

import java.nio.file.Path;

/**
 * One file handled during aggregation.
 *
 * @param source      source file
 * @param destination destination file
 * @param status      copy outcome
 * @param error       failure description, {@code null} unless failed
 */
public record FileCopy(Path source, Path destination, CopyStatus status, String error) {

    public static FileCopy copied(Path source, Path destination) {
        return new FileCopy(source, destination, CopyStatus.COPIED, null);
    }

    public static FileCopy alreadyPresent(Path source, Path destination) {
        return new FileCopy(source, destination, CopyStatus.ALREADY_PRESENT, null);
    }

    public static FileCopy failed(Path source, Path destination, String error) {
        return new FileCopy(source, destination, CopyStatus.FAILED, error);
    }
}
