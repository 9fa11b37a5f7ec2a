package io.seqwarehouse.core.model;

import java.util.Objects;

/**
 * Where a target is expected to be found, relative to the search root.
 *
 * @param type    file or folder
 * @param pattern glob pattern; {@code **} descends any number of directories
 */
public record ExpectedPath(PathType type, String pattern) {

    public ExpectedPath {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
    }
}
