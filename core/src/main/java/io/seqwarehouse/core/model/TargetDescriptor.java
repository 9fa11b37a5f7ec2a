package io.seqwarehouse.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Declarative description of an artifact expected within a sequencing-run tree. Immutable;
 * loaded once per aggregation run by {@code TargetParser}.
 *
 * <p>
 * A subfolder descriptor may omit {@code expectedPath}; it then designates the folder called
 * {@code name} directly under its parent's matched node.
 *
 * @param name         target name, also the destination folder name
 * @param expectedPath expected location, may be null for subfolders
 * @param recursive    whether the copy descends into the matched folder's subfolders
 * @param exclusions   glob patterns excluded from the copy, relative to the copy root
 * @param subfolders   nested descriptors resolved relative to the matched node
 */
public record TargetDescriptor(
        String name,
        ExpectedPath expectedPath,
        boolean recursive,
        List<String> exclusions,
        List<TargetDescriptor> subfolders) {

    public TargetDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        exclusions = exclusions != null ? List.copyOf(exclusions) : List.of();
        subfolders = subfolders != null ? List.copyOf(subfolders) : List.of();
    }

    public static TargetDescriptor of(String name, PathType type, String pattern) {
        return new TargetDescriptor(name, new ExpectedPath(type, pattern), false, List.of(), List.of());
    }

    public TargetDescriptor withRecursive(boolean value) {
        return new TargetDescriptor(name, expectedPath, value, exclusions, subfolders);
    }

    public TargetDescriptor withExclusions(List<String> value) {
        return new TargetDescriptor(name, expectedPath, recursive, value, subfolders);
    }

    public TargetDescriptor withSubfolders(List<TargetDescriptor> value) {
        return new TargetDescriptor(name, expectedPath, recursive, exclusions, value);
    }
}
