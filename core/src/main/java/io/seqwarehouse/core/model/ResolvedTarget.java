package io.seqwarehouse.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A {@link TargetDescriptor} bound to the concrete paths found under a search root.
 *
 * @param descriptor the descriptor that was resolved
 * @param searchRoot directory the pattern was evaluated against
 * @param status     found, not found, or ambiguous
 * @param matches    every matching path, sorted
 * @param subfolders nested results, resolved against the single match (empty unless found)
 */
public record ResolvedTarget(
        TargetDescriptor descriptor,
        Path searchRoot,
        ResolutionStatus status,
        List<Path> matches,
        List<ResolvedTarget> subfolders) {

    public ResolvedTarget {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(status, "status must not be null");
        matches = List.copyOf(matches);
        subfolders = subfolders != null ? List.copyOf(subfolders) : List.of();
    }

    public String name() {
        return descriptor.name();
    }

    /** The single match, or {@code null} unless the status is {@link ResolutionStatus#FOUND}. */
    public Path match() {
        return status == ResolutionStatus.FOUND ? matches.get(0) : null;
    }

    /** Returns a FOUND copy bound to one chosen candidate, with re-resolved subfolders. */
    public ResolvedTarget choose(Path candidate, List<ResolvedTarget> resolvedSubfolders) {
        return new ResolvedTarget(
                descriptor, searchRoot, ResolutionStatus.FOUND, List.of(candidate), resolvedSubfolders);
    }
}
