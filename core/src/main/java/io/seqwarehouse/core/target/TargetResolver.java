package io.seqwarehouse.core.target;

import io.seqwarehouse.core.model.ExpectedPath;
import io.seqwarehouse.core.model.PathType;
import io.seqwarehouse.core.model.ResolutionStatus;
import io.seqwarehouse.core.model.ResolvedTarget;
import io.seqwarehouse.core.model.TargetDescriptor;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds target descriptors to concrete paths under a search root.
 *
 * <p>
 * The descriptor's pattern is matched against every path below the root, relative to it; only
 * candidates of the declared type count. No match resolves to {@link ResolutionStatus#NOT_FOUND},
 * one to {@link ResolutionStatus#FOUND} and several to {@link ResolutionStatus#AMBIGUOUS} with all
 * candidates kept; choosing among them is the caller's decision.
 *
 * <p>
 * Subfolders are resolved only for a found target, against its anchor: the matched folder, or the
 * folder containing the matched file. Unreadable directories are skipped with a warning.
 *
 * <p>
 * Stateless and thread-safe.
 */
public final class TargetResolver {

    private static final Logger LOG = LoggerFactory.getLogger(TargetResolver.class);

    /** Resolves each descriptor against the same root, preserving order. */
    public List<ResolvedTarget> resolveAll(Path root, List<TargetDescriptor> descriptors) {
        List<ResolvedTarget> resolved = new ArrayList<>();
        for (TargetDescriptor descriptor : descriptors) {
            resolved.add(resolve(root, descriptor));
        }
        return resolved;
    }

    /**
     * Resolves one descriptor and, when found, its subfolders.
     *
     * @param root       directory to search
     * @param descriptor target to look for
     * @return the resolution; never {@code null}
     */
    public ResolvedTarget resolve(Path root, TargetDescriptor descriptor) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(descriptor, "descriptor must not be null");

        List<Path> matches = findCandidates(root, descriptor);
        ResolvedTarget result;
        if (matches.isEmpty()) {
            result = new ResolvedTarget(descriptor, root, ResolutionStatus.NOT_FOUND, matches, List.of());
            LOG.warn("Target '{}' not found under {} (pattern {})", descriptor.name(), root, describe(descriptor));
        } else if (matches.size() == 1) {
            result = new ResolvedTarget(
                    descriptor, root, ResolutionStatus.FOUND, matches, resolveSubfolders(descriptor, matches.get(0)));
            LOG.info("Target '{}' found: {}", descriptor.name(), matches.get(0));
        } else {
            result = new ResolvedTarget(descriptor, root, ResolutionStatus.AMBIGUOUS, matches, List.of());
            LOG.warn(
                    "Target '{}' is ambiguous under {}: {} candidates {}",
                    descriptor.name(),
                    root,
                    matches.size(),
                    matches);
        }
        return result;
    }

    /**
     * Binds an ambiguous target to one chosen candidate and resolves its subfolders.
     *
     * @throws IllegalArgumentException if the candidate is not one of the target's matches
     */
    public ResolvedTarget choose(ResolvedTarget target, Path candidate) {
        if (!target.matches().contains(candidate)) {
            throw new IllegalArgumentException(
                    "'" + candidate + "' is not a candidate of target '" + target.name() + "'");
        }
        return target.choose(candidate, resolveSubfolders(target.descriptor(), candidate));
    }

    /** The folder subfolders and copies are anchored at: the match itself, or a file's parent. */
    public static Path anchorOf(Path match) {
        return Files.isDirectory(match) ? match : match.getParent();
    }

    private List<ResolvedTarget> resolveSubfolders(TargetDescriptor descriptor, Path match) {
        if (descriptor.subfolders().isEmpty()) {
            return List.of();
        }
        Path anchor = anchorOf(match);
        List<ResolvedTarget> resolved = new ArrayList<>();
        for (TargetDescriptor subfolder : descriptor.subfolders()) {
            resolved.add(resolve(anchor, subfolder));
        }
        return resolved;
    }

    private List<Path> findCandidates(Path root, TargetDescriptor descriptor) {
        if (!Files.isDirectory(root)) {
            LOG.debug("Search root {} is not a directory", root);
            return List.of();
        }
        if (descriptor.expectedPath() == null) {
            Path folder = root.resolve(descriptor.name());
            return Files.isDirectory(folder) ? List.of(folder) : List.of();
        }

        GlobPattern glob = GlobPattern.compile(descriptor.expectedPath().pattern());
        PathType type = descriptor.expectedPath().type();
        List<Path> candidates = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (type == PathType.FOLDER && !dir.equals(root) && glob.matches(root.relativize(dir))) {
                        candidates.add(dir);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (type == PathType.FILE && attrs.isRegularFile() && glob.matches(root.relativize(file))) {
                        candidates.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    LOG.warn(
                            "Skipping unreadable path {} while resolving '{}': {}",
                            file,
                            descriptor.name(),
                            e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            LOG.warn("Failed to search {} for target '{}': {}", root, descriptor.name(), e.getMessage());
        }
        candidates.sort(null);
        return candidates;
    }

    private static String describe(TargetDescriptor descriptor) {
        ExpectedPath expected = descriptor.expectedPath();
        return expected != null
                ? expected.type().name().toLowerCase(Locale.ROOT) + " " + expected.pattern()
                : "folder " + descriptor.name();
    }
}
