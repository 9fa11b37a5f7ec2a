package io.seqwarehouse.core.aggregate;

import io.seqwarehouse.core.error.AggregationException;
import io.seqwarehouse.core.model.AggregationReport;
import io.seqwarehouse.core.model.CopyStatus;
import io.seqwarehouse.core.model.FileCopy;
import io.seqwarehouse.core.model.ResolutionStatus;
import io.seqwarehouse.core.model.ResolvedTarget;
import io.seqwarehouse.core.model.TargetDescriptor;
import io.seqwarehouse.core.model.TargetOutcome;
import io.seqwarehouse.core.model.TargetState;
import io.seqwarehouse.core.target.TargetResolver;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies resolved targets into a canonical destination tree, {@code <destinationRoot>/<target>/}.
 * Sources are never moved or modified, so a run can be repeated; files already present with the
 * same size and modification time are reported and left alone.
 *
 * <p>
 * The copy root of a target is the matched folder, or the folder containing the matched file. A
 * non-recursive target copies only the files directly inside its copy root; subfolder descriptors
 * are copied separately into {@code <target>/<subfolder>/}. Exclusions are evaluated relative to
 * the copy root.
 *
 * <p>
 * Target outcomes are collected; only an unwritable destination root aborts the run.
 */
public final class Aggregator {

    private static final Logger LOG = LoggerFactory.getLogger(Aggregator.class);

    private final AmbiguityPolicy ambiguityPolicy;
    private final TargetResolver resolver;
    private final AtomicFileCopier copier = new AtomicFileCopier();

    public Aggregator() {
        this(AmbiguityPolicy.FAIL, new TargetResolver());
    }

    public Aggregator(AmbiguityPolicy ambiguityPolicy, TargetResolver resolver) {
        this.ambiguityPolicy = Objects.requireNonNull(ambiguityPolicy, "ambiguityPolicy must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    public AmbiguityPolicy ambiguityPolicy() {
        return ambiguityPolicy;
    }

    /**
     * Copies every found target, and its subfolders, below {@code destinationRoot}.
     *
     * @return one outcome per target and per subfolder, in input order
     * @throws AggregationException if the destination root cannot be created or written
     */
    public AggregationReport aggregate(List<ResolvedTarget> targets, Path destinationRoot) {
        Objects.requireNonNull(targets, "targets must not be null");
        ensureWritable(destinationRoot);

        List<TargetOutcome> outcomes = new ArrayList<>();
        for (ResolvedTarget target : targets) {
            aggregateTarget(target, target.name(), destinationRoot.resolve(target.name()), outcomes);
        }
        AggregationReport report = new AggregationReport(destinationRoot, outcomes);
        LOG.info(
                "Aggregation into {} finished: {} targets, {} files copied, {} already present, {} failed",
                destinationRoot,
                outcomes.size(),
                report.files().stream().filter(f -> f.status() == CopyStatus.COPIED).count(),
                report.files().stream().filter(f -> f.status() == CopyStatus.ALREADY_PRESENT).count(),
                outcomes.stream().filter(o -> o.state() == TargetState.FAILED).count());
        return report;
    }

    /**
     * Aggregates every experiment folder found directly under {@code sequenceRoot}. A folder takes
     * part when its name contains an experiment ID; its targets are resolved against it and copied
     * into {@code <destinationRoot>/<experimentId>/}.
     *
     * @return one report per experiment, ordered by experiment ID
     * @throws AggregationException if the sequence root cannot be listed or a destination is not
     *                              writable
     */
    public Map<String, AggregationReport> aggregateExperiments(
            Path sequenceRoot, Pattern experimentId, List<TargetDescriptor> descriptors, Path destinationRoot) {
        Map<String, Path> experiments = new TreeMap<>();
        try (DirectoryStream<Path> children = Files.newDirectoryStream(sequenceRoot, Files::isDirectory)) {
            for (Path child : children) {
                Matcher matcher = experimentId.matcher(child.getFileName().toString());
                if (!matcher.find()) {
                    LOG.debug("No experiment ID in {}, skipping", child);
                    continue;
                }
                Path previous = experiments.putIfAbsent(matcher.group(), child);
                if (previous != null) {
                    LOG.warn("Experiment {} found in {} and {}; using the first", matcher.group(), previous, child);
                }
            }
        } catch (IOException e) {
            throw new AggregationException(
                    "Cannot list sequence root: " + e.getMessage(), e, sequenceRoot.toString());
        }

        Map<String, AggregationReport> reports = new LinkedHashMap<>();
        for (Map.Entry<String, Path> experiment : experiments.entrySet()) {
            List<ResolvedTarget> resolved = resolver.resolveAll(experiment.getValue(), descriptors);
            reports.put(experiment.getKey(), aggregate(resolved, destinationRoot.resolve(experiment.getKey())));
        }
        if (reports.isEmpty()) {
            LOG.info("No experiments identified for aggregation under {}", sequenceRoot);
        }
        return reports;
    }

    private void aggregateTarget(ResolvedTarget target, String label, Path destination, List<TargetOutcome> outcomes) {
        if (target.status() == ResolutionStatus.NOT_FOUND) {
            outcomes.add(new TargetOutcome(
                    label,
                    TargetState.NOT_FOUND,
                    null,
                    destination,
                    List.of(),
                    "No match under " + target.searchRoot()));
            return;
        }
        ResolvedTarget bound = target;
        if (target.status() == ResolutionStatus.AMBIGUOUS) {
            Optional<Path> chosen = ambiguityPolicy == AmbiguityPolicy.NEWEST_WINS
                    ? newest(target.matches())
                    : Optional.empty();
            if (chosen.isEmpty()) {
                outcomes.add(new TargetOutcome(
                        label,
                        TargetState.FAILED,
                        null,
                        destination,
                        List.of(),
                        "Ambiguous: " + target.matches().size() + " candidates " + target.matches()));
                LOG.warn("Target '{}' not copied: {} candidates", label, target.matches().size());
                return;
            }
            LOG.info("Target '{}' ambiguous; newest candidate {} wins", label, chosen.get());
            bound = resolver.choose(target, chosen.get());
        }

        Path copyRoot = TargetResolver.anchorOf(bound.match());
        Set<Path> delegated = new HashSet<>();
        for (ResolvedTarget subfolder : bound.subfolders()) {
            subfolder.matches().forEach(match -> delegated.add(
                    TargetResolver.anchorOf(match).toAbsolutePath().normalize()));
        }
        outcomes.add(copyTarget(label, bound.descriptor(), copyRoot, delegated, destination));
        for (ResolvedTarget subfolder : bound.subfolders()) {
            aggregateTarget(subfolder, label + "/" + subfolder.name(), destination.resolve(subfolder.name()), outcomes);
        }
    }

    /** Copies {@code copyRoot} into {@code destination}; {@code delegated} folders are left to subfolder targets. */
    private TargetOutcome copyTarget(
            String label, TargetDescriptor descriptor, Path copyRoot, Set<Path> delegated, Path destination) {
        ExclusionFilter exclusions = ExclusionFilter.of(descriptor.exclusions());
        List<FileCopy> files = new ArrayList<>();
        try {
            Files.createDirectories(destination);
            Files.walkFileTree(copyRoot, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(copyRoot)) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (!descriptor.recursive()
                            || delegated.contains(dir.toAbsolutePath().normalize())
                            || exclusions.excludesDirectory(copyRoot.relativize(dir))) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    Path relative = copyRoot.relativize(file);
                    if (attrs.isRegularFile() && !exclusions.excludesFile(relative)) {
                        files.add(copier.copy(file, destination.resolve(relative.toString())));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    files.add(FileCopy.failed(file, null, e.getClass().getSimpleName() + ": " + e.getMessage()));
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            LOG.warn("Target '{}' failed: {}", label, e.getMessage());
            return new TargetOutcome(label, TargetState.FAILED, copyRoot, destination, files, e.getMessage());
        }

        TargetState state;
        String detail = null;
        long failed = files.stream().filter(f -> f.status() == CopyStatus.FAILED).count();
        if (failed > 0) {
            state = TargetState.FAILED;
            detail = failed + " of " + files.size() + " files failed";
        } else if (files.stream().noneMatch(f -> f.status() == CopyStatus.COPIED)) {
            state = TargetState.SKIPPED;
            detail = files.isEmpty() ? "Nothing to copy" : "All files already present";
        } else {
            state = TargetState.COPIED;
        }
        LOG.info("Target '{}' {}: {} files from {}", label, state, files.size(), copyRoot);
        return new TargetOutcome(label, state, copyRoot, destination, files, detail);
    }

    private static Optional<Path> newest(List<Path> candidates) {
        Path best = null;
        FileTime bestTime = null;
        for (Path candidate : candidates) {
            try {
                FileTime time = Files.getLastModifiedTime(candidate);
                if (bestTime == null || time.compareTo(bestTime) > 0) {
                    best = candidate;
                    bestTime = time;
                }
            } catch (IOException e) {
                LOG.warn("Cannot read modification time of {}: {}", candidate, e.getMessage());
            }
        }
        return Optional.ofNullable(best);
    }

    private static void ensureWritable(Path destinationRoot) {
        Objects.requireNonNull(destinationRoot, "destinationRoot must not be null");
        try {
            Files.createDirectories(destinationRoot);
        } catch (IOException e) {
            throw new AggregationException(
                    "Cannot create destination root: " + e.getMessage(), e, destinationRoot.toString());
        }
        if (!Files.isWritable(destinationRoot)) {
            throw new AggregationException("Destination root is not writable", destinationRoot.toString());
        }
    }
}
