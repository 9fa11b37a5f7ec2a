package io.seqwarehouse.core.tabular;

import io.seqwarehouse.core.error.SourceUnreadableException;
import io.seqwarehouse.core.model.RawRow;
import io.seqwarehouse.core.model.SummaryCollection;
import io.seqwarehouse.core.target.GlobPattern;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gathers per-experiment sequencing summaries (bamstats, bedcov, QC tables) from a sequencing
 * folder tree into one table. Each row is stamped with the experiment ID found in its file's
 * path, under {@value #EXPERIMENT_ID_COLUMN}.
 *
 * <p>
 * Files are processed in path order. A file that cannot be read, carries no experiment ID, or
 * repeats an experiment ID already collected is dropped with a warning; the rest are kept.
 */
public final class SequenceSummaryCollector {

    private static final Logger LOG = LoggerFactory.getLogger(SequenceSummaryCollector.class);

    public static final String EXPERIMENT_ID_COLUMN = "expt_id";

    private final LoaderRegistry loaders;
    private final ExperimentIds experimentIds;

    public SequenceSummaryCollector() {
        this(LoaderRegistry.withDefaults(), new ExperimentIds());
    }

    public SequenceSummaryCollector(LoaderRegistry loaders, ExperimentIds experimentIds) {
        this.loaders = Objects.requireNonNull(loaders, "loaders must not be null");
        this.experimentIds = Objects.requireNonNull(experimentIds, "experimentIds must not be null");
    }

    /**
     * Collects every file below {@code root} whose relative path matches {@code glob}.
     *
     * @throws UncheckedIOException if the root cannot be walked
     */
    public SummaryCollection collect(Path root, String glob) {
        GlobPattern pattern = GlobPattern.compile(glob);
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(file -> pattern.matches(root.relativize(file)))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to search " + root + " for " + glob, e);
        }
        LOG.info("Found {} summary files matching {} under {}", files.size(), glob, root);
        return collect(files);
    }

    /** Collects the given files in the given order. */
    public SummaryCollection collect(List<Path> files) {
        List<RawRow> rows = new ArrayList<>();
        List<Path> used = new ArrayList<>();
        List<SourceUnreadableException> dropped = new ArrayList<>();
        Map<String, Path> seen = new HashMap<>();

        for (Path file : files) {
            try {
                String experimentId = experimentIds.require(file);
                Path previous = seen.get(experimentId);
                if (previous != null) {
                    throw new SourceUnreadableException(
                            "Duplicate experiment ID " + experimentId + " (already collected from " + previous + ")",
                            file.toString());
                }
                List<RawRow> fileRows;
                try (Stream<RawRow> loaded = loaders.load(file)) {
                    fileRows = loaded.map(row -> row.with(EXPERIMENT_ID_COLUMN, experimentId))
                            .collect(Collectors.toList());
                }
                seen.put(experimentId, file);
                used.add(file);
                rows.addAll(fileRows);
                LOG.debug("Collected {} rows for {} from {}", fileRows.size(), experimentId, file);
            } catch (SourceUnreadableException e) {
                LOG.warn("Dropping {}: {}", file, e.getMessage());
                dropped.add(e);
            }
        }
        return new SummaryCollection(rows, used, dropped);
    }
}
