package io.seqwarehouse.core.aggregate;

import static io.seqwarehouse.core.testkit.Fixtures.fixture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.seqwarehouse.core.error.AggregationException;
import io.seqwarehouse.core.model.AggregationReport;
import io.seqwarehouse.core.model.CopyStatus;
import io.seqwarehouse.core.model.FileCopy;
import io.seqwarehouse.core.model.PathType;
import io.seqwarehouse.core.model.TargetDescriptor;
import io.seqwarehouse.core.model.TargetOutcome;
import io.seqwarehouse.core.model.TargetState;
import io.seqwarehouse.core.target.TargetParser;
import io.seqwarehouse.core.target.TargetResolver;
import io.seqwarehouse.core.testkit.RunTrees;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link Aggregator}: copying resolved targets into the canonical tree. */
class AggregatorTest {

    private final TargetResolver resolver = new TargetResolver();
    private List<TargetDescriptor> descriptors;

    @TempDir
    Path tempDir;

    private Path runRoot;
    private Path destination;

    @BeforeEach
    void setUp() throws IOException {
        runRoot = RunTrees.create(tempDir.resolve("run"));
        destination = tempDir.resolve("warehouse");
        descriptors = new TargetParser().parse(fixture("targets.yml"));
    }

    @Nested
    @DisplayName("Fail on ambiguity")
    class FailPolicy {

        private final Aggregator aggregator = new Aggregator();

        @Test
        void reportsOneOutcomePerTargetAndSubfolder() {
            AggregationReport report = aggregate(aggregator);

            assertThat(report.outcomes())
                    .extracting(TargetOutcome::name, TargetOutcome::state)
                    .containsExactly(
                            tuple("nomadic", TargetState.COPIED),
                            tuple("nomadic/metadata", TargetState.COPIED),
                            tuple("nomadic/barcodes", TargetState.COPIED),
                            tuple("minknow", TargetState.FAILED));
            assertThat(report.hasFailures()).isTrue();
        }

        @Test
        void nonRecursiveTargetCopiesOnlyTopLevelFilesMinusExclusions() {
            TargetOutcome nomadic = aggregate(aggregator).outcome("nomadic");

            assertThat(nomadic.copyRoot()).isEqualTo(runRoot.resolve("nomadic"));
            assertThat(nomadic.files())
                    .extracting(f -> f.source().getFileName().toString())
                    .containsExactlyInAnyOrder("summary.bam_flagstats.csv", "notes.txt");
            assertThat(destination.resolve("nomadic/summary.bam_flagstats.csv")).exists();
            assertThat(destination.resolve("nomadic/summary.fastq.csv")).doesNotExist();
        }

        @Test
        void subfoldersLandBelowTheirParent() {
            aggregate(aggregator);

            assertThat(destination.resolve("nomadic/metadata/samples.csv")).exists();
            assertThat(destination.resolve("nomadic/barcodes/barcode01/reads.bam")).exists();
            assertThat(destination.resolve("nomadic/barcodes/barcode01/reads.bam.bai")).doesNotExist();
        }

        @Test
        void subfolderRulesOverrideRecursiveParent() throws IOException {
            RunTrees.write(runRoot, "nomadic/metadata/keep.csv", "keep");
            RunTrees.write(runRoot, "nomadic/metadata/skip.tmp", "scratch");
            RunTrees.write(runRoot, "nomadic/metadata/deep/nested.csv", "nested");
            TargetDescriptor metadata = new TargetDescriptor("metadata", null, false, List.of("*.tmp"), List.of());
            List<TargetDescriptor> run = List.of(TargetDescriptor.of("run", PathType.FOLDER, "nomadic")
                    .withRecursive(true)
                    .withSubfolders(List.of(metadata)));

            AggregationReport report = aggregator.aggregate(resolver.resolveAll(runRoot, run), destination);

            assertThat(destination.resolve("run/metadata/keep.csv")).exists();
            assertThat(destination.resolve("run/metadata/skip.tmp")).doesNotExist();
            assertThat(destination.resolve("run/metadata/deep/nested.csv")).doesNotExist();
            assertThat(destination.resolve("run/barcodes/barcode01/reads.bam")).exists();
            assertThat(report.outcome("run").files())
                    .extracting(f -> runRoot.resolve("nomadic").relativize(f.source()).toString())
                    .noneMatch(source -> source.startsWith("metadata"));
            assertThat(report.outcome("run/metadata").files())
                    .extracting(f -> f.source().getFileName().toString())
                    .containsExactlyInAnyOrder("samples.csv", "keep.csv");
        }

        @Test
        void ambiguousTargetCopiesNothing() {
            TargetOutcome minknow = aggregate(aggregator).outcome("minknow");

            assertThat(minknow.files()).isEmpty();
            assertThat(minknow.detail()).startsWith("Ambiguous: 2 candidates");
            assertThat(destination.resolve("minknow")).doesNotExist();
        }

        @Test
        void secondRunFindsEverythingAlreadyPresent() {
            aggregate(aggregator);

            AggregationReport second = aggregate(aggregator);

            assertThat(second.files()).isNotEmpty();
            assertThat(second.files()).extracting(FileCopy::status).containsOnly(CopyStatus.ALREADY_PRESENT);
            assertThat(second.outcome("nomadic").state()).isEqualTo(TargetState.SKIPPED);
            assertThat(second.outcome("nomadic").detail()).isEqualTo("All files already present");
        }

        @Test
        void sourcesAreLeftUntouched() throws IOException {
            aggregate(aggregator);

            assertThat(runRoot.resolve("nomadic/summary.fastq.csv")).exists();
            assertThat(Files.readString(runRoot.resolve("nomadic/notes.txt"))).isEqualTo("run notes");
        }

        @Test
        void noPartialFilesRemain() throws IOException {
            aggregate(aggregator);

            try (Stream<Path> files = Files.walk(destination)) {
                assertThat(files).noneMatch(p -> p.getFileName().toString().endsWith(".part"));
            }
        }

        @Test
        void notFoundTargetIsReported() {
            List<TargetDescriptor> missing = List.of(TargetDescriptor.of("plots", PathType.FOLDER, "**/plots"));

            AggregationReport report = aggregator.aggregate(resolver.resolveAll(runRoot, missing), destination);

            assertThat(report.outcome("plots").state()).isEqualTo(TargetState.NOT_FOUND);
            assertThat(report.hasFailures()).isFalse();
        }

        @Test
        void emptyMatchedFolderIsSkipped() throws IOException {
            Files.createDirectories(runRoot.resolve("empty_plots"));
            List<TargetDescriptor> plots = List.of(TargetDescriptor.of("plots", PathType.FOLDER, "empty_plots"));

            TargetOutcome outcome = aggregator.aggregate(resolver.resolveAll(runRoot, plots), destination)
                    .outcome("plots");

            assertThat(outcome.state()).isEqualTo(TargetState.SKIPPED);
            assertThat(outcome.detail()).isEqualTo("Nothing to copy");
        }

        @Test
        void unwritableDestinationRootAborts() throws IOException {
            Path blocked = Files.writeString(tempDir.resolve("blocked"), "not a directory");

            assertThatThrownBy(() -> aggregator.aggregate(resolver.resolveAll(runRoot, descriptors), blocked))
                    .isInstanceOfSatisfying(AggregationException.class, e -> assertThat(e.source())
                            .isEqualTo(blocked.toString()));
        }
    }

    @Nested
    @DisplayName("Newest candidate wins")
    class NewestWinsPolicy {

        private final Aggregator aggregator = new Aggregator(AmbiguityPolicy.NEWEST_WINS, resolver);

        @Test
        void newestCandidateIsCopied() throws IOException {
            Files.setLastModifiedTime(
                    runRoot.resolve("20240501_run1/fastq_pass"), FileTime.from(Instant.parse("2024-05-01T00:00:00Z")));
            Files.setLastModifiedTime(
                    runRoot.resolve("20240502_run2/fastq_pass"), FileTime.from(Instant.parse("2024-05-02T00:00:00Z")));

            TargetOutcome minknow = aggregate(aggregator).outcome("minknow");

            assertThat(minknow.state()).isEqualTo(TargetState.COPIED);
            assertThat(minknow.copyRoot()).isEqualTo(runRoot.resolve("20240502_run2/fastq_pass"));
            assertThat(Files.readString(destination.resolve("minknow/barcode01.fastq.gz")))
                    .isEqualTo("run2 reads, longer");
        }
    }

    @Nested
    @DisplayName("Per-experiment aggregation")
    class Experiments {

        @Test
        void eachExperimentFolderGetsItsOwnDestination() throws IOException {
            Path sequenceRoot = tempDir.resolve("sequence");
            RunTrees.create(sequenceRoot.resolve("SLJS034_20240501"));
            RunTrees.write(sequenceRoot, "SLJS035/nomadic/summary.bam_flagstats.csv", "barcode\nbarcode02\n");
            RunTrees.write(sequenceRoot, "scratch/nomadic/summary.bam_flagstats.csv", "barcode\n");

            Map<String, AggregationReport> reports = new Aggregator().aggregateExperiments(
                    sequenceRoot, Pattern.compile("SL[A-Z]{2}[0-9]{3}"), descriptors, destination);

            assertThat(reports).containsOnlyKeys("SLJS034", "SLJS035");
            assertThat(reports.get("SLJS035").outcome("nomadic").state()).isEqualTo(TargetState.COPIED);
            assertThat(reports.get("SLJS035").outcome("minknow").state()).isEqualTo(TargetState.NOT_FOUND);
            assertThat(destination.resolve("SLJS034/nomadic/summary.bam_flagstats.csv")).exists();
            assertThat(destination.resolve("SLJS035/nomadic/summary.bam_flagstats.csv")).exists();
        }

        @Test
        void missingSequenceRootAborts() {
            assertThatThrownBy(() -> new Aggregator().aggregateExperiments(
                            tempDir.resolve("absent"), Pattern.compile("SL[A-Z]{2}[0-9]{3}"), descriptors, destination))
                    .isInstanceOf(AggregationException.class)
                    .hasMessageContaining("Cannot list sequence root");
        }
    }

    private AggregationReport aggregate(Aggregator aggregator) {
        return aggregator.aggregate(resolver.resolveAll(runRoot, descriptors), destination);
    }
}
