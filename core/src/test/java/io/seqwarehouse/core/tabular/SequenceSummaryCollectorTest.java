package io.seqwarehouse.core.tabular;

import static org.assertj.core.api.Assertions.assertThat;

import io.seqwarehouse.core.error.SourceUnreadableException;
import io.seqwarehouse.core.model.RawRow;
import io.seqwarehouse.core.model.SummaryCollection;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SequenceSummaryCollectorTest {

    private final SequenceSummaryCollector collector = new SequenceSummaryCollector();

    @TempDir
    Path root;

    @BeforeEach
    void setUp() throws IOException {
        write("SLJS034/nomadic/summary.bam_flagstats.csv", "barcode,n_mapped\nbarcode01,1500\nbarcode02,900\n");
        write("SLJS035/nomadic/summary.bam_flagstats.csv", "barcode,n_mapped\nbarcode01,42\n");
        write("scratch/nomadic/summary.bam_flagstats.csv", "barcode,n_mapped\nbarcode09,1\n");
        write("SLJS034/nomadic/other.csv", "ignored\n1\n");
    }

    @Test
    void collectsMatchingFilesStampedWithExperimentId() {
        SummaryCollection collection = collector.collect(root, "**/summary.bam_flagstats.csv");

        assertThat(collection.files()).hasSize(2);
        assertThat(collection.rows())
                .extracting(row -> row.get(SequenceSummaryCollector.EXPERIMENT_ID_COLUMN))
                .containsExactly("SLJS034", "SLJS034", "SLJS035");
        assertThat(collection.rows().get(0).values().keySet())
                .containsExactly("barcode", "n_mapped", "expt_id");
    }

    @Test
    void fileWithoutExperimentIdIsDropped() {
        SummaryCollection collection = collector.collect(root, "**/summary.bam_flagstats.csv");

        assertThat(collection.dropped()).singleElement().satisfies(e -> {
            assertThat(e.source()).contains("scratch");
            assertThat(e.getMessage()).contains("experiment ID");
        });
    }

    @Test
    void duplicateExperimentIdKeepsTheFirstFile() throws IOException {
        write("archive/SLJS034_rerun/summary.bam_flagstats.csv", "barcode,n_mapped\nbarcode01,7\n");

        SummaryCollection collection = collector.collect(root, "**/summary.bam_flagstats.csv");

        assertThat(collection.rows()).extracting(RawRow::values)
                .noneMatch(values -> "7".equals(values.get("n_mapped")));
        assertThat(collection.dropped())
                .extracting(SourceUnreadableException::getMessage)
                .anyMatch(message -> message.startsWith("Duplicate experiment ID SLJS034"));
    }

    @Test
    void unreadableFileIsDroppedAndTheRestKept() throws IOException {
        write("SLJS036/nomadic/summary.bam_flagstats.json", "{ broken");

        SummaryCollection collection = collector.collect(root, "**/summary.bam_flagstats.{csv,json}");

        assertThat(collection.files()).hasSize(2);
        assertThat(collection.dropped()).extracting(SourceUnreadableException::source)
                .anyMatch(source -> source.contains("SLJS036"));
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
