package io.seqwarehouse.core.target;

import static io.seqwarehouse.core.testkit.Fixtures.fixture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.seqwarehouse.core.error.TargetException;
import io.seqwarehouse.core.model.PathType;
import io.seqwarehouse.core.model.TargetDescriptor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TargetParserTest {

    private final TargetParser parser = new TargetParser();

    @TempDir
    Path tempDir;

    @Test
    void parsesTargetTree() {
        List<TargetDescriptor> targets = parser.parse(fixture("targets.yml"));

        assertThat(targets).extracting(TargetDescriptor::name).containsExactly("nomadic", "minknow");
        TargetDescriptor nomadic = targets.get(0);
        assertThat(nomadic.expectedPath().type()).isEqualTo(PathType.FILE);
        assertThat(nomadic.expectedPath().pattern()).isEqualTo("**/summary.bam_flagstats.csv");
        assertThat(nomadic.recursive()).isFalse();
        assertThat(nomadic.exclusions()).containsExactly("summary.fastq.csv");
    }

    @Test
    void subfoldersMayOmitExpectedPath() {
        TargetDescriptor nomadic = parser.parse(fixture("targets.yml")).get(0);

        assertThat(nomadic.subfolders()).extracting(TargetDescriptor::name).containsExactly("metadata", "barcodes");
        assertThat(nomadic.subfolders().get(0).expectedPath()).isNull();
        TargetDescriptor barcodes = nomadic.subfolders().get(1);
        assertThat(barcodes.expectedPath().type()).isEqualTo(PathType.FOLDER);
        assertThat(barcodes.recursive()).isTrue();
        assertThat(barcodes.exclusions()).containsExactly("*.bam.bai");
    }

    @Test
    void nameDefaultsToKey() {
        TargetDescriptor minknow = parser.parse(fixture("targets.yml")).get(1);

        assertThat(minknow.name()).isEqualTo("minknow");
        assertThat(minknow.subfolders()).isEmpty();
        assertThat(minknow.exclusions()).isEmpty();
    }

    @Test
    void topLevelTargetRequiresExpectedPath() throws IOException {
        Path file = write("""
                metadata:
                  recursive: true
                """);

        assertThatThrownBy(() -> parser.parse(file))
                .isInstanceOf(TargetException.class)
                .hasMessageContaining("Target 'metadata' requires 'expected_path'");
    }

    @Test
    void unknownPathTypeIsRejected() throws IOException {
        Path file = write("""
                reads:
                  expected_path:
                    type: symlink
                    pattern: "**/reads"
                """);

        assertThatThrownBy(() -> parser.parse(file))
                .isInstanceOf(TargetException.class)
                .hasMessageContaining("Invalid target descriptor");
    }

    @Test
    void malformedGlobIsRejected() throws IOException {
        Path file = write("""
                reads:
                  expected_path:
                    type: folder
                    pattern: "**/run[12"
                """);

        assertThatThrownBy(() -> parser.parse(file))
                .isInstanceOf(TargetException.class)
                .hasMessageContaining("Target 'reads'")
                .hasMessageContaining("Unclosed '['");
    }

    @Test
    void invalidYamlIsRejectedWithSource() throws IOException {
        Path file = write("reads: [unclosed\n");

        assertThatThrownBy(() -> parser.parse(file))
                .isInstanceOfSatisfying(TargetException.class, e -> assertThat(e.source())
                        .isEqualTo(file.toString()));
    }

    private Path write(String yaml) throws IOException {
        return Files.writeString(tempDir.resolve("targets.yml"), yaml);
    }
}
