package io.seqwarehouse.core.target;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.seqwarehouse.core.model.PathType;
import io.seqwarehouse.core.model.ResolutionStatus;
import io.seqwarehouse.core.model.ResolvedTarget;
import io.seqwarehouse.core.model.TargetDescriptor;
import io.seqwarehouse.core.testkit.RunTrees;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link TargetResolver} against a small run tree. */
class TargetResolverTest {

    private final TargetResolver resolver = new TargetResolver();

    @TempDir
    Path root;

    @BeforeEach
    void setUp() throws IOException {
        RunTrees.create(root);
    }

    @Test
    @DisplayName("Two matching folders in different runs → ambiguous, all candidates kept")
    void twoMatchingFoldersAreAmbiguous() {
        ResolvedTarget resolved =
                resolver.resolve(root, TargetDescriptor.of("minknow", PathType.FOLDER, "**/*fastq_pass"));

        assertThat(resolved.status()).isEqualTo(ResolutionStatus.AMBIGUOUS);
        assertThat(resolved.matches()).containsExactly(
                root.resolve("20240501_run1/fastq_pass"), root.resolve("20240502_run2/fastq_pass"));
        assertThat(resolved.match()).isNull();
        assertThat(resolved.subfolders()).isEmpty();
    }

    @Test
    void singleFileMatchIsFound() {
        ResolvedTarget resolved = resolver.resolve(
                root, TargetDescriptor.of("nomadic", PathType.FILE, "**/summary.bam_flagstats.csv"));

        assertThat(resolved.status()).isEqualTo(ResolutionStatus.FOUND);
        assertThat(resolved.match()).isEqualTo(root.resolve("nomadic/summary.bam_flagstats.csv"));
        assertThat(TargetResolver.anchorOf(resolved.match())).isEqualTo(root.resolve("nomadic"));
    }

    @Test
    void typeFiltersCandidates() {
        ResolvedTarget asFile = resolver.resolve(root, TargetDescriptor.of("reads", PathType.FILE, "**/fastq_pass"));

        assertThat(asFile.status()).isEqualTo(ResolutionStatus.NOT_FOUND);
        assertThat(asFile.matches()).isEmpty();
    }

    @Test
    void subfoldersResolveAgainstTheAnchor() {
        TargetDescriptor nomadic = TargetDescriptor.of("nomadic", PathType.FILE, "**/summary.bam_flagstats.csv")
                .withSubfolders(List.of(
                        new TargetDescriptor("metadata", null, false, List.of(), List.of()),
                        TargetDescriptor.of("barcodes", PathType.FOLDER, "barcodes"),
                        new TargetDescriptor("plots", null, false, List.of(), List.of())));

        ResolvedTarget resolved = resolver.resolve(root, nomadic);

        assertThat(resolved.subfolders())
                .extracting(ResolvedTarget::name, ResolvedTarget::status)
                .containsExactly(
                        tuple("metadata", ResolutionStatus.FOUND),
                        tuple("barcodes", ResolutionStatus.FOUND),
                        tuple("plots", ResolutionStatus.NOT_FOUND));
        assertThat(resolved.subfolders().get(0).match()).isEqualTo(root.resolve("nomadic/metadata"));
    }

    @Test
    void missingRootResolvesToNotFound() {
        ResolvedTarget resolved = resolver.resolve(
                root.resolve("absent"), TargetDescriptor.of("nomadic", PathType.FILE, "**/*.csv"));

        assertThat(resolved.status()).isEqualTo(ResolutionStatus.NOT_FOUND);
    }

    @Test
    void choosingBindsOneCandidate() {
        ResolvedTarget ambiguous = resolver.resolve(
                root, TargetDescriptor.of("minknow", PathType.FOLDER, "**/fastq_pass"));

        ResolvedTarget chosen = resolver.choose(ambiguous, ambiguous.matches().get(1));

        assertThat(chosen.status()).isEqualTo(ResolutionStatus.FOUND);
        assertThat(chosen.match()).isEqualTo(root.resolve("20240502_run2/fastq_pass"));
        assertThatThrownBy(() -> resolver.choose(ambiguous, root.resolve("nomadic")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolveAllKeepsDescriptorOrder() {
        List<ResolvedTarget> resolved = resolver.resolveAll(root, List.of(
                TargetDescriptor.of("b", PathType.FOLDER, "nomadic"),
                TargetDescriptor.of("a", PathType.FOLDER, "missing")));

        assertThat(resolved).extracting(ResolvedTarget::name).containsExactly("b", "a");
        assertThat(resolved).extracting(ResolvedTarget::status)
                .containsExactly(ResolutionStatus.FOUND, ResolutionStatus.NOT_FOUND);
    }
}
