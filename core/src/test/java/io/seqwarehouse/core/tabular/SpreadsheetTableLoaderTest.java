package io.seqwarehouse.core.tabular;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.seqwarehouse.core.error.SourceUnreadableException;
import io.seqwarehouse.core.model.RawRow;
import io.seqwarehouse.core.testkit.Workbooks;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SpreadsheetTableLoaderTest {

    private final SpreadsheetTableLoader loader = new SpreadsheetTableLoader();

    @TempDir
    Path tempDir;

    private Path workbook;

    @BeforeEach
    void setUp() throws IOException {
        workbook = Workbooks.create()
                .sheet("samples", List.of(
                        List.of("sample_id", "date", "parasitaemia_p/ul", "positive"),
                        List.of("SMP001", LocalDate.of(2024, 3, 1), 1200, true),
                        Arrays.asList("SMP002", null, 35.5, false),
                        Arrays.asList(null, null, null, null),
                        List.of("SMP003", "2024/03/05", 80, true, "stray")))
                .sheet("notes", List.of(List.of("note"), List.of("second tab")))
                .writeTo(tempDir.resolve("samples.xlsx"));
    }

    @Test
    void firstSheetIsReadByDefault() {
        List<RawRow> rows = load(loader.load(workbook));

        assertThat(rows).hasSize(3);
        assertThat(rows.get(0).values().keySet())
                .containsExactly("sample_id", "date", "parasitaemia_p/ul", "positive");
    }

    @Test
    void cellsKeepTheirSpreadsheetTypes() {
        RawRow first = load(loader.load(workbook)).get(0);

        assertThat(first.get("sample_id")).isEqualTo("SMP001");
        assertThat(first.get("date")).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(first.get("parasitaemia_p/ul")).isEqualTo(1200.0);
        assertThat(first.get("positive")).isEqualTo(true);
    }

    @Test
    void missingCellsAreNullAndBlankRowsSkipped() {
        List<RawRow> rows = load(loader.load(workbook));

        assertThat(rows.get(1).get("date")).isNull();
        assertThat(rows.get(2).get("sample_id")).isEqualTo("SMP003");
    }

    @Test
    void locationNamesSheetAndDataRow() {
        List<RawRow> rows = load(loader.load(workbook));

        assertThat(rows.get(0).location().sheet()).isEqualTo("samples");
        assertThat(rows.get(0).location().row()).isEqualTo(1);
        assertThat(rows.get(2).location().row()).isEqualTo(4);
    }

    @Test
    void valueBeyondHeaderIsParseIssue() {
        RawRow third = load(loader.load(workbook)).get(2);

        assertThat(third.parseIssue()).contains("beyond the last header column");
    }

    @Test
    void namedSheetIsRead() {
        List<RawRow> rows = load(loader.load(workbook, "notes"));

        assertThat(rows).singleElement().satisfies(row -> assertThat(row.get("note")).isEqualTo("second tab"));
    }

    @Test
    void defaultSheetCanBeConfigured() {
        List<RawRow> rows = load(new SpreadsheetTableLoader("notes").load(workbook));

        assertThat(rows).hasSize(1);
    }

    @Test
    void missingSheetIsUnreadable() {
        assertThatThrownBy(() -> loader.load(workbook, "rxn_metadata"))
                .isInstanceOf(SourceUnreadableException.class)
                .hasMessageContaining("Workbook has no sheet 'rxn_metadata'");
    }

    @Test
    void sheetNamesAreListedInTabOrder() {
        assertThat(loader.sheetNames(workbook)).containsExactly("samples", "notes");
    }

    @Test
    void nonWorkbookContentIsUnreadable() throws IOException {
        Path fake = Files.writeString(tempDir.resolve("fake.xlsx"), "sample_id,study_id\n");

        assertThatThrownBy(() -> loader.load(fake)).isInstanceOf(SourceUnreadableException.class);
    }

    private static List<RawRow> load(Stream<RawRow> rows) {
        try (rows) {
            return rows.collect(Collectors.toList());
        }
    }
}
