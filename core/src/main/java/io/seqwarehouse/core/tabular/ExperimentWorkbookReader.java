package io.seqwarehouse.core.tabular;

import io.seqwarehouse.core.error.SourceUnreadableException;
import io.seqwarehouse.core.model.ExperimentWorkbook;
import io.seqwarehouse.core.model.IssueKind;
import io.seqwarehouse.core.model.RawRow;
import io.seqwarehouse.core.model.Schema;
import io.seqwarehouse.core.model.SourceLocation;
import io.seqwarehouse.core.model.ValidationIssue;
import io.seqwarehouse.core.model.ValidationResult;
import io.seqwarehouse.core.validate.MetadataValidator;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads experiment workbooks: an {@code expt_metadata} tab holding one experiment-level row and an
 * {@code rxn_metadata} tab holding one row per reaction.
 *
 * <p>
 * Beyond row validation, the workbook is checked for internal consistency. The experiment ID in
 * the file name must equal the one entered on the experiment tab, and the declared reaction count
 * must equal the number of reaction rows. Mismatches are reported as issues; a missing tab or an
 * empty tab makes the whole workbook unreadable.
 */
public final class ExperimentWorkbookReader {

    private static final Logger LOG = LoggerFactory.getLogger(ExperimentWorkbookReader.class);

    public static final String EXPERIMENT_SHEET = "expt_metadata";
    public static final String REACTION_SHEET = "rxn_metadata";
    public static final String EXPERIMENT_ID_COLUMN = "expt_id";
    public static final String REACTION_COUNT_COLUMN = "expt_rxns";

    private final SpreadsheetTableLoader loader;
    private final MetadataValidator validator;
    private final ExperimentIds experimentIds;

    public ExperimentWorkbookReader() {
        this(new SpreadsheetTableLoader(), new MetadataValidator(), new ExperimentIds());
    }

    public ExperimentWorkbookReader(
            SpreadsheetTableLoader loader, MetadataValidator validator, ExperimentIds experimentIds) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.experimentIds = Objects.requireNonNull(experimentIds, "experimentIds must not be null");
    }

    /**
     * Reads and validates one workbook.
     *
     * @param workbook         path to the workbook; its file name must contain an experiment ID
     * @param experimentSchema schema of the experiment tab
     * @param reactionSchema   schema of the reaction tab
     * @throws SourceUnreadableException if the workbook cannot be opened, lacks a tab, has an
     *                                   empty tab, or its file name carries no experiment ID
     */
    public ExperimentWorkbook read(Path workbook, Schema experimentSchema, Schema reactionSchema) {
        String source = workbook.toString();
        String fileId = experimentIds.require(workbook);
        List<String> sheets = loader.sheetNames(workbook);
        if (!sheets.contains(EXPERIMENT_SHEET) || !sheets.contains(REACTION_SHEET)) {
            throw new SourceUnreadableException(
                    "Missing tabs: expected '" + EXPERIMENT_SHEET + "' and '" + REACTION_SHEET + "', found " + sheets,
                    source);
        }

        List<ValidationIssue> issues = new ArrayList<>();
        List<RawRow> experimentRows = readSheet(workbook, EXPERIMENT_SHEET);
        if (experimentRows.isEmpty()) {
            throw new SourceUnreadableException("No rows found on tab '" + EXPERIMENT_SHEET + "'", source);
        }
        RawRow experimentRow = experimentRows.get(0);
        if (experimentRows.size() > 1) {
            issues.add(new ValidationIssue(
                    IssueKind.ROW_COUNT_MISMATCH,
                    null,
                    experimentRows.size(),
                    "Expected 1 row on '" + EXPERIMENT_SHEET + "' but found " + experimentRows.size(),
                    new SourceLocation(workbook, EXPERIMENT_SHEET, 0)));
        }

        Object sheetId = experimentRow.get(EXPERIMENT_ID_COLUMN);
        if (sheetId == null || !fileId.equals(sheetId.toString().trim())) {
            issues.add(new ValidationIssue(
                    IssueKind.IDENTIFIER_MISMATCH,
                    null,
                    sheetId,
                    "File name experiment ID '" + fileId + "' does not match '" + EXPERIMENT_ID_COLUMN + "' value '"
                            + sheetId + "'",
                    experimentRow.location()));
        }

        List<RawRow> reactionRows = readSheet(workbook, REACTION_SHEET).stream()
                .map(row -> stampExperimentId(row, fileId))
                .collect(Collectors.toList());
        if (reactionRows.isEmpty()) {
            throw new SourceUnreadableException("No rows found on tab '" + REACTION_SHEET + "'", source);
        }
        checkReactionCount(experimentRow, reactionRows.size(), issues);

        ValidationResult experiment = validator.validate(experimentRows, experimentSchema);
        ValidationResult reactions = validator.validate(reactionRows, reactionSchema);
        LOG.info(
                "Read workbook {}: experiment {} ({}), {} reactions, {} workbook issues",
                workbook.getFileName(),
                fileId,
                ExperimentIds.experimentType(fileId),
                reactionRows.size(),
                issues.size());
        return new ExperimentWorkbook(
                workbook, fileId, ExperimentIds.experimentType(fileId), experiment, reactions, issues);
    }

    private List<RawRow> readSheet(Path workbook, String sheet) {
        try (Stream<RawRow> rows = loader.load(workbook, sheet)) {
            return rows.collect(Collectors.toList());
        }
    }

    private static RawRow stampExperimentId(RawRow row, String experimentId) {
        Object value = row.get(EXPERIMENT_ID_COLUMN);
        if (value == null || value.toString().isBlank()) {
            return row.with(EXPERIMENT_ID_COLUMN, experimentId);
        }
        return row;
    }

    private static void checkReactionCount(RawRow experimentRow, int found, List<ValidationIssue> issues) {
        Object declared = experimentRow.get(REACTION_COUNT_COLUMN);
        if (declared == null) {
            return;
        }
        Integer expected = parseCount(declared);
        if (expected == null || expected != found) {
            issues.add(new ValidationIssue(
                    IssueKind.ROW_COUNT_MISMATCH,
                    null,
                    declared,
                    "Declared " + declared + " reactions in '" + REACTION_COUNT_COLUMN + "' but found " + found
                            + " rows on '" + REACTION_SHEET + "'",
                    experimentRow.location()));
        }
    }

    private static Integer parseCount(Object declared) {
        if (declared instanceof Number number) {
            double value = number.doubleValue();
            return value == Math.rint(value) ? (int) value : null;
        }
        try {
            return Integer.parseInt(declared.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
