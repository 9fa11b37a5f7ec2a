package io.seqwarehouse.core.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One experiment workbook after validation: the single experiment-level row and its reaction
 * rows, plus workbook-level consistency issues.
 *
 * @param file           workbook path
 * @param experimentId   experiment ID taken from the file name
 * @param experimentType experiment type derived from the ID prefix, e.g. {@code seqlib}
 * @param experiment     validated {@code expt_metadata} tab
 * @param reactions      validated {@code rxn_metadata} tab
 * @param issues         identifier and row-count mismatches between file name and tabs
 */
public record ExperimentWorkbook(
        Path file,
        String experimentId,
        String experimentType,
        ValidationResult experiment,
        ValidationResult reactions,
        List<ValidationIssue> issues) {

    public ExperimentWorkbook {
        issues = List.copyOf(issues);
    }

    /** Workbook issues followed by every row-level issue of both tabs. */
    public List<ValidationIssue> allIssues() {
        List<ValidationIssue> all = new ArrayList<>(issues);
        all.addAll(experiment.issues());
        all.addAll(reactions.issues());
        return all;
    }
}
