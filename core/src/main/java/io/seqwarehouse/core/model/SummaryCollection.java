package io.seqwarehouse.core.model;

import io.seqwarehouse.core.error.SourceUnreadableException;
import java.nio.file.Path;
import java.util.List;

/**
 * Rows gathered from per-experiment sequence summary files, each stamped with its experiment ID.
 *
 * @param rows    concatenated rows in file order
 * @param files   files that contributed rows
 * @param dropped files left out, with the reason
 */
public record SummaryCollection(List<RawRow> rows, List<Path> files, List<SourceUnreadableException> dropped) {

    public SummaryCollection {
        rows = List.copyOf(rows);
        files = List.copyOf(files);
        dropped = List.copyOf(dropped);
    }
}
