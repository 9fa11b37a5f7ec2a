package io.seqwarehouse.core.model;

import java.nio.file.Path;

/**
 * Where a row came from, for error attribution.
 *
 * @param file  source file
 * @param sheet spreadsheet tab name, or {@code null} for delimited and JSON sources
 * @param row   1-based data row number (header excluded)
 */
public record SourceLocation(Path file, String sheet, int row) {

    public static SourceLocation of(Path file, int row) {
        return new SourceLocation(file, null, row);
    }

    @Override
    public String toString() {
        String name = file != null ? file.getFileName().toString() : "<unknown>";
        return sheet != null ? name + "[" + sheet + "]:" + row : name + ":" + row;
    }
}
