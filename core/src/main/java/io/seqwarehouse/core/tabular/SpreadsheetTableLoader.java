package io.seqwarehouse.core.tabular;

import io.seqwarehouse.core.error.SourceUnreadableException;
import io.seqwarehouse.core.model.RawRow;
import io.seqwarehouse.core.model.SourceLocation;
import io.seqwarehouse.core.spi.TabularLoader;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads one sheet of an Excel workbook ({@code .xlsx}, {@code .xlsm}, {@code .xls}). The first
 * row of the sheet is the header.
 *
 * <p>Cell values keep their spreadsheet type: text as {@link String}, numbers as {@link Double},
 * date-formatted cells as {@link java.time.LocalDate} (or {@link LocalDateTime} when a time of day
 * is present), booleans as {@link Boolean}. Formula cells contribute their cached result. Error
 * cells make the row malformed.
 */
public final class SpreadsheetTableLoader implements TabularLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SpreadsheetTableLoader.class);

    private final String defaultSheet;

    /** Creates a loader that reads the first sheet unless told otherwise. */
    public SpreadsheetTableLoader() {
        this(null);
    }

    /**
     * Creates a loader that reads the named sheet by default.
     *
     * @param defaultSheet sheet name, or {@code null} for the first sheet
     */
    public SpreadsheetTableLoader(String defaultSheet) {
        this.defaultSheet = defaultSheet;
    }

    @Override
    public Set<String> extensions() {
        return Set.of("xlsx", "xlsm", "xls");
    }

    @Override
    public Stream<RawRow> load(Path source) {
        return load(source, defaultSheet);
    }

    /**
     * Loads the named sheet.
     *
     * @param sheetName sheet to read, or {@code null} for the first sheet
     * @throws SourceUnreadableException if the workbook cannot be opened or lacks the sheet
     */
    public Stream<RawRow> load(Path source, String sheetName) {
        Workbook workbook = open(source);
        Sheet sheet = sheetName == null ? firstSheet(workbook) : workbook.getSheet(sheetName);
        if (sheet == null) {
            SourceUnreadableException missing = new SourceUnreadableException(
                    "Workbook has no sheet '" + (sheetName == null ? "<first>" : sheetName) + "'",
                    source.toString());
            closeAfterFailure(workbook, missing);
            throw missing;
        }
        LOG.debug("Reading sheet '{}' of {}", sheet.getSheetName(), source);
        return RowStreams.of(new SheetRows(source, sheet), workbook);
    }

    /**
     * Lists the workbook's sheet names in tab order.
     *
     * @throws SourceUnreadableException if the workbook cannot be opened
     */
    public List<String> sheetNames(Path source) {
        Workbook workbook = open(source);
        try (workbook) {
            List<String> names = new ArrayList<>();
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                names.add(workbook.getSheetName(i));
            }
            return names;
        } catch (IOException e) {
            throw new SourceUnreadableException("Failed to close workbook: " + e.getMessage(), e, source.toString());
        }
    }

    private static Workbook open(Path source) {
        try {
            return WorkbookFactory.create(source.toFile(), null, true);
        } catch (IOException | EncryptedDocumentException e) {
            throw new SourceUnreadableException("Cannot open workbook: " + e.getMessage(), e, source.toString());
        } catch (RuntimeException e) {
            // POI reports non-workbook content with assorted unchecked exceptions
            throw new SourceUnreadableException("Corrupt workbook: " + e.getMessage(), e, source.toString());
        }
    }

    private static Sheet firstSheet(Workbook workbook) {
        return workbook.getNumberOfSheets() == 0 ? null : workbook.getSheetAt(0);
    }

    private static void closeAfterFailure(Workbook workbook, RuntimeException failure) {
        try {
            workbook.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private static final class SheetRows extends RowStreams.LazyIterator {

        private final Path source;
        private final String sheetName;
        private final Iterator<Row> rows;
        private final int headerRowNum;
        private List<String> header;

        SheetRows(Path source, Sheet sheet) {
            this.source = source;
            this.sheetName = sheet.getSheetName();
            this.rows = sheet.rowIterator();
            this.headerRowNum = sheet.getFirstRowNum();
        }

        @Override
        protected RawRow computeNext() {
            while (rows.hasNext()) {
                Row row = rows.next();
                if (header == null) {
                    header = readHeader(row);
                    continue;
                }
                RawRow raw = toRow(row);
                if (raw.isBlank() && raw.parseIssue() == null) {
                    continue;
                }
                return raw;
            }
            return null;
        }

        private static List<String> readHeader(Row row) {
            List<String> names = new ArrayList<>();
            for (int i = 0; i < Math.max(row.getLastCellNum(), 0); i++) {
                Cell cell = row.getCell(i);
                Object value = cell == null ? null : cellValue(cell, cell.getCellType());
                names.add(value == null ? "" : value.toString().trim());
            }
            return names;
        }

        private RawRow toRow(Row row) {
            Map<String, Object> values = new LinkedHashMap<>();
            List<String> problems = new ArrayList<>();
            for (int i = 0; i < header.size(); i++) {
                Cell cell = row.getCell(i);
                Object value = null;
                if (cell != null) {
                    CellType type = cell.getCellType() == CellType.FORMULA
                            ? cell.getCachedFormulaResultType()
                            : cell.getCellType();
                    if (type == CellType.ERROR) {
                        problems.add("error value in column '" + header.get(i) + "'");
                    } else {
                        value = cellValue(cell, type);
                    }
                }
                values.putIfAbsent(header.get(i), value);
            }
            for (int i = header.size(); i < row.getLastCellNum(); i++) {
                Cell cell = row.getCell(i);
                if (cell != null && cellValue(cell, cell.getCellType()) != null) {
                    problems.add("value beyond the last header column");
                    break;
                }
            }
            int rowNumber = row.getRowNum() - headerRowNum;
            return new RawRow(
                    values,
                    new SourceLocation(source, sheetName, rowNumber),
                    problems.isEmpty() ? null : String.join("; ", problems));
        }

        private static Object cellValue(Cell cell, CellType type) {
            switch (type) {
                case STRING:
                    String text = cell.getStringCellValue();
                    return text == null || text.isEmpty() ? null : text;
                case NUMERIC:
                    if (DateUtil.isCellDateFormatted(cell)) {
                        LocalDateTime dateTime = cell.getLocalDateTimeCellValue();
                        return dateTime.toLocalTime().equals(LocalTime.MIDNIGHT) ? dateTime.toLocalDate() : dateTime;
                    }
                    return cell.getNumericCellValue();
                case BOOLEAN:
                    return cell.getBooleanCellValue();
                case FORMULA:
                    return cellValue(cell, cell.getCachedFormulaResultType());
                default:
                    return null;
            }
        }
    }
}
