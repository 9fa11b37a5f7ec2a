package io.seqwarehouse.core.testkit;

import io.seqwarehouse.core.model.RawRow;
import io.seqwarehouse.core.model.SourceLocation;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/** Shared paths and row builders for tests. */
public final class Fixtures {

    private static final Path ROOT = Path.of("src/test/resources/fixtures");

    private Fixtures() {}

    public static Path fixture(String relative) {
        return ROOT.resolve(relative);
    }

    public static Path schema(String relative) {
        return ROOT.resolve("dataschemas").resolve(relative);
    }

    public static Path catalog() {
        return schema("datasources.yml");
    }

    public static Path invalid(String fileName) {
        return ROOT.resolve("invalid").resolve(fileName);
    }

    public static Path table(String fileName) {
        return ROOT.resolve("tables").resolve(fileName);
    }

    /** Builds a raw row from alternating column names and values. */
    public static RawRow row(int rowNumber, Object... columnsAndValues) {
        if (columnsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("columnsAndValues must alternate names and values");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            values.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return new RawRow(values, SourceLocation.of(Path.of("test.csv"), rowNumber));
    }
}
