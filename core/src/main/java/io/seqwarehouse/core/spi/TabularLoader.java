package io.seqwarehouse.core.spi;

import io.seqwarehouse.core.model.RawRow;
import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads one tabular source into raw rows. Implementations handle one family of file formats and
 * are registered with {@code LoaderRegistry} by extension.
 *
 * <p>Implementations MUST be stateless and thread-safe. Loading never coerces types; that is the
 * validator's job.
 */
public interface TabularLoader {

    /**
     * File extensions this loader handles, lower case without the leading dot, e.g. {@code "csv"}.
     *
     * @return a non-empty set of extensions
     */
    Set<String> extensions();

    /**
     * Opens the source and returns its rows lazily, in source order. Calling again restarts from the
     * first row. The caller must close the stream; closing it releases the underlying file.
     *
     * <p>A row the loader cannot fully parse is still returned, with {@link RawRow#parseIssue()}
     * set, and the stream continues.
     *
     * @param source file to read
     * @return a finite stream of rows
     * @throws io.seqwarehouse.core.error.SourceUnreadableException if the file cannot be opened or
     *     is corrupt
     */
    Stream<RawRow> load(Path source);
}
