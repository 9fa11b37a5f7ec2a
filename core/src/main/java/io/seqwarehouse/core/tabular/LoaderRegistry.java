package io.seqwarehouse.core.tabular;

import io.seqwarehouse.core.error.SourceUnreadableException;
import io.seqwarehouse.core.model.RawRow;
import io.seqwarehouse.core.spi.TabularLoader;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Registry of tabular loaders keyed by file extension. Thread-safe: registration and lookup can
 * happen concurrently.
 */
public final class LoaderRegistry {

    private final Map<String, TabularLoader> loaders = new ConcurrentHashMap<>();

    /** Creates a registry with the delimited, spreadsheet and JSON loaders registered. */
    public static LoaderRegistry withDefaults() {
        LoaderRegistry registry = new LoaderRegistry();
        registry.register(new DelimitedTableLoader());
        registry.register(new SpreadsheetTableLoader());
        registry.register(new JsonTableLoader());
        return registry;
    }

    /**
     * Registers a loader for each of its extensions. A loader already registered for an extension is
     * replaced (last-write-wins).
     *
     * @throws NullPointerException     if loader is null
     * @throws IllegalArgumentException if the loader declares no extensions
     */
    public void register(TabularLoader loader) {
        if (loader == null) {
            throw new NullPointerException("loader must not be null");
        }
        if (loader.extensions() == null || loader.extensions().isEmpty()) {
            throw new IllegalArgumentException("loader must declare at least one extension");
        }
        for (String extension : loader.extensions()) {
            loaders.put(extension.toLowerCase(Locale.ROOT), loader);
        }
    }

    /** Looks up the loader for a file by its extension. */
    public Optional<TabularLoader> loaderFor(Path file) {
        return Optional.ofNullable(loaders.get(extensionOf(file)));
    }

    /**
     * Looks up the loader for a file, throwing if none is registered.
     *
     * @throws SourceUnreadableException if no loader handles the file's extension
     */
    public TabularLoader requireLoader(Path file) {
        return loaderFor(file)
                .orElseThrow(() -> new SourceUnreadableException(
                        "No loader registered for extension '" + extensionOf(file) + "'", file.toString()));
    }

    /** Loads a file with the loader registered for its extension. */
    public Stream<RawRow> load(Path file) {
        return requireLoader(file).load(file);
    }

    public boolean handles(Path file) {
        return loaders.containsKey(extensionOf(file));
    }

    public int size() {
        return loaders.size();
    }

    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
