package io.seqwarehouse.core.tabular;

import io.seqwarehouse.core.error.SourceUnreadableException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds experiment IDs such as {@code SLJS034} in file and folder names. The two-letter prefix
 * encodes the experiment type.
 */
public final class ExperimentIds {

    /** Default experiment ID shape: type prefix, two initials, three digits. */
    public static final String DEFAULT_PATTERN = "(SW|PC|SL)[a-zA-Z]{2}[0-9]{3}";

    private static final Map<String, String> TYPES = Map.of("PC", "PCR", "SL", "seqlib", "SW", "sWGA");

    private final Pattern pattern;

    public ExperimentIds() {
        this(Pattern.compile(DEFAULT_PATTERN));
    }

    public ExperimentIds(Pattern pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
    }

    public Pattern pattern() {
        return pattern;
    }

    /** Searches the file name first, then the whole path. */
    public Optional<String> find(Path path) {
        Optional<String> fromName = find(path.getFileName().toString());
        return fromName.isPresent() ? fromName : find(path.toString());
    }

    public Optional<String> find(String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    /**
     * Finds the experiment ID of a file that must carry one.
     *
     * @throws SourceUnreadableException if no ID is present
     */
    public String require(Path path) {
        return find(path)
                .orElseThrow(() -> new SourceUnreadableException(
                        "Unable to identify an experiment ID (" + pattern.pattern() + ")", path.toString()));
    }

    /**
     * Maps an experiment ID to its type: {@code PC} to PCR, {@code SL} to seqlib, {@code SW} to
     * sWGA.
     *
     * @return the type, or {@code null} for an unknown prefix
     */
    public static String experimentType(String experimentId) {
        if (experimentId == null || experimentId.length() < 2) {
            return null;
        }
        return TYPES.get(experimentId.substring(0, 2));
    }
}
