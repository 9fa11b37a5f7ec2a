package io.seqwarehouse.core.aggregate;

import io.seqwarehouse.core.target.GlobPattern;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Exclusion patterns evaluated relative to a copy root, following rsync conventions. A pattern
 * without {@code /} matches any file or directory with that name at any depth. A trailing
 * {@code /} restricts a pattern to directories. A pattern containing {@code /} elsewhere is
 * matched against the whole relative path. An excluded directory excludes its whole subtree.
 */
final class ExclusionFilter {

    private record Rule(GlobPattern glob, boolean directoryOnly, boolean byName) {}

    private final List<Rule> rules;

    private ExclusionFilter(List<Rule> rules) {
        this.rules = rules;
    }

    static ExclusionFilter of(List<String> patterns) {
        List<Rule> rules = new ArrayList<>();
        for (String raw : patterns) {
            String pattern = raw.trim();
            if (pattern.isEmpty()) {
                continue;
            }
            boolean directoryOnly = pattern.endsWith("/");
            if (directoryOnly) {
                pattern = pattern.substring(0, pattern.length() - 1);
            }
            boolean byName = pattern.indexOf('/') < 0;
            rules.add(new Rule(GlobPattern.compile(pattern), directoryOnly, byName));
        }
        return new ExclusionFilter(List.copyOf(rules));
    }

    boolean isEmpty() {
        return rules.isEmpty();
    }

    /** Whether a directory, given relative to the copy root, is excluded with its subtree. */
    boolean excludesDirectory(Path relative) {
        return matches(relative, true);
    }

    /** Whether a file, given relative to the copy root, is excluded. */
    boolean excludesFile(Path relative) {
        return matches(relative, false);
    }

    private boolean matches(Path relative, boolean directory) {
        for (Rule rule : rules) {
            if (rule.directoryOnly() && !directory) {
                continue;
            }
            boolean hit = rule.byName()
                    ? rule.glob().matches(relative.getFileName().toString())
                    : rule.glob().matches(relative);
            if (hit) {
                return true;
            }
        }
        return false;
    }
}
