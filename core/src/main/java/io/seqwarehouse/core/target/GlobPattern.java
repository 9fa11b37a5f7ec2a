package io.seqwarehouse.core.target;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A glob matched against {@code /}-separated relative paths.
 *
 * <p>
 * Supports {@code *} (any run of characters within one path component), {@code ?} (one character),
 * {@code [abc]} and {@code [!abc]} character classes, {@code {a,b}} alternatives, and {@code **}
 * which spans any number of directories, including none: {@code **}{@code /summary} matches both
 * {@code summary} and {@code run1/out/summary}.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    /**
     * Compiles a glob.
     *
     * @throws IllegalArgumentException if the glob is malformed, e.g. an unclosed {@code [} or
     *                                  {@code {}
     */
    public static GlobPattern compile(String glob) {
        Objects.requireNonNull(glob, "glob must not be null");
        String trimmed = glob.startsWith("/") ? glob.substring(1) : glob;
        try {
            return new GlobPattern(glob, Pattern.compile(toRegex(trimmed)));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Malformed glob '" + glob + "': " + e.getDescription(), e);
        }
    }

    public String glob() {
        return glob;
    }

    /** Matches a path relative to the search root. */
    public boolean matches(Path relative) {
        return matches(toUnixString(relative));
    }

    /** Matches a {@code /}-separated relative path. */
    public boolean matches(String relativePath) {
        return regex.matcher(relativePath).matches();
    }

    /** Joins the path's components with {@code /} regardless of platform. */
    static String toUnixString(Path relative) {
        StringBuilder out = new StringBuilder();
        for (Path part : relative) {
            if (out.length() > 0) {
                out.append('/');
            }
            out.append(part.toString());
        }
        return out.toString();
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int braceDepth = 0;
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*':
                    if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                        boolean atStart = i == 0 || glob.charAt(i - 1) == '/';
                        boolean slashAfter = i + 2 < glob.length() && glob.charAt(i + 2) == '/';
                        if (atStart && slashAfter) {
                            regex.append("(?:.*/)?");
                            i += 3;
                        } else if (atStart && i + 2 == glob.length() && i > 0) {
                            // trailing "/**": the directory itself or anything below it
                            regex.setLength(regex.length() - 1);
                            regex.append("(?:/.*)?");
                            i += 2;
                        } else {
                            regex.append(".*");
                            i += 2;
                        }
                        continue;
                    }
                    regex.append("[^/]*");
                    break;
                case '?':
                    regex.append("[^/]");
                    break;
                case '[':
                    int close = glob.indexOf(']', i + 2);
                    if (close < 0) {
                        throw new IllegalArgumentException("Unclosed '[' in glob '" + glob + "'");
                    }
                    String body = glob.substring(i + 1, close);
                    if (body.startsWith("!")) {
                        body = "^" + body.substring(1);
                    }
                    regex.append('[').append(body.replace("\\", "\\\\").replace("[", "\\[")).append(']');
                    i = close + 1;
                    continue;
                case '{':
                    braceDepth++;
                    regex.append("(?:");
                    break;
                case '}':
                    if (braceDepth == 0) {
                        regex.append("\\}");
                    } else {
                        braceDepth--;
                        regex.append(')');
                    }
                    break;
                case ',':
                    regex.append(braceDepth > 0 ? "|" : ",");
                    break;
                default:
                    if ("\\.^$+|()".indexOf(c) >= 0) {
                        regex.append('\\');
                    }
                    regex.append(c);
            }
            i++;
        }
        if (braceDepth != 0) {
            throw new IllegalArgumentException("Unclosed '{' in glob '" + glob + "'");
        }
        return regex.toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
