package io.seqwarehouse.core.target;

import com.fasterxml.jackson.databind.JsonNode;
import io.seqwarehouse.core.error.TargetException;
import io.seqwarehouse.core.model.ExpectedPath;
import io.seqwarehouse.core.model.PathType;
import io.seqwarehouse.core.model.TargetDescriptor;
import io.seqwarehouse.core.schema.DescriptorReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Parses the YAML target descriptor tree:
 *
 * <pre>
 * nomadic:
 *   name: nomadic
 *   expected_path:
 *     type: file
 *     pattern: "**&#47;summary.bam_flagstats.csv"
 *   recursive: false
 *   exclusions: [summary.fastq.csv, barcodes/]
 *   subfolders:
 *     metadata:
 *       name: metadata
 * </pre>
 *
 * A missing {@code name} defaults to the mapping key. Top-level targets must declare an
 * {@code expected_path}; subfolders may omit it.
 *
 * <p>
 * Thread-safe.
 */
public final class TargetParser {

    private final DescriptorReader reader;

    public TargetParser() {
        this.reader = new DescriptorReader(DescriptorReader.TARGET_DESCRIPTOR_SCHEMA);
    }

    /**
     * Parses a target descriptor file.
     *
     * @return top-level descriptors in declaration order
     * @throws TargetException if the file is unreadable or malformed
     */
    public List<TargetDescriptor> parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = reader.read(path);
        } catch (IOException e) {
            throw new TargetException("Failed to read or parse YAML: " + e.getMessage(), e, source);
        }
        if (!root.isObject()) {
            throw new TargetException("Target descriptor must be a mapping of target names", source);
        }
        List<String> violations = reader.violations(root);
        if (!violations.isEmpty()) {
            throw new TargetException("Invalid target descriptor: " + violations, source);
        }
        return parseTargets(root, true, source);
    }

    private List<TargetDescriptor> parseTargets(JsonNode node, boolean topLevel, String source) {
        List<TargetDescriptor> targets = new ArrayList<>();
        for (Map.Entry<String, JsonNode> entry : node.properties()) {
            targets.add(parseTarget(entry.getKey(), entry.getValue(), topLevel, source));
        }
        return targets;
    }

    private TargetDescriptor parseTarget(String key, JsonNode node, boolean topLevel, String source) {
        String name = node.path("name").asText(key);
        ExpectedPath expectedPath = null;
        JsonNode expected = node.get("expected_path");
        if (expected != null && !expected.isNull()) {
            PathType type = PathType.valueOf(expected.get("type").asText().toUpperCase(Locale.ROOT));
            String pattern = expected.get("pattern").asText();
            try {
                GlobPattern.compile(pattern);
            } catch (IllegalArgumentException e) {
                throw new TargetException("Target '" + name + "': " + e.getMessage(), e, source);
            }
            expectedPath = new ExpectedPath(type, pattern);
        } else if (topLevel) {
            throw new TargetException("Target '" + name + "' requires 'expected_path'", source);
        }

        List<String> exclusions = new ArrayList<>();
        JsonNode exclusionsNode = node.get("exclusions");
        if (exclusionsNode != null && exclusionsNode.isArray()) {
            exclusionsNode.forEach(item -> exclusions.add(item.asText()));
        }

        List<TargetDescriptor> subfolders = List.of();
        JsonNode subfoldersNode = node.get("subfolders");
        if (subfoldersNode != null && subfoldersNode.isObject()) {
            subfolders = parseTargets(subfoldersNode, false, source);
        }
        return new TargetDescriptor(
                name, expectedPath, node.path("recursive").asBoolean(false), exclusions, subfolders);
    }
}
