package io.seqwarehouse.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.seqwarehouse.core.aggregate.AmbiguityPolicy;
import io.seqwarehouse.core.error.ConfigLoadException;
import io.seqwarehouse.core.export.HeaderStyle;
import io.seqwarehouse.core.reconcile.TablePrecedence;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@link WarehouseConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * schemas:
 *   catalog: dataschemas/datasources.yml
 * targets:
 *   file: targets.yml
 * reconcile:
 *   precedence: [experimental, sample, sequence]
 * aggregate:
 *   ambiguity: newest-wins
 * experiment:
 *   id-pattern: "(SW|PC|SL)[a-zA-Z]{2}[0-9]{3}"
 * export:
 *   header-style: label
 *   delimiter: "\t"
 * </pre>
 *
 * <p>
 * Missing keys keep the defaults of {@link WarehouseConfig.Builder}. Relative paths are resolved
 * against the configuration file's directory.
 *
 * <p>
 * Every key can be overridden by an environment variable named {@code SEQWAREHOUSE_} followed by
 * the key in upper case with dots and dashes as underscores, e.g.
 * {@code SEQWAREHOUSE_AGGREGATE_AMBIGUITY}. Environment values win over YAML values. A variable
 * counts as set only when it is defined and non-blank after trimming, except that a single
 * character, a literal tab included, is taken as is for the export delimiter. The precedence list
 * is comma-separated.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_PREFIX = "SEQWAREHOUSE_";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from a YAML file, overlaying {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, not valid YAML, or holds an invalid value
     */
    public static WarehouseConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from a YAML file, overlaying variables from {@code envLookup}, which
     * returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing, not valid YAML, or holds an invalid value
     */
    public static WarehouseConfig load(Path configPath, Function<String, String> envLookup) {
        String source = configPath.toString();
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found", source);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + e.getMessage(), e, source);
        }
        if (root == null || root.isMissingNode()) {
            root = YAML_MAPPER.createObjectNode();
        }
        Path baseDir = configPath.toAbsolutePath().getParent();
        WarehouseConfig config = mapToConfig(root, baseDir, envLookup, source);
        LOG.info("Configuration loaded from {}: {}", configPath, config);
        return config;
    }

    /** Builds configuration from defaults and environment variables only. */
    public static WarehouseConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), Path.of("").toAbsolutePath(), envLookup, "<environment>");
    }

    private static WarehouseConfig mapToConfig(
            JsonNode root, Path baseDir, Function<String, String> envLookup, String source) {
        WarehouseConfig.Builder builder = WarehouseConfig.builder();

        String catalog = value(root, envLookup, "schemas", "catalog");
        if (catalog != null) builder.schemaCatalog(baseDir.resolve(catalog).normalize());
        String targets = value(root, envLookup, "targets", "file");
        if (targets != null) builder.targetsFile(baseDir.resolve(targets).normalize());

        List<String> precedence = precedence(root, envLookup);
        if (precedence != null) {
            try {
                builder.precedence(TablePrecedence.of(precedence).order());
            } catch (IllegalArgumentException e) {
                throw new ConfigLoadException("Invalid reconcile.precedence: " + e.getMessage(), e, source);
            }
        }

        String ambiguity = value(root, envLookup, "aggregate", "ambiguity");
        if (ambiguity != null) {
            builder.ambiguityPolicy(enumValue(AmbiguityPolicy.class, ambiguity, "aggregate.ambiguity", source));
        }

        String idPattern = value(root, envLookup, "experiment", "id-pattern");
        if (idPattern != null) {
            try {
                builder.experimentIdPattern(Pattern.compile(idPattern));
            } catch (PatternSyntaxException e) {
                throw new ConfigLoadException("Invalid experiment.id-pattern: " + e.getDescription(), e, source);
            }
        }

        String headerStyle = value(root, envLookup, "export", "header-style");
        if (headerStyle != null) {
            builder.headerStyle(enumValue(HeaderStyle.class, headerStyle, "export.header-style", source));
        }

        String rawDelimiter = envLookup.apply(envName("export", "delimiter"));
        String delimiter = rawDelimiter != null && rawDelimiter.length() == 1
                ? rawDelimiter
                : value(root, envLookup, "export", "delimiter");
        if (delimiter != null) builder.delimiter(delimiter(delimiter, source));

        return builder.build();
    }

    /** The environment value if set, else the YAML value, else {@code null}. */
    private static String value(JsonNode root, Function<String, String> envLookup, String section, String key) {
        String env = envLookup.apply(envName(section, key));
        if (env != null && !env.trim().isEmpty()) {
            return env.trim();
        }
        JsonNode node = root.path(section).get(key);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static List<String> precedence(JsonNode root, Function<String, String> envLookup) {
        String env = envLookup.apply(envName("reconcile", "precedence"));
        if (env != null && !env.trim().isEmpty()) {
            return Arrays.stream(env.split(",")).map(String::trim).toList();
        }
        JsonNode node = root.path("reconcile").get("precedence");
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<String> entries = new ArrayList<>();
            node.forEach(entry -> entries.add(entry.asText()));
            return entries;
        }
        return Arrays.stream(node.asText().split(",")).map(String::trim).toList();
    }

    static String envName(String section, String key) {
        return ENV_PREFIX + (section + "_" + key).replace('-', '_').replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String text, String key, String source) {
        String normalized = text.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException(
                    "Invalid " + key + " '" + text + "', expected one of " + Arrays.toString(type.getEnumConstants()),
                    e,
                    source);
        }
    }

    private static char delimiter(String text, String source) {
        String normalized = text.equalsIgnoreCase("tab") || text.equals("\\t") ? "\t" : text;
        if (normalized.length() != 1) {
            throw new ConfigLoadException(
                    "Invalid export.delimiter '" + text + "', expected a single character or 'tab'", source);
        }
        return normalized.charAt(0);
    }
}
