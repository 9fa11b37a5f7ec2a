package io.seqwarehouse.core.config;

import io.seqwarehouse.core.aggregate.AmbiguityPolicy;
import io.seqwarehouse.core.export.HeaderStyle;
import io.seqwarehouse.core.reconcile.TablePrecedence;
import io.seqwarehouse.core.tabular.ExperimentIds;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable warehouse configuration. Built through {@link Builder}; every setting has a default:
 *
 * <ul>
 *   <li>{@code schemas.catalog}: {@code datasources.yml}
 *   <li>{@code targets.file}: {@code targets.yml}
 *   <li>{@code reconcile.precedence}: {@code [experimental, sample, sequence]}
 *   <li>{@code aggregate.ambiguity}: {@code fail}
 *   <li>{@code experiment.id-pattern}: {@value ExperimentIds#DEFAULT_PATTERN}
 *   <li>{@code export.header-style}: {@code field}
 *   <li>{@code export.delimiter}: {@code ,}
 * </ul>
 */
public final class WarehouseConfig {

    private final Path schemaCatalog;
    private final Path targetsFile;
    private final List<String> precedence;
    private final AmbiguityPolicy ambiguityPolicy;
    private final Pattern experimentIdPattern;
    private final HeaderStyle headerStyle;
    private final char delimiter;

    private WarehouseConfig(Builder builder) {
        this.schemaCatalog = builder.schemaCatalog;
        this.targetsFile = builder.targetsFile;
        this.precedence = List.copyOf(builder.precedence);
        this.ambiguityPolicy = builder.ambiguityPolicy;
        this.experimentIdPattern = builder.experimentIdPattern;
        this.headerStyle = builder.headerStyle;
        this.delimiter = builder.delimiter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static WarehouseConfig defaults() {
        return builder().build();
    }

    public Path schemaCatalog() {
        return schemaCatalog;
    }

    public Path targetsFile() {
        return targetsFile;
    }

    public List<String> precedence() {
        return precedence;
    }

    public TablePrecedence tablePrecedence() {
        return TablePrecedence.of(precedence);
    }

    public AmbiguityPolicy ambiguityPolicy() {
        return ambiguityPolicy;
    }

    public Pattern experimentIdPattern() {
        return experimentIdPattern;
    }

    public HeaderStyle headerStyle() {
        return headerStyle;
    }

    public char delimiter() {
        return delimiter;
    }

    @Override
    public String toString() {
        return "WarehouseConfig[catalog=" + schemaCatalog + ", targets=" + targetsFile + ", precedence=" + precedence
                + ", ambiguity=" + ambiguityPolicy + ", idPattern=" + experimentIdPattern + ", header=" + headerStyle
                + ", delimiter='" + delimiter + "']";
    }

    /** Builder for {@link WarehouseConfig}. */
    public static final class Builder {

        private Path schemaCatalog = Path.of("datasources.yml");
        private Path targetsFile = Path.of("targets.yml");
        private List<String> precedence = TablePrecedence.DEFAULT_ORDER;
        private AmbiguityPolicy ambiguityPolicy = AmbiguityPolicy.FAIL;
        private Pattern experimentIdPattern = Pattern.compile(ExperimentIds.DEFAULT_PATTERN);
        private HeaderStyle headerStyle = HeaderStyle.FIELD;
        private char delimiter = ',';

        Builder() {}

        public Builder schemaCatalog(Path schemaCatalog) {
            this.schemaCatalog = Objects.requireNonNull(schemaCatalog);
            return this;
        }

        public Builder targetsFile(Path targetsFile) {
            this.targetsFile = Objects.requireNonNull(targetsFile);
            return this;
        }

        public Builder precedence(List<String> precedence) {
            this.precedence = Objects.requireNonNull(precedence);
            return this;
        }

        public Builder ambiguityPolicy(AmbiguityPolicy ambiguityPolicy) {
            this.ambiguityPolicy = Objects.requireNonNull(ambiguityPolicy);
            return this;
        }

        public Builder experimentIdPattern(Pattern experimentIdPattern) {
            this.experimentIdPattern = Objects.requireNonNull(experimentIdPattern);
            return this;
        }

        public Builder headerStyle(HeaderStyle headerStyle) {
            this.headerStyle = Objects.requireNonNull(headerStyle);
            return this;
        }

        public Builder delimiter(char delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public WarehouseConfig build() {
            return new WarehouseConfig(this);
        }
    }
}
