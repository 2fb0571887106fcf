package io.dockerfilexform.core.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Settings for a parse/rewrite/print run.
 *
 * <ul>
 * <li>{@code buildArgs}: {@code KEY=VALUE} or {@code KEY} strings overriding in-file {@code ARG}
 * defaults (default: none)</li>
 * <li>{@code skipStageReferences}: treat {@code FROM}/{@code COPY --from} values that name an
 * earlier build stage (or a stage index) as non-references (default: {@code true})</li>
 * <li>{@code preserveSpacing}: pad with blank lines so instructions keep their original line
 * numbers (default: {@code true})</li>
 * </ul>
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class RewriteConfig {

    private static final RewriteConfig DEFAULTS = builder().build();

    private final List<String> buildArgs;
    private final boolean skipStageReferences;
    private final boolean preserveSpacing;

    private RewriteConfig(Builder builder) {
        this.buildArgs = List.copyOf(builder.buildArgs);
        this.skipStageReferences = builder.skipStageReferences;
        this.preserveSpacing = builder.preserveSpacing;
    }

    public static RewriteConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> buildArgs() {
        return buildArgs;
    }

    public boolean skipStageReferences() {
        return skipStageReferences;
    }

    public boolean preserveSpacing() {
        return preserveSpacing;
    }

    @Override
    public String toString() {
        return "RewriteConfig{buildArgs=" + buildArgs + ", skipStageReferences=" + skipStageReferences
                + ", preserveSpacing=" + preserveSpacing + "}";
    }

    /** Builder with documented defaults. */
    public static final class Builder {

        private final List<String> buildArgs = new ArrayList<>();
        private boolean skipStageReferences = true;
        private boolean preserveSpacing = true;

        private Builder() {}

        public Builder buildArg(String buildArg) {
            buildArgs.add(Objects.requireNonNull(buildArg, "buildArg must not be null"));
            return this;
        }

        /** Replaces any build args added so far. */
        public Builder buildArgs(List<String> values) {
            buildArgs.clear();
            values.forEach(this::buildArg);
            return this;
        }

        public Builder skipStageReferences(boolean skipStageReferences) {
            this.skipStageReferences = skipStageReferences;
            return this;
        }

        public Builder preserveSpacing(boolean preserveSpacing) {
            this.preserveSpacing = preserveSpacing;
            return this;
        }

        public RewriteConfig build() {
            return new RewriteConfig(this);
        }
    }
}
