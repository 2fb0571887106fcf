package io.dockerfilexform.core.parser;

import java.util.Locale;

/**
 * Instruction keywords known to the grammar. Unknown keywords still parse (as whitespace-split
 * words) and are represented by their raw uppercase name on the {@link Node}.
 */
public enum Keyword {
    ADD,
    ARG,
    CMD,
    COPY,
    ENTRYPOINT,
    ENV,
    EXPOSE,
    FROM,
    HEALTHCHECK,
    LABEL,
    MAINTAINER,
    ONBUILD,
    RUN,
    SHELL,
    STOPSIGNAL,
    USER,
    VOLUME,
    WORKDIR;

    /**
     * Returns the keyword with the given name (case-insensitive), or {@code null} if the name is not
     * a known instruction.
     */
    public static Keyword lookup(String name) {
        if (name == null) {
            return null;
        }
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** Whether the instruction body may be written as a JSON array. */
    public boolean acceptsJsonForm() {
        return switch (this) {
            case ADD, CMD, COPY, ENTRYPOINT, RUN, SHELL, VOLUME, HEALTHCHECK -> true;
            default -> false;
        };
    }

    /** Whether the instruction may carry here-documents. */
    public boolean acceptsHeredocs() {
        return this == ADD || this == COPY || this == RUN;
    }
}
