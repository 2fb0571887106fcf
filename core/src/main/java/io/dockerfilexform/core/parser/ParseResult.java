package io.dockerfilexform.core.parser;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link DockerfileParser#parse}: the top-level instructions in source order, the leading
 * directives, and the escape token in effect.
 */
public record ParseResult(List<Node> root, List<Directive> directives, char escapeToken) {

    public ParseResult {
        root = List.copyOf(Objects.requireNonNull(root, "root must not be null"));
        directives = List.copyOf(Objects.requireNonNull(directives, "directives must not be null"));
    }
}
