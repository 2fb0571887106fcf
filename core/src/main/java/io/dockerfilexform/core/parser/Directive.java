package io.dockerfilexform.core.parser;

import java.util.Objects;

/**
 * A leading parser directive such as {@code # syntax = docker/dockerfile:1} or
 * {@code # escape = `}. Names are stored lowercase.
 *
 * @param name  directive name, lowercase
 * @param value directive value, trimmed
 * @param line  1-based source line
 */
public record Directive(String name, String value, int line) {

    public Directive {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
