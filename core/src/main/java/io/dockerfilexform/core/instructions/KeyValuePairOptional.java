package io.dockerfilexform.core.instructions;

import java.util.Objects;

/**
 * A variable name with an optional value, as declared by {@code ARG NAME[=value]} or supplied as a
 * {@code KEY[=VALUE]} build argument.
 *
 * @param key   variable name, never blank
 * @param value raw value, or {@code null} when none was given
 */
public record KeyValuePairOptional(String key, String value) {

    public KeyValuePairOptional {
        Objects.requireNonNull(key, "key must not be null");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public String toString() {
        return value == null ? key : key + "=" + value;
    }
}
