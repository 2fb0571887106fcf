package io.dockerfilexform.core.engine;

import io.dockerfilexform.core.instructions.KeyValuePairOptional;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts caller-supplied build arguments ({@code KEY=VALUE} or bare {@code KEY}) into override
 * pairs. A bare key has no value and defers to the in-file default. Keys are unique; a repeated key
 * keeps its last value.
 */
public final class BuildArgs {

    private BuildArgs() {}

    /**
     * @throws IllegalArgumentException if an entry has an empty key
     */
    public static List<KeyValuePairOptional> parse(List<String> buildArgs) {
        Objects.requireNonNull(buildArgs, "buildArgs must not be null");
        Map<String, KeyValuePairOptional> byKey = new LinkedHashMap<>();
        for (String entry : buildArgs) {
            int eq = entry.indexOf('=');
            String key = eq < 0 ? entry : entry.substring(0, eq);
            if (key.isEmpty()) {
                throw new IllegalArgumentException("build arg name must not be empty: '" + entry + "'");
            }
            byKey.put(key, new KeyValuePairOptional(key, eq < 0 ? null : entry.substring(eq + 1)));
        }
        return new ArrayList<>(byKey.values());
    }
}
