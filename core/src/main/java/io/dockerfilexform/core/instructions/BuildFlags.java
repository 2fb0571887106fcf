package io.dockerfilexform.core.instructions;

import io.dockerfilexform.core.error.InstructionParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validates and reads the raw flag strings of one instruction against the flags that instruction
 * accepts.
 */
final class BuildFlags {

    private enum Type {
        STRING,
        BOOL,
        STRINGS
    }

    private final String keyword;
    private final Map<String, Type> declared = new LinkedHashMap<>();
    private final Map<String, List<String>> values = new LinkedHashMap<>();

    BuildFlags(String keyword) {
        this.keyword = keyword;
    }

    BuildFlags addString(String name) {
        declared.put(name, Type.STRING);
        return this;
    }

    BuildFlags addBool(String name) {
        declared.put(name, Type.BOOL);
        return this;
    }

    /** A flag that may be repeated. */
    BuildFlags addStrings(String name) {
        declared.put(name, Type.STRINGS);
        return this;
    }

    /**
     * Reads {@code rawFlags}.
     *
     * @throws InstructionParseException on unknown, duplicate or malformed flags
     */
    BuildFlags parse(List<String> rawFlags) {
        Set<String> seen = new HashSet<>();
        for (String raw : rawFlags) {
            if (!raw.startsWith("--")) {
                throw new InstructionParseException("Invalid flag: " + raw, keyword);
            }
            String body = raw.substring(2);
            int eq = body.indexOf('=');
            String name = eq < 0 ? body : body.substring(0, eq);
            String value = eq < 0 ? null : unquote(body.substring(eq + 1));

            Type type = declared.get(name);
            if (type == null) {
                throw new InstructionParseException("Unknown flag: " + name, keyword);
            }
            if (type != Type.STRINGS && !seen.add(name)) {
                throw new InstructionParseException("Duplicate flag specified: " + name, keyword);
            }
            if (type == Type.BOOL) {
                if (value != null && !"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                    throw new InstructionParseException(
                            String.format("expecting boolean value for flag %s, not: %s", name, value), keyword);
                }
                value = value == null ? "true" : value.toLowerCase(Locale.ROOT);
            } else if (value == null) {
                throw new InstructionParseException("Missing a value on flag: " + name, keyword);
            }
            values.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        }
        return this;
    }

    /** The last value of a string flag, or {@code null} if it was not given. */
    String string(String name) {
        List<String> given = values.get(name);
        return given == null ? null : given.get(given.size() - 1);
    }

    boolean bool(String name) {
        return "true".equals(string(name));
    }

    List<String> strings(String name) {
        return values.getOrDefault(name, List.of());
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
