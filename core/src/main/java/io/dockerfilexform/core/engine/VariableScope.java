package io.dockerfilexform.core.engine;

import io.dockerfilexform.core.error.WordExpansionException;
import io.dockerfilexform.core.instructions.ArgInstruction;
import io.dockerfilexform.core.instructions.KeyValuePairOptional;
import io.dockerfilexform.core.shell.ShellLexer;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Variable values visible at the current point of a single pass over a Dockerfile.
 *
 * <p>
 * Seeded with external overrides; each {@code ARG} declaration then updates it in file order:
 * <ul>
 * <li>an override with a value for the key always wins, at every declaration;</li>
 * <li>otherwise a default value is expanded against the variables declared so far (the raw default
 * is kept when expansion fails) and replaces any earlier value;</li>
 * <li>a declaration without a default keeps an existing value, or binds the empty string.</li>
 * </ul>
 * Overrides without a value are ignored. Overrides for names never declared in the file are
 * visible from the start.
 *
 * <p>
 * One instance per pass; not thread-safe.
 */
public final class VariableScope {

    private static final Logger LOG = LoggerFactory.getLogger(VariableScope.class);

    private final ShellLexer lexer;
    private final Map<String, String> overrides = new HashMap<>();
    private final Map<String, String> values = new LinkedHashMap<>();

    public VariableScope(ShellLexer lexer, List<KeyValuePairOptional> externalOverrides) {
        this.lexer = Objects.requireNonNull(lexer, "lexer must not be null");
        for (KeyValuePairOptional override : externalOverrides) {
            if (override.hasValue()) {
                overrides.put(override.key(), override.value());
                values.put(override.key(), override.value());
            }
        }
    }

    /** Applies every pair of {@code arg} in order. */
    public void declare(ArgInstruction arg) {
        arg.pairs().forEach(this::declare);
    }

    public void declare(KeyValuePairOptional pair) {
        String override = overrides.get(pair.key());
        if (override != null) {
            values.put(pair.key(), override);
        } else if (pair.hasValue()) {
            values.put(pair.key(), expandDefault(pair));
        } else {
            values.putIfAbsent(pair.key(), "");
        }
    }

    /**
     * Expands {@code word} against the current values.
     *
     * @throws WordExpansionException if the word cannot be expanded
     */
    public String expand(String word) {
        return lexer.processWord(word, values);
    }

    /** Current value of {@code name}, or {@code null} if it is not defined. */
    public String get(String name) {
        return values.get(name);
    }

    /** Read-only view of the current values in first-definition order. */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    private String expandDefault(KeyValuePairOptional pair) {
        try {
            return lexer.processWord(pair.value(), values);
        } catch (WordExpansionException e) {
            LOG.debug("Keeping unexpanded default for ARG {}: {}", pair.key(), e.getMessage());
            return pair.value();
        }
    }
}
