package io.dockerfilexform.core.parser;

import io.dockerfilexform.core.error.DirectiveParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the block of parser directives at the top of a Dockerfile.
 *
 * <p>
 * A directive is a comment of the form {@code # name = value}. Only {@code syntax},
 * {@code escape} and {@code check} are recognized; the block ends at the first line that is not a
 * recognized directive (an instruction, a blank line, or an ordinary comment).
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class DirectiveParser {

    /** Escape token used when no {@code escape} directive is present. */
    public static final char DEFAULT_ESCAPE_TOKEN = '\\';

    private static final Pattern DIRECTIVE_PATTERN =
            Pattern.compile("^#[ \\t]*([a-zA-Z][a-zA-Z0-9]*)[ \\t]*=[ \\t]*(.+?)[ \\t]*$");

    private static final Set<String> KNOWN_DIRECTIVES = Set.of("syntax", "escape", "check");

    private DirectiveParser() {}

    /**
     * Returns the leading directives of {@code text} in source order.
     *
     * @throws DirectiveParseException if a directive is repeated or {@code escape} has a value
     *                                 other than a backslash or a backtick
     */
    public static List<Directive> parseAll(String text) {
        Objects.requireNonNull(text, "text must not be null");
        List<Directive> directives = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        List<String> lines = DockerfileParser.splitLines(DockerfileParser.stripBom(text));
        for (int i = 0; i < lines.size(); i++) {
            Matcher m = DIRECTIVE_PATTERN.matcher(lines.get(i));
            if (!m.matches()) {
                break;
            }
            String name = m.group(1).toLowerCase(Locale.ROOT);
            if (!KNOWN_DIRECTIVES.contains(name)) {
                break;
            }
            int line = i + 1;
            if (!seen.add(name)) {
                throw new DirectiveParseException("only one " + name + " parser directive can be used", line);
            }
            String value = m.group(2);
            if ("escape".equals(name) && !"\\".equals(value) && !"`".equals(value)) {
                throw new DirectiveParseException(
                        String.format("invalid escape token '%s' does not match ` or \\", value), line);
            }
            directives.add(new Directive(name, value, line));
        }
        return directives;
    }

    /** Returns the escape token declared by {@code directives}, or the default backslash. */
    public static char escapeToken(List<Directive> directives) {
        for (Directive directive : directives) {
            if ("escape".equals(directive.name())) {
                return directive.value().charAt(0);
            }
        }
        return DEFAULT_ESCAPE_TOKEN;
    }
}
