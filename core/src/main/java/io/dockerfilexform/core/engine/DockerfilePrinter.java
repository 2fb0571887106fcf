package io.dockerfilexform.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dockerfilexform.core.error.PrintException;
import io.dockerfilexform.core.parser.Directive;
import io.dockerfilexform.core.parser.Heredoc;
import io.dockerfilexform.core.parser.Keyword;
import io.dockerfilexform.core.parser.Node;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writes a (possibly rewritten) tree back out as Dockerfile text.
 *
 * <p>
 * Directives come first as {@code # name = value}. Each instruction is rendered on one line by a
 * keyword rule, followed by its here-documents, and is preceded by enough blank lines to land on
 * its original line number; once past an instruction the cursor skips the lines it spanned in the
 * source, so collapsed continuations do not leave gaps. Comments and intra-instruction whitespace
 * are not preserved.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class DockerfilePrinter {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final boolean preserveSpacing;

    /** Printer that pads to original line numbers. */
    public DockerfilePrinter() {
        this(true);
    }

    public DockerfilePrinter(boolean preserveSpacing) {
        this.preserveSpacing = preserveSpacing;
    }

    /** Renders {@code directives} and {@code root} to a string. */
    public String print(List<Directive> directives, List<Node> root) {
        StringBuilder sb = new StringBuilder();
        print(directives, root, sb);
        return sb.toString();
    }

    /**
     * Renders {@code directives} and {@code root} to {@code out}.
     *
     * @throws PrintException if {@code out} fails
     */
    public void print(List<Directive> directives, List<Node> root, Appendable out) {
        Objects.requireNonNull(directives, "directives must not be null");
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(out, "out must not be null");
        try {
            int cursor = 1;
            for (Directive directive : directives) {
                out.append("# ")
                        .append(directive.name())
                        .append(" = ")
                        .append(directive.value())
                        .append('\n');
                cursor++;
            }

            for (Node node : root) {
                if (preserveSpacing) {
                    while (cursor < node.startLine()) {
                        out.append('\n');
                        cursor++;
                    }
                }
                out.append(format(node)).append('\n');
                cursor = Math.max(cursor + renderedLines(node), node.endLine() + 1);
            }
        } catch (IOException e) {
            throw new PrintException("Failed to write Dockerfile output", e);
        }
    }

    /** Renders a single instruction, here-documents included, without a trailing newline. */
    public static String format(Node node) {
        return appendHeredocs(node, formatLine(node));
    }

    private static String formatLine(Node node) {
        Keyword keyword = node.knownKeyword();
        if (keyword == Keyword.ONBUILD && !node.children().isEmpty()) {
            return String.join(" ", head(node)) + " " + formatLine(node.children().get(0));
        }
        if (keyword != null && keyword.acceptsJsonForm() && node.hasAttribute(Node.Attribute.JSON)) {
            return formatJson(node, keyword);
        }
        if ((keyword == Keyword.LABEL || keyword == Keyword.ENV)
                && !node.hasAttribute(Node.Attribute.LEGACY_KEY_VALUE)) {
            return formatKeyValue(node);
        }
        List<String> words = head(node);
        words.addAll(node.arguments());
        return String.join(" ", words);
    }

    /** {@code KEYWORD flag... ["a", "b"]}; HEALTHCHECK keeps its {@code CMD} word outside the array. */
    private static String formatJson(Node node, Keyword keyword) {
        List<String> words = head(node);
        List<String> arguments = node.arguments();
        if (keyword == Keyword.HEALTHCHECK && !arguments.isEmpty()) {
            words.add(arguments.get(0));
            arguments = arguments.subList(1, arguments.size());
        }
        List<String> encoded = new ArrayList<>(arguments.size());
        for (String argument : arguments) {
            encoded.add(quote(argument));
        }
        words.add("[" + String.join(", ", encoded) + "]");
        return String.join(" ", words);
    }

    /** {@code KEYWORD flag... k1=v1 k2=v2}; an odd trailing argument is written alone. */
    private static String formatKeyValue(Node node) {
        List<String> words = head(node);
        List<String> arguments = node.arguments();
        for (int i = 0; i < arguments.size(); i += 2) {
            if (i + 1 < arguments.size()) {
                words.add(arguments.get(i) + "=" + arguments.get(i + 1));
            } else {
                words.add(arguments.get(i));
            }
        }
        return String.join(" ", words);
    }

    private static List<String> head(Node node) {
        List<String> words = new ArrayList<>();
        words.add(node.keyword());
        words.addAll(node.flags());
        return words;
    }

    private static String appendHeredocs(Node node, String line) {
        if (node.heredocs().isEmpty()) {
            return line;
        }
        StringBuilder sb = new StringBuilder(line);
        for (Heredoc heredoc : node.heredocs()) {
            sb.append('\n').append(heredoc.content()).append(heredoc.name());
        }
        return sb.toString();
    }

    private static String quote(String value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode argument as JSON string", e);
        }
    }

    /** The instruction line plus the body and terminator of each here-document. */
    private static int renderedLines(Node node) {
        int lines = 1;
        for (Heredoc heredoc : node.heredocs()) {
            lines += heredoc.lineCount();
        }
        return lines;
    }
}
