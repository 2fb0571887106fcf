package io.dockerfilexform.core.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * One parsed instruction.
 *
 * <p>
 * The structure of a node (keyword, number of arguments and flags, children, heredocs, line
 * numbers) is fixed at parse time. Argument values and flag strings can be replaced in place
 * through {@link #setArgument} and {@link #setFlag}, which is how image references are rewritten
 * without disturbing node order.
 *
 * <p>
 * Not thread-safe. Callers must not run two rewrite passes over the same tree concurrently.
 */
public final class Node {

    /** Structural markers set by the parser. */
    public enum Attribute {
        /** Body was written as a JSON array ({@code CMD ["a", "b"]}). */
        JSON,
        /** {@code ENV key value} whitespace form, printed without {@code =}. */
        LEGACY_KEY_VALUE
    }

    private final String keyword;
    private final List<String> arguments;
    private final List<String> flags;
    private final Set<Attribute> attributes;
    private final List<Heredoc> heredocs;
    private final List<Node> children;
    private final int startLine;
    private final int endLine;
    private final String original;
    private Node parent;

    private Node(
            String keyword,
            List<String> arguments,
            List<String> flags,
            Set<Attribute> attributes,
            List<Heredoc> heredocs,
            List<Node> children,
            int startLine,
            int endLine,
            String original) {
        this.keyword = Objects.requireNonNull(keyword, "keyword must not be null");
        this.arguments = new ArrayList<>(arguments);
        this.flags = new ArrayList<>(flags);
        this.attributes = attributes.isEmpty() ? EnumSet.noneOf(Attribute.class) : EnumSet.copyOf(attributes);
        this.heredocs = List.copyOf(heredocs);
        this.children = List.copyOf(children);
        this.startLine = startLine;
        this.endLine = endLine;
        this.original = original;
        for (Node child : this.children) {
            child.parent = this;
        }
    }

    /** Uppercase instruction name, e.g. {@code FROM}. */
    public String keyword() {
        return keyword;
    }

    /** The known keyword, or {@code null} for instructions the grammar does not recognize. */
    public Keyword knownKeyword() {
        return Keyword.lookup(keyword);
    }

    /** Argument values in source order (read-only view). */
    public List<String> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    /** The first argument, or {@code null} if the instruction has none. */
    public String firstArgument() {
        return arguments.isEmpty() ? null : arguments.get(0);
    }

    /** Raw flag strings in source order, e.g. {@code --from=builder} (read-only view). */
    public List<String> flags() {
        return Collections.unmodifiableList(flags);
    }

    public Set<Attribute> attributes() {
        return Collections.unmodifiableSet(attributes);
    }

    public boolean hasAttribute(Attribute attribute) {
        return attributes.contains(attribute);
    }

    public List<Heredoc> heredocs() {
        return heredocs;
    }

    /** Nested instructions; only {@code ONBUILD} has one. */
    public List<Node> children() {
        return children;
    }

    /** The enclosing node for an {@code ONBUILD} body, {@code null} for top-level instructions. */
    public Node parent() {
        return parent;
    }

    public boolean isNested() {
        return parent != null;
    }

    /** 1-based first source line of the instruction. */
    public int startLine() {
        return startLine;
    }

    /** 1-based last source line, including continuation and heredoc lines. */
    public int endLine() {
        return endLine;
    }

    /** The logical instruction line as read (continuations joined, heredoc bodies excluded). */
    public String original() {
        return original;
    }

    /**
     * Replaces the argument at {@code index}.
     *
     * @throws IndexOutOfBoundsException if there is no such argument
     */
    public void setArgument(int index, String value) {
        arguments.set(index, Objects.requireNonNull(value, "value must not be null"));
    }

    /**
     * Replaces the flag string at {@code index}.
     *
     * @throws IndexOutOfBoundsException if there is no such flag
     */
    public void setFlag(int index, String flag) {
        flags.set(index, Objects.requireNonNull(flag, "flag must not be null"));
    }

    /** Starts a node for the given keyword; the keyword is stored uppercase. */
    public static Builder builder(String keyword) {
        return new Builder(keyword);
    }

    @Override
    public String toString() {
        return "Node{" + keyword + " flags=" + flags + " args=" + arguments + " line=" + startLine + "}";
    }

    /** Assembles a {@link Node}. Used by the parser and by callers that build trees by hand. */
    public static final class Builder {

        private final String keyword;
        private final List<String> arguments = new ArrayList<>();
        private final List<String> flags = new ArrayList<>();
        private final Set<Attribute> attributes = EnumSet.noneOf(Attribute.class);
        private final List<Heredoc> heredocs = new ArrayList<>();
        private final List<Node> children = new ArrayList<>();
        private int startLine = 1;
        private int endLine = -1;
        private String original;

        private Builder(String keyword) {
            this.keyword = Objects.requireNonNull(keyword, "keyword must not be null").toUpperCase(Locale.ROOT);
        }

        public Builder argument(String value) {
            arguments.add(Objects.requireNonNull(value, "argument must not be null"));
            return this;
        }

        public Builder arguments(List<String> values) {
            values.forEach(this::argument);
            return this;
        }

        public Builder flag(String flag) {
            flags.add(Objects.requireNonNull(flag, "flag must not be null"));
            return this;
        }

        public Builder flags(List<String> values) {
            values.forEach(this::flag);
            return this;
        }

        public Builder attribute(Attribute attribute) {
            attributes.add(attribute);
            return this;
        }

        public Builder heredoc(Heredoc heredoc) {
            heredocs.add(Objects.requireNonNull(heredoc, "heredoc must not be null"));
            return this;
        }

        public Builder child(Node child) {
            children.add(Objects.requireNonNull(child, "child must not be null"));
            return this;
        }

        /** Source line span; {@code endLine} defaults to {@code startLine}. */
        public Builder lines(int startLine, int endLine) {
            this.startLine = startLine;
            this.endLine = endLine;
            return this;
        }

        public Builder line(int line) {
            return lines(line, line);
        }

        public Builder original(String original) {
            this.original = original;
            return this;
        }

        public Node build() {
            int end = endLine < startLine ? startLine : endLine;
            return new Node(keyword, arguments, flags, attributes, heredocs, children, startLine, end, original);
        }
    }
}
