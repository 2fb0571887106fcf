package io.dockerfilexform.core.parser;

import io.dockerfilexform.core.error.DirectiveParseException;
import io.dockerfilexform.core.error.GrammarParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses Dockerfile text into a list of top-level {@link Node}s annotated with source lines.
 *
 * <p>
 * Handles comments, blank lines, line continuations via the escape token, instruction flags,
 * JSON-array and key/value argument forms, here-documents and {@code ONBUILD} triggers. Leading
 * directives are read by {@link DirectiveParser}; their errors surface as
 * {@link DirectiveParseException}, every other failure as {@link GrammarParseException}.
 *
 * <p>
 * Thread-safe: each call to {@link #parse} works on its own state.
 */
public final class DockerfileParser {

    private static final Logger LOG = LoggerFactory.getLogger(DockerfileParser.class);

    private static final Pattern INSTRUCTION = Pattern.compile("^(\\S+)\\s*(.*)$", Pattern.DOTALL);

    /**
     * {@code <<EOF}, {@code <<-EOF}, {@code <<"EOF"}, {@code <<'EOF'} at the start of a word;
     * here-strings are excluded.
     */
    private static final Pattern HEREDOC_MARKER = Pattern.compile("<<(-?)([\"']?)([A-Za-z_][A-Za-z0-9_]*)\\2");

    private static final char BOM = '\uFEFF';

    /**
     * Parses {@code text}.
     *
     * @param text Dockerfile content
     * @return the instructions, directives and escape token
     * @throws DirectiveParseException if the leading directive block is invalid
     * @throws GrammarParseException   if an instruction cannot be parsed or there are none
     */
    public ParseResult parse(String text) {
        Objects.requireNonNull(text, "text must not be null");

        List<Directive> directives = DirectiveParser.parseAll(text);
        char escapeToken = DirectiveParser.escapeToken(directives);

        LineReader reader = new LineReader(splitLines(stripBom(text)));
        List<Node> root = new ArrayList<>();
        while (reader.hasNext()) {
            String line = reader.next();
            if (isBlank(line) || isComment(line)) {
                continue;
            }
            root.add(readInstruction(reader, line, escapeToken));
        }

        if (root.isEmpty()) {
            throw new GrammarParseException("file with no instructions", 0);
        }
        LOG.debug(
                "Parsed {} instructions and {} directives (escape token '{}')",
                root.size(),
                directives.size(),
                escapeToken);
        return new ParseResult(root, directives, escapeToken);
    }

    /** Reads one instruction starting at the reader's current line, consuming continuations and heredocs. */
    private Node readInstruction(LineReader reader, String firstLine, char escapeToken) {
        int startLine = reader.lineNumber();
        StringBuilder logical = new StringBuilder();

        String current = firstLine.stripLeading();
        boolean continued = hasContinuation(current, escapeToken);
        logical.append(continued ? trimContinuation(current, escapeToken) : current);
        while (continued && reader.hasNext()) {
            String next = reader.next();
            if (isComment(next)) {
                continue;
            }
            if (isBlank(next)) {
                LOG.warn("Empty continuation line found at line {}; empty continuation lines are deprecated",
                        reader.lineNumber());
                continue;
            }
            continued = hasContinuation(next, escapeToken);
            logical.append(continued ? trimContinuation(next, escapeToken) : next);
        }

        String text = logical.toString().trim();
        Matcher m = INSTRUCTION.matcher(text);
        if (!m.matches()) {
            throw new GrammarParseException("expected an instruction: " + text, startLine);
        }
        String keyword = m.group(1).toUpperCase(Locale.ROOT);
        String rest = m.group(2);

        List<Heredoc> heredocs = new ArrayList<>();
        Keyword known = Keyword.lookup(keyword);
        if (known != null && known.acceptsHeredocs()) {
            heredocs = readHeredocs(reader, rest, escapeToken, startLine);
        }

        return buildNode(keyword, rest, heredocs, escapeToken, startLine, reader.lineNumber(), text);
    }

    /** Reads a body for each unquoted word of {@code rest} that opens a here-document. */
    private List<Heredoc> readHeredocs(LineReader reader, String rest, char escapeToken, int startLine) {
        List<Heredoc> heredocs = new ArrayList<>();
        for (String word : ArgumentSplitter.words(rest, escapeToken)) {
            Matcher marker = HEREDOC_MARKER.matcher(word);
            if (!marker.lookingAt()) {
                continue;
            }
            boolean chomp = !marker.group(1).isEmpty();
            boolean expand = marker.group(2).isEmpty();
            String name = marker.group(3);

            StringBuilder content = new StringBuilder();
            boolean terminated = false;
            while (reader.hasNext()) {
                String line = reader.next();
                String candidate = chomp ? stripLeadingTabs(line) : line;
                if (candidate.equals(name)) {
                    terminated = true;
                    break;
                }
                content.append(candidate).append('\n');
            }
            if (!terminated) {
                throw new GrammarParseException("unterminated heredoc " + name, startLine);
            }
            heredocs.add(new Heredoc(name, content.toString(), expand, chomp));
        }
        return heredocs;
    }

    private Node buildNode(
            String keyword,
            String rest,
            List<Heredoc> heredocs,
            char escapeToken,
            int startLine,
            int endLine,
            String original) {
        FlagSplit flags = extractFlags(rest, startLine);
        String body = flags.rest().trim();

        Node.Builder builder = Node.builder(keyword)
                .flags(flags.flags())
                .lines(startLine, endLine)
                .original(original);
        heredocs.forEach(builder::heredoc);

        Keyword known = Keyword.lookup(keyword);
        if (known == Keyword.ONBUILD) {
            return builder.child(parseTrigger(body, escapeToken, startLine, endLine))
                    .build();
        }

        ArgumentSplitter.Split split = split(known, keyword, body, escapeToken, startLine);
        split.attributes().forEach(builder::attribute);
        return builder.arguments(split.arguments()).build();
    }

    private static ArgumentSplitter.Split split(
            Keyword known, String keyword, String body, char escapeToken, int line) {
        if (known == null) {
            return ArgumentSplitter.whitespaceDelimited(body);
        }
        return switch (known) {
            case CMD, ENTRYPOINT, RUN, SHELL -> ArgumentSplitter.maybeJson(body, line);
            case ADD, COPY, VOLUME -> ArgumentSplitter.maybeJsonToList(body, line);
            case ENV, LABEL -> ArgumentSplitter.nameValue(keyword, body, escapeToken, line);
            case ARG -> ArgumentSplitter.nameOrNameValue(body, escapeToken);
            case HEALTHCHECK -> ArgumentSplitter.healthcheck(body, line);
            case MAINTAINER, STOPSIGNAL, USER, WORKDIR -> ArgumentSplitter.singleString(body);
            case EXPOSE, FROM, ONBUILD -> ArgumentSplitter.whitespaceDelimited(body);
        };
    }

    /** Parses the instruction wrapped by {@code ONBUILD}. */
    private Node parseTrigger(String body, char escapeToken, int startLine, int endLine) {
        Matcher m = INSTRUCTION.matcher(body);
        if (!m.matches()) {
            throw new GrammarParseException("ONBUILD requires an instruction", startLine);
        }
        String keyword = m.group(1).toUpperCase(Locale.ROOT);
        Keyword known = Keyword.lookup(keyword);
        if (known == Keyword.ONBUILD || known == Keyword.FROM || known == Keyword.MAINTAINER) {
            throw new GrammarParseException(keyword + " isn't allowed as an ONBUILD trigger", startLine);
        }
        return buildNode(keyword, m.group(2), List.of(), escapeToken, startLine, endLine, body);
    }

    /** Leading {@code --name[=value]} words and the text after them. */
    private record FlagSplit(List<String> flags, String rest) {}

    /**
     * Extracts leading flag words. Stops at the first word that does not start with {@code --} or
     * after a bare {@code --}. Flag words are kept verbatim, quotes included.
     */
    private static FlagSplit extractFlags(String rest, int line) {
        List<String> flags = new ArrayList<>();
        int pos = 0;
        int length = rest.length();
        while (true) {
            while (pos < length && Character.isWhitespace(rest.charAt(pos))) {
                pos++;
            }
            if (!rest.startsWith("--", pos)) {
                return new FlagSplit(flags, rest.substring(pos));
            }
            int start = pos;
            char quote = 0;
            while (pos < length) {
                char ch = rest.charAt(pos);
                if (quote != 0) {
                    if (ch == quote) {
                        quote = 0;
                    }
                } else if (ch == '\'' || ch == '"') {
                    quote = ch;
                } else if (Character.isWhitespace(ch)) {
                    break;
                }
                pos++;
            }
            if (quote != 0) {
                throw new GrammarParseException("unterminated quote in flag: " + rest.substring(start), line);
            }
            String word = rest.substring(start, pos);
            if ("--".equals(word)) {
                return new FlagSplit(flags, rest.substring(pos));
            }
            flags.add(word);
        }
    }

    private static boolean hasContinuation(String line, char escapeToken) {
        String trimmed = stripTrailingBlanks(line);
        return !trimmed.isEmpty() && trimmed.charAt(trimmed.length() - 1) == escapeToken;
    }

    private static String trimContinuation(String line, char escapeToken) {
        String trimmed = stripTrailingBlanks(line);
        return trimmed.substring(0, trimmed.length() - 1);
    }

    private static String stripTrailingBlanks(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == ' ' || line.charAt(end - 1) == '\t')) {
            end--;
        }
        return line.substring(0, end);
    }

    private static String stripLeadingTabs(String line) {
        int start = 0;
        while (start < line.length() && line.charAt(start) == '\t') {
            start++;
        }
        return line.substring(start);
    }

    private static boolean isBlank(String line) {
        return line.isBlank();
    }

    private static boolean isComment(String line) {
        return line.stripLeading().startsWith("#");
    }

    static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
    }

    /** Splits on {@code \n}, dropping a trailing {@code \r} from each line. */
    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines.add(dropCarriageReturn(text.substring(start, i)));
                start = i + 1;
            }
        }
        if (start < text.length()) {
            lines.add(dropCarriageReturn(text.substring(start)));
        }
        return lines;
    }

    private static String dropCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    /** Sequential access to physical lines with 1-based numbering. */
    private static final class LineReader {

        private final List<String> lines;
        private int next;

        LineReader(List<String> lines) {
            this.lines = lines;
        }

        boolean hasNext() {
            return next < lines.size();
        }

        String next() {
            return lines.get(next++);
        }

        /** Line number of the line most recently returned by {@link #next()}. */
        int lineNumber() {
            return next;
        }
    }
}
