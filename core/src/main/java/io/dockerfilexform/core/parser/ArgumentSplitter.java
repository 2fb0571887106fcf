package io.dockerfilexform.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dockerfilexform.core.error.GrammarParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword-specific argument splitting rules. Each method turns the text after the keyword and its
 * flags into the node's argument list.
 */
final class ArgumentSplitter {

    private static final ObjectMapper JSON = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final Pattern WHITESPACE = Pattern.compile("[ \\t\\r\\n\\f]+");

    private ArgumentSplitter() {}

    /** Arguments plus the structural attributes the split discovered. */
    record Split(List<String> arguments, Set<Node.Attribute> attributes) {

        static Split of(List<String> arguments) {
            return new Split(arguments, EnumSet.noneOf(Node.Attribute.class));
        }

        static Split empty() {
            return of(List.of());
        }
    }

    /**
     * {@code RUN}, {@code CMD}, {@code ENTRYPOINT}, {@code SHELL}: a JSON string array, or the whole
     * rest as one argument.
     */
    static Split maybeJson(String rest, int line) {
        if (rest.isEmpty()) {
            return Split.empty();
        }
        List<String> json = parseJsonArray(rest, line);
        if (json != null) {
            return new Split(json, EnumSet.of(Node.Attribute.JSON));
        }
        return Split.of(List.of(rest));
    }

    /** {@code ADD}, {@code COPY}, {@code VOLUME}: a JSON string array, or whitespace-split words. */
    static Split maybeJsonToList(String rest, int line) {
        List<String> json = parseJsonArray(rest, line);
        if (json != null) {
            return new Split(json, EnumSet.of(Node.Attribute.JSON));
        }
        return whitespaceDelimited(rest);
    }

    /** {@code FROM}, {@code EXPOSE} and unknown keywords. */
    static Split whitespaceDelimited(String rest) {
        List<String> words = new ArrayList<>();
        for (String word : WHITESPACE.split(rest.trim())) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return Split.of(words);
    }

    /** {@code USER}, {@code WORKDIR}, {@code STOPSIGNAL}, {@code MAINTAINER}: the rest as one value. */
    static Split singleString(String rest) {
        return rest.isEmpty() ? Split.empty() : Split.of(List.of(rest));
    }

    /** {@code ARG}: one argument per quote-aware word ({@code NAME} or {@code NAME=value}). */
    static Split nameOrNameValue(String rest, char escapeToken) {
        return Split.of(words(rest, escapeToken));
    }

    /**
     * {@code LABEL}, {@code ENV}: alternating key and value arguments. A first word without
     * {@code =} selects the legacy {@code KEY value} form, where the value is the rest of the line.
     */
    static Split nameValue(String keyword, String rest, char escapeToken, int line) {
        List<String> words = words(rest, escapeToken);
        if (words.isEmpty()) {
            return Split.empty();
        }

        if (!words.get(0).contains("=")) {
            String[] parts = WHITESPACE.split(rest, 2);
            if (parts.length < 2 || parts[1].isEmpty()) {
                throw new GrammarParseException(keyword + " must have two arguments", line);
            }
            return new Split(List.of(parts[0], parts[1]), EnumSet.of(Node.Attribute.LEGACY_KEY_VALUE));
        }

        List<String> arguments = new ArrayList<>();
        for (String word : words) {
            int eq = word.indexOf('=');
            if (eq < 0) {
                throw new GrammarParseException(
                        String.format("Syntax error - can't find = in \"%s\". Must be of the form: name=value", word),
                        line);
            }
            if (eq == 0) {
                throw new GrammarParseException(keyword + " names can not be blank", line);
            }
            arguments.add(word.substring(0, eq));
            arguments.add(word.substring(eq + 1));
        }
        return Split.of(arguments);
    }

    /**
     * {@code HEALTHCHECK}: {@code NONE}, or {@code CMD} followed by the maybe-JSON command. The type
     * word is the first argument.
     */
    static Split healthcheck(String rest, int line) {
        String[] parts = WHITESPACE.split(rest.trim(), 2);
        String type = parts[0].toUpperCase(Locale.ROOT);
        String command = parts.length > 1 ? parts[1].trim() : "";
        if (type.isEmpty()) {
            throw new GrammarParseException("HEALTHCHECK requires an argument", line);
        }
        if ("NONE".equals(type)) {
            if (!command.isEmpty()) {
                throw new GrammarParseException("HEALTHCHECK NONE takes no arguments", line);
            }
            return Split.of(List.of(type));
        }
        if (!"CMD".equals(type)) {
            throw new GrammarParseException(
                    String.format("Unknown type \"%s\" in HEALTHCHECK (try CMD)", type), line);
        }
        Split cmd = maybeJson(command, line);
        List<String> arguments = new ArrayList<>();
        arguments.add(type);
        arguments.addAll(cmd.arguments());
        return new Split(arguments, cmd.attributes());
    }

    /**
     * Splits {@code rest} into words on unquoted whitespace. Quotes and escape tokens are kept in
     * the words; an escape token at the very end of the text is dropped.
     */
    static List<String> words(String rest, char escapeToken) {
        List<String> words = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        boolean inWord = false;
        char quote = 0;

        for (int pos = 0; pos < rest.length(); pos++) {
            char ch = rest.charAt(pos);
            if (quote != 0) {
                if (ch == quote) {
                    quote = 0;
                } else if (ch == escapeToken && quote != '\'') {
                    if (pos + 1 == rest.length()) {
                        continue;
                    }
                    word.append(ch);
                    ch = rest.charAt(++pos);
                }
                word.append(ch);
                continue;
            }
            if (Character.isWhitespace(ch)) {
                if (inWord) {
                    words.add(word.toString());
                    word.setLength(0);
                    inWord = false;
                }
                continue;
            }
            inWord = true;
            if (ch == '\'' || ch == '"') {
                quote = ch;
            } else if (ch == escapeToken) {
                if (pos + 1 == rest.length()) {
                    continue;
                }
                word.append(ch);
                ch = rest.charAt(++pos);
            }
            word.append(ch);
        }
        if (inWord) {
            words.add(word.toString());
        }
        return words;
    }

    /**
     * Returns the elements of a JSON string array, or {@code null} when {@code rest} is not JSON.
     *
     * @throws GrammarParseException when {@code rest} is a JSON array with non-string elements
     */
    private static List<String> parseJsonArray(String rest, int line) {
        if (!rest.startsWith("[")) {
            return null;
        }
        JsonNode tree;
        try {
            tree = JSON.readTree(rest);
        } catch (JsonProcessingException e) {
            return null;
        }
        if (tree == null || !tree.isArray()) {
            return null;
        }
        List<String> values = new ArrayList<>(tree.size());
        for (JsonNode element : tree) {
            if (!element.isTextual()) {
                throw new GrammarParseException("JSON array must contain only strings: " + rest, line);
            }
            values.add(element.textValue());
        }
        return values;
    }
}
