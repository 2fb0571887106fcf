package io.dockerfilexform.core.shell;

import io.dockerfilexform.core.error.WordExpansionException;
import java.util.Map;
import java.util.Objects;

/**
 * Expands one Dockerfile word the way the builder does before using it: quotes are removed, the
 * escape token protects the next character, and {@code $NAME} / {@code ${NAME}} references are
 * replaced from a variable map. Unknown variables expand to the empty string.
 *
 * <p>
 * Supported {@code ${...}} forms: {@code ${NAME}}, {@code ${NAME:-word}}, {@code ${NAME-word}},
 * {@code ${NAME:+word}}, {@code ${NAME+word}}, {@code ${NAME:?message}}, {@code ${NAME?message}}.
 * With a colon the modifier also triggers on an empty value, without it only on an unset one.
 *
 * <p>
 * This is word expansion only; no command substitution, globbing or field splitting.
 *
 * <p>
 * Thread-safe: instances are immutable and every call works on its own cursor.
 */
public final class ShellLexer {

    private final char escapeToken;

    public ShellLexer(char escapeToken) {
        this.escapeToken = escapeToken;
    }

    public char escapeToken() {
        return escapeToken;
    }

    /**
     * Expands {@code word} against {@code variables}.
     *
     * @throws WordExpansionException on unterminated quotes or braces, unsupported modifiers, or a
     *                                {@code ?} modifier whose variable is unset
     */
    public String processWord(String word, Map<String, String> variables) {
        Objects.requireNonNull(word, "word must not be null");
        Objects.requireNonNull(variables, "variables must not be null");
        return new Cursor(word, variables).word();
    }

    /** Single-use scanning state over one word. */
    private final class Cursor {

        private final String text;
        private final Map<String, String> variables;
        private int pos;

        Cursor(String text, Map<String, String> variables) {
            this.text = text;
            this.variables = variables;
        }

        String word() {
            StringBuilder out = new StringBuilder();
            while (pos < text.length()) {
                char ch = text.charAt(pos);
                if (ch == '\'') {
                    out.append(singleQuoted());
                } else if (ch == '"') {
                    out.append(doubleQuoted());
                } else if (ch == '$') {
                    out.append(dollar());
                } else if (ch == escapeToken) {
                    pos++;
                    if (pos < text.length()) {
                        out.append(text.charAt(pos++));
                    }
                } else {
                    out.append(ch);
                    pos++;
                }
            }
            return out.toString();
        }

        private String singleQuoted() {
            int close = text.indexOf('\'', pos + 1);
            if (close < 0) {
                throw new WordExpansionException("unexpected end of statement while looking for matching single-quote");
            }
            String literal = text.substring(pos + 1, close);
            pos = close + 1;
            return literal;
        }

        private String doubleQuoted() {
            StringBuilder out = new StringBuilder();
            pos++;
            while (pos < text.length()) {
                char ch = text.charAt(pos);
                if (ch == '"') {
                    pos++;
                    return out.toString();
                }
                if (ch == '$') {
                    out.append(dollar());
                    continue;
                }
                if (ch == escapeToken && pos + 1 < text.length()) {
                    char next = text.charAt(pos + 1);
                    if (next == '"' || next == '$' || next == escapeToken) {
                        out.append(next);
                        pos += 2;
                        continue;
                    }
                }
                out.append(ch);
                pos++;
            }
            throw new WordExpansionException("unexpected end of statement while looking for matching double-quote");
        }

        /** Expands the {@code $} reference at {@code pos}. A lone {@code $} stays literal. */
        private String dollar() {
            pos++;
            if (pos >= text.length()) {
                return "$";
            }
            char next = text.charAt(pos);
            if (next == '{') {
                pos++;
                return braced();
            }
            String name = name();
            if (name.isEmpty()) {
                return "$";
            }
            return variables.getOrDefault(name, "");
        }

        private String braced() {
            String name = name();
            if (name.isEmpty()) {
                throw new WordExpansionException("bad substitution: missing variable name in " + text);
            }
            if (pos >= text.length()) {
                throw new WordExpansionException("syntax error: missing '}' in " + text);
            }
            char ch = text.charAt(pos++);
            if (ch == '}') {
                return variables.getOrDefault(name, "");
            }

            boolean colon = ch == ':';
            if (colon) {
                if (pos >= text.length()) {
                    throw new WordExpansionException("syntax error: missing '}' in " + text);
                }
                ch = text.charAt(pos++);
            }
            if (ch != '-' && ch != '+' && ch != '?') {
                throw new WordExpansionException(String.format("unsupported modifier (%c) in substitution", ch));
            }
            String word = untilClosingBrace();

            String value = variables.get(name);
            boolean missing = value == null || (colon && value.isEmpty());
            switch (ch) {
                case '-':
                    return missing ? word : value;
                case '+':
                    return missing ? "" : word;
                default:
                    if (missing) {
                        String message = word.isEmpty() ? "is not allowed to be " + (colon ? "unset or empty" : "unset") : word;
                        throw new WordExpansionException(name + ": " + message);
                    }
                    return value;
            }
        }

        /** Expands the modifier word up to and including the closing brace. */
        private String untilClosingBrace() {
            StringBuilder out = new StringBuilder();
            while (pos < text.length()) {
                char ch = text.charAt(pos);
                if (ch == '}') {
                    pos++;
                    return out.toString();
                }
                if (ch == '$') {
                    out.append(dollar());
                } else if (ch == escapeToken && pos + 1 < text.length()) {
                    out.append(text.charAt(pos + 1));
                    pos += 2;
                } else {
                    out.append(ch);
                    pos++;
                }
            }
            throw new WordExpansionException("syntax error: missing '}' in " + text);
        }

        private String name() {
            int start = pos;
            if (pos < text.length() && isNameStart(text.charAt(pos))) {
                pos++;
                while (pos < text.length() && isNamePart(text.charAt(pos))) {
                    pos++;
                }
            }
            return text.substring(start, pos);
        }
    }

    private static boolean isNameStart(char ch) {
        return ch == '_' || (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    private static boolean isNamePart(char ch) {
        return isNameStart(ch) || (ch >= '0' && ch <= '9');
    }
}
