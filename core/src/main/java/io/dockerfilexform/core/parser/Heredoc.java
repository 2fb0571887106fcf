package io.dockerfilexform.core.parser;

import java.util.Objects;

/**
 * An inline here-document attached to a {@code RUN}, {@code COPY} or {@code ADD} instruction.
 *
 * @param name    terminator word, e.g. {@code EOF}
 * @param content body lines, each including its line ending; verbatim unless {@code chomp} is set
 * @param expand  {@code false} when the terminator was quoted ({@code <<"EOF"})
 * @param chomp   {@code true} for the {@code <<-} form, which strips leading tabs from the body and
 *                terminator
 */
public record Heredoc(String name, String content, boolean expand, boolean chomp) {

    public Heredoc {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /** Number of physical lines the body and terminator occupy. */
    public int lineCount() {
        int lines = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                lines++;
            }
        }
        return lines;
    }
}
