package io.dockerfilexform.core.error;

/** Thrown when the instruction grammar cannot be parsed (bad key/value, unterminated heredoc, ...). */
public final class GrammarParseException extends DockerfileParseException {

    private static final long serialVersionUID = 1L;

    public GrammarParseException(String message, int line) {
        super(message, line);
    }
}
