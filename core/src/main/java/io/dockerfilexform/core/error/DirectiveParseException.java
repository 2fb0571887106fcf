package io.dockerfilexform.core.error;

/** Thrown when a leading parser directive is repeated or carries an invalid value. */
public final class DirectiveParseException extends DockerfileParseException {

    private static final long serialVersionUID = 1L;

    public DirectiveParseException(String message, int line) {
        super(message, line);
    }
}
