package io.dockerfilexform.core.error;

/**
 * Abstract parent for fatal parse errors. Thrown by {@code DockerfileParser.parse()} and
 * {@code DirectiveParser.parseAll()}. Carries the 1-based source line that triggered the error.
 */
public abstract class DockerfileParseException extends DockerfileException {

    private static final long serialVersionUID = 1L;

    private final int line;

    protected DockerfileParseException(String message, int line) {
        super(format(message, line), Phase.PARSE);
        this.line = line;
    }

    /** The 1-based source line, or {@code 0} if the error is not tied to a line. */
    public int line() {
        return line;
    }

    private static String format(String message, int line) {
        return line > 0 ? "line " + line + ": " + message : message;
    }
}
