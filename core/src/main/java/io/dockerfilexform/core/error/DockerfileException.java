package io.dockerfilexform.core.error;

/**
 * Abstract base for all dockerfile-xform exceptions. Never thrown directly; use the concrete
 * subclasses under {@link DockerfileParseException}, {@link InterpretException} or
 * {@link PrintException}.
 */
public abstract class DockerfileException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        INTERPRET,
        PRINT
    }

    private final Phase phase;

    protected DockerfileException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected DockerfileException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
