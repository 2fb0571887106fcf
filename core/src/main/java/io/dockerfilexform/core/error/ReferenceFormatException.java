package io.dockerfilexform.core.error;

/** Thrown when a string is not a valid image reference. */
public final class ReferenceFormatException extends InterpretException {

    private static final long serialVersionUID = 1L;

    private final String input;

    public ReferenceFormatException(String message, String input) {
        super(message + ": " + input, null);
        this.input = input;
    }

    /** The rejected input string. */
    public String input() {
        return input;
    }
}
