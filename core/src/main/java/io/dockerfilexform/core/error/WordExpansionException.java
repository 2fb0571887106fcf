package io.dockerfilexform.core.error;

/** Thrown when variable substitution on a word fails (bad modifier, unterminated brace, {@code ?}). */
public final class WordExpansionException extends InterpretException {

    private static final long serialVersionUID = 1L;

    public WordExpansionException(String message) {
        super(message, null);
    }
}
