package io.dockerfilexform.core.error;

/** Thrown when a parsed node cannot be turned into a typed instruction (bad flags, arity, names). */
public final class InstructionParseException extends InterpretException {

    private static final long serialVersionUID = 1L;

    public InstructionParseException(String message, String keyword) {
        super(message, keyword);
    }
}
