package io.dockerfilexform.core.error;

/**
 * Abstract parent for per-instruction interpretation errors: structuring a node, expanding a
 * word, or parsing an image reference. The reference resolver absorbs these and skips the node;
 * direct callers of the structurer, expander or reference parser see them thrown.
 */
public abstract class InterpretException extends DockerfileException {

    private static final long serialVersionUID = 1L;

    private final String keyword;

    protected InterpretException(String message, String keyword) {
        super(message, Phase.INTERPRET);
        this.keyword = keyword;
    }

    /** The instruction keyword being interpreted, or {@code null} if not tied to one. */
    public String keyword() {
        return keyword;
    }
}
