package io.dockerfilexform.core.error;

import java.io.IOException;

/** Thrown when writing the formatted Dockerfile to its destination fails. */
public final class PrintException extends DockerfileException {

    private static final long serialVersionUID = 1L;

    public PrintException(String message, IOException cause) {
        super(message, cause, Phase.PRINT);
    }
}
