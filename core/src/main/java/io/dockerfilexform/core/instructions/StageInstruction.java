package io.dockerfilexform.core.instructions;

import io.dockerfilexform.core.parser.Node;
import java.util.Objects;

/**
 * {@code FROM [--platform=...] base [AS name]}: the start of a build stage.
 *
 * @param node     source node
 * @param baseName base image as written, variables unexpanded
 * @param name     lowercase stage name, or {@code null} for an unnamed stage
 * @param platform value of {@code --platform}, or {@code null}
 */
public record StageInstruction(Node node, String baseName, String name, String platform) implements Instruction {

    public StageInstruction {
        Objects.requireNonNull(baseName, "baseName must not be null");
    }
}
