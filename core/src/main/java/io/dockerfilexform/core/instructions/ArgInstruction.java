package io.dockerfilexform.core.instructions;

import io.dockerfilexform.core.parser.Node;
import java.util.List;
import java.util.Objects;

/** {@code ARG NAME[=default] ...}. */
public record ArgInstruction(Node node, List<KeyValuePairOptional> pairs) implements Instruction {

    public ArgInstruction {
        pairs = List.copyOf(Objects.requireNonNull(pairs, "pairs must not be null"));
    }
}
