package io.dockerfilexform.core.instructions;

import io.dockerfilexform.core.parser.Node;

/**
 * A node interpreted as a typed instruction. Only the instructions that carry image references or
 * variable defaults are modelled.
 */
public sealed interface Instruction permits ArgInstruction, StageInstruction, CopyInstruction {

    /** The node this instruction was read from. */
    Node node();
}
