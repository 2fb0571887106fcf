package io.dockerfilexform.core.engine;

import io.dockerfilexform.core.parser.Node;
import io.dockerfilexform.core.reference.ImageReference;

/** Receives each image reference found by {@link ImageReferenceResolver}. */
@FunctionalInterface
public interface ImageRefVisitor {

    /**
     * Called for one resolved reference.
     *
     * @param node      the {@code FROM} or {@code COPY} node the reference came from
     * @param reference the reference after variable substitution and normalization
     * @return a replacement to write back into the node, or {@code null} to leave it unchanged
     */
    ImageReference visit(Node node, ImageReference reference);
}
