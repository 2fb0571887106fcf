package io.dockerfilexform.core.engine;

import io.dockerfilexform.core.parser.Node;

/**
 * Callback for {@link AstTraversal#traverse}. Throwing stops the walk; the exception reaches the
 * caller of {@code traverse} unchanged.
 *
 * @param <E> exception type the visitor may throw
 */
@FunctionalInterface
public interface NodeVisitor<E extends Exception> {

    void visit(Node node) throws E;
}
