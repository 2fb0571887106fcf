package io.dockerfilexform.core.engine;

import io.dockerfilexform.core.parser.Node;
import java.util.List;
import java.util.Objects;

/**
 * Post-order walk over a Dockerfile tree: a node's children ({@code ONBUILD} triggers) are visited
 * before the node, and top-level nodes in source order. Halts on the first exception thrown by the
 * visitor.
 */
public final class AstTraversal {

    private AstTraversal() {}

    public static <E extends Exception> void traverse(List<Node> root, NodeVisitor<E> visitor) throws E {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(visitor, "visitor must not be null");
        for (Node node : root) {
            traverseNode(node, visitor);
        }
    }

    private static <E extends Exception> void traverseNode(Node node, NodeVisitor<E> visitor) throws E {
        for (Node child : node.children()) {
            traverseNode(child, visitor);
        }
        visitor.visit(node);
    }
}
