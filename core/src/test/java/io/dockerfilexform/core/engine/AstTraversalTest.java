package io.dockerfilexform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.dockerfilexform.core.parser.Node;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AstTraversal")
class AstTraversalTest {

    private static List<Node> tree() {
        Node trigger = Node.builder("RUN").argument("make").line(2).build();
        return List.of(
                Node.builder("FROM").argument("alpine").line(1).build(),
                Node.builder("ONBUILD").child(trigger).line(2).build(),
                Node.builder("CMD").argument("sh").line(3).build());
    }

    @Test
    @DisplayName("children are visited before their parent, top level in source order")
    void postOrder() {
        List<String> visited = new ArrayList<>();

        AstTraversal.traverse(tree(), node -> visited.add(node.keyword()));

        assertThat(visited).containsExactly("FROM", "RUN", "ONBUILD", "CMD");
    }

    @Test
    @DisplayName("the first exception stops the walk and reaches the caller unchanged")
    void haltsOnFirstError() {
        List<String> visited = new ArrayList<>();
        IOException failure = new IOException("stop");

        assertThatThrownBy(() -> AstTraversal.traverse(tree(), node -> {
                    visited.add(node.keyword());
                    if ("RUN".equals(node.keyword())) {
                        throw failure;
                    }
                }))
                .isSameAs(failure);
        assertThat(visited).containsExactly("FROM", "RUN");
    }

    @Test
    @DisplayName("an empty tree visits nothing")
    void empty() {
        List<Node> visited = new ArrayList<>();

        AstTraversal.traverse(List.of(), visited::add);

        assertThat(visited).isEmpty();
    }
}
