package io.dockerfilexform.core.instructions;

import io.dockerfilexform.core.parser.Node;
import java.util.List;
import java.util.Objects;

/**
 * {@code COPY [--from=...] [--chown=...] [--chmod=...] [--link] [--parents] [--exclude=...] src... dest}.
 *
 * @param node    source node
 * @param sources source paths (or heredoc markers)
 * @param dest    destination path
 * @param from    value of {@code --from}, or {@code null}
 * @param chown   value of {@code --chown}, or {@code null}
 * @param chmod   value of {@code --chmod}, or {@code null}
 * @param link    whether {@code --link} was given
 * @param parents whether {@code --parents} was given
 * @param exclude every {@code --exclude} pattern, in order
 */
public record CopyInstruction(
        Node node, List<String> sources, String dest, String from, String chown, String chmod, boolean link,
        boolean parents, List<String> exclude)
        implements Instruction {

    public CopyInstruction {
        sources = List.copyOf(Objects.requireNonNull(sources, "sources must not be null"));
        Objects.requireNonNull(dest, "dest must not be null");
        exclude = List.copyOf(Objects.requireNonNull(exclude, "exclude must not be null"));
    }

    public boolean hasFrom() {
        return from != null && !from.isEmpty();
    }
}
