package io.dockerfilexform.core.engine;

import io.dockerfilexform.core.error.InstructionParseException;
import io.dockerfilexform.core.error.ReferenceFormatException;
import io.dockerfilexform.core.error.WordExpansionException;
import io.dockerfilexform.core.instructions.ArgInstruction;
import io.dockerfilexform.core.instructions.CopyInstruction;
import io.dockerfilexform.core.instructions.InstructionParser;
import io.dockerfilexform.core.instructions.KeyValuePairOptional;
import io.dockerfilexform.core.instructions.StageInstruction;
import io.dockerfilexform.core.parser.Keyword;
import io.dockerfilexform.core.parser.Node;
import io.dockerfilexform.core.reference.ImageReference;
import io.dockerfilexform.core.reference.RefSelector;
import io.dockerfilexform.core.reference.ReferenceParser;
import io.dockerfilexform.core.shell.ShellLexer;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the image references of a Dockerfile tree and optionally rewrites them in place.
 *
 * <p>
 * Inspects top-level {@code FROM} base names (after {@code ARG} substitution) and the
 * {@code --from} flag of {@code COPY} instructions at any depth. Per-node failures (an instruction
 * that does not structure, a word that does not expand, a string that is not a reference) skip
 * that node and never abort the walk; they are logged at DEBUG.
 *
 * <p>
 * Thread-safe itself, but a pass mutates the nodes it is given: never run two passes over the same
 * tree concurrently.
 */
public final class ImageReferenceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ImageReferenceResolver.class);

    private static final String FROM_FLAG_PREFIX = "--from=";

    private final char escapeToken;
    private final boolean skipStageReferences;

    /** Resolver that skips references to earlier build stages. */
    public ImageReferenceResolver(char escapeToken) {
        this(escapeToken, true);
    }

    /**
     * @param escapeToken         escape token of the parsed file, used for word expansion
     * @param skipStageReferences whether names of earlier stages and stage indices are skipped
     */
    public ImageReferenceResolver(char escapeToken, boolean skipStageReferences) {
        this.escapeToken = escapeToken;
        this.skipStageReferences = skipStageReferences;
    }

    /**
     * Calls {@code visitor} for every image reference in {@code root}, in source order, and writes
     * back any replacement it returns.
     *
     * @param root              top-level nodes
     * @param externalOverrides build args overriding in-file {@code ARG} defaults
     * @param visitor           receives each reference; returns a replacement or {@code null}
     */
    public void forEachImageReference(
            List<Node> root, List<KeyValuePairOptional> externalOverrides, ImageRefVisitor visitor) {
        Objects.requireNonNull(visitor, "visitor must not be null");
        Pass pass = new Pass(new VariableScope(new ShellLexer(escapeToken), externalOverrides), visitor);
        AstTraversal.traverse(root, pass::visit);
    }

    /**
     * Replaces every reference matched by {@code selector} with {@code replacement}.
     *
     * @return {@code true} if at least one reference was replaced
     */
    public boolean injectDigest(
            List<Node> root,
            RefSelector selector,
            ImageReference replacement,
            List<KeyValuePairOptional> externalOverrides) {
        Objects.requireNonNull(selector, "selector must not be null");
        Objects.requireNonNull(replacement, "replacement must not be null");
        boolean[] modified = {false};
        forEachImageReference(root, externalOverrides, (node, reference) -> {
            if (!selector.matches(reference)) {
                return null;
            }
            modified[0] = true;
            LOG.info(
                    "Replacing image reference {} with {} in {} at line {}",
                    reference.familiarString(),
                    replacement.familiarString(),
                    node.keyword(),
                    node.startLine());
            return replacement;
        });
        return modified[0];
    }

    /** State of one walk: variable scope and the stage names declared so far. */
    private final class Pass {

        private final VariableScope scope;
        private final ImageRefVisitor visitor;
        private final Set<String> stageNames = new HashSet<>();

        Pass(VariableScope scope, ImageRefVisitor visitor) {
            this.scope = scope;
            this.visitor = visitor;
        }

        void visit(Node node) {
            Keyword keyword = node.knownKeyword();
            if (keyword == Keyword.ARG && !node.isNested()) {
                declareArgs(node);
            } else if (keyword == Keyword.FROM && !node.isNested()) {
                visitStage(node);
            } else if (keyword == Keyword.COPY) {
                visitCopy(node);
            }
        }

        private void declareArgs(Node node) {
            ArgInstruction arg;
            try {
                arg = InstructionParser.parseArg(node);
            } catch (InstructionParseException e) {
                LOG.debug("Ignoring ARG at line {} ({}): {}", node.startLine(), node.original(), e.getMessage());
                return;
            }
            scope.declare(arg);
        }

        private void visitStage(Node node) {
            if (node.arguments().isEmpty()) {
                return;
            }

            String baseName;
            String stageName = null;
            try {
                StageInstruction stage = InstructionParser.parseStage(node);
                baseName = stage.baseName();
                stageName = stage.name();
            } catch (InstructionParseException e) {
                LOG.debug("FROM at line {} did not parse ({}); using first argument", node.startLine(), e.getMessage());
                baseName = node.firstArgument();
            }

            try {
                String expanded = expand(node, baseName);
                if (expanded.isEmpty()) {
                    return;
                }
                if (isStageReference(expanded)) {
                    LOG.debug("Skipping FROM at line {}: '{}' names an earlier stage", node.startLine(), expanded);
                    return;
                }
                ImageReference reference = parseReference(node, expanded);
                if (reference == null) {
                    return;
                }
                ImageReference replacement = visitor.visit(node, reference);
                if (replacement != null) {
                    node.setArgument(0, replacement.familiarString());
                }
            } finally {
                if (stageName != null) {
                    stageNames.add(stageName);
                }
            }
        }

        private void visitCopy(Node node) {
            if (node.flags().isEmpty()) {
                return;
            }

            CopyInstruction copy;
            try {
                copy = InstructionParser.parseCopy(node);
            } catch (InstructionParseException e) {
                LOG.debug("Ignoring COPY at line {} ({}): {}", node.startLine(), node.original(), e.getMessage());
                return;
            }
            if (!copy.hasFrom()) {
                return;
            }
            if (isStageReference(copy.from())) {
                LOG.debug("Skipping COPY at line {}: --from={} names a stage", node.startLine(), copy.from());
                return;
            }

            ImageReference reference = parseReference(node, copy.from());
            if (reference == null) {
                return;
            }
            ImageReference replacement = visitor.visit(node, reference);
            if (replacement == null) {
                return;
            }
            List<String> flags = node.flags();
            for (int i = 0; i < flags.size(); i++) {
                if (flags.get(i).startsWith(FROM_FLAG_PREFIX)) {
                    node.setFlag(i, FROM_FLAG_PREFIX + replacement.familiarString());
                }
            }
        }

        /** Expands variables in {@code word}; falls back to the word itself when expansion fails. */
        private String expand(Node node, String word) {
            try {
                return scope.expand(word);
            } catch (WordExpansionException e) {
                LOG.debug("Using unexpanded '{}' at line {}: {}", word, node.startLine(), e.getMessage());
                return word;
            }
        }

        private ImageReference parseReference(Node node, String value) {
            try {
                return ReferenceParser.parseNormalizedNamed(value);
            } catch (ReferenceFormatException e) {
                LOG.debug(
                        "Skipping {} at line {} ({}): {}",
                        node.keyword(),
                        node.startLine(),
                        node.original(),
                        e.getMessage());
                return null;
            }
        }

        private boolean isStageReference(String value) {
            if (!skipStageReferences) {
                return false;
            }
            return stageNames.contains(value.toLowerCase(Locale.ROOT)) || isStageIndex(value);
        }
    }

    private static boolean isStageIndex(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }
}
