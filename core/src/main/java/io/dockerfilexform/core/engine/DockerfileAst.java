package io.dockerfilexform.core.engine;

import io.dockerfilexform.core.config.RewriteConfig;
import io.dockerfilexform.core.error.DirectiveParseException;
import io.dockerfilexform.core.error.GrammarParseException;
import io.dockerfilexform.core.error.PrintException;
import io.dockerfilexform.core.instructions.KeyValuePairOptional;
import io.dockerfilexform.core.parser.Directive;
import io.dockerfilexform.core.parser.DockerfileParser;
import io.dockerfilexform.core.parser.Node;
import io.dockerfilexform.core.parser.ParseResult;
import io.dockerfilexform.core.reference.ImageReference;
import io.dockerfilexform.core.reference.RefSelector;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parsed Dockerfile: parse once, optionally rewrite image references, print.
 *
 * <pre>{@code
 * DockerfileAst ast = DockerfileAst.parse(text);
 * boolean pinned = ast.injectImageDigest(
 *         RefSelector.nameOnly("myapp"),
 *         ReferenceParser.parseNormalizedNamed("myapp@sha256:..."),
 *         List.of());
 * String rewritten = ast.print();
 * }</pre>
 *
 * <p>
 * Build args passed to an operation are merged after {@link RewriteConfig#buildArgs()}, so a
 * per-call value wins over a configured one.
 *
 * <p>
 * Not thread-safe: rewrite operations mutate the tree.
 */
public final class DockerfileAst {

    private static final DockerfileParser PARSER = new DockerfileParser();

    private final ParseResult result;
    private final RewriteConfig config;
    private final ImageReferenceResolver resolver;
    private final DockerfilePrinter printer;

    private DockerfileAst(ParseResult result, RewriteConfig config) {
        this.result = result;
        this.config = config;
        this.resolver = new ImageReferenceResolver(result.escapeToken(), config.skipStageReferences());
        this.printer = new DockerfilePrinter(config.preserveSpacing());
    }

    /**
     * Parses {@code text} with the default configuration.
     *
     * @throws DirectiveParseException if the directive block is invalid
     * @throws GrammarParseException   if the instructions cannot be parsed
     */
    public static DockerfileAst parse(String text) {
        return parse(text, RewriteConfig.defaults());
    }

    /**
     * Parses {@code text}.
     *
     * @throws DirectiveParseException if the directive block is invalid
     * @throws GrammarParseException   if the instructions cannot be parsed
     */
    public static DockerfileAst parse(String text, RewriteConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new DockerfileAst(PARSER.parse(text), config);
    }

    public List<Directive> directives() {
        return result.directives();
    }

    /** Top-level instructions in source order. */
    public List<Node> root() {
        return result.root();
    }

    public char escapeToken() {
        return result.escapeToken();
    }

    public RewriteConfig config() {
        return config;
    }

    /** Post-order walk over all instructions; see {@link AstTraversal}. */
    public <E extends Exception> void traverse(NodeVisitor<E> visitor) throws E {
        AstTraversal.traverse(result.root(), visitor);
    }

    /** See {@link ImageReferenceResolver#forEachImageReference}. */
    public void forEachImageReference(ImageRefVisitor visitor, List<String> buildArgs) {
        resolver.forEachImageReference(result.root(), overrides(buildArgs), visitor);
    }

    /** Returns every image reference in source order without modifying the tree. */
    public List<ImageReference> findImageReferences(List<String> buildArgs) {
        List<ImageReference> references = new ArrayList<>();
        forEachImageReference(
                (node, reference) -> {
                    references.add(reference);
                    return null;
                },
                buildArgs);
        return references;
    }

    /**
     * Rewrites every reference matched by {@code selector} to {@code replacement}.
     *
     * @return {@code true} if anything was replaced
     */
    public boolean injectImageDigest(RefSelector selector, ImageReference replacement, List<String> buildArgs) {
        return resolver.injectDigest(result.root(), selector, replacement, overrides(buildArgs));
    }

    public String print() {
        return printer.print(result.directives(), result.root());
    }

    /**
     * @throws PrintException if {@code out} fails
     */
    public void print(Appendable out) {
        printer.print(result.directives(), result.root(), out);
    }

    private List<KeyValuePairOptional> overrides(List<String> buildArgs) {
        Objects.requireNonNull(buildArgs, "buildArgs must not be null");
        List<String> merged = new ArrayList<>(config.buildArgs());
        merged.addAll(buildArgs);
        return BuildArgs.parse(merged);
    }
}
