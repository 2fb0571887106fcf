package io.dockerfilexform.core.instructions;

import io.dockerfilexform.core.error.InstructionParseException;
import io.dockerfilexform.core.parser.Keyword;
import io.dockerfilexform.core.parser.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns parsed {@link Node}s into typed {@link Instruction}s. Supports {@code ARG}, {@code FROM} and
 * {@code COPY}; any other keyword is rejected.
 *
 * <p>
 * Thread-safe and stateless; all methods are static.
 */
public final class InstructionParser {

    private static final Pattern STAGE_NAME = Pattern.compile("^[a-z][a-z0-9_.-]*$");

    private InstructionParser() {}

    /**
     * Interprets {@code node}.
     *
     * @throws InstructionParseException if the keyword is unsupported or the node is malformed
     */
    public static Instruction parse(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        Keyword keyword = node.knownKeyword();
        if (keyword == Keyword.ARG) {
            return parseArg(node);
        }
        if (keyword == Keyword.FROM) {
            return parseStage(node);
        }
        if (keyword == Keyword.COPY) {
            return parseCopy(node);
        }
        throw new InstructionParseException("unsupported instruction: " + node.keyword(), node.keyword());
    }

    /** {@code ARG NAME[=value] ...}. */
    public static ArgInstruction parseArg(Node node) {
        requireKeyword(node, Keyword.ARG);
        new BuildFlags("ARG").parse(node.flags());
        if (node.arguments().isEmpty()) {
            throw new InstructionParseException("ARG requires at least one argument", "ARG");
        }
        List<KeyValuePairOptional> pairs = new ArrayList<>();
        for (String argument : node.arguments()) {
            int eq = argument.indexOf('=');
            if (eq == 0) {
                throw new InstructionParseException("ARG names can not be blank", "ARG");
            }
            pairs.add(eq < 0
                    ? new KeyValuePairOptional(argument, null)
                    : new KeyValuePairOptional(argument.substring(0, eq), argument.substring(eq + 1)));
        }
        return new ArgInstruction(node, pairs);
    }

    /** {@code FROM [--platform=...] base [AS name]}. */
    public static StageInstruction parseStage(Node node) {
        requireKeyword(node, Keyword.FROM);
        BuildFlags flags = new BuildFlags("FROM").addString("platform").parse(node.flags());

        List<String> args = node.arguments();
        boolean named = args.size() == 3 && "AS".equalsIgnoreCase(args.get(1));
        if (args.size() != 1 && !named) {
            throw new InstructionParseException("FROM requires either one or three arguments", "FROM");
        }

        String name = null;
        if (named) {
            name = args.get(2).toLowerCase(Locale.ROOT);
            if (!STAGE_NAME.matcher(name).matches()) {
                throw new InstructionParseException(
                        String.format(
                                "invalid name for build stage: \"%s\", name can't start with a number or contain symbols",
                                args.get(2)),
                        "FROM");
            }
        }
        return new StageInstruction(node, args.get(0), name, flags.string("platform"));
    }

    /** {@code COPY [flags] src... dest}. */
    public static CopyInstruction parseCopy(Node node) {
        requireKeyword(node, Keyword.COPY);
        BuildFlags flags = new BuildFlags("COPY")
                .addString("from")
                .addString("chown")
                .addString("chmod")
                .addBool("link")
                .addBool("parents")
                .addStrings("exclude")
                .parse(node.flags());

        List<String> args = node.arguments();
        if (args.size() < 2) {
            throw new InstructionParseException(
                    "COPY requires at least two arguments, but only one was provided. Destination could not be determined.",
                    "COPY");
        }
        return new CopyInstruction(
                node,
                args.subList(0, args.size() - 1),
                args.get(args.size() - 1),
                flags.string("from"),
                flags.string("chown"),
                flags.string("chmod"),
                flags.bool("link"),
                flags.bool("parents"),
                flags.strings("exclude"));
    }

    private static void requireKeyword(Node node, Keyword expected) {
        if (node.knownKeyword() != expected) {
            throw new InstructionParseException(
                    "expected " + expected + " instruction, got " + node.keyword(), node.keyword());
        }
    }
}
