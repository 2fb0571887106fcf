package io.dockerfilexform.core.reference;

import java.util.Objects;

/** Decides whether an image reference found in a Dockerfile should be rewritten. */
@FunctionalInterface
public interface RefSelector {

    boolean matches(ImageReference reference);

    /** Matches any reference to the same repository, whatever its tag or digest. */
    static RefSelector nameOnly(ImageReference target) {
        Objects.requireNonNull(target, "target must not be null");
        String name = target.name();
        return reference -> name.equals(reference.name());
    }

    /** Parses {@code target} and matches any reference to the same repository. */
    static RefSelector nameOnly(String target) {
        return nameOnly(ReferenceParser.parseNormalizedNamed(target));
    }

    /** Matches only references equal to {@code target}, tag and digest included. */
    static RefSelector exact(ImageReference target) {
        Objects.requireNonNull(target, "target must not be null");
        return target::equals;
    }
}
