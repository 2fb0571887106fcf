package io.dockerfilexform.core.reference;

import java.util.Objects;

/**
 * A normalized container image reference: {@code domain/path[:tag][@digest]}.
 *
 * <p>
 * Instances come from {@link ReferenceParser#parseNormalizedNamed}, so the domain is always
 * present ({@code docker.io} for Docker Hub) and official images carry the {@code library/} path
 * prefix. {@link #familiarString()} renders the short form users write.
 *
 * @param domain registry host, optionally with port
 * @param path   repository path below the domain
 * @param tag    tag, or {@code null}
 * @param digest content digest ({@code algorithm:hex}), or {@code null}
 */
public record ImageReference(String domain, String path, String tag, String digest) {

    static final String DEFAULT_DOMAIN = "docker.io";
    static final String OFFICIAL_REPO_PREFIX = "library/";

    public ImageReference {
        Objects.requireNonNull(domain, "domain must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }

    /** Fully qualified repository name without tag or digest, e.g. {@code docker.io/library/alpine}. */
    public String name() {
        return domain + "/" + path;
    }

    /** Repository name as users write it, e.g. {@code alpine} or {@code gcr.io/project/app}. */
    public String familiarName() {
        if (!DEFAULT_DOMAIN.equals(domain)) {
            return name();
        }
        if (path.startsWith(OFFICIAL_REPO_PREFIX) && path.indexOf('/', OFFICIAL_REPO_PREFIX.length()) < 0) {
            return path.substring(OFFICIAL_REPO_PREFIX.length());
        }
        return path;
    }

    /** Familiar name plus tag and digest, e.g. {@code alpine:3.18} or {@code myapp@sha256:...}. */
    public String familiarString() {
        return familiarName() + suffix();
    }

    public boolean isTagged() {
        return tag != null;
    }

    public boolean isDigested() {
        return digest != null;
    }

    /**
     * Returns a copy carrying {@code newTag} instead of the current tag.
     *
     * @throws io.dockerfilexform.core.error.ReferenceFormatException if the tag is invalid
     */
    public ImageReference withTag(String newTag) {
        ReferenceParser.validateTag(newTag);
        return new ImageReference(domain, path, newTag, digest);
    }

    /**
     * Returns a copy pinned to {@code newDigest}.
     *
     * @throws io.dockerfilexform.core.error.ReferenceFormatException if the digest is invalid
     */
    public ImageReference withDigest(String newDigest) {
        ReferenceParser.validateDigest(newDigest);
        return new ImageReference(domain, path, tag, newDigest);
    }

    /** Returns a copy with neither tag nor digest. */
    public ImageReference withoutTagOrDigest() {
        return new ImageReference(domain, path, null, null);
    }

    /** Fully qualified form, e.g. {@code docker.io/library/alpine:3.18}. */
    @Override
    public String toString() {
        return name() + suffix();
    }

    private String suffix() {
        StringBuilder sb = new StringBuilder();
        if (tag != null) {
            sb.append(':').append(tag);
        }
        if (digest != null) {
            sb.append('@').append(digest);
        }
        return sb.toString();
    }
}
