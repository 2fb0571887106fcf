package io.dockerfilexform.core.reference;

import io.dockerfilexform.core.error.ReferenceFormatException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses image reference strings into normalized {@link ImageReference}s.
 *
 * <p>
 * Grammar: {@code [domain[:port]/]component[/component...][:tag][@algorithm:hex]}. Path components
 * are lowercase alphanumerics joined by {@code .}, {@code _}, {@code __} or runs of {@code -}. A
 * first component without {@code .} or {@code :} (and not {@code localhost}) is a Docker Hub path,
 * normalized to {@code docker.io}, with {@code library/} prepended to single-component names.
 *
 * <p>
 * Thread-safe and stateless; all methods are static.
 */
public final class ReferenceParser {

    private static final int NAME_TOTAL_LENGTH_MAX = 255;

    private static final String ALPHANUMERIC = "[a-z0-9]+";
    private static final String SEPARATOR = "(?:[._]|__|[-]+)";
    private static final String PATH_COMPONENT = ALPHANUMERIC + "(?:" + SEPARATOR + ALPHANUMERIC + ")*";
    private static final String DOMAIN_COMPONENT = "(?:[a-zA-Z0-9]|[a-zA-Z0-9][a-zA-Z0-9-]*[a-zA-Z0-9])";
    private static final String DOMAIN_NAME = DOMAIN_COMPONENT + "(?:\\." + DOMAIN_COMPONENT + ")*";
    private static final String IPV6_ADDRESS = "\\[(?:[a-fA-F0-9:]+)\\]";
    private static final String DOMAIN = "(?:" + DOMAIN_NAME + "|" + IPV6_ADDRESS + ")(?::[0-9]+)?";
    private static final String TAG = "[\\w][\\w.-]{0,127}";
    private static final String DIGEST = "[A-Za-z][A-Za-z0-9]*(?:[-_+.][A-Za-z][A-Za-z0-9]*)*[:][0-9A-Fa-f]{32,}";
    private static final String NAME = "(?:" + DOMAIN + "/)?" + PATH_COMPONENT + "(?:/" + PATH_COMPONENT + ")*";

    private static final Pattern REFERENCE =
            Pattern.compile("^(" + NAME + ")(?::(" + TAG + "))?(?:@(" + DIGEST + "))?$");
    private static final Pattern ANCHORED_NAME =
            Pattern.compile("^(?:(" + DOMAIN + ")/)?(" + PATH_COMPONENT + "(?:/" + PATH_COMPONENT + ")*)$");
    private static final Pattern ANCHORED_TAG = Pattern.compile("^" + TAG + "$");
    private static final Pattern ANCHORED_DIGEST = Pattern.compile("^" + DIGEST + "$");
    private static final Pattern IDENTIFIER = Pattern.compile("^[a-f0-9]{64}$");

    /** Hex length required by each supported digest algorithm. */
    private static final Map<String, Integer> DIGEST_HEX_LENGTHS = Map.of("sha256", 64, "sha384", 96, "sha512", 128);

    private ReferenceParser() {}

    /**
     * Parses a reference as users write it ({@code alpine}, {@code myorg/app:1.0},
     * {@code gcr.io/p/app@sha256:...}) and normalizes it.
     *
     * @throws ReferenceFormatException if {@code value} is not a valid reference
     */
    public static ImageReference parseNormalizedNamed(String value) {
        Objects.requireNonNull(value, "value must not be null");
        if (IDENTIFIER.matcher(value).matches()) {
            throw new ReferenceFormatException(
                    "invalid repository name, cannot specify 64-byte hexadecimal strings", value);
        }

        String domain;
        String remainder;
        int slash = value.indexOf('/');
        String first = slash < 0 ? null : value.substring(0, slash);
        if (first == null
                || (first.indexOf('.') < 0
                        && first.indexOf(':') < 0
                        && !"localhost".equals(first)
                        && first.toLowerCase(Locale.ROOT).equals(first))) {
            domain = ImageReference.DEFAULT_DOMAIN;
            remainder = value;
        } else {
            domain = first;
            remainder = value.substring(slash + 1);
        }
        if ("index.docker.io".equals(domain)) {
            domain = ImageReference.DEFAULT_DOMAIN;
        }
        if (ImageReference.DEFAULT_DOMAIN.equals(domain) && remainder.indexOf('/') < 0) {
            remainder = ImageReference.OFFICIAL_REPO_PREFIX + remainder;
        }

        int colon = remainder.indexOf(':');
        String remoteName = colon < 0 ? remainder : remainder.substring(0, colon);
        if (!remoteName.toLowerCase(Locale.ROOT).equals(remoteName)) {
            throw new ReferenceFormatException("repository name must be lowercase", value);
        }
        return parse(domain + "/" + remainder, value);
    }

    /** Parses an already-qualified reference; {@code original} is reported in errors. */
    private static ImageReference parse(String qualified, String original) {
        Matcher m = REFERENCE.matcher(qualified);
        if (!m.matches()) {
            if (qualified.isEmpty()) {
                throw new ReferenceFormatException("repository name must have at least one component", original);
            }
            throw new ReferenceFormatException("invalid reference format", original);
        }

        String name = m.group(1);
        if (name.length() > NAME_TOTAL_LENGTH_MAX) {
            throw new ReferenceFormatException(
                    "repository name must not be more than " + NAME_TOTAL_LENGTH_MAX + " characters", original);
        }
        String digest = m.group(3);
        if (digest != null) {
            validateDigest(digest);
        }

        Matcher nameMatch = ANCHORED_NAME.matcher(name);
        if (!nameMatch.matches()) {
            throw new ReferenceFormatException("invalid reference format", original);
        }
        return new ImageReference(nameMatch.group(1), nameMatch.group(2), m.group(2), digest);
    }

    static void validateTag(String tag) {
        if (tag == null || !ANCHORED_TAG.matcher(tag).matches()) {
            throw new ReferenceFormatException("invalid tag format", String.valueOf(tag));
        }
    }

    static void validateDigest(String digest) {
        if (digest == null || !ANCHORED_DIGEST.matcher(digest).matches()) {
            throw new ReferenceFormatException("invalid digest format", String.valueOf(digest));
        }
        int colon = digest.indexOf(':');
        String algorithm = digest.substring(0, colon);
        String hex = digest.substring(colon + 1);
        Integer length = DIGEST_HEX_LENGTHS.get(algorithm);
        if (length == null) {
            throw new ReferenceFormatException("unsupported digest algorithm", digest);
        }
        if (hex.length() != length || !hex.chars().allMatch(c -> (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
            throw new ReferenceFormatException("invalid checksum digest format", digest);
        }
    }
}
