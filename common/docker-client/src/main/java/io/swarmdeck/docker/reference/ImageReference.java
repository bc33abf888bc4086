package io.swarmdeck.docker.reference;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed container image reference.
 * <p>
 * References are normalized the way the Docker daemon does it: an image without a registry
 * domain lives on {@code docker.io}, and single-component names on that registry are placed
 * under {@code library/}. A {@link Named} reference may carry a tag, a {@link Canonical}
 * reference is additionally pinned to a content digest, and an {@link Identifier} is a bare
 * image id or digest with no repository name at all.
 */
public sealed interface ImageReference
    permits ImageReference.Named, ImageReference.Canonical, ImageReference.Identifier {

    String DEFAULT_DOMAIN = "docker.io";
    String LEGACY_DEFAULT_DOMAIN = "index.docker.io";
    String OFFICIAL_REPOSITORY_PREFIX = "library/";
    int NAME_TOTAL_LENGTH_MAX = 255;

    /**
     * Parses any reference form: a 64-character hex id, a bare digest, or a (possibly
     * familiar) repository name with optional tag and digest.
     *
     * @throws InvalidImageReferenceException when {@code reference} is not valid
     */
    static ImageReference parse(String reference) {
        if (reference == null || reference.isEmpty()) {
            throw new InvalidImageReferenceException(String.valueOf(reference),
                "repository name must have at least one component");
        }
        if (Grammar.IDENTIFIER.matcher(reference).matches()) {
            return new Identifier(new Digest("sha256", reference));
        }
        if (Digest.isDigest(reference)) {
            return new Identifier(Digest.parse(reference));
        }
        return parseNormalizedNamed(reference);
    }

    /**
     * Parses a repository reference, filling in the default domain and official repository
     * prefix where the reference omits them.
     */
    static ImageReference parseNormalizedNamed(String reference) {
        if (Grammar.IDENTIFIER.matcher(reference).matches()) {
            throw new InvalidImageReferenceException(reference,
                "cannot specify 64-byte hexadecimal strings");
        }
        String domain;
        String remainder;
        int slash = reference.indexOf('/');
        String first = slash == -1 ? "" : reference.substring(0, slash);
        if (slash == -1
            || (!first.contains(".") && !first.contains(":") && !"localhost".equals(first))) {
            domain = DEFAULT_DOMAIN;
            remainder = reference;
        } else {
            domain = first;
            remainder = reference.substring(slash + 1);
        }
        if (LEGACY_DEFAULT_DOMAIN.equals(domain)) {
            domain = DEFAULT_DOMAIN;
        }
        if (DEFAULT_DOMAIN.equals(domain) && remainder.indexOf('/') == -1) {
            remainder = OFFICIAL_REPOSITORY_PREFIX + remainder;
        }
        int colon = remainder.indexOf(':');
        String remoteName = colon == -1 ? remainder : remainder.substring(0, colon);
        if (!remoteName.toLowerCase(Locale.ROOT).equals(remoteName)) {
            throw new InvalidImageReferenceException(reference, "repository name must be lowercase");
        }

        Matcher matcher = Grammar.REFERENCE.matcher(domain + "/" + remainder);
        if (!matcher.matches()) {
            throw new InvalidImageReferenceException(reference, "does not match the reference grammar");
        }
        String name = matcher.group(1);
        if (name.length() > NAME_TOTAL_LENGTH_MAX) {
            throw new InvalidImageReferenceException(reference,
                "repository name must not be more than " + NAME_TOTAL_LENGTH_MAX + " characters");
        }
        String path = name.substring(domain.length() + 1);
        String tag = matcher.group(2);
        String digest = matcher.group(3);
        if (digest != null) {
            return new Canonical(domain, path, tag, Digest.parse(digest));
        }
        return new Named(domain, path, tag);
    }

    /**
     * Reference as a normalized string, e.g. {@code docker.io/library/nginx:1.25}.
     */
    String toString();

    record Named(String domain, String path, String tag) implements ImageReference {

        public Named {
            Objects.requireNonNull(domain, "domain");
            Objects.requireNonNull(path, "path");
        }

        public String name() {
            return domain + "/" + path;
        }

        public boolean isTagged() {
            return tag != null;
        }

        public Canonical withDigest(Digest digest) {
            return new Canonical(domain, path, tag, Objects.requireNonNull(digest, "digest"));
        }

        @Override
        public String toString() {
            return tag == null ? name() : name() + ":" + tag;
        }
    }

    record Canonical(String domain, String path, String tag, Digest digest) implements ImageReference {

        public Canonical {
            Objects.requireNonNull(domain, "domain");
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(digest, "digest");
        }

        public String name() {
            return domain + "/" + path;
        }

        @Override
        public String toString() {
            String named = tag == null ? name() : name() + ":" + tag;
            return named + "@" + digest;
        }
    }

    record Identifier(Digest digest) implements ImageReference {

        public Identifier {
            Objects.requireNonNull(digest, "digest");
        }

        @Override
        public String toString() {
            return digest.toString();
        }
    }

    final class Grammar {
        private static final String DOMAIN_COMPONENT =
            "(?:[a-zA-Z0-9]|[a-zA-Z0-9][a-zA-Z0-9-]*[a-zA-Z0-9])";
        private static final String DOMAIN =
            DOMAIN_COMPONENT + "(?:\\." + DOMAIN_COMPONENT + ")*(?::[0-9]+)?";
        private static final String NAME_COMPONENT = "[a-z0-9]+(?:(?:[._]|__|[-]*)[a-z0-9]+)*";
        private static final String NAME =
            "(?:" + DOMAIN + "/)?" + NAME_COMPONENT + "(?:/" + NAME_COMPONENT + ")*";
        private static final String TAG = "[\\w][\\w.-]{0,127}";
        private static final String DIGEST =
            "[A-Za-z][A-Za-z0-9]*(?:[-_+.][A-Za-z][A-Za-z0-9]*)*:[a-f0-9]{32,}";

        static final Pattern IDENTIFIER = Pattern.compile("[a-f0-9]{64}");
        static final Pattern REFERENCE =
            Pattern.compile("(" + NAME + ")(?::(" + TAG + "))?(?:@(" + DIGEST + "))?");

        private Grammar() {
        }
    }
}
