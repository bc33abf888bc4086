package io.swarmdeck.docker.reference;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Content digest in {@code algorithm:hex} form.
 */
public record Digest(String algorithm, String hex) {

    private static final Pattern DIGEST =
        Pattern.compile("[A-Za-z][A-Za-z0-9]*(?:[-_+.][A-Za-z][A-Za-z0-9]*)*:[a-f0-9]{32,}");

    private static final Map<String, Integer> HEX_LENGTHS = Map.of(
        "sha256", 64,
        "sha384", 96,
        "sha512", 128);

    public Digest {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(hex, "hex");
    }

    /**
     * Parses and validates a digest. Only the SHA-2 algorithms are accepted and the hex part must
     * be the lowercase hex encoding of the length the algorithm produces.
     *
     * @throws InvalidImageReferenceException when the value is not a supported digest
     */
    public static Digest parse(String value) {
        if (value == null || !DIGEST.matcher(value).matches()) {
            throw new InvalidImageReferenceException(String.valueOf(value), "invalid digest format");
        }
        int colon = value.indexOf(':');
        String algorithm = value.substring(0, colon);
        String hex = value.substring(colon + 1);
        Integer expected = HEX_LENGTHS.get(algorithm);
        if (expected == null) {
            throw new InvalidImageReferenceException(value, "unsupported digest algorithm " + algorithm);
        }
        if (hex.length() != expected) {
            throw new InvalidImageReferenceException(value, "invalid " + algorithm + " digest length");
        }
        return new Digest(algorithm, hex);
    }

    static boolean isDigest(String value) {
        if (value == null || !DIGEST.matcher(value).matches()) {
            return false;
        }
        int colon = value.indexOf(':');
        Integer expected = HEX_LENGTHS.get(value.substring(0, colon));
        return expected != null && value.length() - colon - 1 == expected;
    }

    @Override
    public String toString() {
        return algorithm + ":" + hex;
    }
}
