package io.swarmdeck.docker;

import com.github.dockerjava.api.model.ServicePlacement;
import com.github.dockerjava.api.model.SwarmNodePlatform;
import io.swarmdeck.docker.model.DistributionInspect;
import io.swarmdeck.docker.model.DistributionPlatform;
import io.swarmdeck.docker.reference.Digest;
import io.swarmdeck.docker.reference.ImageReference;
import io.swarmdeck.docker.reference.InvalidImageReferenceException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites applied to a service spec using registry information before it is submitted.
 */
public final class ServicePinning {

    private static final Logger log = LoggerFactory.getLogger(ServicePinning.class);

    private ServicePinning() {
    }

    /**
     * Pins {@code image} to {@code digest}.
     *
     * @return the normalized reference with the digest appended, or empty when the image cannot be
     *     parsed, already names a digest, is a bare image id, or the digest itself is malformed
     */
    public static Optional<String> imageWithDigest(String image, String digest) {
        ImageReference reference;
        try {
            reference = ImageReference.parse(image);
        } catch (InvalidImageReferenceException e) {
            log.debug("Not pinning image {}: {}", image, e.getMessage());
            return Optional.empty();
        }
        if (!(reference instanceof ImageReference.Named named)) {
            return Optional.empty();
        }
        Digest parsed;
        try {
            parsed = Digest.parse(digest);
        } catch (InvalidImageReferenceException e) {
            log.debug("Not pinning image {} to {}: {}", image, digest, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(named.withDigest(parsed).toString());
    }

    /**
     * Appends every platform reported by the registry to {@code placement} in place, creating a
     * placement when none exists. Existing platforms keep their position and duplicates are not
     * removed.
     */
    public static ServicePlacement mergePlatforms(ServicePlacement placement, DistributionInspect inspect) {
        ServicePlacement target = placement == null ? new ServicePlacement() : placement;
        if (inspect.platforms().isEmpty()) {
            return target;
        }
        List<SwarmNodePlatform> merged = target.getPlatforms() == null
            ? new ArrayList<>()
            : new ArrayList<>(target.getPlatforms());
        for (DistributionPlatform platform : inspect.platforms()) {
            merged.add(new SwarmNodePlatform()
                .withArchitecture(platform.architecture())
                .withOs(platform.os()));
        }
        target.setPlatforms(merged);
        return target;
    }

    /**
     * Warning attached to a create response when the image could not be pinned by digest.
     */
    public static String digestWarning(String image) {
        return ("image %s could not be accessed on a registry to record\n"
            + "its digest. Each node will access %s independently,\n"
            + "possibly leading to different nodes running different\n"
            + "versions of the image.\n").formatted(image, image);
    }
}
