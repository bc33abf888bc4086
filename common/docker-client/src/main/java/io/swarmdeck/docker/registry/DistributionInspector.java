package io.swarmdeck.docker.registry;

import io.swarmdeck.docker.model.DistributionInspect;

/**
 * Looks up the manifest digest and supported platforms of an image on its registry.
 */
public interface DistributionInspector {

    /**
     * @param image               image reference as written in the service spec
     * @param encodedRegistryAuth base64url-encoded credentials, or {@code null} for anonymous access
     */
    DistributionInspect inspect(String image, String encodedRegistryAuth);
}
