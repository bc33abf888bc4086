package io.swarmdeck.docker.model;

/**
 * Per-call options for service creation.
 *
 * @param encodedRegistryAuth base64url-encoded registry credentials, sent as {@code X-Registry-Auth}
 * @param queryRegistry       whether to resolve the image digest and platforms through the registry
 */
public record ServiceCreateOptions(String encodedRegistryAuth, boolean queryRegistry) {

    public static ServiceCreateOptions defaults() {
        return new ServiceCreateOptions(null, false);
    }

    public static ServiceCreateOptions queryingRegistry(String encodedRegistryAuth) {
        return new ServiceCreateOptions(encodedRegistryAuth, true);
    }

    public boolean hasRegistryAuth() {
        return encodedRegistryAuth != null && !encodedRegistryAuth.isEmpty();
    }
}
