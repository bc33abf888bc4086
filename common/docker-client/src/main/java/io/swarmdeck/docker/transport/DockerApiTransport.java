package io.swarmdeck.docker.transport;

import java.util.Map;

/**
 * Minimal HTTP port onto the Docker Engine API.
 * <p>
 * Implementations raise {@link io.swarmdeck.docker.DockerApiException} for non-successful status
 * codes and {@link io.swarmdeck.docker.DockerDaemonUnavailableException} when the daemon cannot be
 * reached. A returned response is always successful and must be closed by the caller.
 */
public interface DockerApiTransport {

    /**
     * API version this transport speaks, e.g. {@code 1.41}; {@code null} when unversioned.
     */
    String apiVersion();

    DockerApiResponse post(String path, Map<String, String> headers, Object body);

    DockerApiResponse get(String path, Map<String, String> headers);
}
