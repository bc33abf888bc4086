package io.swarmdeck.docker;

/**
 * Indicates that the Docker daemon could not be reached from the current runtime.
 */
public class DockerDaemonUnavailableException extends DockerClientException {

    public DockerDaemonUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
