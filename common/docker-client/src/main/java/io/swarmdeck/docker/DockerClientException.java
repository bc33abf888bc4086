package io.swarmdeck.docker;

/**
 * Base type for failures raised while talking to the Docker Engine API.
 */
public class DockerClientException extends RuntimeException {

    public DockerClientException(String message) {
        super(message);
    }

    public DockerClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
