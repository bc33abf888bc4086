package io.swarmdeck.docker;

/**
 * The daemon answered a request with a non-successful status code.
 */
public class DockerApiException extends DockerClientException {

    private final int statusCode;

    public DockerApiException(int statusCode, String message) {
        super("Docker API returned status " + statusCode + ": " + message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
