package io.swarmdeck.docker.reference;

import io.swarmdeck.docker.DockerClientException;

public class InvalidImageReferenceException extends DockerClientException {

    public InvalidImageReferenceException(String reference, String reason) {
        super("invalid reference format '" + reference + "': " + reason);
    }
}
