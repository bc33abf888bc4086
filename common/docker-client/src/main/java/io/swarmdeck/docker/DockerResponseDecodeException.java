package io.swarmdeck.docker;

/**
 * A response body could not be decoded into the expected type.
 * <p>
 * When raised by {@link DockerServiceClient#createService} the partial response still carries any
 * warning collected before decoding, so callers can surface it alongside the failure.
 */
public class DockerResponseDecodeException extends DockerClientException {

    private final transient Object partialResponse;

    public DockerResponseDecodeException(String message, Object partialResponse, Throwable cause) {
        super(message, cause);
        this.partialResponse = partialResponse;
    }

    public <T> T getPartialResponse(Class<T> type) {
        return type.isInstance(partialResponse) ? type.cast(partialResponse) : null;
    }
}
