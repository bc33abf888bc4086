package io.swarmdeck.docker.transport;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Successful Engine API response whose body has not been consumed yet.
 * <p>
 * Closing never throws; a failure to release the underlying connection is logged at DEBUG.
 */
public final class DockerApiResponse implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DockerApiResponse.class);

    private final int statusCode;
    private final InputStream body;
    private final Closeable resource;

    public DockerApiResponse(int statusCode, InputStream body, Closeable resource) {
        this.statusCode = statusCode;
        this.body = body == null ? InputStream.nullInputStream() : body;
        this.resource = Objects.requireNonNull(resource, "resource");
    }

    public int statusCode() {
        return statusCode;
    }

    public InputStream body() {
        return body;
    }

    @Override
    public void close() {
        try {
            resource.close();
        } catch (IOException | RuntimeException e) {
            log.debug("Failed to close Docker API response with status {}: {}", statusCode, e.getMessage(), e);
        }
    }
}
