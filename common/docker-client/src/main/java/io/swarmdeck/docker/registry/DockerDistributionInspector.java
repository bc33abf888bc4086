package io.swarmdeck.docker.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.swarmdeck.docker.DockerResponseDecodeException;
import io.swarmdeck.docker.model.DistributionInspect;
import io.swarmdeck.docker.transport.DockerApiResponse;
import io.swarmdeck.docker.transport.DockerApiTransport;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the daemon to contact the registry on our behalf via {@code GET /distribution/{name}/json}.
 */
public class DockerDistributionInspector implements DistributionInspector {

    private static final Logger log = LoggerFactory.getLogger(DockerDistributionInspector.class);

    static final String REGISTRY_AUTH_HEADER = "X-Registry-Auth";

    private final DockerApiTransport transport;
    private final ObjectMapper json;

    public DockerDistributionInspector(DockerApiTransport transport, ObjectMapper json) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.json = Objects.requireNonNull(json, "json");
    }

    @Override
    public DistributionInspect inspect(String image, String encodedRegistryAuth) {
        if (image == null || image.isBlank()) {
            throw new IllegalArgumentException("image must not be blank");
        }
        Map<String, String> headers = new LinkedHashMap<>();
        if (encodedRegistryAuth != null && !encodedRegistryAuth.isEmpty()) {
            headers.put(REGISTRY_AUTH_HEADER, encodedRegistryAuth);
        }
        log.debug("Inspecting distribution of {}", image);
        try (DockerApiResponse response = transport.get("/distribution/" + image + "/json", headers)) {
            return json.readValue(response.body(), DistributionInspect.class);
        } catch (IOException e) {
            throw new DockerResponseDecodeException(
                "Failed to decode distribution inspect response for " + image, null, e);
        }
    }
}
