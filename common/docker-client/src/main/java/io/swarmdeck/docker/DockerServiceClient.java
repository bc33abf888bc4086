package io.swarmdeck.docker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.model.ContainerSpec;
import com.github.dockerjava.api.model.ServiceSpec;
import com.github.dockerjava.api.model.TaskSpec;
import io.swarmdeck.docker.model.DistributionInspect;
import io.swarmdeck.docker.model.ServiceCreateOptions;
import io.swarmdeck.docker.model.ServiceCreateResponse;
import io.swarmdeck.docker.registry.DistributionInspector;
import io.swarmdeck.docker.transport.DockerApiResponse;
import io.swarmdeck.docker.transport.DockerApiTransport;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Submits Swarm services to a Docker daemon.
 * <p>
 * When asked to, the client first resolves the service image through the registry so every node
 * runs the same image: the reference is pinned to the manifest digest and the placement is
 * narrowed to the platforms the image was published for. Both rewrites are applied to the given
 * {@link ServiceSpec} in place. A failed lookup does not stop the submission; the daemon response
 * then carries a warning instead.
 */
public class DockerServiceClient {

    private static final Logger log = LoggerFactory.getLogger(DockerServiceClient.class);

    static final String SERVICES_CREATE_PATH = "/services/create";
    static final String VERSION_HEADER = "version";
    static final String REGISTRY_AUTH_HEADER = "X-Registry-Auth";

    private final DockerApiTransport transport;
    private final DistributionInspector distributionInspector;
    private final ObjectMapper json;
    private final ServiceCreateOptions defaultOptions;

    public DockerServiceClient(DockerApiTransport transport,
                               DistributionInspector distributionInspector,
                               ObjectMapper json) {
        this(transport, distributionInspector, json, ServiceCreateOptions.defaults());
    }

    public DockerServiceClient(DockerApiTransport transport,
                               DistributionInspector distributionInspector,
                               ObjectMapper json,
                               ServiceCreateOptions defaultOptions) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.distributionInspector = Objects.requireNonNull(distributionInspector, "distributionInspector");
        this.json = Objects.requireNonNull(json, "json");
        this.defaultOptions = defaultOptions != null ? defaultOptions : ServiceCreateOptions.defaults();
    }

    public ServiceCreateResponse createService(ServiceSpec service) {
        return createService(service, defaultOptions);
    }

    /**
     * Creates a service.
     *
     * @throws DockerApiException              when the daemon rejects the request
     * @throws DockerDaemonUnavailableException when the daemon cannot be reached
     * @throws DockerResponseDecodeException   when the daemon response cannot be decoded; the
     *                                         partial {@link ServiceCreateResponse} keeps any warning
     */
    public ServiceCreateResponse createService(ServiceSpec service, ServiceCreateOptions options) {
        Objects.requireNonNull(service, "service");
        ServiceCreateOptions resolved = options != null ? options : defaultOptions;

        Map<String, String> headers = new LinkedHashMap<>();
        if (transport.apiVersion() != null) {
            headers.put(VERSION_HEADER, transport.apiVersion());
        }
        if (resolved.hasRegistryAuth()) {
            headers.put(REGISTRY_AUTH_HEADER, resolved.encodedRegistryAuth());
        }

        RuntimeException distributionError = null;
        if (resolved.queryRegistry()) {
            String image = imageOf(service);
            try {
                DistributionInspect inspect = distributionInspector.inspect(image, resolved.encodedRegistryAuth());
                pinToDistribution(service, inspect);
            } catch (RuntimeException e) {
                distributionError = e;
                log.warn("Unable to resolve digest of image {}: {}", image, e.getMessage());
            }
        }

        log.info("Creating Swarm service {} using image {}", service.getName(), imageOf(service));
        ServiceCreateResponse response;
        IOException decodeError = null;
        try (DockerApiResponse raw = transport.post(SERVICES_CREATE_PATH, headers, service)) {
            try {
                response = json.readValue(raw.body(), ServiceCreateResponse.class);
            } catch (IOException e) {
                decodeError = e;
                response = ServiceCreateResponse.empty();
            }
        }
        if (response == null) {
            response = ServiceCreateResponse.empty();
        }

        if (distributionError != null) {
            response = response.withWarning(ServicePinning.digestWarning(imageOf(service)));
        }
        if (decodeError != null) {
            throw new DockerResponseDecodeException(
                "Failed to decode service create response for " + service.getName(), response, decodeError);
        }
        return response;
    }

    private static void pinToDistribution(ServiceSpec service, DistributionInspect inspect) {
        TaskSpec template = service.getTaskTemplate();
        if (template == null) {
            template = new TaskSpec();
            service.withTaskTemplate(template);
        }
        ContainerSpec container = template.getContainerSpec();
        if (container != null) {
            Optional<String> pinned = ServicePinning.imageWithDigest(container.getImage(), inspect.digest());
            if (pinned.isPresent()) {
                log.debug("Pinned image {} to {}", container.getImage(), pinned.get());
                container.withImage(pinned.get());
            }
        }
        template.withPlacement(ServicePinning.mergePlatforms(template.getPlacement(), inspect));
        log.debug("Placement platforms for {}: {}", service.getName(), template.getPlacement().getPlatforms());
    }

    private static String imageOf(ServiceSpec service) {
        TaskSpec template = service.getTaskTemplate();
        if (template == null || template.getContainerSpec() == null) {
            return null;
        }
        return template.getContainerSpec().getImage();
    }
}
