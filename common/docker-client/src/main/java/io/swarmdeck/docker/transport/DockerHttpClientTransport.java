package io.swarmdeck.docker.transport;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.transport.DockerHttpClient;
import io.swarmdeck.docker.DockerApiException;
import io.swarmdeck.docker.DockerClientException;
import io.swarmdeck.docker.DockerDaemonUnavailableException;
import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DockerApiTransport} backed by docker-java's {@link DockerHttpClient}, which handles unix
 * sockets, named pipes and TLS endpoints alike. Request bodies are written without null fields.
 */
public class DockerHttpClientTransport implements DockerApiTransport {

    private static final Logger log = LoggerFactory.getLogger(DockerHttpClientTransport.class);

    private static final String DOCKER_HINT =
        "Ensure Docker is installed, running, and that the process can access the Docker socket "
            + "(for example /var/run/docker.sock) or an explicit DOCKER_HOST.";

    private final DockerHttpClient httpClient;
    private final ObjectMapper json;
    private final String apiVersion;

    public DockerHttpClientTransport(DockerHttpClient httpClient, ObjectMapper json, String apiVersion) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.json = Objects.requireNonNull(json, "json").copy()
            .setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL);
        this.apiVersion = normalizeVersion(apiVersion);
    }

    @Override
    public String apiVersion() {
        return apiVersion;
    }

    @Override
    public DockerApiResponse post(String path, Map<String, String> headers, Object body) {
        Map<String, String> requestHeaders = new LinkedHashMap<>(headers == null ? Map.of() : headers);
        requestHeaders.put("Content-Type", "application/json");
        DockerHttpClient.Request request = DockerHttpClient.Request.builder()
            .method(DockerHttpClient.Request.Method.POST)
            .path(versionedPath(path))
            .headers(requestHeaders)
            .body(new ByteArrayInputStream(encode(body)))
            .build();
        return execute("POST " + path, request);
    }

    @Override
    public DockerApiResponse get(String path, Map<String, String> headers) {
        DockerHttpClient.Request request = DockerHttpClient.Request.builder()
            .method(DockerHttpClient.Request.Method.GET)
            .path(versionedPath(path))
            .headers(headers == null ? Map.of() : headers)
            .build();
        return execute("GET " + path, request);
    }

    String versionedPath(String path) {
        String resolved = path.startsWith("/") ? path : "/" + path;
        return apiVersion == null ? resolved : "/v" + apiVersion + resolved;
    }

    private DockerApiResponse execute(String action, DockerHttpClient.Request request) {
        log.debug("{} -> {}", action, request.path());
        DockerHttpClient.Response response;
        try {
            response = httpClient.execute(request);
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
        DockerApiResponse apiResponse =
            new DockerApiResponse(response.getStatusCode(), response.getBody(), response);
        int status = apiResponse.statusCode();
        if (status >= 200 && status < 300) {
            return apiResponse;
        }
        String message;
        try (apiResponse) {
            message = readErrorMessage(status, apiResponse.body());
        }
        log.debug("{} failed with status {}: {}", action, status, message);
        throw new DockerApiException(status, message);
    }

    private byte[] encode(Object body) {
        try {
            return json.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new DockerClientException("Failed to encode request body", e);
        }
    }

    private String readErrorMessage(int status, InputStream body) {
        String raw;
        try {
            raw = new String(body.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new DockerClientException("Failed to read error response with status " + status, e);
        }
        if (raw.isEmpty()) {
            return "status " + status;
        }
        try {
            JsonNode node = json.readTree(raw);
            JsonNode message = node == null ? null : node.get("message");
            if (message != null && message.isTextual()) {
                return message.asText();
            }
        } catch (JsonProcessingException e) {
            log.trace("Error response is not JSON: {}", e.getOriginalMessage());
        }
        return raw;
    }

    private RuntimeException translate(String action, RuntimeException e) {
        if (e instanceof DockerClientException) {
            return e;
        }
        if (isDockerUnavailable(e)) {
            return new DockerDaemonUnavailableException(
                "Unable to " + action + " because the Docker daemon is unavailable. " + DOCKER_HINT,
                e);
        }
        return e;
    }

    private boolean isDockerUnavailable(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof ConnectException
                || t instanceof NoRouteToHostException
                || t instanceof SocketTimeoutException
                || t instanceof UnknownHostException
                || t instanceof FileNotFoundException
                || t instanceof NoSuchFileException
                || (t instanceof IOException && messageContains(t, "No such file or directory"))) {
                return true;
            }
            String className = t.getClass().getName();
            if ("com.sun.jna.LastErrorException".equals(className)
                && messageContains(t, "No such file or directory")) {
                return true;
            }
            if (messageContains(t, "permission denied") && messageContains(t, "docker")) {
                return true;
            }
        }
        return false;
    }

    private boolean messageContains(Throwable t, String needle) {
        String message = t.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT)
            .contains(needle.toLowerCase(Locale.ROOT));
    }

    private static String normalizeVersion(String version) {
        if (version == null || version.isBlank()) {
            return null;
        }
        String trimmed = version.trim();
        return trimmed.startsWith("v") ? trimmed.substring(1) : trimmed;
    }
}
