package io.swarmdeck.docker.registry;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.model.AuthConfig;
import io.swarmdeck.docker.DockerClientException;
import java.util.Base64;
import java.util.Objects;

/**
 * Encodes registry credentials for the {@code X-Registry-Auth} header: URL-safe base64 of the
 * {@link AuthConfig} JSON, without null fields.
 */
public final class RegistryAuthEncoder {

    private RegistryAuthEncoder() {
    }

    public static String encode(AuthConfig authConfig, ObjectMapper json) {
        Objects.requireNonNull(authConfig, "authConfig");
        ObjectMapper writer = json.copy().setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL);
        try {
            return Base64.getUrlEncoder().encodeToString(writer.writeValueAsBytes(authConfig));
        } catch (JsonProcessingException e) {
            throw new DockerClientException("Failed to encode registry credentials", e);
        }
    }
}
