package io.swarmdeck.docker.registry;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.model.AuthConfig;
import java.util.Base64;
import org.junit.jupiter.api.Test;

class RegistryAuthEncoderTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void encodesCredentialsAsUrlSafeBase64Json() throws Exception {
        AuthConfig authConfig = new AuthConfig()
            .withUsername("deployer")
            .withPassword("s3cr3t?>>")
            .withRegistryAddress("registry.local:5000");

        String encoded = RegistryAuthEncoder.encode(authConfig, json);

        assertThat(encoded).doesNotContain("+", "/");
        JsonNode decoded = json.readTree(Base64.getUrlDecoder().decode(encoded));
        assertThat(decoded.path("username").asText()).isEqualTo("deployer");
        assertThat(decoded.path("password").asText()).isEqualTo("s3cr3t?>>");
        assertThat(decoded.path("serveraddress").asText()).isEqualTo("registry.local:5000");
        assertThat(decoded.has("identitytoken")).isFalse();
        assertThat(decoded.has("email")).isFalse();
    }

    @Test
    void encodesIdentityToken() throws Exception {
        AuthConfig authConfig = new AuthConfig()
            .withIdentityToken("refresh-token")
            .withRegistryAddress("registry.local");

        JsonNode decoded = json.readTree(Base64.getUrlDecoder().decode(RegistryAuthEncoder.encode(authConfig, json)));

        assertThat(decoded.path("identitytoken").asText()).isEqualTo("refresh-token");
        assertThat(decoded.has("username")).isFalse();
        assertThat(decoded.has("password")).isFalse();
    }
}
