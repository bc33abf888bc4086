package io.swarmdeck.docker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "swarmdeck.docker")
public record DockerClientProperties(String host,
                                     @DefaultValue("/var/run/docker.sock") @NotBlank String socketPath,
                                     @DefaultValue("1.41") String apiVersion,
                                     @DefaultValue("5s") Duration connectTimeout,
                                     @DefaultValue("60s") Duration responseTimeout,
                                     @DefaultValue("100") int maxConnections,
                                     @DefaultValue @Valid Registry registry) {

  public DockerClientProperties {
    if (maxConnections <= 0) {
      throw new IllegalArgumentException("swarmdeck.docker.max-connections must be positive");
    }
    registry = registry != null ? registry : new Registry(true, null, null, null);
  }

  public boolean hasHost() {
    return host != null && !host.isBlank();
  }

  /**
   * Docker host URI, falling back to the unix socket when no explicit host is configured.
   */
  public String resolvedHost() {
    return hasHost() ? host : "unix://" + socketPath;
  }

  public record Registry(@DefaultValue("true") boolean queryByDefault,
                         String username,
                         String password,
                         String serverAddress) {

    public boolean hasCredentials() {
      return username != null && !username.isBlank();
    }

    @Override
    public String toString() {
      return "Registry[queryByDefault=" + queryByDefault + ", username=" + username
          + ", serverAddress=" + serverAddress + "]";
    }
  }
}
