package io.swarmdeck.docker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.model.AuthConfig;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import io.swarmdeck.docker.DockerServiceClient;
import io.swarmdeck.docker.model.ServiceCreateOptions;
import io.swarmdeck.docker.registry.DistributionInspector;
import io.swarmdeck.docker.registry.DockerDistributionInspector;
import io.swarmdeck.docker.registry.RegistryAuthEncoder;
import io.swarmdeck.docker.transport.DockerApiTransport;
import io.swarmdeck.docker.transport.DockerHttpClientTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires a {@link DockerServiceClient} against the Docker daemon described by
 * {@link DockerClientProperties}.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ConditionalOnClass(ApacheDockerHttpClient.class)
@ConditionalOnProperty(prefix = "swarmdeck.docker", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(DockerClientProperties.class)
public class DockerServiceClientAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(DockerServiceClientAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public DefaultDockerClientConfig dockerClientConfig(DockerClientProperties properties) {
    return DefaultDockerClientConfig.createDefaultConfigBuilder()
        .withDockerHost(properties.resolvedHost())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public DockerHttpClient dockerHttpClient(DefaultDockerClientConfig config, DockerClientProperties properties) {
    log.info("Using Docker host {}", config.getDockerHost());
    return new ApacheDockerHttpClient.Builder()
        .dockerHost(config.getDockerHost())
        .sslConfig(config.getSSLConfig())
        .maxConnections(properties.maxConnections())
        .connectionTimeout(properties.connectTimeout())
        .responseTimeout(properties.responseTimeout())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public DockerApiTransport dockerApiTransport(DockerHttpClient dockerHttpClient,
                                               ObjectProvider<ObjectMapper> objectMapper,
                                               DockerClientProperties properties) {
    return new DockerHttpClientTransport(dockerHttpClient, resolveMapper(objectMapper), properties.apiVersion());
  }

  @Bean
  @ConditionalOnMissingBean
  public DistributionInspector distributionInspector(DockerApiTransport transport,
                                                     ObjectProvider<ObjectMapper> objectMapper) {
    return new DockerDistributionInspector(transport, resolveMapper(objectMapper));
  }

  @Bean
  @ConditionalOnMissingBean
  public DockerServiceClient dockerServiceClient(DockerApiTransport transport,
                                                 DistributionInspector distributionInspector,
                                                 ObjectProvider<ObjectMapper> objectMapper,
                                                 DockerClientProperties properties) {
    ObjectMapper json = resolveMapper(objectMapper);
    return new DockerServiceClient(transport, distributionInspector, json,
        defaultCreateOptions(properties.registry(), json));
  }

  static ServiceCreateOptions defaultCreateOptions(DockerClientProperties.Registry registry, ObjectMapper json) {
    String encodedAuth = null;
    if (registry.hasCredentials()) {
      AuthConfig authConfig = new AuthConfig()
          .withUsername(registry.username())
          .withPassword(registry.password());
      if (registry.serverAddress() != null && !registry.serverAddress().isBlank()) {
        authConfig = authConfig.withRegistryAddress(registry.serverAddress());
      }
      encodedAuth = RegistryAuthEncoder.encode(authConfig, json);
    }
    return new ServiceCreateOptions(encodedAuth, registry.queryByDefault());
  }

  private static ObjectMapper resolveMapper(ObjectProvider<ObjectMapper> objectMapper) {
    return objectMapper.getIfAvailable(ObjectMapper::new);
  }
}
