package io.swarmdeck.docker.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.model.ContainerSpec;
import com.github.dockerjava.api.model.ServiceSpec;
import com.github.dockerjava.api.model.TaskSpec;
import com.github.dockerjava.transport.DockerHttpClient;
import io.swarmdeck.docker.DockerApiException;
import io.swarmdeck.docker.DockerDaemonUnavailableException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class DockerHttpClientTransportTest {

    private final ObjectMapper json = new ObjectMapper();
    private DockerHttpClient httpClient;
    private DockerHttpClient.Response response;

    @BeforeEach
    void setUp() {
        httpClient = mock(DockerHttpClient.class);
        response = mock(DockerHttpClient.Response.class);
        when(httpClient.execute(any())).thenReturn(response);
    }

    @Test
    void postsJsonBodyToVersionedPath() throws IOException {
        when(response.getStatusCode()).thenReturn(201);
        when(response.getBody()).thenReturn(body("{\"ID\":\"svc\"}"));
        DockerHttpClientTransport transport = new DockerHttpClientTransport(httpClient, json, "v1.41");

        ServiceSpec spec = new ServiceSpec().withName("web")
            .withTaskTemplate(new TaskSpec().withContainerSpec(new ContainerSpec().withImage("nginx")));
        try (DockerApiResponse apiResponse = transport.post("/services/create", Map.of("version", "1.41"), spec)) {
            assertThat(apiResponse.statusCode()).isEqualTo(201);
            assertThat(new String(apiResponse.body().readAllBytes(), StandardCharsets.UTF_8))
                .isEqualTo("{\"ID\":\"svc\"}");
        }

        ArgumentCaptor<DockerHttpClient.Request> captor = ArgumentCaptor.forClass(DockerHttpClient.Request.class);
        verify(httpClient).execute(captor.capture());
        DockerHttpClient.Request request = captor.getValue();
        assertThat(request.method()).isEqualTo(DockerHttpClient.Request.Method.POST);
        assertThat(request.path()).isEqualTo("/v1.41/services/create");
        assertThat(request.headers())
            .containsEntry("version", "1.41")
            .containsEntry("Content-Type", "application/json");
        JsonNode sent = json.readTree(request.body());
        assertThat(sent.path("Name").asText()).isEqualTo("web");
        assertThat(sent.path("TaskTemplate").path("ContainerSpec").path("Image").asText()).isEqualTo("nginx");
        assertThat(sent.path("TaskTemplate").has("Placement")).isFalse();
        verify(response).close();
    }

    @Test
    void leavesPathUnversionedWithoutApiVersion() {
        when(response.getStatusCode()).thenReturn(200);
        when(response.getBody()).thenReturn(body("{}"));
        DockerHttpClientTransport transport = new DockerHttpClientTransport(httpClient, json, " ");

        transport.get("/distribution/nginx/json", Map.of()).close();

        ArgumentCaptor<DockerHttpClient.Request> captor = ArgumentCaptor.forClass(DockerHttpClient.Request.class);
        verify(httpClient).execute(captor.capture());
        assertThat(captor.getValue().method()).isEqualTo(DockerHttpClient.Request.Method.GET);
        assertThat(captor.getValue().path()).isEqualTo("/distribution/nginx/json");
        assertThat(transport.apiVersion()).isNull();
    }

    @Test
    void mapsErrorStatusToApiExceptionAndClosesResponse() {
        when(response.getStatusCode()).thenReturn(409);
        when(response.getBody()).thenReturn(body("{\"message\":\"name conflicts with an existing object\"}"));
        DockerHttpClientTransport transport = new DockerHttpClientTransport(httpClient, json, "1.41");

        assertThatThrownBy(() -> transport.post("/services/create", Map.of(), Map.of()))
            .isInstanceOfSatisfying(DockerApiException.class, e -> {
                assertThat(e.getStatusCode()).isEqualTo(409);
                assertThat(e.getMessage()).contains("name conflicts with an existing object");
            });
        verify(response).close();
    }

    @Test
    void usesRawBodyWhenErrorIsNotJson() {
        when(response.getStatusCode()).thenReturn(500);
        when(response.getBody()).thenReturn(body("internal failure"));
        DockerHttpClientTransport transport = new DockerHttpClientTransport(httpClient, json, "1.41");

        assertThatThrownBy(() -> transport.get("/distribution/nginx/json", Map.of()))
            .isInstanceOf(DockerApiException.class)
            .hasMessageContaining("internal failure");
    }

    @Test
    void wrapsConnectionRefusedWithHelpfulMessage() {
        when(httpClient.execute(any())).thenThrow(new RuntimeException(new ConnectException("Connection refused")));
        DockerHttpClientTransport transport = new DockerHttpClientTransport(httpClient, json, "1.41");

        assertThatThrownBy(() -> transport.post("/services/create", Map.of(), Map.of()))
            .isInstanceOf(DockerDaemonUnavailableException.class)
            .hasMessageContaining("Docker daemon is unavailable");
    }

    @Test
    void wrapsMissingDockerSocket() {
        when(httpClient.execute(any()))
            .thenThrow(new RuntimeException(new IOException("No such file or directory")));
        DockerHttpClientTransport transport = new DockerHttpClientTransport(httpClient, json, "1.41");

        assertThatThrownBy(() -> transport.get("/distribution/nginx/json", Map.of()))
            .isInstanceOf(DockerDaemonUnavailableException.class)
            .hasMessageContaining("/var/run/docker.sock");
    }

    @Test
    void passesThroughUnrelatedFailures() {
        IllegalStateException failure = new IllegalStateException("boom");
        when(httpClient.execute(any())).thenThrow(failure);
        DockerHttpClientTransport transport = new DockerHttpClientTransport(httpClient, json, "1.41");

        assertThatThrownBy(() -> transport.get("/distribution/nginx/json", Map.of())).isSameAs(failure);
    }

    private static ByteArrayInputStream body(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
