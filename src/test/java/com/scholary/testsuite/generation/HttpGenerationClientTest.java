package com.scholary.testsuite.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.testsuite.TestFixtures;
import com.scholary.testsuite.storage.ResultLocation;
import com.scholary.testsuite.storage.ResultStore;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Runs the client against a local HTTP stub of the generation API. */
class HttpGenerationClientTest {

  private static final byte[] IMAGE = {(byte) 0xFF, (byte) 0xD8, 1, 2, 3};
  private static final String OK_BODY = "{\"output\":{\"images\":[\"%s/images/a.jpg\"]}}";

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = TestFixtures.objectMapper();
  private final ResultStore resultStore = mock(ResultStore.class);
  private final ResultLocation location = new ResultLocation("style-1", "model-1", "suite-1_r1");

  private HttpServer server;
  private String baseUrl;
  private final AtomicInteger generateCalls = new AtomicInteger();
  private final List<Integer> generateStatuses = new CopyOnWriteArrayList<>();
  private final List<JsonNode> generateBodies = new CopyOnWriteArrayList<>();
  private volatile String generateResponse = OK_BODY;

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    baseUrl = "http://localhost:" + server.getAddress().getPort();
    server.createContext(
        "/api/generate-image",
        exchange -> {
          int call = generateCalls.getAndIncrement();
          generateBodies.add(objectMapper.readTree(exchange.getRequestBody()));
          int status = call < generateStatuses.size() ? generateStatuses.get(call) : 200;
          byte[] body =
              (status == 200 ? String.format(generateResponse, baseUrl) : "{\"error\":\"busy\"}")
                  .getBytes(StandardCharsets.UTF_8);
          exchange.getResponseHeaders().add("Content-Type", "application/json");
          exchange.sendResponseHeaders(status, body.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
          }
        });
    server.createContext(
        "/images/a.jpg",
        exchange -> {
          exchange.sendResponseHeaders(200, IMAGE.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(IMAGE);
          }
        });
    server.createContext(
        "/images/missing.jpg",
        exchange -> {
          exchange.sendResponseHeaders(404, -1);
          exchange.close();
        });
    server.start();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  private HttpGenerationClient client() {
    GenerationProperties properties =
        new GenerationProperties(
            baseUrl,
            5,
            10,
            3,
            1,
            5,
            "classpath:workflows/text_to_image_workflow.json",
            "flux1-dev-fp8",
            tempDir.toString());
    return new HttpGenerationClient(
        properties,
        objectMapper,
        new WorkflowTemplate(objectMapper, properties),
        new GenerationResponseDecoder(),
        resultStore);
  }

  private GenerationRequest request() {
    return new GenerationRequest(
        "p1", "front a fox back", 7L, "style-1", TestFixtures.settings(), TestFixtures.model());
  }

  @Test
  void generate_returnsDecodedImageReference() {
    String url = client().generate(request());

    assertThat(url).isEqualTo(baseUrl + "/images/a.jpg");
    assertThat(generateCalls).hasValue(1);
  }

  @Test
  void generate_sendsWorkflowAndAdapter() {
    client().generate(request());

    JsonNode body = generateBodies.get(0);
    assertThat(body.path("styleId").asText()).isEqualTo("style-1");
    assertThat(body.path("mode").asText()).isEqualTo("text-to-image");
    JsonNode input = body.at("/payload/input");
    assertThat(input.path("force_download").asBoolean()).isFalse();
    assertThat(input.at("/model_urls/0/id").asText()).isEqualTo("watercolor_v1.safetensors");
    assertThat(input.at("/model_urls/0/url").asText())
        .isEqualTo("https://models.example.com/loras/watercolor_v1.safetensors");
    assertThat(input.at("/workflow/6/inputs/text").asText()).isEqualTo("front a fox back");
    assertThat(input.at("/workflow/25/inputs/noise_seed").asLong()).isEqualTo(7L);
  }

  @Test
  void generate_retriesServerErrors() {
    generateStatuses.addAll(List.of(503, 429));

    String url = client().generate(request());

    assertThat(url).endsWith("/images/a.jpg");
    assertThat(generateCalls).hasValue(3);
  }

  @Test
  void generate_givesUpAfterMaxRetries() {
    generateStatuses.addAll(List.of(500, 502, 503, 504));

    assertThatThrownBy(() -> client().generate(request()))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("after 3 attempts");
    assertThat(generateCalls).hasValue(3);
  }

  @Test
  void generate_clientErrorIsNotRetried() {
    generateStatuses.add(400);

    assertThatThrownBy(() -> client().generate(request()))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("status 400");
    assertThat(generateCalls).hasValue(1);
  }

  @Test
  void generate_responseWithoutImageIsNotRetried() {
    generateResponse = "{\"output\":{\"status\":\"COMPLETED\"}}";

    assertThatThrownBy(() -> client().generate(request()))
        .isInstanceOf(GenerationException.class)
        .hasMessage("No image URL found in generation result");
    assertThat(generateCalls).hasValue(1);
  }

  @Test
  void materialize_downloadsRemoteImage() {
    when(resultStore.saveImage(eq(location), eq("p1"), any())).thenReturn("/local/p1.jpg");

    String local = client().materialize(location, "p1", baseUrl + "/images/a.jpg");

    assertThat(local).isEqualTo("/local/p1.jpg");
    verify(resultStore).saveImage(location, "p1", IMAGE);
  }

  @Test
  void materialize_missingRemoteImageFails() {
    assertThatThrownBy(() -> client().materialize(location, "p1", baseUrl + "/images/missing.jpg"))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("404");
  }

  @Test
  void materialize_readsLocalReferenceWithoutQuery() throws IOException {
    Files.createDirectories(tempDir.resolve("outputs"));
    Files.write(tempDir.resolve("outputs/img.jpg"), IMAGE);
    when(resultStore.saveImage(eq(location), eq("p1"), any())).thenReturn("/local/p1.jpg");

    client().materialize(location, "p1", "/outputs/img.jpg?t=123");

    verify(resultStore).saveImage(location, "p1", IMAGE);
  }

  @Test
  void materialize_rejectsPathOutsideSourceRoot() {
    assertThatThrownBy(() -> client().materialize(location, "p1", "../../etc/passwd"))
        .isInstanceOf(GenerationException.class)
        .hasMessageContaining("escapes");
  }

  @Test
  void buildRequestBody_hasWorkflowUnderPayloadInput() {
    ObjectNode body = client().buildRequestBody(request());

    assertThat(body.at("/payload/input/workflow/43/inputs/num_loras").asInt()).isEqualTo(1);
  }

  @Test
  void backoff_growsExponentiallyUpToMax() {
    HttpGenerationClient client = client();

    assertThat(client.backoffFor(1)).isBetween(1L, 2L);
    assertThat(client.backoffFor(2)).isBetween(2L, 3L);
    assertThat(client.backoffFor(10)).isBetween(5L, 6L);
  }
}
