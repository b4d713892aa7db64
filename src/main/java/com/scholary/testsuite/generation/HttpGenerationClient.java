package com.scholary.testsuite.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.testsuite.logging.StructuredLogger;
import com.scholary.testsuite.storage.ResultLocation;
import com.scholary.testsuite.storage.ResultStore;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the image generation API.
 *
 * <p>Sends one text-to-image workflow per request, decodes the image reference from the response
 * and downloads the image into result storage. Transport failures, 429 and 5xx responses are
 * retried with exponential backoff and jitter. A response without an image reference is not
 * retried.
 */
@Component
public class HttpGenerationClient implements GenerationClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpGenerationClient.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final HttpClient httpClient;
  private final GenerationProperties properties;
  private final ObjectMapper objectMapper;
  private final WorkflowTemplate workflowTemplate;
  private final GenerationResponseDecoder decoder;
  private final ResultStore resultStore;
  private final Path localSourceRoot;

  public HttpGenerationClient(
      GenerationProperties properties,
      ObjectMapper objectMapper,
      WorkflowTemplate workflowTemplate,
      GenerationResponseDecoder decoder,
      ResultStore resultStore) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.workflowTemplate = workflowTemplate;
    this.decoder = decoder;
    this.resultStore = resultStore;
    this.localSourceRoot = Paths.get(properties.localSourceRoot()).toAbsolutePath().normalize();

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

    LOGGER.info("Initialized generation client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public String generate(GenerationRequest request) {
    ObjectNode body = buildRequestBody(request);
    URI uri = URI.create(properties.baseUrl() + "/api/generate-image");

    JsonNode response = withRetries(request.promptId(), "generate", () -> postJson(uri, body));

    GenerationResponseDecoder.DecodedImage image = decoder.decode(response);
    LOGGER.debug("Image reference for {} found in {}", request.promptId(), image.shape());
    return image.url();
  }

  @Override
  public String materialize(ResultLocation location, String promptId, String imageReference) {
    byte[] image;
    if (isRemote(imageReference)) {
      URI uri = URI.create(imageReference);
      image = withRetries(promptId, "download", () -> download(uri));
    } else {
      image = readLocal(imageReference);
    }
    return resultStore.saveImage(location, promptId, image);
  }

  /**
   * Build the generate-image request body.
   *
   * <pre>
   * {
   *   "payload": {
   *     "input": {
   *       "workflow": { ... },
   *       "model_urls": [{"id": "adapter.safetensors", "url": "https://..."}],
   *       "force_download": false
   *     }
   *   },
   *   "styleId": "...",
   *   "mode": "text-to-image"
   * }
   * </pre>
   */
  ObjectNode buildRequestBody(GenerationRequest request) {
    ObjectNode body = objectMapper.createObjectNode();
    ObjectNode input = body.putObject("payload").putObject("input");
    input.set("workflow", workflowTemplate.build(request));
    input
        .putArray("model_urls")
        .addObject()
        .put("id", request.model().loraFilename())
        .put("url", request.model().loraUrl());
    input.put("force_download", false);
    body.put("styleId", request.styleId());
    body.put("mode", "text-to-image");
    return body;
  }

  private JsonNode postJson(URI uri, JsonNode body) throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(uri)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)))
            .build();

    HttpResponse<byte[]> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
    checkStatus(uri, response);
    try {
      return objectMapper.readTree(response.body());
    } catch (JsonProcessingException e) {
      throw new GenerationException("Generation response is not valid JSON", e);
    }
  }

  private byte[] download(URI uri) throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(uri)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .GET()
            .build();

    HttpResponse<byte[]> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
    checkStatus(uri, response);
    return response.body();
  }

  private byte[] readLocal(String reference) {
    String relative = stripQuery(reference).replaceFirst("^/+", "");
    Path source = localSourceRoot.resolve(relative).normalize();
    if (!source.startsWith(localSourceRoot)) {
      throw new GenerationException("Image reference escapes the local source root: " + reference);
    }
    try {
      return Files.readAllBytes(source);
    } catch (NoSuchFileException e) {
      throw new GenerationException("Source file not found: " + source, e);
    } catch (IOException e) {
      throw new GenerationException("Failed to read source file: " + source, e);
    }
  }

  private static void checkStatus(URI uri, HttpResponse<byte[]> response) throws IOException {
    int status = response.statusCode();
    if (status / 100 == 2) {
      return;
    }
    String message = String.format("%s returned status %d", uri, status);
    if (status == 429 || status >= 500) {
      throw new IOException(message);
    }
    throw new GenerationException(message);
  }

  private <T> T withRetries(String promptId, String operation, HttpCall<T> call) {
    int maxRetries = properties.maxRetries();
    int attempt = 0;
    Exception lastException = null;

    while (attempt < maxRetries) {
      try {
        return call.execute();
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < maxRetries) {
          long backoffMs = backoffFor(attempt);
          structuredLogger.logGenerationRetry(
              promptId, operation, attempt, maxRetries, backoffMs, e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new GenerationException(operation + " interrupted for " + promptId, e);
      }
    }

    throw new GenerationException(
        String.format("%s failed for %s after %d attempts", operation, promptId, maxRetries),
        lastException);
  }

  /** Exponential backoff with jitter, capped at maxBackoffMs. */
  long backoffFor(int attempt) {
    long base = properties.initialBackoffMs() << Math.min(attempt - 1, 20);
    long capped = Math.min(base, properties.maxBackoffMs());
    return capped + ThreadLocalRandom.current().nextLong(properties.initialBackoffMs() + 1);
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GenerationException("Retry backoff interrupted", e);
    }
  }

  private static boolean isRemote(String reference) {
    return reference.startsWith("http://") || reference.startsWith("https://");
  }

  private static String stripQuery(String reference) {
    int query = reference.indexOf('?');
    return query >= 0 ? reference.substring(0, query) : reference;
  }

  @FunctionalInterface
  private interface HttpCall<T> {
    T execute() throws IOException, InterruptedException;
  }
}
