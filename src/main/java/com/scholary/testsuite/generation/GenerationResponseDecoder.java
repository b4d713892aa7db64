package com.scholary.testsuite.generation;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

/**
 * Extracts the image reference from a generation response.
 *
 * <p>Shapes are tried in {@link ResponseShape} declaration order and the first non-empty match
 * wins. A response that matches none of them is a hard failure.
 */
@Component
public class GenerationResponseDecoder {

  /** The image reference and the shape it was found in. */
  public record DecodedImage(ResponseShape shape, String url) {}

  /**
   * Decode a response.
   *
   * @throws GenerationException if no known location holds an image reference
   */
  public DecodedImage decode(JsonNode response) {
    if (response != null) {
      for (ResponseShape shape : ResponseShape.values()) {
        String url = urlOf(response.at(shape.pointer()));
        if (url != null) {
          return new DecodedImage(shape, url);
        }
      }
    }
    throw new GenerationException("No image URL found in generation result");
  }

  private static String urlOf(JsonNode node) {
    if (node.isTextual()) {
      return blankToNull(node.asText());
    }
    if (node.isObject() && node.path("url").isTextual()) {
      return blankToNull(node.path("url").asText());
    }
    return null;
  }

  private static String blankToNull(String value) {
    return value.isBlank() ? null : value;
  }
}
