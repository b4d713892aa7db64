package com.scholary.testsuite.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.testsuite.objectstore.ObjectNotFoundException;
import com.scholary.testsuite.objectstore.ObjectStoreClient;
import com.scholary.testsuite.objectstore.ObjectStoreException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores results in an S3-compatible bucket.
 *
 * <p>Keys mirror the filesystem layout under an optional prefix:
 * {@code <prefix>/<styleId>/test_results/<resultId>/result.json}. Each bundle is serialized into
 * one buffer and sent in a single put, which S3 applies atomically.
 */
public class S3ResultStore implements ResultStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ResultStore.class);

  private static final String BUNDLE_SUFFIX = "/" + FileSystemResultStore.BUNDLE_FILE;

  private final ObjectStoreClient objectStoreClient;
  private final ObjectMapper objectMapper;
  private final String bucket;
  private final String prefix;

  public S3ResultStore(
      ObjectStoreClient objectStoreClient, ObjectMapper objectMapper, String bucket, String prefix) {
    this.objectStoreClient = objectStoreClient;
    this.objectMapper = objectMapper;
    this.bucket = bucket;
    this.prefix = normalizePrefix(prefix);
  }

  @Override
  public void saveBundle(ResultLocation location, ResultBundle bundle) {
    String key = prefix + location.relativeDir() + BUNDLE_SUFFIX;
    try {
      byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(bundle);
      objectStoreClient.putObject(bucket, key, json, "application/json");
    } catch (IOException | ObjectStoreException e) {
      throw new ResultStoreException("Failed to save test result: s3://" + bucket + "/" + key, e);
    }
    LOGGER.debug(
        "Saved result bundle: key={}, model={}, images={}",
        key,
        location.modelId(),
        bundle.images().size());
  }

  @Override
  public String saveImage(ResultLocation location, String promptId, byte[] image) {
    ResultLocation.requireSegment("promptId", promptId);
    String key = prefix + location.relativeDir() + "/" + promptId + ".jpg";
    try {
      objectStoreClient.putObject(bucket, key, image, "image/jpeg");
    } catch (ObjectStoreException e) {
      throw new ResultStoreException("Failed to save test image: s3://" + bucket + "/" + key, e);
    }
    LOGGER.info("Saved test image: prompt={}, key={}", promptId, key);
    return "s3://" + bucket + "/" + key;
  }

  @Override
  public List<StoredResult> listResults(String styleId) {
    ResultLocation.requireSegment("styleId", styleId);
    String resultsPrefix = prefix + styleId + "/test_results/";

    List<String> keys;
    try {
      keys = objectStoreClient.listKeys(bucket, resultsPrefix);
    } catch (ObjectStoreException e) {
      throw new ResultStoreException("Failed to list test results: " + resultsPrefix, e);
    }

    List<StoredResult> results = new ArrayList<>();
    for (String key : keys) {
      String relative = key.substring(resultsPrefix.length());
      // Only direct children: <resultId>/result.json
      if (!relative.endsWith(BUNDLE_SUFFIX) || relative.indexOf('/') != relative.lastIndexOf('/')) {
        continue;
      }
      String resultId = relative.substring(0, relative.length() - BUNDLE_SUFFIX.length());
      try {
        ResultBundle bundle =
            objectMapper.readValue(objectStoreClient.getObject(bucket, key), ResultBundle.class);
        results.add(new StoredResult(resultId, bundle));
      } catch (IOException | ObjectStoreException e) {
        LOGGER.warn("Skipping unreadable test result {}: {}", key, e.getMessage());
      }
    }

    results.sort(FileSystemResultStore.NEWEST_FIRST);
    return results;
  }

  @Override
  public ResultBundle loadResult(String styleId, String resultId) {
    String key = prefix + new ResultLocation(styleId, null, resultId).relativeDir() + BUNDLE_SUFFIX;
    try {
      return objectMapper.readValue(objectStoreClient.getObject(bucket, key), ResultBundle.class);
    } catch (ObjectNotFoundException e) {
      throw new ResultNotFoundException(styleId, resultId);
    } catch (IOException | ObjectStoreException e) {
      throw new ResultStoreException("Failed to load test result: " + key, e);
    }
  }

  private static String normalizePrefix(String prefix) {
    if (prefix == null || prefix.isBlank()) {
      return "";
    }
    String trimmed = prefix.replaceAll("^/+", "").replaceAll("/+$", "");
    return trimmed.isEmpty() ? "" : trimmed + "/";
  }
}
