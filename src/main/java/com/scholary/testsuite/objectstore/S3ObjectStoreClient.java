package com.scholary.testsuite.objectstore;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>Uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. The
 * differences are the endpoint and path-style access configuration.
 *
 * <p>The SDK retries transient failures (network issues, 500 errors, throttling) on its own. For
 * non-retryable errors (404, 403) we fail fast.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    this.s3Client =
        S3Client.builder()
            .region(region)
            .credentialsProvider(StaticCredentialsProvider.create(credentials))
            .endpointOverride(URI.create(properties.endpoint()))
            .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
            .build();
  }

  S3ObjectStoreClient(S3Client s3Client) {
    this.s3Client = s3Client;
  }

  @Override
  public void putObject(String bucket, String key, byte[] data, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        data.length,
        contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength((long) data.length)
              .build();

      s3Client.putObject(request, RequestBody.fromBytes(data));

      LOGGER.debug("Uploaded object: bucket={}, key={}", bucket, key);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format("Unexpected error uploading object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public byte[] getObject(String bucket, String key) {
    LOGGER.debug("Fetching object: bucket={}, key={}", bucket, key);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
      return s3Client.getObjectAsBytes(request).asByteArray();

    } catch (NoSuchKeyException e) {
      // Object doesn't exist - this is not retryable
      throw new ObjectNotFoundException(
          String.format("Object not found: bucket=%s, key=%s", bucket, key), e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to retrieve object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format("Unexpected error retrieving object: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public List<String> listKeys(String bucket, String prefix) {
    LOGGER.debug("Listing objects: bucket={}, prefix={}", bucket, prefix);

    try {
      ListObjectsV2Request request =
          ListObjectsV2Request.builder().bucket(bucket).prefix(prefix).build();

      // The paginator follows continuation tokens for listings over 1000 keys
      return s3Client.listObjectsV2Paginator(request).contents().stream()
          .map(S3Object::key)
          .collect(Collectors.toList());

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to list objects: bucket=%s, prefix=%s, statusCode=%s",
              bucket, prefix, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  /**
   * Release connections and threads held by the SDK client.
   *
   * <p>Registered as the bean's destroy method.
   */
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
