package com.scholary.testsuite.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores results on the local filesystem.
 *
 * <p>Layout: {@code <rootDir>/<styleId>/test_results/<resultId>/result.json} with one
 * {@code <promptId>.jpg} per generated image in the same directory. Every file is written to a
 * temporary sibling first and then moved over the target, so readers never see a torn document.
 */
public class FileSystemResultStore implements ResultStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemResultStore.class);

  static final String BUNDLE_FILE = "result.json";

  /** Orders results by bundle timestamp, newest first; bundles without one go last. */
  static final Comparator<StoredResult> NEWEST_FIRST =
      Comparator.comparing(
          (StoredResult r) -> r.bundle().timestamp(),
          Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

  private final Path rootDir;
  private final String publicPrefix;
  private final ObjectMapper objectMapper;

  public FileSystemResultStore(ResultStoreProperties properties, ObjectMapper objectMapper) {
    this(Paths.get(properties.rootDir()), properties.publicPrefix(), objectMapper);
  }

  public FileSystemResultStore(Path rootDir, String publicPrefix, ObjectMapper objectMapper) {
    this.rootDir = rootDir;
    this.publicPrefix = stripTrailingSlash(publicPrefix);
    this.objectMapper = objectMapper;
    LOGGER.info("Initialized filesystem result store: rootDir={}", rootDir.toAbsolutePath());
  }

  @Override
  public void saveBundle(ResultLocation location, ResultBundle bundle) {
    Path dir = rootDir.resolve(location.relativeDir());
    try {
      byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(bundle);
      writeAtomically(dir, BUNDLE_FILE, json);
      LOGGER.debug(
          "Saved result bundle: style={}, model={}, result={}, images={}",
          location.styleId(),
          location.modelId(),
          location.resultId(),
          bundle.images().size());
    } catch (IOException e) {
      throw new ResultStoreException("Failed to save test result: " + dir.resolve(BUNDLE_FILE), e);
    }
  }

  @Override
  public String saveImage(ResultLocation location, String promptId, byte[] image) {
    ResultLocation.requireSegment("promptId", promptId);
    String filename = promptId + ".jpg";
    Path dir = rootDir.resolve(location.relativeDir());
    try {
      writeAtomically(dir, filename, image);
    } catch (IOException e) {
      throw new ResultStoreException("Failed to save test image: " + dir.resolve(filename), e);
    }
    LOGGER.info("Saved test image: prompt={}, bytes={}", promptId, image.length);
    return publicPrefix + "/" + location.relativeDir() + "/" + filename;
  }

  @Override
  public List<StoredResult> listResults(String styleId) {
    ResultLocation.requireSegment("styleId", styleId);
    Path resultsDir = rootDir.resolve(styleId).resolve("test_results");
    if (!Files.isDirectory(resultsDir)) {
      return List.of();
    }

    List<StoredResult> results = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(resultsDir, Files::isDirectory)) {
      for (Path entry : entries) {
        String resultId = entry.getFileName().toString();
        try {
          ResultBundle bundle =
              objectMapper.readValue(entry.resolve(BUNDLE_FILE).toFile(), ResultBundle.class);
          results.add(new StoredResult(resultId, bundle));
        } catch (IOException e) {
          LOGGER.warn("Skipping unreadable test result {}: {}", entry, e.getMessage());
        }
      }
    } catch (IOException e) {
      throw new ResultStoreException("Failed to list test results: " + resultsDir, e);
    }

    results.sort(NEWEST_FIRST);
    return results;
  }

  @Override
  public ResultBundle loadResult(String styleId, String resultId) {
    ResultLocation location = new ResultLocation(styleId, null, resultId);
    Path file = rootDir.resolve(location.relativeDir()).resolve(BUNDLE_FILE);
    try {
      return objectMapper.readValue(Files.readAllBytes(file), ResultBundle.class);
    } catch (NoSuchFileException e) {
      throw new ResultNotFoundException(styleId, resultId);
    } catch (IOException e) {
      throw new ResultStoreException("Failed to load test result: " + file, e);
    }
  }

  private void writeAtomically(Path dir, String filename, byte[] content) throws IOException {
    Files.createDirectories(dir);
    Path target = dir.resolve(filename);
    Path temp = Files.createTempFile(dir, "." + filename + "-", ".tmp");
    try {
      Files.write(temp, content);
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private static String stripTrailingSlash(String value) {
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }
}
