package com.scholary.testsuite.storage;

/**
 * Where a job's bundle and images are stored.
 *
 * <p>Each part becomes a path segment or key segment, so separators and dot segments are rejected.
 */
public record ResultLocation(String styleId, String modelId, String resultId) {

  /** Matches a single path segment: no separators and not a dot segment. */
  public static final String SEGMENT_PATTERN = "^(?!\\.{1,2}$)[^/\\\\]+$";

  public ResultLocation {
    requireSegment("styleId", styleId);
    requireSegment("resultId", resultId);
  }

  static void requireSegment(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    if (value.contains("/") || value.contains("\\") || value.equals(".") || value.equals("..")) {
      throw new IllegalArgumentException(name + " is not a valid path segment: " + value);
    }
  }

  /** Relative path of this result below the style root, e.g. {@code s1/test_results/r1}. */
  public String relativeDir() {
    return styleId + "/test_results/" + resultId;
  }
}
