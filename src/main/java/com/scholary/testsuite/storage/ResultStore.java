package com.scholary.testsuite.storage;

import java.util.List;

/**
 * Persistence for test suite results.
 *
 * <p>Writes are whole-document replacements: a reader sees either the previous bundle or the new
 * one, never a partially written file. Saving the same location again overwrites it.
 */
public interface ResultStore {

  /**
   * Store (or replace) the bundle of a result.
   *
   * @throws ResultStoreException if the bundle cannot be written
   */
  void saveBundle(ResultLocation location, ResultBundle bundle);

  /**
   * Store the image generated for one prompt next to the bundle.
   *
   * @return the local reference clients use to fetch the image
   * @throws ResultStoreException if the image cannot be written
   */
  String saveImage(ResultLocation location, String promptId, byte[] image);

  /**
   * List every readable result of a style, newest first.
   *
   * <p>Entries whose bundle cannot be read are skipped.
   */
  List<StoredResult> listResults(String styleId);

  /**
   * Load one stored bundle.
   *
   * @throws ResultNotFoundException if no bundle is stored under the given ids
   */
  ResultBundle loadResult(String styleId, String resultId);
}
