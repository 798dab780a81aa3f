package com.devicetrack.locator.source;

import java.io.InputStream;

/**
 * Read access to objects in a bucket-style store.
 */
public interface ObjectSource {
  /**
   * Opens an object for reading. The caller closes the returned stream.
   *
   * @param bucket bucket name
   * @param key object key
   * @return object content
   * @throws ObjectSourceException when the store is unreachable, the object is missing or access
   *     is denied
   */
  InputStream fetch(String bucket, String key);
}
