/*
Copyright 2021 Adobe. All rights reserved.
This file is licensed to you under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License. You may obtain a copy
of the License at http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software distributed under
the License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR REPRESENTATIONS
OF ANY KIND, either express or implied. See the License for the specific language
governing permissions and limitations under the License.
*/

package com.adobe.storagefacade.storage.api;

import com.adobe.storagefacade.common.exceptions.StorageException;

import java.util.List;

/**
 * Interface modelling a storage backend (e.g. a local directory tree or an S3 bucket) addressed by
 * caller supplied relative paths.
 * <p>
 * Misuse (malformed paths, unmet preconditions) is reported through {@link StorageException}.
 * Routine IO failures are never thrown, they degrade to {@code false}, zero or empty values.
 */
public interface StorageAdapter {

  /**
   * Check whether the given path exists. A missing resource is not an error.
   * @param path
   * @return
   */
  boolean exists(String path);

  /**
   * Reads the whole content stored at the given path.
   * @param path
   * @return The content, or an empty array if the underlying read failed.
   */
  byte[] read(String path);

  /**
   * Writes the content at the given path.
   * @param path
   * @param content
   * @param config Write options. Options other than overwrite are adapter specific.
   * @return True if the underlying write reported success.
   * @throws StorageException if the path exists and overwrite is not set.
   */
  boolean write(String path, byte[] content, WriteConfig config);

  boolean delete(String path);

  /**
   * @return The size in bytes, zero if it can not be determined.
   */
  long size(String path);

  /**
   * @return The last modification time as UNIX epoch seconds, zero if it can not be determined.
   */
  long lastModified(String path);

  /**
   * Resolves the given path to a locator meaningful for this adapter.
   * @param path
   * @return
   * @throws StorageException if the path does not exist.
   */
  String path(String path);

  /**
   * @return False if the source does not exist.
   */
  boolean copy(String from, String to);

  /**
   * Moves a resource. This is not guaranteed to be atomic: a failure after the destination was
   * written leaves the source in place.
   * @return False if the source does not exist.
   */
  boolean move(String from, String to);

  /**
   * Lists the files under a directory, sorted in case-insensitive natural order.
   */
  List<String> files(String directory, boolean recursive);

  /**
   * Lists the directories under a directory, sorted in case-insensitive natural order.
   */
  List<String> directories(String directory, boolean recursive);

  boolean createDirectory(String path);

  /**
   * Deletes an empty directory.
   * @throws StorageException if the path is missing or is not a directory.
   */
  boolean deleteDirectory(String path);
}
