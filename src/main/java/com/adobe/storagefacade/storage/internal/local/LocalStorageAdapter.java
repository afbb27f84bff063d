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

package com.adobe.storagefacade.storage.internal.local;

import com.adobe.storagefacade.common.exceptions.StorageException;
import com.adobe.storagefacade.storage.api.StorageAdapter;
import com.adobe.storagefacade.storage.api.WriteConfig;
import com.adobe.storagefacade.utils.collections.NaturalOrderComparator;

import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Implementation of {@link StorageAdapter} confined to a directory of the local filesystem.
 * <p>
 * Every caller path goes through {@link PathNormalizer} before any filesystem call, so no operation
 * can reach outside of the root directory.
 */
public class LocalStorageAdapter implements StorageAdapter {

  private static final Logger LOG = LoggerFactory.getLogger(LocalStorageAdapter.class);

  private static final CharMatcher TRAILING_SEPARATORS = CharMatcher.anyOf("/" + File.separator);

  private final String root;
  private final PathNormalizer pathNormalizer;

  public LocalStorageAdapter(String root) {
    this.root = TRAILING_SEPARATORS.trimTrailingFrom(Preconditions.checkNotNull(root));
    this.pathNormalizer = new PathNormalizer(this);
  }

  public String getRoot() {
    return root;
  }

  @Override
  public boolean exists(String path) {
    return Files.exists(Paths.get(absolutePath(path)));
  }

  @Override
  public byte[] read(String path) {
    Path file = Paths.get(path(path));
    try {
      return Files.readAllBytes(file);
    } catch (IOException e) {
      LOG.warn("Error reading {}", file, e);
      return new byte[0];
    }
  }

  @Override
  public boolean write(String path, byte[] content, WriteConfig config) {
    Preconditions.checkNotNull(content);
    Preconditions.checkNotNull(config);
    if (exists(path) && !config.overwrite()) {
      throw new StorageException(this, StorageException.Reason.ALREADY_EXISTS, path);
    }

    Path file = Paths.get(absolutePath(path));
    try {
      createParentDirectories(file);
      Files.write(file, content);
      // an empty write is reported as a failure
      return content.length > 0;
    } catch (IOException e) {
      LOG.warn("Error writing {}", file, e);
      return false;
    }
  }

  @Override
  public boolean delete(String path) {
    Path file = Paths.get(path(path));
    if (Files.isDirectory(file, LinkOption.NOFOLLOW_LINKS)) {
      LOG.warn("Refusing to delete directory {}, use deleteDirectory instead", file);
      return false;
    }
    try {
      Files.delete(file);
      return true;
    } catch (IOException e) {
      LOG.warn("Error deleting {}", file, e);
      return false;
    }
  }

  @Override
  public long size(String path) {
    Path file = Paths.get(path(path));
    try {
      return Files.size(file);
    } catch (IOException e) {
      LOG.warn("Error reading size of {}", file, e);
      return 0;
    }
  }

  @Override
  public long lastModified(String path) {
    Path file = Paths.get(path(path));
    try {
      return Files.getLastModifiedTime(file).to(TimeUnit.SECONDS);
    } catch (IOException e) {
      LOG.warn("Error reading modification time of {}", file, e);
      return 0;
    }
  }

  @Override
  public String path(String path) {
    if (!exists(path)) {
      throw new StorageException(this, StorageException.Reason.DOES_NOT_EXIST, path);
    }
    return absolutePath(path);
  }

  @Override
  public boolean copy(String from, String to) {
    Path source = Paths.get(absolutePath(from));
    Path target = Paths.get(absolutePath(to));
    if (!Files.exists(source)) {
      return false;
    }
    if (Files.isDirectory(source)) {
      LOG.warn("Refusing to copy directory {}, only files can be copied", source);
      return false;
    }
    try {
      createParentDirectories(target);
      Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
      return true;
    } catch (IOException e) {
      LOG.warn("Error copying {} to {}", source, target, e);
      return false;
    }
  }

  @Override
  public boolean move(String from, String to) {
    Path source = Paths.get(absolutePath(from));
    Path target = Paths.get(absolutePath(to));
    if (!Files.exists(source)) {
      return false;
    }
    try {
      createParentDirectories(target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
      return true;
    } catch (IOException e) {
      LOG.warn("Error moving {} to {}", source, target, e);
      return false;
    }
  }

  @Override
  public List<String> files(String directory, boolean recursive) {
    return list(directory, recursive, it -> !Files.isDirectory(it));
  }

  @Override
  public List<String> directories(String directory, boolean recursive) {
    return list(directory, recursive, it -> Files.isDirectory(it));
  }

  @Override
  public boolean createDirectory(String path) {
    Path directory = Paths.get(absolutePath(path));
    if (Files.exists(directory)) {
      LOG.debug("{} already exists", directory);
      return false;
    }
    try {
      Files.createDirectories(directory);
      return true;
    } catch (IOException e) {
      LOG.warn("Error creating directory {}", directory, e);
      return false;
    }
  }

  @Override
  public boolean deleteDirectory(String path) {
    Path directory = Paths.get(absolutePath(path));
    if (!Files.isDirectory(directory)) {
      throw new StorageException(this, StorageException.Reason.INVALID_DIRECTORY, path);
    }
    try {
      Files.delete(directory);
      return true;
    } catch (DirectoryNotEmptyException e) {
      LOG.warn("Directory {} is not empty", directory);
      return false;
    } catch (IOException e) {
      LOG.warn("Error deleting directory {}", directory, e);
      return false;
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("root", root)
        .toString();
  }

  /**
   * Lists the entries under the directory accepted by the filter. The directory itself is never part
   * of the result.
   */
  private List<String> list(String directory, boolean recursive, Predicate<Path> filter) {
    Path start = Paths.get(absolutePath(directory));
    try (Stream<Path> entries = recursive ? Files.walk(start).skip(1) : Files.list(start)) {
      return entries
          .filter(filter)
          .map(Path::toString)
          .sorted(NaturalOrderComparator.INSTANCE)
          .collect(ImmutableList.toImmutableList());
    } catch (IOException | UncheckedIOException e) {
      LOG.warn("Error listing {}", start, e);
      return ImmutableList.of();
    }
  }

  private static void createParentDirectories(Path file) throws IOException {
    Path parent = file.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
  }

  private String absolutePath(String path) {
    return root + "/" + pathNormalizer.normalize(path);
  }
}
