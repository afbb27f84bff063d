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

package com.adobe.storagefacade.storage.internal.s3;

import com.adobe.storagefacade.common.exceptions.StorageException;
import com.adobe.storagefacade.objectstore.ObjectStoreClient;
import com.adobe.storagefacade.objectstore.ObjectStoreResponse;
import com.adobe.storagefacade.storage.api.StorageAdapter;
import com.adobe.storagefacade.storage.api.WriteConfig;

import com.amazonaws.services.s3.Headers;
import com.amazonaws.util.DateUtils;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Longs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Implementation of {@link StorageAdapter} backed by a bucket of a remote object store.
 * Keys are used verbatim, there is no path normalization.
 * <p>
 * Successful metadata probes are cached per path for the lifetime of the instance, so chains such as
 * {@code exists} followed by {@code size} only reach the store once. The cache is unbounded, is only
 * evicted by writes and deletes issued through this instance and is not thread safe.
 * <p>
 * The store has no directory concept: listings are always empty and directory operations return false.
 */
public class S3StorageAdapter implements StorageAdapter, Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(S3StorageAdapter.class);

  private final String bucket;
  private final ObjectStoreClient client;
  private final Map<String, ObjectStoreResponse> metadataCache = new HashMap<>();

  public S3StorageAdapter(String bucket, ObjectStoreClient client) {
    this.bucket = Preconditions.checkNotNull(bucket);
    this.client = Preconditions.checkNotNull(client);
  }

  public String getBucket() {
    return bucket;
  }

  @Override
  public boolean exists(String path) {
    return getMetadata(path)
        .map(it -> it.getCode() == ObjectStoreResponse.STATUS_OK)
        .orElse(false);
  }

  @Override
  public byte[] read(String path) {
    ObjectStoreResponse response = client.getObject(bucket, path);
    if (response.hasError()) {
      LOG.warn("Error reading {}/{}: {}", bucket, path, response.getError().get());
      return new byte[0];
    }
    return response.getBody();
  }

  @Override
  public boolean write(String path, byte[] content, WriteConfig config) {
    Preconditions.checkNotNull(content);
    Preconditions.checkNotNull(config);
    if (exists(path) && !config.overwrite()) {
      throw new StorageException(this, StorageException.Reason.ALREADY_EXISTS, path);
    }

    ObjectStoreResponse response = client.putObject(bucket, path, content, config.getMetadata());
    if (response.hasError()) {
      LOG.warn("Error writing {}/{}: {}", bucket, path, response.getError().get());
      return false;
    }
    evict(path);
    return true;
  }

  @Override
  public boolean delete(String path) {
    ObjectStoreResponse response = client.deleteObject(bucket, path);
    if (response.hasError()) {
      LOG.warn("Error deleting {}/{}: {}", bucket, path, response.getError().get());
      return false;
    }
    evict(path);
    return true;
  }

  @Override
  public long size(String path) {
    return getMetadata(path)
        .flatMap(it -> it.header(Headers.CONTENT_LENGTH))
        .map(it -> Longs.tryParse(it.trim()))
        .orElse(0L);
  }

  @Override
  public long lastModified(String path) {
    return getMetadata(path)
        .flatMap(it -> it.header(Headers.LAST_MODIFIED))
        .map(S3StorageAdapter::parseHttpDate)
        .orElse(0L);
  }

  @Override
  public String path(String path) {
    if (!exists(path)) {
      throw new StorageException(this, StorageException.Reason.DOES_NOT_EXIST, path);
    }
    return path;
  }

  @Override
  public boolean copy(String from, String to) {
    if (!exists(from)) {
      return false;
    }
    return write(to, read(from), WriteConfig.defaults());
  }

  @Override
  public boolean move(String from, String to) {
    if (!exists(from)) {
      return false;
    }
    // the source is kept if the destination could not be written
    if (!write(to, read(from), WriteConfig.defaults())) {
      return false;
    }
    return delete(from);
  }

  @Override
  public List<String> files(String directory, boolean recursive) {
    return ImmutableList.of();
  }

  @Override
  public List<String> directories(String directory, boolean recursive) {
    return ImmutableList.of();
  }

  @Override
  public boolean createDirectory(String path) {
    return false;
  }

  @Override
  public boolean deleteDirectory(String path) {
    return false;
  }

  @Override
  public void close() throws IOException {
    client.close();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("bucket", bucket)
        .toString();
  }

  @VisibleForTesting
  int cachedEntries() {
    return metadataCache.size();
  }

  /**
   * Returns the metadata probe for the path. Only probes that found the object are cached, so a
   * missing object is probed again on every call.
   */
  private Optional<ObjectStoreResponse> getMetadata(String path) {
    String digest = digest(path);
    ObjectStoreResponse cached = metadataCache.get(digest);
    if (cached != null) {
      return Optional.of(cached);
    }

    ObjectStoreResponse response = client.getObjectInfo(bucket, path);
    if (response.hasError() || response.getCode() != ObjectStoreResponse.STATUS_OK) {
      LOG.debug("No metadata for {}/{} (status {})", bucket, path, response.getCode());
      return Optional.empty();
    }
    LOG.debug("Caching metadata of {}/{}", bucket, path);
    metadataCache.put(digest, response);
    return Optional.of(response);
  }

  private void evict(String path) {
    metadataCache.remove(digest(path));
  }

  private static String digest(String path) {
    return Hashing.sha256().hashString(path, StandardCharsets.UTF_8).toString();
  }

  private static Long parseHttpDate(String value) {
    try {
      return TimeUnit.MILLISECONDS.toSeconds(DateUtils.parseRFC822Date(value).getTime());
    } catch (RuntimeException e) {
      LOG.debug("Unparseable date {}", value, e);
      return 0L;
    }
  }
}
