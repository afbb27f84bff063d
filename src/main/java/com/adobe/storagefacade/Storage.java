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

package com.adobe.storagefacade;

import com.adobe.storagefacade.storage.api.StorageAdapter;
import com.adobe.storagefacade.storage.api.WriteConfig;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Bytes;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Entry point for file oriented operations over a single {@link StorageAdapter}.
 * <p>
 * Every operation is delegated to the adapter, so it behaves the same whichever adapter is used.
 * {@link #append} and {@link #prepend} are built on read followed by a full rewrite: they are neither
 * atomic nor meant for large files.
 */
public class Storage implements Closeable {

  public static final String DEFAULT_SEPARATOR = System.lineSeparator();

  private final StorageAdapter adapter;

  public Storage(StorageAdapter adapter) {
    this.adapter = Preconditions.checkNotNull(adapter);
  }

  public StorageAdapter getAdapter() {
    return adapter;
  }

  public boolean exists(String path) {
    return adapter.exists(path);
  }

  public boolean missing(String path) {
    return !adapter.exists(path);
  }

  public byte[] read(String path) {
    return adapter.read(path);
  }

  public String readString(String path) {
    return new String(adapter.read(path), StandardCharsets.UTF_8);
  }

  public boolean write(String path, byte[] content, WriteConfig config) {
    return adapter.write(path, content, config);
  }

  public boolean write(String path, byte[] content) {
    return write(path, content, WriteConfig.defaults());
  }

  public boolean write(String path, String content, WriteConfig config) {
    return write(path, content.getBytes(StandardCharsets.UTF_8), config);
  }

  public boolean write(String path, String content) {
    return write(path, content, WriteConfig.defaults());
  }

  /**
   * Adds data at the end of the file, after the separator. The file is created with only the data
   * if it does not exist.
   */
  public boolean append(String path, byte[] data, byte[] separator) {
    if (exists(path)) {
      return write(path, Bytes.concat(read(path), separator, data), WriteConfig.overwriting());
    }
    return write(path, data);
  }

  public boolean append(String path, String data, String separator) {
    return append(path, data.getBytes(StandardCharsets.UTF_8), separator.getBytes(StandardCharsets.UTF_8));
  }

  public boolean append(String path, String data) {
    return append(path, data, DEFAULT_SEPARATOR);
  }

  /**
   * Adds data at the beginning of the file, before the separator. The file is created with only the
   * data if it does not exist.
   */
  public boolean prepend(String path, byte[] data, byte[] separator) {
    if (exists(path)) {
      return write(path, Bytes.concat(data, separator, read(path)), WriteConfig.overwriting());
    }
    return write(path, data);
  }

  public boolean prepend(String path, String data, String separator) {
    return prepend(path, data.getBytes(StandardCharsets.UTF_8), separator.getBytes(StandardCharsets.UTF_8));
  }

  public boolean prepend(String path, String data) {
    return prepend(path, data, DEFAULT_SEPARATOR);
  }

  public boolean delete(String path) {
    return adapter.delete(path);
  }

  public long size(String path) {
    return adapter.size(path);
  }

  public long lastModified(String path) {
    return adapter.lastModified(path);
  }

  public String path(String path) {
    return adapter.path(path);
  }

  public boolean copy(String from, String to) {
    return adapter.copy(from, to);
  }

  public boolean move(String from, String to) {
    return adapter.move(from, to);
  }

  public List<String> files(String directory, boolean recursive) {
    return adapter.files(directory, recursive);
  }

  public List<String> files(String directory) {
    return files(directory, false);
  }

  public List<String> directories(String directory, boolean recursive) {
    return adapter.directories(directory, recursive);
  }

  public List<String> directories(String directory) {
    return directories(directory, false);
  }

  public boolean createDirectory(String path) {
    return adapter.createDirectory(path);
  }

  public boolean deleteDirectory(String path) {
    return adapter.deleteDirectory(path);
  }

  /**
   * Releases the adapter resources, if it holds any.
   */
  @Override
  public void close() throws IOException {
    if (adapter instanceof Closeable) {
      ((Closeable) adapter).close();
    }
  }
}
