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

package com.adobe.storagefacade.common.exceptions;

import com.adobe.storagefacade.storage.api.StorageAdapter;

import com.google.common.base.Preconditions;

/**
 * Raised on caller misuse of a {@link StorageAdapter}: bad paths or unmet preconditions.
 * Routine IO failures are never reported through this exception.
 */
public class StorageException extends RuntimeException {

  public enum Reason {
    ALREADY_EXISTS("File already exists"),
    DOES_NOT_EXIST("File does not exist"),
    INVALID_PATH("Invalid path"),
    PATH_TRAVERSAL("Directory traversal detected"),
    INVALID_DIRECTORY("Invalid directory");

    private final String description;

    Reason(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

  private final transient StorageAdapter adapter;
  private final Reason reason;

  public StorageException(StorageAdapter adapter, Reason reason, String path) {
    super(formatMessage(reason, path));
    this.adapter = Preconditions.checkNotNull(adapter);
    this.reason = Preconditions.checkNotNull(reason);
  }

  /**
   * @return The adapter instance that raised this error.
   */
  public StorageAdapter getAdapter() {
    return adapter;
  }

  public Reason getReason() {
    return reason;
  }

  private static String formatMessage(Reason reason, String path) {
    return String.format("%s: %s", reason.getDescription(), path);
  }
}
