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

package com.adobe.storagefacade.objectstore;

import java.io.Closeable;
import java.util.Map;

/**
 * Minimal client for a remote key/value object store.
 * Implementations report failures through {@link ObjectStoreResponse#getError()} and never throw.
 */
public interface ObjectStoreClient extends Closeable {

  /**
   * Fetches the object content.
   */
  ObjectStoreResponse getObject(String bucket, String key);

  /**
   * Stores the object, replacing any existing one.
   * @param headers Request headers sent with the object (e.g. Content-Type).
   */
  ObjectStoreResponse putObject(String bucket, String key, byte[] body, Map<String, String> headers);

  ObjectStoreResponse deleteObject(String bucket, String key);

  /**
   * Probes the object without fetching its content.
   * @return A response carrying the object headers, or a 404 status if the object does not exist.
   */
  ObjectStoreResponse getObjectInfo(String bucket, String key);
}
