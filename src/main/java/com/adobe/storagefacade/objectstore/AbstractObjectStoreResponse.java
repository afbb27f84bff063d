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

import org.immutables.value.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a single {@link ObjectStoreClient} call.
 */
@Value.Immutable
@Value.Style(strictBuilder = true, typeImmutable = "*")
public abstract class AbstractObjectStoreResponse {

  public static final int STATUS_OK = 200;
  public static final int STATUS_NO_CONTENT = 204;
  public static final int STATUS_NOT_FOUND = 404;
  /**
   * Used when the request never reached the remote store.
   */
  public static final int STATUS_UNKNOWN = 0;

  /**
   * @return The error message, present if the call failed.
   */
  public abstract Optional<String> getError();

  /**
   * @return The HTTP-style status code.
   */
  public abstract int getCode();

  @Value.Default
  public byte[] getBody() {
    return new byte[0];
  }

  public abstract Map<String, String> getHeaders();

  public boolean hasError() {
    return getError().isPresent();
  }

  /**
   * Looks up a header ignoring the case of its name.
   */
  public Optional<String> header(String name) {
    return getHeaders().entrySet().stream()
        .filter(it -> it.getKey().equalsIgnoreCase(name))
        .map(Map.Entry::getValue)
        .findFirst();
  }
}
