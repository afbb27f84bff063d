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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * Turns a caller supplied path into a canonical path relative to the adapter root.
 * <p>
 * Both separator styles are accepted. The result never contains empty or {@code .} segments and
 * never ascends above the root: a {@code ..} with nothing left to pop is rejected instead of being
 * clamped. Paths carrying Unicode control or format characters are rejected as well.
 */
public class PathNormalizer {

  private static final Pattern FORBIDDEN_CHARACTERS = Pattern.compile("\\p{C}");
  private static final Splitter SEGMENT_SPLITTER = Splitter.on('/');
  private static final Joiner SEGMENT_JOINER = Joiner.on('/');

  private final StorageAdapter owner;

  /**
   * @param owner Adapter reported by the errors raised from this normalizer.
   */
  public PathNormalizer(StorageAdapter owner) {
    this.owner = Preconditions.checkNotNull(owner);
  }

  /**
   * @param rawPath
   * @return The normalized path, empty if the input resolves to the root itself.
   * @throws StorageException if the path is malformed or escapes the root.
   */
  public String normalize(String rawPath) {
    Preconditions.checkNotNull(rawPath);
    String path = rawPath.replace('\\', '/');

    if (FORBIDDEN_CHARACTERS.matcher(path).find()) {
      throw new StorageException(owner, StorageException.Reason.INVALID_PATH, rawPath);
    }

    Deque<String> segments = new ArrayDeque<>();
    for (String segment : SEGMENT_SPLITTER.split(path)) {
      switch (segment) {
        case "":
        case ".":
          break;
        case "..":
          if (segments.isEmpty()) {
            throw new StorageException(owner, StorageException.Reason.PATH_TRAVERSAL, rawPath);
          }
          segments.removeLast();
          break;
        default:
          segments.addLast(segment);
          break;
      }
    }
    return SEGMENT_JOINER.join(segments);
  }
}
