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

import com.google.common.base.Preconditions;

import org.immutables.value.Value;

import java.util.Map;

/**
 * Options passed with a single write call.
 * Only the overwrite flag is interpreted, every other option is handed verbatim to the adapter
 * (e.g. request headers for S3, ignored by the local adapter).
 */
@Value.Immutable
@Value.Style(strictBuilder = true, typeImmutable = "*")
public abstract class AbstractWriteConfig {

  public static final String OVERWRITE = "overwrite";

  /**
   * @return True if an existing resource may be replaced.
   */
  @Value.Default
  public boolean overwrite() {
    return false;
  }

  /**
   * @return Adapter specific options, keyed by option name.
   */
  public abstract Map<String, String> getMetadata();

  @Value.Check
  protected void validate() {
    Preconditions.checkState(!getMetadata().containsKey(OVERWRITE), "overwrite must be set through the flag");
  }

  public static WriteConfig defaults() {
    return WriteConfig.builder().build();
  }

  public static WriteConfig overwriting() {
    return WriteConfig.builder().overwrite(true).build();
  }

  /**
   * Builds a config from a flat option map. The {@value #OVERWRITE} key is parsed as a boolean,
   * all the others are kept as metadata.
   */
  public static WriteConfig fromOptions(Map<String, String> options) {
    Preconditions.checkNotNull(options);
    WriteConfig.Builder builder = WriteConfig.builder();
    for (Map.Entry<String, String> option : options.entrySet()) {
      if (OVERWRITE.equals(option.getKey())) {
        builder.overwrite(Boolean.parseBoolean(option.getValue()));
      } else {
        builder.putMetadata(option.getKey(), option.getValue());
      }
    }
    return builder.build();
  }
}
