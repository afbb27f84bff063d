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

package com.adobe.storagefacade.common.configuration;

import com.google.common.base.Preconditions;

import java.util.Optional;

/**
 * Implementation of {@link KeyValueConfiguration} that reads every key with a fixed suffix appended,
 * e.g. {@code storage.local.root} is read as {@code storage.local.root.uploads}.
 */
public class FilteringKeyValueConfiguration implements KeyValueConfiguration {

  private final KeyValueConfiguration keyValueConfiguration;
  private final String suffix;

  public FilteringKeyValueConfiguration(KeyValueConfiguration keyValueConfiguration, String suffix) {
    this.keyValueConfiguration = Preconditions.checkNotNull(keyValueConfiguration);
    this.suffix = Preconditions.checkNotNull(suffix);
  }

  @Override
  public int getInt(String key, int defaultValue) {
    return keyValueConfiguration.getInt(scoped(key), defaultValue);
  }

  @Override
  public String getString(String key, String defaultValue) {
    return keyValueConfiguration.getString(scoped(key), defaultValue);
  }

  @Override
  public String getString(String key) {
    return keyValueConfiguration.getString(scoped(key));
  }

  @Override
  public Optional<String> getOptionalString(String key) {
    return keyValueConfiguration.getOptionalString(scoped(key));
  }

  @Override
  public boolean getBoolean(String key, boolean defaultValue) {
    return keyValueConfiguration.getBoolean(scoped(key), defaultValue);
  }

  private String scoped(String key) {
    return key + "." + suffix;
  }
}
