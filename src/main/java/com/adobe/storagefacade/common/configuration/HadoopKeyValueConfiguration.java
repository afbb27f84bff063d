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
import com.google.common.base.Strings;

import org.apache.hadoop.conf.Configuration;

import java.util.Optional;

/**
 * {@link KeyValueConfiguration} reading from a Hadoop {@link Configuration}.
 */
public class HadoopKeyValueConfiguration implements KeyValueConfiguration {

  private final Configuration configuration;

  public HadoopKeyValueConfiguration(Configuration configuration) {
    this.configuration = Preconditions.checkNotNull(configuration);
  }

  @Override
  public int getInt(String key, int defaultValue) {
    return configuration.getInt(key, defaultValue);
  }

  @Override
  public String getString(String key, String defaultValue) {
    return configuration.get(key, defaultValue);
  }

  @Override
  public String getString(String key) {
    return getOptionalString(key)
        .orElseThrow(() -> new IllegalArgumentException(key + " is not set"));
  }

  @Override
  public Optional<String> getOptionalString(String key) {
    String val = configuration.getTrimmed(key);
    return Strings.isNullOrEmpty(val) ? Optional.empty() : Optional.of(val);
  }

  @Override
  public boolean getBoolean(String key, boolean defaultValue) {
    return configuration.getBoolean(key, defaultValue);
  }
}
