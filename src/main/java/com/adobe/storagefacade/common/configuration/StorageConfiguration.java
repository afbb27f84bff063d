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
 * Provides configuration information for a single named storage (a "disk"). Every key is looked up
 * with the disk name as suffix, so several storages can share one configuration source.
 */
public class StorageConfiguration {

  private final String disk;
  private final KeyValueConfiguration diskAwareConfiguration;

  public StorageConfiguration(String disk, KeyValueConfiguration keyValueConfiguration) {
    this.disk = Preconditions.checkNotNull(disk);
    this.diskAwareConfiguration = new FilteringKeyValueConfiguration(keyValueConfiguration, disk);
  }

  public String getDisk() {
    return disk;
  }

  public int getInt(String key, int defaultValue) {
    return diskAwareConfiguration.getInt(key, defaultValue);
  }

  public String getString(String key, String defaultValue) {
    return diskAwareConfiguration.getString(key, defaultValue);
  }

  public String getString(String key) {
    return diskAwareConfiguration.getString(key);
  }

  public Optional<String> getOptionalString(String key) {
    return diskAwareConfiguration.getOptionalString(key);
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    return diskAwareConfiguration.getBoolean(key, defaultValue);
  }
}
