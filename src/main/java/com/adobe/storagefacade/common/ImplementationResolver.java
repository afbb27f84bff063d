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

package com.adobe.storagefacade.common;

import com.adobe.storagefacade.common.exceptions.StorageCreationException;

import com.google.common.base.Preconditions;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.util.ReflectionUtils;

/**
 * Helper used to instantiate types bound dynamically in the Hadoop config.
 */
public class ImplementationResolver {

  private final Configuration configuration;

  public ImplementationResolver(Configuration configuration) {
    this.configuration = Preconditions.checkNotNull(configuration);
  }

  /**
   * @param key Configuration key holding the class name.
   * @param contract Type the bound class must implement.
   * @param defaultImplementation Used when the key is not set.
   * @return A new instance, configured if it is {@link org.apache.hadoop.conf.Configurable}.
   */
  public <T> T resolve(String key, Class<T> contract, Class<? extends T> defaultImplementation) {
    Class<? extends T> type;
    try {
      type = configuration.getClass(key, defaultImplementation, contract);
    } catch (RuntimeException e) {
      throw new StorageCreationException("Unable to load the class bound to " + key, e);
    }
    if (type == null) {
      throw new IllegalArgumentException("No implementation bound to " + key);
    }
    return ReflectionUtils.newInstance(type, configuration);
  }
}
