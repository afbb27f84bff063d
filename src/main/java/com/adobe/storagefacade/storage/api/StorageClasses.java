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

/**
 * Configuration keys binding implementation classes. Keys are suffixed with the disk name.
 */
public enum StorageClasses {
  ADAPTER_FACTORY("storage.adapter.factory.class");

  private final String key;

  StorageClasses(String key) {
    this.key = Preconditions.checkNotNull(key);
  }

  public String getKey() {
    return key;
  }

  public String forDisk(String disk) {
    return key + "." + disk;
  }

  @Override
  public String toString() {
    return key;
  }
}
