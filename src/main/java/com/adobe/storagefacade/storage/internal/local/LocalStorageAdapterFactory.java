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

import com.adobe.storagefacade.common.configuration.StorageConfiguration;
import com.adobe.storagefacade.storage.api.StorageAdapter;
import com.adobe.storagefacade.storage.api.StorageAdapterFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LocalStorageAdapterFactory implements StorageAdapterFactory {

  private static final Logger LOG = LoggerFactory.getLogger(LocalStorageAdapterFactory.class);

  @Override
  public StorageAdapter create(StorageConfiguration configuration) {
    String root = new LocalStorageAdapterConfiguration(configuration).getRootDirectory();
    LOG.info("Creating local storage {} rooted at {}", configuration.getDisk(), root);
    return new LocalStorageAdapter(root);
  }
}
