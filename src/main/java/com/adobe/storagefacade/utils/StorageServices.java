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

package com.adobe.storagefacade.utils;

import com.adobe.storagefacade.Storage;
import com.adobe.storagefacade.common.ImplementationResolver;
import com.adobe.storagefacade.common.configuration.HadoopKeyValueConfiguration;
import com.adobe.storagefacade.common.configuration.StorageConfiguration;
import com.adobe.storagefacade.storage.api.StorageAdapterFactory;
import com.adobe.storagefacade.storage.api.StorageClasses;
import com.adobe.storagefacade.storage.internal.local.LocalStorageAdapterFactory;

import org.apache.hadoop.conf.Configuration;

public final class StorageServices {

  private StorageServices() {
    throw new IllegalStateException("Non-instantiable class");
  }

  /**
   * Creates the storage configured under the given disk name.
   * @param configuration Hadoop Configuration holding the disk scoped properties
   * @param disk Name of the storage, used as suffix of every property
   * @return a Storage backed by the adapter bound to {@link StorageClasses#ADAPTER_FACTORY},
   *     the local filesystem adapter if none is bound
   */
  public static Storage createStorage(Configuration configuration, String disk) {
    StorageAdapterFactory adapterFactory = new ImplementationResolver(configuration)
        .resolve(StorageClasses.ADAPTER_FACTORY.forDisk(disk), StorageAdapterFactory.class, LocalStorageAdapterFactory.class);

    return new Storage(adapterFactory.create(createStorageConfiguration(configuration, disk)));
  }

  /**
   * @param configuration Hadoop Configuration
   * @param disk Name of the storage
   * @return StorageConfiguration configuration object for a specific storage
   */
  public static StorageConfiguration createStorageConfiguration(Configuration configuration, String disk) {
    return new StorageConfiguration(disk, new HadoopKeyValueConfiguration(configuration));
  }
}
