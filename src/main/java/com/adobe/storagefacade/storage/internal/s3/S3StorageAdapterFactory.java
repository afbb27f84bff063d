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

package com.adobe.storagefacade.storage.internal.s3;

import com.adobe.storagefacade.common.configuration.StorageConfiguration;
import com.adobe.storagefacade.objectstore.AmazonS3ObjectStoreClient;
import com.adobe.storagefacade.storage.api.StorageAdapter;
import com.adobe.storagefacade.storage.api.StorageAdapterFactory;
import com.adobe.storagefacade.utils.aws.LoggingBackoffStrategy;

import com.amazonaws.ClientConfiguration;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.retry.PredefinedBackoffStrategies;
import com.amazonaws.retry.PredefinedRetryPolicies;
import com.amazonaws.retry.RetryPolicy;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.google.common.annotations.VisibleForTesting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Creates {@link S3StorageAdapter} instances, each with its own {@link AmazonS3} client.
 */
public class S3StorageAdapterFactory implements StorageAdapterFactory {

  private static final Logger LOG = LoggerFactory.getLogger(S3StorageAdapterFactory.class);

  @Override
  public StorageAdapter create(StorageConfiguration configuration) {
    S3StorageAdapterConfiguration s3Configuration = new S3StorageAdapterConfiguration(configuration);
    String bucket = s3Configuration.getBucket();
    LOG.info("Creating S3 storage {} on bucket {}", configuration.getDisk(), bucket);
    return new S3StorageAdapter(bucket, new AmazonS3ObjectStoreClient(createS3Client(configuration.getDisk(), s3Configuration)));
  }

  @VisibleForTesting
  static ClientConfiguration createClientConfiguration(String disk, S3StorageAdapterConfiguration configuration) {
    int baseDelay = configuration.getBaseExponentialDelayMillis();
    int maxDelay = configuration.getMaxExponentialDelayMillis();

    RetryPolicy.BackoffStrategy backoffStrategy;
    if (configuration.useFullJitterBackoff()) {
      backoffStrategy = new PredefinedBackoffStrategies.FullJitterBackoffStrategy(baseDelay, maxDelay);
    } else {
      backoffStrategy = new PredefinedBackoffStrategies.EqualJitterBackoffStrategy(baseDelay, maxDelay);
    }

    RetryPolicy retryPolicy = new RetryPolicy(PredefinedRetryPolicies.DEFAULT_RETRY_CONDITION,
                                              new LoggingBackoffStrategy(disk, backoffStrategy),
                                              configuration.getMaxRetries(),
                                              true);

    return new ClientConfiguration()
        .withRetryPolicy(retryPolicy)
        .withMaxConnections(configuration.getMaxHttpConnections());
  }

  private static AmazonS3 createS3Client(String disk, S3StorageAdapterConfiguration configuration) {
    AmazonS3ClientBuilder clientBuilder = AmazonS3ClientBuilder.standard()
        .withClientConfiguration(createClientConfiguration(disk, configuration));

    configuration.getCredentialsProvider()
        .ifPresent(clientBuilder::withCredentials);

    Optional<AwsClientBuilder.EndpointConfiguration> endpointConfiguration = configuration.getEndpointConfiguration();
    if (endpointConfiguration.isPresent()) {
      clientBuilder.withEndpointConfiguration(endpointConfiguration.get())
          .withPathStyleAccessEnabled(true);
    } else {
      configuration.getRegion().ifPresent(clientBuilder::withRegion);
    }

    return clientBuilder.build();
  }
}
