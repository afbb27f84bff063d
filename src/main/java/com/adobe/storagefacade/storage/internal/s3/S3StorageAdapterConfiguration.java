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

import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.google.common.base.Preconditions;

import java.util.Optional;

public class S3StorageAdapterConfiguration {

  public static final String BUCKET_PROP = "storage.s3.bucket";
  public static final String AWS_ACCESS_KEY_ID = "storage.s3.access";
  public static final String AWS_SECRET_ACCESS_KEY = "storage.s3.secret";
  public static final String AWS_ENDPOINT = "storage.s3.endpoint";
  public static final String AWS_SIGNING_REGION = "storage.s3.signing.region";
  public static final String AWS_REGION = "storage.s3.region";
  public static final String MAX_RETRIES = "storage.s3.max.retries";
  public static final String BASE_EXPONENTIAL_DELAY = "storage.s3.base.exponential.delay";
  public static final String MAX_EXPONENTIAL_DELAY = "storage.s3.max.exponential.delay";
  public static final String USE_FULL_JITTER_BACKOFF = "storage.s3.backoff.full.jitter";
  public static final String MAX_HTTP_CONNECTIONS = "storage.s3.max.http.conn";

  public static final int DEFAULT_MAX_RETRIES = 10;
  public static final int DEFAULT_BASE_EXPONENTIAL_DELAY = 10;
  public static final int DEFAULT_MAX_EXPONENTIAL_DELAY = 30000;
  public static final boolean DEFAULT_USE_FULL_JITTER = true;
  public static final int DEFAULT_MAX_HTTP_CONNECTIONS = 50;

  private final StorageConfiguration configuration;

  public S3StorageAdapterConfiguration(StorageConfiguration configuration) {
    this.configuration = Preconditions.checkNotNull(configuration);
  }

  public String getBucket() {
    return configuration.getOptionalString(BUCKET_PROP)
        .orElseThrow(() -> new IllegalStateException(BUCKET_PROP + " must be set for disk " + configuration.getDisk()));
  }

  /**
   * @return Static credentials if both the access and the secret key are set, otherwise the SDK default chain applies.
   */
  public Optional<AWSCredentialsProvider> getCredentialsProvider() {
    Optional<String> accessKey = configuration.getOptionalString(AWS_ACCESS_KEY_ID);
    Optional<String> secretKey = configuration.getOptionalString(AWS_SECRET_ACCESS_KEY);
    if (!accessKey.isPresent() || !secretKey.isPresent()) {
      return Optional.empty();
    }
    return Optional.of(new AWSStaticCredentialsProvider(new BasicAWSCredentials(accessKey.get(), secretKey.get())));
  }

  /**
   * @return A custom endpoint (e.g. an S3 compatible store) if both endpoint and signing region are set.
   */
  public Optional<AwsClientBuilder.EndpointConfiguration> getEndpointConfiguration() {
    Optional<String> endpoint = configuration.getOptionalString(AWS_ENDPOINT);
    Optional<String> signingRegion = configuration.getOptionalString(AWS_SIGNING_REGION);
    if (!endpoint.isPresent() || !signingRegion.isPresent()) {
      return Optional.empty();
    }
    return Optional.of(new AwsClientBuilder.EndpointConfiguration(endpoint.get(), signingRegion.get()));
  }

  /**
   * @return The region of the bucket, used only when no custom endpoint is configured.
   */
  public Optional<String> getRegion() {
    return configuration.getOptionalString(AWS_REGION);
  }

  public int getMaxRetries() {
    return configuration.getInt(MAX_RETRIES, DEFAULT_MAX_RETRIES);
  }

  public int getBaseExponentialDelayMillis() {
    return configuration.getInt(BASE_EXPONENTIAL_DELAY, DEFAULT_BASE_EXPONENTIAL_DELAY);
  }

  public int getMaxExponentialDelayMillis() {
    return configuration.getInt(MAX_EXPONENTIAL_DELAY, DEFAULT_MAX_EXPONENTIAL_DELAY);
  }

  public boolean useFullJitterBackoff() {
    return configuration.getBoolean(USE_FULL_JITTER_BACKOFF, DEFAULT_USE_FULL_JITTER);
  }

  public int getMaxHttpConnections() {
    return configuration.getInt(MAX_HTTP_CONNECTIONS, DEFAULT_MAX_HTTP_CONNECTIONS);
  }
}
