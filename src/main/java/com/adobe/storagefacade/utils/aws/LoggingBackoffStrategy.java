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

package com.adobe.storagefacade.utils.aws;

import com.amazonaws.AmazonClientException;
import com.amazonaws.AmazonWebServiceRequest;
import com.amazonaws.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Backoff strategy reporting each retry of a storage request, then delegating the delay computation.
 */
public class LoggingBackoffStrategy implements RetryPolicy.BackoffStrategy {

  private static final Logger LOG = LoggerFactory.getLogger(LoggingBackoffStrategy.class);

  private final String disk;
  private final RetryPolicy.BackoffStrategy delegate;

  public LoggingBackoffStrategy(String disk, RetryPolicy.BackoffStrategy delegate) {
    this.disk = Objects.requireNonNull(disk);
    this.delegate = Objects.requireNonNull(delegate);
  }

  @Override
  public long delayBeforeNextRetry(AmazonWebServiceRequest originalRequest, AmazonClientException exception, int retries) {
    long delay = delegate.delayBeforeNextRetry(originalRequest, exception, retries);
    LOG.warn("Retrying {} on disk {} in {} ms (retry {}): {}",
        originalRequest == null ? "request" : originalRequest.getClass().getSimpleName(),
        disk,
        delay,
        retries,
        exception == null ? "" : exception.getMessage());
    return delay;
  }
}
