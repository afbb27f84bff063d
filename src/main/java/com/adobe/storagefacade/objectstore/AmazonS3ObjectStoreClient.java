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

package com.adobe.storagefacade.objectstore;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.Headers;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.util.DateUtils;
import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link ObjectStoreClient} backed by an {@link AmazonS3} client.
 * SDK exceptions are translated into error responses.
 */
public class AmazonS3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOG = LoggerFactory.getLogger(AmazonS3ObjectStoreClient.class);

  private static final Map<String, String> STANDARD_HEADERS = ImmutableList.of(
      Headers.CONTENT_TYPE,
      Headers.CACHE_CONTROL,
      Headers.CONTENT_DISPOSITION,
      Headers.CONTENT_ENCODING,
      Headers.CONTENT_LANGUAGE,
      Headers.CONTENT_MD5,
      Headers.S3_CANNED_ACL,
      Headers.STORAGE_CLASS)
      .stream()
      .collect(ImmutableMap.toImmutableMap(it -> Ascii.toLowerCase(it), it -> it));

  private final AmazonS3 amazonS3;

  public AmazonS3ObjectStoreClient(AmazonS3 amazonS3) {
    this.amazonS3 = Preconditions.checkNotNull(amazonS3);
  }

  @Override
  public ObjectStoreResponse getObject(String bucket, String key) {
    return execute("getObject", bucket, key, () -> {
      try (S3Object s3Object = amazonS3.getObject(bucket, key)) {
        return ObjectStoreResponse.builder()
            .code(ObjectStoreResponse.STATUS_OK)
            .body(ByteStreams.toByteArray(s3Object.getObjectContent()))
            .putAllHeaders(toHeaders(s3Object.getObjectMetadata()))
            .build();
      } catch (IOException e) {
        throw new SdkClientException("Unable to read content of " + bucket + "/" + key, e);
      }
    });
  }

  @Override
  public ObjectStoreResponse putObject(String bucket, String key, byte[] body, Map<String, String> headers) {
    ObjectMetadata objectMetadata = new ObjectMetadata();
    for (Map.Entry<String, String> header : headers.entrySet()) {
      String name = canonicalHeaderName(header.getKey());
      if (Headers.CONTENT_TYPE.equals(name)) {
        objectMetadata.setContentType(header.getValue());
      } else {
        objectMetadata.setHeader(name, header.getValue());
      }
    }
    objectMetadata.setContentLength(body.length);

    return execute("putObject", bucket, key, () -> {
      amazonS3.putObject(bucket, key, new ByteArrayInputStream(body), objectMetadata);
      return ObjectStoreResponse.builder()
          .code(ObjectStoreResponse.STATUS_OK)
          .build();
    });
  }

  @Override
  public ObjectStoreResponse deleteObject(String bucket, String key) {
    return execute("deleteObject", bucket, key, () -> {
      amazonS3.deleteObject(bucket, key);
      return ObjectStoreResponse.builder()
          .code(ObjectStoreResponse.STATUS_NO_CONTENT)
          .build();
    });
  }

  @Override
  public ObjectStoreResponse getObjectInfo(String bucket, String key) {
    return execute("getObjectInfo", bucket, key, () -> ObjectStoreResponse.builder()
        .code(ObjectStoreResponse.STATUS_OK)
        .putAllHeaders(toHeaders(amazonS3.getObjectMetadata(bucket, key)))
        .build());
  }

  @Override
  public void close() throws IOException {
    amazonS3.shutdown();
  }

  private static ObjectStoreResponse execute(String operation, String bucket, String key, Supplier<ObjectStoreResponse> call) {
    try {
      return call.get();
    } catch (AmazonServiceException e) {
      if (e.getStatusCode() != ObjectStoreResponse.STATUS_NOT_FOUND) {
        LOG.warn("{} failed for {}/{}", operation, bucket, key, e);
      }
      return ObjectStoreResponse.builder()
          .code(e.getStatusCode())
          .error(String.valueOf(e.getErrorMessage()))
          .build();
    } catch (SdkClientException e) {
      LOG.error("{} could not be sent for {}/{}", operation, bucket, key, e);
      return ObjectStoreResponse.builder()
          .code(ObjectStoreResponse.STATUS_UNKNOWN)
          .error(String.valueOf(e.getMessage()))
          .build();
    }
  }

  // ObjectMetadata looks standard headers up by their exact canonical name
  private static String canonicalHeaderName(String name) {
    return STANDARD_HEADERS.getOrDefault(Ascii.toLowerCase(name), name);
  }

  private static Map<String, String> toHeaders(ObjectMetadata objectMetadata) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(Headers.CONTENT_LENGTH, Long.toString(objectMetadata.getContentLength()));
    if (objectMetadata.getLastModified() != null) {
      headers.put(Headers.LAST_MODIFIED, DateUtils.formatRFC822Date(objectMetadata.getLastModified()));
    }
    if (objectMetadata.getContentType() != null) {
      headers.put(Headers.CONTENT_TYPE, objectMetadata.getContentType());
    }
    if (objectMetadata.getETag() != null) {
      headers.put(Headers.ETAG, objectMetadata.getETag());
    }
    for (Map.Entry<String, String> userMetadata : objectMetadata.getUserMetadata().entrySet()) {
      headers.put(Headers.S3_USER_METADATA_PREFIX + userMetadata.getKey(), userMetadata.getValue());
    }
    return headers;
  }
}
