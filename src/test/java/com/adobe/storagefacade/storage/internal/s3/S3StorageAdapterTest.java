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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.adobe.storagefacade.common.exceptions.StorageException;
import com.adobe.storagefacade.objectstore.ObjectStoreClient;
import com.adobe.storagefacade.objectstore.ObjectStoreResponse;
import com.adobe.storagefacade.storage.api.WriteConfig;

import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class S3StorageAdapterTest {

  private static final String BUCKET = "bucket";

  @Mock
  private ObjectStoreClient mockClient;

  private S3StorageAdapter adapter;

  @Before
  public void setup() {
    MockitoAnnotations.initMocks(this);
    when(mockClient.getObjectInfo(anyString(), anyString())).thenReturn(notFound());
    when(mockClient.putObject(anyString(), anyString(), any(byte[].class), anyMap())).thenReturn(ok());
    when(mockClient.deleteObject(anyString(), anyString())).thenReturn(noContent());

    adapter = new S3StorageAdapter(BUCKET, mockClient);
  }

  @Test
  public void testSuccessfulProbeIsCached() {
    when(mockClient.getObjectInfo(BUCKET, "k")).thenReturn(info("2", "Wed, 21 Oct 2015 07:28:00 GMT"));

    assertTrue(adapter.exists("k"));
    assertTrue(adapter.exists("k"));
    assertEquals(2, adapter.size("k"));
    assertEquals("k", adapter.path("k"));

    verify(mockClient, times(1)).getObjectInfo(BUCKET, "k");
    assertEquals(1, adapter.cachedEntries());
  }

  @Test
  public void testMissingObjectIsProbedEveryTime() {
    assertFalse(adapter.exists("missing"));
    assertFalse(adapter.exists("missing"));

    verify(mockClient, times(2)).getObjectInfo(BUCKET, "missing");
    assertEquals(0, adapter.cachedEntries());
  }

  @Test
  public void testFailedProbeIsNotCached() {
    when(mockClient.getObjectInfo(BUCKET, "k")).thenReturn(failure());

    assertFalse(adapter.exists("k"));
    assertEquals(0, adapter.size("k"));
    assertEquals(0, adapter.cachedEntries());
  }

  @Test
  public void testSizeAndLastModifiedComeFromHeaders() {
    when(mockClient.getObjectInfo(BUCKET, "k")).thenReturn(info("1024", "Wed, 21 Oct 2015 07:28:00 GMT"));

    assertEquals(1024, adapter.size("k"));
    assertEquals(1445412480L, adapter.lastModified("k"));
  }

  @Test
  public void testUnparseableHeadersDegradeToZero() {
    when(mockClient.getObjectInfo(BUCKET, "k")).thenReturn(info("not a number", "yesterday"));

    assertEquals(0, adapter.size("k"));
    assertEquals(0, adapter.lastModified("k"));
  }

  @Test
  public void testSizeAndLastModifiedOfMissingObjectAreZero() {
    assertEquals(0, adapter.size("missing"));
    assertEquals(0, adapter.lastModified("missing"));
  }

  @Test
  public void testPathOfMissingObjectThrowsDoesNotExist() {
    try {
      adapter.path("missing");
      fail("Expected a StorageException");
    } catch (StorageException e) {
      assertEquals(StorageException.Reason.DOES_NOT_EXIST, e.getReason());
      assertSame(adapter, e.getAdapter());
    }
  }

  @Test
  public void testReadReturnsBody() {
    when(mockClient.getObject(BUCKET, "k")).thenReturn(ObjectStoreResponse.builder()
        .code(ObjectStoreResponse.STATUS_OK)
        .body(bytes("content"))
        .build());

    assertArrayEquals(bytes("content"), adapter.read("k"));
  }

  @Test
  public void testReadFailureReturnsEmptyContent() {
    when(mockClient.getObject(BUCKET, "k")).thenReturn(failure());

    assertArrayEquals(new byte[0], adapter.read("k"));
  }

  @Test
  public void testWriteForwardsMetadataAsHeaders() {
    WriteConfig config = WriteConfig.builder()
        .putMetadata("Content-Type", "text/plain")
        .build();

    assertTrue(adapter.write("k", bytes("data"), config));

    verify(mockClient, times(1))
        .putObject(BUCKET, "k", bytes("data"), ImmutableMap.of("Content-Type", "text/plain"));
  }

  @Test
  public void testWriteOverExistingObjectFailsWithoutOverwrite() {
    when(mockClient.getObjectInfo(BUCKET, "k")).thenReturn(info("2", "Wed, 21 Oct 2015 07:28:00 GMT"));

    try {
      adapter.write("k", bytes("data"), WriteConfig.defaults());
      fail("Expected a StorageException");
    } catch (StorageException e) {
      assertEquals(StorageException.Reason.ALREADY_EXISTS, e.getReason());
    }
    verify(mockClient, never()).putObject(anyString(), anyString(), any(byte[].class), anyMap());
  }

  @Test
  public void testWriteOverExistingObjectWithOverwrite() {
    when(mockClient.getObjectInfo(BUCKET, "k")).thenReturn(info("2", "Wed, 21 Oct 2015 07:28:00 GMT"));

    assertTrue(adapter.write("k", bytes("data"), WriteConfig.overwriting()));
  }

  @Test
  public void testWriteFailureIsReported() {
    when(mockClient.putObject(eq(BUCKET), eq("k"), any(byte[].class), anyMap())).thenReturn(failure());

    assertFalse(adapter.write("k", bytes("data"), WriteConfig.defaults()));
  }

  @Test
  public void testWriteAndDeleteEvictCachedMetadata() {
    when(mockClient.getObjectInfo(BUCKET, "k")).thenReturn(info("2", "Wed, 21 Oct 2015 07:28:00 GMT"));
    adapter.exists("k");
    assertEquals(1, adapter.cachedEntries());

    adapter.write("k", bytes("data"), WriteConfig.overwriting());
    assertEquals(0, adapter.cachedEntries());

    when(mockClient.getObjectInfo(BUCKET, "k")).thenReturn(info("4", "Wed, 21 Oct 2015 07:28:00 GMT"));
    assertEquals(4, adapter.size("k"));
    assertEquals(1, adapter.cachedEntries());

    assertTrue(adapter.delete("k"));
    assertEquals(0, adapter.cachedEntries());

    when(mockClient.getObjectInfo(BUCKET, "k")).thenReturn(notFound());
    assertFalse(adapter.exists("k"));
  }

  @Test
  public void testDeleteFailureIsReported() {
    when(mockClient.deleteObject(BUCKET, "k")).thenReturn(failure());

    assertFalse(adapter.delete("k"));
  }

  @Test
  public void testCopyWritesContentOfSource() {
    when(mockClient.getObjectInfo(BUCKET, "src")).thenReturn(info("4", "Wed, 21 Oct 2015 07:28:00 GMT"));
    when(mockClient.getObject(BUCKET, "src")).thenReturn(ObjectStoreResponse.builder()
        .code(ObjectStoreResponse.STATUS_OK)
        .body(bytes("data"))
        .build());

    assertTrue(adapter.copy("src", "dst"));

    verify(mockClient, times(1)).putObject(BUCKET, "dst", bytes("data"), ImmutableMap.of());
    verify(mockClient, never()).deleteObject(anyString(), anyString());
  }

  @Test
  public void testCopyAndMoveOfMissingSourceFail() {
    assertFalse(adapter.copy("src", "dst"));
    assertFalse(adapter.move("src", "dst"));

    verify(mockClient, never()).putObject(anyString(), anyString(), any(byte[].class), anyMap());
  }

  @Test
  public void testMoveDeletesSourceAfterWrite() {
    when(mockClient.getObjectInfo(BUCKET, "src")).thenReturn(info("4", "Wed, 21 Oct 2015 07:28:00 GMT"));
    when(mockClient.getObject(BUCKET, "src")).thenReturn(ObjectStoreResponse.builder()
        .code(ObjectStoreResponse.STATUS_OK)
        .body(bytes("data"))
        .build());

    assertTrue(adapter.move("src", "dst"));

    verify(mockClient, times(1)).putObject(BUCKET, "dst", bytes("data"), ImmutableMap.of());
    verify(mockClient, times(1)).deleteObject(BUCKET, "src");
  }

  @Test
  public void testMoveKeepsSourceWhenWriteFails() {
    when(mockClient.getObjectInfo(BUCKET, "src")).thenReturn(info("4", "Wed, 21 Oct 2015 07:28:00 GMT"));
    when(mockClient.getObject(BUCKET, "src")).thenReturn(ObjectStoreResponse.builder()
        .code(ObjectStoreResponse.STATUS_OK)
        .body(bytes("data"))
        .build());
    when(mockClient.putObject(eq(BUCKET), eq("dst"), any(byte[].class), anyMap())).thenReturn(failure());

    assertFalse(adapter.move("src", "dst"));

    verify(mockClient, never()).deleteObject(anyString(), anyString());
  }

  @Test
  public void testDirectoryOperationsAreNotSupported() {
    assertTrue(adapter.files("dir", true).isEmpty());
    assertTrue(adapter.directories("dir", false).isEmpty());
    assertFalse(adapter.createDirectory("dir"));
    assertFalse(adapter.deleteDirectory("dir"));
  }

  @Test
  public void testCloseClosesClient() throws IOException {
    adapter.close();

    verify(mockClient, times(1)).close();
  }

  private static ObjectStoreResponse info(String contentLength, String lastModified) {
    return ObjectStoreResponse.builder()
        .code(ObjectStoreResponse.STATUS_OK)
        .putHeaders("content-length", contentLength)
        .putHeaders("Last-Modified", lastModified)
        .build();
  }

  private static ObjectStoreResponse ok() {
    return ObjectStoreResponse.builder()
        .code(ObjectStoreResponse.STATUS_OK)
        .build();
  }

  private static ObjectStoreResponse noContent() {
    return ObjectStoreResponse.builder()
        .code(ObjectStoreResponse.STATUS_NO_CONTENT)
        .build();
  }

  private static ObjectStoreResponse notFound() {
    return ObjectStoreResponse.builder()
        .code(ObjectStoreResponse.STATUS_NOT_FOUND)
        .error("Not Found")
        .build();
  }

  private static ObjectStoreResponse failure() {
    return ObjectStoreResponse.builder()
        .code(ObjectStoreResponse.STATUS_UNKNOWN)
        .error("Connection refused")
        .build();
  }

  private static byte[] bytes(String content) {
    return content.getBytes(StandardCharsets.UTF_8);
  }
}
