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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;

import com.adobe.storagefacade.common.exceptions.StorageException;
import com.adobe.storagefacade.storage.api.StorageAdapter;

import com.tngtech.java.junit.dataprovider.DataProvider;
import com.tngtech.java.junit.dataprovider.DataProviderRunner;
import com.tngtech.java.junit.dataprovider.UseDataProvider;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;

import java.util.Arrays;

@RunWith(DataProviderRunner.class)
public class PathNormalizerTest {

  private StorageAdapter owner;

  private PathNormalizer pathNormalizer;

  @DataProvider
  public static Object[][] validPaths() {
    return new Object[][] {
        new Object[] {"a/b.txt", "a/b.txt"},
        new Object[] {"/a/b.txt", "a/b.txt"},
        new Object[] {"a//b.txt", "a/b.txt"},
        new Object[] {"./a/./b.txt", "a/b.txt"},
        new Object[] {"a/b/../c.txt", "a/c.txt"},
        new Object[] {"a/b/c/../../d", "a/d"},
        new Object[] {"a\\b\\c.txt", "a/b/c.txt"},
        new Object[] {"a\\..\\b.txt", "b.txt"},
        new Object[] {"a/..", ""},
        new Object[] {"/", ""},
        new Object[] {"", ""},
        new Object[] {"dir/", "dir"},
        new Object[] {"..a/b..", "..a/b.."},
        new Object[] {"café/日本.txt", "café/日本.txt"},
    };
  }

  @DataProvider
  public static Object[][] traversalPaths() {
    return new Object[][] {
        new Object[] {".."},
        new Object[] {"../etc/passwd"},
        new Object[] {"/../bootstrap.php"},
        new Object[] {"a/../../b"},
        new Object[] {"..\\secret"},
        new Object[] {"./a/./../.."},
    };
  }

  @DataProvider
  public static Object[][] malformedPaths() {
    return new Object[][] {
        new Object[] {"s\ti.php"},
        new Object[] {"a\nb"},
        new Object[] {"a\u0000b"},
        new Object[] {"a\u200Bb"},
        new Object[] {"a\u202Eb"},
        new Object[] {"\u007F"},
        // rejected even when the traversal check would also fail
        new Object[] {"../\u0001"},
    };
  }

  @Before
  public void setup() {
    owner = mock(StorageAdapter.class);
    pathNormalizer = new PathNormalizer(owner);
  }

  @Test
  @UseDataProvider("validPaths")
  public void testPathIsNormalized(String rawPath, String expected) {
    assertEquals(expected, pathNormalizer.normalize(rawPath));
  }

  @Test
  @UseDataProvider("validPaths")
  public void testNormalizedPathHasNoEmptyOrDotSegments(String rawPath, String ignored) {
    String normalized = pathNormalizer.normalize(rawPath);
    if (normalized.isEmpty()) {
      return;
    }

    assertFalse(normalized.startsWith("../") || normalized.equals(".."));
    assertFalse(Arrays.asList(normalized.split("/", -1)).contains(""));
    assertFalse(Arrays.asList(normalized.split("/", -1)).contains("."));
  }

  @Test
  @UseDataProvider("validPaths")
  public void testNormalizationIsIdempotent(String rawPath, String ignored) {
    String normalized = pathNormalizer.normalize(rawPath);

    assertEquals(normalized, pathNormalizer.normalize(normalized));
  }

  @Test
  @UseDataProvider("traversalPaths")
  public void testTraversalAboveRootIsRejected(String rawPath) {
    try {
      pathNormalizer.normalize(rawPath);
      fail("Expected a StorageException for " + rawPath);
    } catch (StorageException e) {
      assertEquals(StorageException.Reason.PATH_TRAVERSAL, e.getReason());
      assertSame(owner, e.getAdapter());
    }
  }

  @Test
  @UseDataProvider("malformedPaths")
  public void testControlCharactersAreRejected(String rawPath) {
    try {
      pathNormalizer.normalize(rawPath);
      fail("Expected a StorageException");
    } catch (StorageException e) {
      assertEquals(StorageException.Reason.INVALID_PATH, e.getReason());
      assertSame(owner, e.getAdapter());
    }
  }

  @Test(expected = NullPointerException.class)
  public void testNullPathIsRejected() {
    pathNormalizer.normalize(null);
  }
}
