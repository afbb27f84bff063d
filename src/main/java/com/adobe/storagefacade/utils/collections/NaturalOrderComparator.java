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

package com.adobe.storagefacade.utils.collections;

import com.google.common.base.CharMatcher;

import java.util.Comparator;

/**
 * Case-insensitive comparator ordering digit runs by their numeric value, so that
 * {@code file2} sorts before {@code File10}. Strings equal ignoring case are ordered
 * case-sensitively to keep the order total.
 */
public final class NaturalOrderComparator implements Comparator<String> {

  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

  private NaturalOrderComparator() {}

  @Override
  public int compare(String left, String right) {
    int result = compareIgnoringCase(left, right);
    return result != 0 ? result : left.compareTo(right);
  }

  private static int compareIgnoringCase(String left, String right) {
    int i = 0;
    int j = 0;
    while (i < left.length() && j < right.length()) {
      char l = left.charAt(i);
      char r = right.charAt(j);

      if (DIGITS.matches(l) && DIGITS.matches(r)) {
        int leftEnd = endOfDigits(left, i);
        int rightEnd = endOfDigits(right, j);
        int result = compareNumbers(left.substring(i, leftEnd), right.substring(j, rightEnd));
        if (result != 0) {
          return result;
        }
        i = leftEnd;
        j = rightEnd;
        continue;
      }

      int result = Character.compare(Character.toLowerCase(l), Character.toLowerCase(r));
      if (result != 0) {
        return result;
      }
      i++;
      j++;
    }
    return Integer.compare(left.length() - i, right.length() - j);
  }

  private static int endOfDigits(String str, int start) {
    int end = start;
    while (end < str.length() && DIGITS.matches(str.charAt(end))) {
      end++;
    }
    return end;
  }

  // arbitrary length digit runs, compared without parsing
  private static int compareNumbers(String left, String right) {
    String l = stripLeadingZeros(left);
    String r = stripLeadingZeros(right);
    if (l.length() != r.length()) {
      return Integer.compare(l.length(), r.length());
    }
    int result = l.compareTo(r);
    return result != 0 ? result : Integer.compare(left.length(), right.length());
  }

  private static String stripLeadingZeros(String digits) {
    int idx = 0;
    while (idx < digits.length() - 1 && digits.charAt(idx) == '0') {
      idx++;
    }
    return digits.substring(idx);
  }
}
