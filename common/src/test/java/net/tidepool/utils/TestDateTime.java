// This file is part of Tidepool.
// Copyright (C) 2018  The Tidepool Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tidepool.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;

import org.junit.Test;

import net.tidepool.exceptions.InvalidSizeSpecException;

public final class TestDateTime {

  @Test
  public void parseSizeSpec() {
    assertEquals(30000L, DateTime.parseSizeSpec("30s"));
    assertEquals(300000L, DateTime.parseSizeSpec("5m"));
    assertEquals(3600000L, DateTime.parseSizeSpec("1h"));
    assertEquals(86400000L, DateTime.parseSizeSpec("1d"));
    assertEquals(7 * 86400000L, DateTime.parseSizeSpec("7d"));
  }

  @Test
  public void parseSizeSpecBad() {
    final String[] bad = new String[] { null, "", "m", "5", "5x", "-5m", 
        "0m", "5mm", "5 m", "1.5h", "1w", "99999999999999999999d" };
    for (final String size : bad) {
      try {
        DateTime.parseSizeSpec(size);
        fail("Expected InvalidSizeSpecException for " + size);
      } catch (InvalidSizeSpecException e) { }
    }
  }

  @Test
  public void parseSizeSpecNonAsciiDigits() {
    // Arabic-Indic and fullwidth digits
    final String[] bad = new String[] { "\u0661h", "\uFF15m", "1\u0660s" };
    for (final String size : bad) {
      try {
        DateTime.parseSizeSpec(size);
        fail("Expected InvalidSizeSpecException for " + size);
      } catch (InvalidSizeSpecException e) { }
      assertFalse(DateTime.isSizeSpec(size));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void parseSizeSpecIsIllegalArgument() {
    DateTime.parseSizeSpec("1y");
  }

  @Test
  public void isSizeSpec() {
    assertTrue(DateTime.isSizeSpec("1h"));
    assertTrue(DateTime.isSizeSpec("15m"));
    assertFalse(DateTime.isSizeSpec("hourly"));
    assertFalse(DateTime.isSizeSpec("2015"));
    assertFalse(DateTime.isSizeSpec(null));
  }

  @Test
  public void getSizeUnitsAndCount() {
    assertEquals('m', DateTime.getSizeUnits("15m"));
    assertEquals(15, DateTime.getSizeCount("15m"));
    assertEquals('d', DateTime.getSizeUnits("2d"));
    assertEquals(2, DateTime.getSizeCount("2d"));
  }

  @Test
  public void humanizeDuration() {
    assertEquals("0 milliseconds", DateTime.humanizeDuration(0));
    assertEquals("1 millisecond", DateTime.humanizeDuration(1));
    assertEquals("1 second", DateTime.humanizeDuration(1000));
    assertEquals("5 minutes", DateTime.humanizeDuration(300000));
    assertEquals("2 hours", DateTime.humanizeDuration(7200000));
    assertEquals("1 day", DateTime.humanizeDuration(86400000));
    assertEquals("1 day", DateTime.humanizeDuration(86400000 + 3600000));
  }

  @Test
  public void toUTCString() {
    // Fri, 15 May 2015 14:21:13.432 UTC
    assertEquals("2015-05-15T14:21:13.432Z", 
        DateTime.toUTCString(Instant.ofEpochMilli(1431699673432L)));
  }

  @Test
  public void ordinal() {
    assertEquals("1st", DateTime.ordinal(1));
    assertEquals("2nd", DateTime.ordinal(2));
    assertEquals("3rd", DateTime.ordinal(3));
    assertEquals("4th", DateTime.ordinal(4));
    assertEquals("11th", DateTime.ordinal(11));
    assertEquals("12th", DateTime.ordinal(12));
    assertEquals("13th", DateTime.ordinal(13));
    assertEquals("21st", DateTime.ordinal(21));
    assertEquals("22nd", DateTime.ordinal(22));
    assertEquals("31st", DateTime.ordinal(31));
  }
}
