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
package net.tidepool.core;

import java.nio.charset.Charset;
import java.time.ZoneId;
import java.time.ZoneOffset;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/** Constants used in various places.  */
public final class Const {

  /** The UTC zone used for bucket math and UTC calendar conversions. */
  public static final ZoneId UTC = ZoneOffset.UTC;

  /** Used for column names and string values. */
  public static final Charset UTF8_CHARSET = Charset.forName("UTF8");

  /** The group key used by pipelines when no grouping is active. */
  public static final String ALL_KEY = "all";

  /** The default column aggregated and filled when none is given. */
  public static final String DEFAULT_FIELD = "value";

  /** Separator between a window key and a group-by key. */
  public static final String GROUP_SEPARATOR = "::";

  /**
   * A global function to use for NON-SECURE hashing of things like option
   * objects. Used for deterministic hashing.
   */
  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();
  public static HashFunction HASH_FUNCTION() {
    return HASH_FUNCTION;
  }

  /**
   * Returns the zone used to resolve calendar periods.
   * @param utc Whether or not to use UTC.
   * @return UTC or the system default zone.
   */
  public static ZoneId zone(final boolean utc) {
    return utc ? UTC : ZoneId.systemDefault();
  }

  private Const() {
    // Constants only
  }
}
