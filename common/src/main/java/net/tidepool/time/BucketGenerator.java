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
package net.tidepool.time;

import java.time.Instant;

import net.tidepool.utils.DateTime;

/**
 * Maps instants onto fixed size buckets. A bucket is identified by the size
 * and its position, {@code floor(epoch_ms / length_ms)}, joined with a dash.
 * Positions are computed against the epoch so day buckets are aligned on
 * UTC midnight whatever the local zone is.
 * 
 * @since 1.0
 */
public class BucketGenerator {

  /** The size given by the caller, e.g. "5m". */
  private final String size;

  /** The size in milliseconds. */
  private final long length;

  /**
   * Default ctor.
   * @param size A bucket size such as "30s", "5m", "1h" or "1d".
   * @throws net.tidepool.exceptions.InvalidSizeSpecException if the size
   * was malformed.
   */
  public BucketGenerator(final String size) {
    this.length = DateTime.parseSizeSpec(size);
    this.size = size;
  }

  /** @return The bucket size string. */
  public String size() {
    return size;
  }

  /** @return The bucket length in milliseconds. */
  public long length() {
    return length;
  }

  /**
   * @param instant A non-null instant.
   * @return The index string of the bucket containing the instant.
   */
  public String bucketIndex(final Instant instant) {
    return size + "-" + bucketPosition(instant, length);
  }

  /**
   * @param instant A non-null instant.
   * @return The index of the bucket containing the instant.
   */
  public Index bucket(final Instant instant) {
    return new Index(bucketIndex(instant));
  }

  /**
   * @param size A bucket size.
   * @param instant A non-null instant.
   * @return The index string of the bucket containing the instant.
   * @throws net.tidepool.exceptions.InvalidSizeSpecException if the size
   * was malformed.
   */
  public static String bucketIndex(final String size, final Instant instant) {
    return size + "-" + bucketPosition(instant, lengthFromSize(size));
  }

  /**
   * @param size A bucket size.
   * @return The length of the bucket in milliseconds.
   * @throws net.tidepool.exceptions.InvalidSizeSpecException if the size
   * was malformed.
   */
  public static long lengthFromSize(final String size) {
    return DateTime.parseSizeSpec(size);
  }

  /**
   * @param instant A non-null instant.
   * @param length A positive bucket length in milliseconds.
   * @return The floored position of the instant.
   */
  public static long bucketPosition(final Instant instant, final long length) {
    return Math.floorDiv(instant.toEpochMilli(), length);
  }
}
