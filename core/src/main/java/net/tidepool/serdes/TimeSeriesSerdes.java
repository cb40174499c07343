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
package net.tidepool.serdes;

import net.tidepool.series.TimeSeries;

/**
 * Converts whole series to and from bytes.
 * 
 * @since 1.0
 */
public interface TimeSeriesSerdes {

  /**
   * Encodes the series.
   * @param series A non-null series.
   * @return A non-null byte array.
   * @throws net.tidepool.exceptions.SerdesException if the series could 
   * not be encoded.
   */
  public byte[] serialize(final TimeSeries series);

  /**
   * Decodes a series.
   * @param data A non-null byte array.
   * @return The series.
   * @throws net.tidepool.exceptions.SerdesException if the data could not 
   * be decoded.
   */
  public TimeSeries deserialize(final byte[] data);

}
