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
package net.tidepool.exceptions;

/**
 * Thrown when a binary payload cannot be decoded with the schema supplied
 * by the caller.
 * 
 * @since 1.0
 */
public class SchemaDecodeException extends SerdesException {
  private static final long serialVersionUID = -3115096238504460941L;

  /**
   * Default ctor.
   * @param msg A descriptive message.
   */
  public SchemaDecodeException(final String msg) {
    super(msg);
  }
  
  /**
   * Ctor with a cause.
   * @param msg A descriptive message.
   * @param cause A non-null cause of the exception.
   */
  public SchemaDecodeException(final String msg, final Exception cause) {
    super(msg, cause);
  }
}
