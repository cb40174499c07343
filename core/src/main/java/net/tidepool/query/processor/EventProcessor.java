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
package net.tidepool.query.processor;

import net.tidepool.query.Batch;

/**
 * A single stage of a pipeline. Processors are stateless and immutable, 
 * the same instance may be run over many batches.
 * 
 * @since 1.0
 */
public interface EventProcessor {

  /**
   * Runs the stage.
   * @param batch The non-null input batch.
   * @return The non-null output batch.
   */
  public Batch process(final Batch batch);
}
