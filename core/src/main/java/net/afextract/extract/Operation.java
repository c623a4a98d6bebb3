// This file is part of AFExtract.
// Copyright (C) 2026  The AFExtract Authors.
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
package net.afextract.extract;

/**
 * The extractions the engine can run.
 * 
 * @since 1.0
 */
public enum Operation {
  /** Interpolated samples over each row's range. */
  INTERPOLATED_EXTRACT(true),
  
  /** Summaries over each row's range. */
  SUMMARY_EXTRACT(true),
  
  /** Interval summaries where a filter expression holds. */
  FILTERED_SUMMARY_EXTRACT(false),
  
  /** Summaries of an expression over each row's range. */
  CALC_SUMMARY_EXTRACT(true),
  
  /** Interpolated samples over each procedure's whole span. */
  CONTINUOUS_INTERPOLATED_EXTRACT(false),
  
  /** Archived samples per procedure and tag. */
  RECORDED_EXTRACT(false),
  
  /** Plot decimated samples per procedure and tag. */
  PLOT_EXTRACT(false);
  
  /** Whether the rows can be split across workers. */
  private final boolean chunkable;
  
  Operation(final boolean chunkable) {
    this.chunkable = chunkable;
  }
  
  /** @return Whether the rows can be split across workers. */
  public boolean isChunkable() {
    return chunkable;
  }
}
