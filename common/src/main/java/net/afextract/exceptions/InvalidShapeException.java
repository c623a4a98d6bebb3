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
package net.afextract.exceptions;

/**
 * Thrown when a table does not have the shape an operation needs, e.g. a
 * referenced column is missing or a cell holds more than one tag where
 * exactly one is required.
 * 
 * @since 1.0
 */
public class InvalidShapeException extends IllegalArgumentException {
  private static final long serialVersionUID = 2316085729348122714L;

  /** The offending column, if any. */
  protected final String column;
  
  /**
   * Ctor without a column.
   * @param msg A non-null message to be given.
   */
  public InvalidShapeException(final String msg) {
    this(msg, null);
  }
  
  /**
   * Default ctor.
   * @param msg A non-null message to be given.
   * @param column The offending column. May be null.
   */
  public InvalidShapeException(final String msg, final String column) {
    super(msg);
    this.column = column;
  }
  
  /** @return The offending column. May be null. */
  public String getColumn() {
    return column;
  }
}
