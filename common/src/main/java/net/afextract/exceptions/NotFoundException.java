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
 * Thrown when a named thing could not be located in the data source or in
 * a table, e.g. a template, a tag query or a column. The failing identifier
 * is carried along so callers can report exactly what was missing.
 * 
 * @since 1.0
 */
public class NotFoundException extends RuntimeException {
  private static final long serialVersionUID = -4521830277416395718L;

  /** The identifier that could not be resolved. */
  protected final String identifier;
  
  /**
   * Default ctor.
   * @param msg A non-null message to be given.
   * @param identifier The identifier that failed to resolve. May be null.
   */
  public NotFoundException(final String msg, final String identifier) {
    super(msg);
    this.identifier = identifier;
  }
  
  /** @return The identifier that could not be resolved. May be null. */
  public String getIdentifier() {
    return identifier;
  }
}
