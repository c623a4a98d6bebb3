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
 * Thrown when a lookup succeeded but produced nothing the caller can use,
 * e.g. no referenced elements exist for any row of a template.
 * 
 * @since 1.0
 */
public class EmptyResultException extends RuntimeException {
  private static final long serialVersionUID = 8927510863371042955L;

  /** The scope that came back empty. May be null. */
  protected final String scope;
  
  /**
   * Default ctor.
   * @param msg A non-null message to be given.
   * @param scope The scope that came back empty. May be null.
   */
  public EmptyResultException(final String msg, final String scope) {
    super(msg);
    this.scope = scope;
  }
  
  /** @return The scope that came back empty. May be null. */
  public String getScope() {
    return scope;
  }
}
