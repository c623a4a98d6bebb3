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
 * Bubbled up when a chunked extraction is canceled before all of the 
 * chunks completed, e.g. on a timeout.
 * 
 * @since 1.0
 */
public class ExecutionCanceledException extends RuntimeException {
  private static final long serialVersionUID = -3304827611560719418L;

  /** The number of chunks that had not finished. */
  protected final int pending;
  
  /**
   * Default ctor.
   * @param msg A non-null message to be given.
   * @param pending The number of chunks that had not finished.
   * @param t The original exception that caused this to be thrown.
   */
  public ExecutionCanceledException(final String msg, 
                                    final int pending,
                                    final Throwable t) {
    super(msg, t);
    this.pending = pending;
  }
  
  /** @return The number of chunks that had not finished. */
  public int getPending() {
    return pending;
  }
}
