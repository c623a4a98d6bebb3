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

import java.time.Instant;

/**
 * Wraps any failure raised by the data source while fetching samples,
 * summaries, attributes or nodes. The offending time range and expression
 * are recorded so the failing call can be reproduced. These are never
 * retried.
 * 
 * @since 1.0
 */
public class DataSourceException extends RuntimeException {
  private static final long serialVersionUID = -7011958316235309672L;

  /** The start of the range requested. May be null. */
  protected final Instant start;
  
  /** The end of the range requested. May be null. */
  protected final Instant end;
  
  /** The filter or calculation expression in play. May be null. */
  protected final String expression;
  
  /**
   * Ctor for failures without a time range.
   * @param msg A non-null message to be given.
   * @param t The original exception that caused this to be thrown.
   */
  public DataSourceException(final String msg, final Throwable t) {
    this(msg, null, null, null, t);
  }
  
  /**
   * Default ctor.
   * @param msg A non-null message to be given.
   * @param start The start of the range requested. May be null.
   * @param end The end of the range requested. May be null.
   * @param expression The expression in play. May be null.
   * @param t The original exception that caused this to be thrown.
   */
  public DataSourceException(final String msg, 
                             final Instant start, 
                             final Instant end,
                             final String expression,
                             final Throwable t) {
    super(msg, t);
    this.start = start;
    this.end = end;
    this.expression = expression;
  }
  
  /** @return The start of the range requested. May be null. */
  public Instant getStart() {
    return start;
  }
  
  /** @return The end of the range requested. May be null. */
  public Instant getEnd() {
    return end;
  }
  
  /** @return The expression in play. May be null. */
  public String getExpression() {
    return expression;
  }
  
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(getClass())
        .append(": ")
        .append(getMessage())
        .append(" range[")
        .append(start)
        .append(", ")
        .append(end)
        .append("]");
    if (expression != null) {
      buf.append(" expression[")
         .append(expression)
         .append("]");
    }
    return buf.toString();
  }
}
