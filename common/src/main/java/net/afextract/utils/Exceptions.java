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
package net.afextract.utils;

import java.util.concurrent.ExecutionException;

import com.stumbleupon.async.DeferredGroupException;

/**
 * A class with utility methods for dealing with Exceptions raised by
 * workers.
 * @since 1.0
 */
public class Exceptions {

  /**
   * Iterates through the stack trace, looking for the actual cause of the
   * deferred group exception. These traces can be huge and truncated in the
   * logs so it's really useful to be able to spit out the source.
   * @param e A DeferredGroupException to parse
   * @return The root cause of the exception if found. 
   */
  public static Throwable getCause(final DeferredGroupException e) {
    Throwable ex = e;
    while (ex.getClass().equals(DeferredGroupException.class)) {
      if (ex.getCause() == null) {
        break;
      } else {
        ex = ex.getCause();
      }
    }
    return ex;
  }
  
  /**
   * Turns a worker failure into something the caller can rethrow without
   * declaring it, unwrapping group and execution wrappers first.
   * @param t A non-null throwable.
   * @return The unwrapped runtime exception, or a RuntimeException wrapping
   * a checked cause.
   */
  public static RuntimeException asRuntime(final Throwable t) {
    Throwable ex = t;
    if (ex instanceof DeferredGroupException) {
      ex = getCause((DeferredGroupException) ex);
    }
    while (ex instanceof ExecutionException && ex.getCause() != null) {
      ex = ex.getCause();
    }
    if (ex instanceof RuntimeException) {
      return (RuntimeException) ex;
    }
    if (ex instanceof Error) {
      throw (Error) ex;
    }
    return new RuntimeException(ex);
  }
}
