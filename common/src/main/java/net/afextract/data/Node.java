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
package net.afextract.data;

import java.time.Instant;

import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.afextract.utils.DateTime;

/**
 * A single entry in an event or asset hierarchy as returned by the data
 * source. Immutable once built. The level is derived from the path so the
 * two can never disagree.
 * 
 * @since 1.0
 */
public class Node {
  
  /** The kinds of hierarchies. */
  public static enum Kind {
    /** Time bound events such as procedures, unit procedures and phases. */
    EVENT,
    
    /** Equipment elements without time bounds. */
    ASSET
  }
  
  /** The opaque handle into the data source. */
  private final Object identity;
  
  /** The kind of node. */
  private final Kind kind;
  
  /** The full path. */
  private final String path;
  
  /** The display name. */
  private final String name;
  
  /** An optional template name. */
  private final String template;
  
  /** The start time, may be null for assets. */
  private final Instant start;
  
  /** The end time, may be null for assets or running events. */
  private final Instant end;
  
  /** Derived from the path. */
  private final int level;
  
  /**
   * Protected ctor.
   * @param builder The non-null builder.
   */
  protected Node(final Builder builder) {
    if (builder.kind == null) {
      throw new IllegalArgumentException("Kind cannot be null.");
    }
    identity = builder.identity;
    kind = builder.kind;
    path = builder.path;
    level = NodePath.level(path);
    name = Strings.isNullOrEmpty(builder.name) ? 
        NodePath.leaf(path) : builder.name;
    template = Strings.emptyToNull(builder.template);
    start = builder.start;
    end = builder.end;
    if (start != null && end != null && !DateTime.isMaxSourceTime(end) 
        && end.isBefore(start)) {
      throw new IllegalArgumentException("End " + end 
          + " cannot be before start " + start + " for " + path);
    }
  }
  
  /** @return The opaque handle into the data source. May be null. */
  public Object identity() {
    return identity;
  }
  
  /** @return The kind of node. */
  public Kind kind() {
    return kind;
  }
  
  /** @return The full path. */
  public String path() {
    return path;
  }
  
  /** @return The display name. */
  public String name() {
    return name;
  }
  
  /** @return The template name, null if untemplated. */
  public String template() {
    return template;
  }
  
  /** @return The start time. May be null. */
  public Instant start() {
    return start;
  }
  
  /** @return The end time. May be null. */
  public Instant end() {
    return end;
  }
  
  /** @return The depth in the tree, 0 for roots. */
  public int level() {
    return level;
  }
  
  /** @return The key of the top level ancestor. */
  public String root() {
    return NodePath.root(path);
  }
  
  /** @return True if the node has not finished yet. */
  public boolean isOpen() {
    return end == null || DateTime.isMaxSourceTime(end);
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final Node other = (Node) o;
    return Objects.equal(kind, other.kind)
        && Objects.equal(path, other.path)
        && Objects.equal(start, other.start)
        && Objects.equal(end, other.end);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(kind, path, start, end);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{kind=")
        .append(kind)
        .append(", path=")
        .append(path)
        .append(", template=")
        .append(template)
        .append(", start=")
        .append(start)
        .append(", end=")
        .append(end)
        .append("}")
        .toString();
  }
  
  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private Object identity;
    private Kind kind = Kind.EVENT;
    private String path;
    private String name;
    private String template;
    private Instant start;
    private Instant end;
    
    public Builder setIdentity(final Object identity) {
      this.identity = identity;
      return this;
    }
    
    public Builder setKind(final Kind kind) {
      this.kind = kind;
      return this;
    }
    
    public Builder setPath(final String path) {
      this.path = path;
      return this;
    }
    
    public Builder setName(final String name) {
      this.name = name;
      return this;
    }
    
    public Builder setTemplate(final String template) {
      this.template = template;
      return this;
    }
    
    public Builder setStart(final Instant start) {
      this.start = start;
      return this;
    }
    
    public Builder setEnd(final Instant end) {
      this.end = end;
      return this;
    }
    
    public Node build() {
      return new Node(this);
    }
  }
}
