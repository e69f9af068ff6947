/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.caramel.compile;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable mapping from variable names to the depth at which each variable
 * was bound.
 *
 * <p>When a binder is introduced at depth {@code d}, a reference to it from
 * depth {@code e} (where {@code e > d}) becomes the de Bruijn index
 * {@code e - d - 1}.
 *
 * <p>A scope is a chain; binding a name creates a new link and leaves the
 * original scope unchanged, so a scope can be shared between the branches of
 * a traversal. If a name is bound more than once, the most recent binding
 * wins.
 */
public abstract class Scope {
  Scope() {}

  /** Returns an empty scope. */
  public static Scope empty() {
    return EmptyScope.INSTANCE;
  }

  /** Returns a scope that is this scope plus a binding. */
  public Scope bind(String name, int depth) {
    return new SubScope(this, name, depth);
  }

  /** Returns the depth at which a name is bound, or null if it is not bound. */
  public abstract @Nullable Integer getOpt(String name);

  /**
   * Returns the depth at which a name is bound; throws {@link
   * UnboundVariableException} if it is not bound.
   */
  public int get(String name) {
    final Integer depth = getOpt(name);
    if (depth == null) {
      throw new UnboundVariableException(name);
    }
    return depth;
  }

  /** Returns the de Bruijn index of a name referenced at a given depth. */
  public int index(String name, int depth) {
    return depth - get(name) - 1;
  }

  /** Scope that has no bindings. */
  private static class EmptyScope extends Scope {
    static final EmptyScope INSTANCE = new EmptyScope();

    @Override
    public String toString() {
      return "[]";
    }

    @Override
    public @Nullable Integer getOpt(String name) {
      return null;
    }
  }

  /** Scope that consists of a binding and a parent scope. */
  private static class SubScope extends Scope {
    private final Scope parent;
    private final String name;
    private final int depth;

    SubScope(Scope parent, String name, int depth) {
      this.parent = requireNonNull(parent);
      this.name = requireNonNull(name);
      checkArgument(depth >= 0, "negative depth %s", depth);
      this.depth = depth;
    }

    @Override
    public String toString() {
      return name + ":" + depth + ", ...";
    }

    @Override
    public @Nullable Integer getOpt(String name) {
      if (name.equals(this.name)) {
        return depth;
      }
      return parent.getOpt(name);
    }
  }
}

// End Scope.java
