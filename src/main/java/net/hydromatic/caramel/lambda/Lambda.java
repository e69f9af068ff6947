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
package net.hydromatic.caramel.lambda;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Term of the pure lambda calculus.
 *
 * <p>Variables are de Bruijn indices: {@code Var 0} refers to the innermost
 * enclosing {@link Abs}, {@code Var 1} to the one outside that, and so on.
 * There are no names and no literals.
 */
public abstract class Lambda {
  Lambda() {}

  /** Creates an abstraction. */
  public static Abs abs(Lambda body) {
    return new Abs(body);
  }

  /** Creates an application. */
  public static App app(Lambda fn, Lambda arg) {
    return new App(fn, arg);
  }

  /** Creates a variable. */
  public static Var var(int index) {
    return new Var(index);
  }

  /**
   * Folds this term bottom-up.
   *
   * <p>Does not recurse; the depth of the term is limited by the heap, not by
   * the stack. The Church numeral for {@code n} is {@code n} levels deep.
   */
  public final <R> R fold(LambdaFolder<R> folder) {
    final Deque<Frame> todo = new ArrayDeque<>();
    final Deque<R> done = new ArrayDeque<>();
    todo.push(new Frame(this, 0));
    while (!todo.isEmpty()) {
      final Frame frame = todo.pop();
      final Lambda t = frame.lambda;
      if (t instanceof Var) {
        done.push(folder.var(frame.depth, ((Var) t).index));
      } else if (!frame.expanded) {
        // Visit the children, then come back to this node.
        frame.expanded = true;
        todo.push(frame);
        if (t instanceof Abs) {
          todo.push(new Frame(((Abs) t).body, frame.depth + 1));
        } else {
          todo.push(new Frame(((App) t).arg, frame.depth));
          todo.push(new Frame(((App) t).fn, frame.depth));
        }
      } else if (t instanceof Abs) {
        done.push(folder.abs(frame.depth, done.pop()));
      } else {
        final R arg = done.pop();
        done.push(folder.app(done.pop(), arg));
      }
    }
    return done.pop();
  }

  /**
   * Converts this term to a string.
   *
   * <p>For example, the Church numeral 2 is "λλ(1 (1 0))".
   */
  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  abstract StringBuilder unparse(StringBuilder b);

  /** Abstraction. */
  public static final class Abs extends Lambda {
    public final Lambda body;

    Abs(Lambda body) {
      this.body = requireNonNull(body);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return body.unparse(b.append('λ'));
    }

    @Override
    public int hashCode() {
      return body.hashCode() * 31 + 1;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Abs && body.equals(((Abs) o).body);
    }
  }

  /** Application of a function to an argument. */
  public static final class App extends Lambda {
    public final Lambda fn;
    public final Lambda arg;

    App(Lambda fn, Lambda arg) {
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      b.append('(');
      fn.unparse(b).append(' ');
      return arg.unparse(b).append(')');
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof App
              && fn.equals(((App) o).fn)
              && arg.equals(((App) o).arg);
    }
  }

  /** Variable, as a de Bruijn index. */
  public static final class Var extends Lambda {
    public final int index;

    Var(int index) {
      checkArgument(index >= 0, "negative index %s", index);
      this.index = index;
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return b.append(index);
    }

    @Override
    public int hashCode() {
      return index;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && index == ((Var) o).index;
    }
  }

  /** Node waiting to be folded, and the number of binders around it. */
  private static final class Frame {
    final Lambda lambda;
    final int depth;
    boolean expanded;

    Frame(Lambda lambda, int depth) {
      this.lambda = lambda;
      this.depth = depth;
    }
  }
}

// End Lambda.java
