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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Implementations of {@link Normalizer}. */
public abstract class Normalizers {
  private Normalizers() {}

  /** Returns a normalizer that returns its argument unchanged. */
  public static Normalizer identity() {
    return term -> term;
  }

  /**
   * Returns a normalizer that reduces in normal order (leftmost outermost
   * redex first) until it reaches a normal form, or throws {@link
   * ReductionLimitException} after {@code maxSteps} beta-reductions.
   *
   * <p>Normal order finds a normal form whenever one exists.
   */
  public static Normalizer normalOrder(int maxSteps) {
    checkArgument(maxSteps >= 0, "negative step limit %s", maxSteps);
    return term -> new Reducer(maxSteps).normal(term);
  }

  /**
   * Replaces variable 0 in {@code body} with {@code arg}, and decrements the
   * other free variables of {@code body} because the binder has gone.
   */
  static Lambda beta(Lambda body, Lambda arg) {
    return body.fold(
        new VarMapper() {
          @Override
          public Lambda var(int depth, int index) {
            if (index == depth) {
              return shift(arg, depth, 0);
            }
            return Lambda.var(index > depth ? index - 1 : index);
          }
        });
  }

  /** Adds {@code d} to each variable that is free above {@code cutoff}. */
  static Lambda shift(Lambda t, int d, int cutoff) {
    if (d == 0) {
      return t;
    }
    return t.fold(
        new VarMapper() {
          @Override
          public Lambda var(int depth, int index) {
            return Lambda.var(index >= cutoff + depth ? index + d : index);
          }
        });
  }

  /** Folder that rebuilds a term, replacing each variable. */
  private abstract static class VarMapper implements LambdaFolder<Lambda> {
    @Override
    public Lambda abs(int depth, Lambda body) {
      return Lambda.abs(body);
    }

    @Override
    public Lambda app(Lambda fn, Lambda arg) {
      return Lambda.app(fn, arg);
    }
  }

  /**
   * State of one call to a normal-order normalizer.
   *
   * <p>Neither method recurses. {@link #normal} keeps a stack of pending
   * tasks and a stack of finished subterms.
   */
  private static class Reducer {
    final int maxSteps;
    int steps;

    Reducer(int maxSteps) {
      this.maxSteps = maxSteps;
    }

    Lambda normal(Lambda t) {
      final Deque<Runnable> todo = new ArrayDeque<>();
      final Deque<Lambda> done = new ArrayDeque<>();
      todo.push(() -> expand(t, todo, done));
      while (!todo.isEmpty()) {
        todo.pop().run();
      }
      return done.pop();
    }

    /**
     * Reduces a term to head normal form, and schedules the normalization of
     * its parts. When they are complete, the normal form of the term will be
     * on top of {@code done}.
     */
    private void expand(Lambda t, Deque<Runnable> todo, Deque<Lambda> done) {
      final Lambda h = headNormal(t);
      if (h instanceof Lambda.Abs) {
        todo.push(() -> done.push(Lambda.abs(done.pop())));
        todo.push(() -> expand(((Lambda.Abs) h).body, todo, done));
        return;
      }

      // The head is a variable, so only the arguments can reduce.
      // Arguments are collected last first.
      final List<Lambda> args = new ArrayList<>();
      Lambda head = h;
      while (head instanceof Lambda.App) {
        args.add(((Lambda.App) head).arg);
        head = ((Lambda.App) head).fn;
      }
      final Lambda var = head;
      final int n = args.size();
      todo.push(() -> {
        final Lambda[] normalArgs = new Lambda[n];
        for (int i = n - 1; i >= 0; i--) {
          normalArgs[i] = done.pop();
        }
        Lambda result = var;
        for (Lambda arg : normalArgs) {
          result = Lambda.app(result, arg);
        }
        done.push(result);
      });
      // Push the last argument first, so that the first is normalized first.
      for (Lambda arg : args) {
        todo.push(() -> expand(arg, todo, done));
      }
    }

    /** Reduces until the term is not an application of an abstraction. */
    Lambda headNormal(Lambda t) {
      // Arguments of the spine, first argument on top.
      final Deque<Lambda> args = new ArrayDeque<>();
      for (;;) {
        while (t instanceof Lambda.App) {
          args.push(((Lambda.App) t).arg);
          t = ((Lambda.App) t).fn;
        }
        if (!(t instanceof Lambda.Abs) || args.isEmpty()) {
          break;
        }
        if (steps++ >= maxSteps) {
          throw new ReductionLimitException(maxSteps);
        }
        t = beta(((Lambda.Abs) t).body, args.pop());
      }
      while (!args.isEmpty()) {
        t = Lambda.app(t, args.pop());
      }
      return t;
    }
  }
}

// End Normalizers.java
