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

import java.util.function.Consumer;
import net.hydromatic.caramel.ast.Term;
import net.hydromatic.caramel.lambda.Lambda;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on a parsed term, then
   * calls the underlying tracer.
   */
  public static Tracer withOnParse(Tracer tracer, Consumer<Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onParse(Term term) {
        consumer.accept(term);
        super.onParse(term);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a term whose let
   * blocks have been sorted, then calls the underlying tracer.
   */
  public static Tracer withOnSort(Tracer tracer, Consumer<Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onSort(Term term) {
        consumer.accept(term);
        super.onSort(term);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on an encoded term, then
   * calls the underlying tracer.
   */
  public static Tracer withOnEncode(Tracer tracer, Consumer<Lambda> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onEncode(Lambda lambda) {
        consumer.accept(lambda);
        super.onEncode(lambda);
      }
    };
  }

  public static Tracer withOnNormalize(
      Tracer tracer, Consumer<Lambda> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onNormalize(Lambda lambda) {
        consumer.accept(lambda);
        super.onNormalize(lambda);
      }
    };
  }

  public static Tracer withOnDecode(Tracer tracer, Consumer<Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDecode(Term term) {
        consumer.accept(term);
        super.onDecode(term);
      }
    };
  }

  /**
   * Returns a tracer that handles exceptions by passing them to the given
   * action.
   */
  public static Tracer withOnException(
      Tracer tracer, Consumer<RuntimeException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean onException(RuntimeException e) {
        consumer.accept(e);
        super.onException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onParse(Term term) {}

    @Override
    public void onSort(Term term) {}

    @Override
    public void onEncode(Lambda lambda) {}

    @Override
    public void onNormalize(Lambda lambda) {}

    @Override
    public void onDecode(Term term) {}

    @Override
    public boolean onException(RuntimeException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onParse(Term term) {
      tracer.onParse(term);
    }

    @Override
    public void onSort(Term term) {
      tracer.onSort(term);
    }

    @Override
    public void onEncode(Lambda lambda) {
      tracer.onEncode(lambda);
    }

    @Override
    public void onNormalize(Lambda lambda) {
      tracer.onNormalize(lambda);
    }

    @Override
    public void onDecode(Term term) {
      tracer.onDecode(term);
    }

    @Override
    public boolean onException(RuntimeException e) {
      return tracer.onException(e);
    }
  }
}

// End Tracers.java
