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
package net.hydromatic.caramel.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.caramel.ast.Term;
import net.hydromatic.caramel.compile.Evaluator;
import net.hydromatic.caramel.compile.LetSorter;
import net.hydromatic.caramel.compile.Pretty;
import net.hydromatic.caramel.compile.Tracer;
import net.hydromatic.caramel.compile.Tracers;
import net.hydromatic.caramel.lambda.Normalizers;
import net.hydromatic.caramel.parse.CaramelParser;
import net.hydromatic.caramel.util.CaramelException;

/**
 * Runs Caramel programs: parses source text, evaluates the term, and prints
 * the result.
 *
 * <p>A session is immutable. Its behavior is controlled by properties (see
 * {@link Prop}) and it reports each step to a {@link Tracer}.
 */
public class Session {
  /** Property values. Properties not in the map have their default value. */
  public final ImmutableMap<Prop, Object> map;

  private final Tracer tracer;

  /** Creates a Session. */
  public Session(Map<Prop, Object> map, Tracer tracer) {
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a Session with default properties that traces nothing. */
  public Session() {
    this(ImmutableMap.of(), Tracers.empty());
  }

  /** Returns a session that is the same as this but with a property set. */
  public Session withProp(Prop prop, Object value) {
    final Map<Prop, Object> map2 = new LinkedHashMap<>(map);
    prop.set(map2, value);
    return new Session(map2, tracer);
  }

  /** Returns a session that is the same as this but with a given tracer. */
  public Session withTracer(Tracer tracer) {
    return new Session(map, tracer);
  }

  /** Parses source text. */
  public Term parse(String source) {
    final Term term = CaramelParser.parse(source);
    tracer.onParse(term);
    return term;
  }

  /**
   * Evaluates a term.
   *
   * <p>If {@link Prop#SORT_RECURSIVE_LETS} is set, first sorts the
   * definitions of its lets.
   */
  public Term evaluate(Term term) {
    if (Prop.SORT_RECURSIVE_LETS.booleanValue(map)) {
      term = LetSorter.sort(term);
      tracer.onSort(term);
    }
    final Evaluator evaluator =
        new Evaluator(
            Normalizers.normalOrder(Prop.MAX_REDUCTION_STEPS.intValue(map)),
            Prop.RESUGAR.booleanValue(map),
            tracer);
    return evaluator.evaluate(term);
  }

  /**
   * Parses and evaluates a program, and returns the result as source text.
   *
   * <p>If a step throws, offers the exception to the tracer. If the tracer
   * handles it, returns a description of the error; otherwise rethrows it.
   */
  public String run(String source) {
    try {
      return Pretty.pretty(evaluate(parse(source)));
    } catch (RuntimeException e) {
      if (!tracer.onException(e)) {
        throw e;
      }
      return describe(e);
    }
  }

  /** Returns a description of an error, for the user. */
  static String describe(RuntimeException e) {
    if (e instanceof CaramelException) {
      return ((CaramelException) e).describeTo(new StringBuilder()).toString();
    }
    return "Error: " + e.getMessage();
  }
}

// End Session.java
