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
package net.hydromatic.caramel;

import static net.hydromatic.caramel.Matchers.isTerm;
import static net.hydromatic.caramel.Matchers.throwsA;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.caramel.ast.Pos;
import net.hydromatic.caramel.ast.Term;
import net.hydromatic.caramel.compile.LetSorter;
import net.hydromatic.caramel.compile.Pretty;
import net.hydromatic.caramel.compile.Tracer;
import net.hydromatic.caramel.compile.Tracers;
import net.hydromatic.caramel.eval.Prop;
import net.hydromatic.caramel.eval.Session;
import net.hydromatic.caramel.lambda.Lambda;
import net.hydromatic.caramel.parse.CaramelParseException;
import net.hydromatic.caramel.parse.CaramelParser;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.Matcher;

/** Fluent test helper. */
class Cml {
  private final String source;
  private final @Nullable Pos pos;
  private final Map<Prop, Object> propMap;
  private final Tracer tracer;

  Cml(
      String source,
      @Nullable Pos pos,
      Map<Prop, Object> propMap,
      Tracer tracer) {
    this.source = source;
    this.pos = pos;
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = tracer;
  }

  /** Creates a {@code Cml}. */
  static Cml cml(String source) {
    return new Cml(source, null, ImmutableMap.of(), Tracers.empty());
  }

  /** Creates a {@code Cml} containing an error position delimited by '$'. */
  static Cml cmlE(String source) {
    final Map.Entry<String, Pos> pair = Pos.split(source, '$', "");
    return new Cml(
        pair.getKey(), pair.getValue(), ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Runs a task and checks that it throws an exception.
   *
   * @param runnable Task to run
   * @param matcher Checks whether exception is as expected
   */
  static void assertError(Runnable runnable, Matcher<Throwable> matcher) {
    try {
      runnable.run();
      fail("expected error");
    } catch (Throwable e) {
      assertThat(e, matcher);
    }
  }

  Cml withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    prop.set(map, value);
    return new Cml(source, pos, map, tracer);
  }

  Cml withTracer(Tracer tracer) {
    return new Cml(source, pos, propMap, tracer);
  }

  private Session session() {
    return new Session(propMap, tracer);
  }

  @CanIgnoreReturnValue
  Cml withParse(Consumer<Term> action) {
    action.accept(CaramelParser.parse(source));
    return this;
  }

  @CanIgnoreReturnValue
  Cml assertParse(Matcher<Term> matcher) {
    return withParse(term -> assertThat(term, matcher));
  }

  /**
   * Checks that the source can be parsed and returns the given string when
   * printed.
   */
  @CanIgnoreReturnValue
  Cml assertParse(String expected) {
    return assertParse(isTerm(expected));
  }

  /**
   * Checks that the source can be parsed and returns the identical text when
   * printed.
   */
  @CanIgnoreReturnValue
  Cml assertParseSame() {
    return assertParse(source);
  }

  /**
   * Checks that the source can be parsed, and that printing the term and
   * parsing it again gives the same term.
   */
  @CanIgnoreReturnValue
  Cml assertParseRoundTrip() {
    return withParse(
        term -> assertThat(CaramelParser.parse(Pretty.pretty(term)), is(term)));
  }

  /**
   * Checks that parsing throws {@link CaramelParseException} with the given
   * message, at the position marked by '$' if there is one.
   */
  @CanIgnoreReturnValue
  Cml assertParseThrows(String message) {
    assertError(
        () -> CaramelParser.parse(source),
        throwsA(CaramelParseException.class, message, pos));
    return this;
  }

  /** Checks the definitions of let blocks after sorting. */
  @CanIgnoreReturnValue
  Cml assertSorted(String expected) {
    return withParse(
        term -> assertThat(LetSorter.sort(term), isTerm(expected)));
  }

  /** Checks that the encoded pure term has the given string. */
  @CanIgnoreReturnValue
  Cml assertEncode(String expected) {
    final Lambda[] encoded = {null};
    final Tracer tracer2 =
        Tracers.withOnEncode(tracer, lambda -> encoded[0] = lambda);
    session().withTracer(tracer2).run(source);
    assertThat(String.valueOf(encoded[0]), is(expected));
    return this;
  }

  /** Checks that evaluating the source gives the given result. */
  @CanIgnoreReturnValue
  Cml assertEval(String expected) {
    assertThat(session().run(source), is(expected));
    return this;
  }

  @CanIgnoreReturnValue
  Cml assertEvalThrows(Matcher<Throwable> matcher) {
    assertError(() -> session().run(source), matcher);
    return this;
  }
}

// End Cml.java
