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

import static net.hydromatic.caramel.ast.TermBuilder.term;
import static net.hydromatic.caramel.lambda.Lambda.abs;
import static net.hydromatic.caramel.lambda.Lambda.app;
import static net.hydromatic.caramel.lambda.Lambda.var;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.caramel.ast.Term;
import net.hydromatic.caramel.lambda.Lambda;
import net.hydromatic.caramel.parse.CaramelParser;
import org.junit.jupiter.api.Test;

/** Tests {@link Encoder}. */
public class EncoderTest {
  private static String encode(String source) {
    return Encoder.encode(CaramelParser.parse(source)).toString();
  }

  @Test
  void testNatural() {
    assertThat(Encoder.church(0), hasToString("λλ0"));
    assertThat(Encoder.church(3), hasToString("λλ(1 (1 (1 0)))"));
    assertThat(encode("2"), is("λλ(1 (1 0))"));
  }

  @Test
  void testFn() {
    assertThat(encode("(x -> x)"), is("λ0"));
    assertThat(encode("(x y z -> (x z (y z)))"), is("λλλ((2 0) (1 0))"));
    assertThat(encode("(x -> (x -> x))"), is("λλ0"));
    assertThat(encode("(x y -> ((z -> x) y))"), is("λλ(λ2 0)"));
  }

  @Test
  void testListAndTuple() {
    assertThat(encode("[]"), is("λλ0"));
    assertThat(encode("[1, 0]"), is("λλ((1 λλ(1 0)) ((1 λλ0) 0))"));
    assertThat(encode("()"), is("λ0"));
    assertThat(encode("(0, 0)"), is("λ((0 λλ0) λλ0)"));
    // Elements are shifted past the binders of the list and the tuple.
    assertThat(encode("(x -> [x])"), is("λλλ((1 2) 0)"));
    assertThat(encode("(x -> (x, x))"), is("λλ((0 1) 1)"));
  }

  @Test
  void testBits() {
    assertThat(Encoder.bits(2, 2), hasToString("λ((0 λλ0) λλ1)"));
    assertThat(encode("'A'"),
        is("λ((((((((0 λλ1) λλ0) λλ1) λλ1) λλ1) λλ1) λλ1) λλ0)"));

    // A word is a tuple of 32 bits; bit 0 is (t f -> t), bit 1 is (t f -> f).
    final Term zero = term.fn(ImmutableList.of("t", "f"), term.id("t"));
    final Term one = term.fn(ImmutableList.of("t", "f"), term.id("f"));
    final List<Term> bits = new ArrayList<>();
    for (int i = 0; i < 32; i++) {
      bits.add(i == 0 || i == 31 ? one : zero);
    }
    assertThat(Encoder.encode(term.word(0x8000_0001L)),
        is(Encoder.encode(term.tuple(bits))));
  }

  @Test
  void testString() {
    assertThat(Encoder.encode(term.str("ab")),
        is(Encoder.encode(term.list(term.chr('a'), term.chr('b')))));
    assertThat(Encoder.encode(term.str("")), is(Encoder.church(0)));
  }

  @Test
  void testCharOutOfRange() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Encoder.encode(term.chr(256)));
    assertThat(e.getMessage(), is("character 256 does not fit in 8 bits"));
  }

  @Test
  void testLet() {
    assertThat(encode("{a = 1; a}"), is("(λ0 λλ(1 0))"));
    assertThat(encode("{a = 1; b = a; b}"), is("(λ(λ0 0) λλ(1 0))"));
    assertThat(encode("{f x = x; f}"), is("(λ0 λ0)"));
    assertThat(encode("(y -> {f x = (x y); f})"), is("λ(λ0 λ(0 1))"));
  }

  /** A definition cannot see itself or the definitions that follow it. */
  @Test
  void testLetScope() {
    final UnboundVariableException e =
        assertThrows(UnboundVariableException.class,
            () -> encode("{a = b; b = 1; a}"));
    assertThat(e.name, is("b"));
    assertThrows(UnboundVariableException.class,
        () -> encode("{f n = (f n); f}"));
  }

  @Test
  void testScope() {
    final Scope scope = Scope.empty().bind("x", 0).bind("y", 1);
    assertThat(Encoder.encode(term.id("x"), scope, 2), is(var(1)));
    assertThat(Encoder.encode(term.id("y"), scope, 2), is(var(0)));
    assertThat(
        Encoder.encode(term.fn("z", term.id("x")), scope, 2), is(abs(var(2))));
  }

  @Test
  void testUnbound() {
    final UnboundVariableException e =
        assertThrows(UnboundVariableException.class,
            () -> encode("(x -> (x y))"));
    assertThat(e.name, is("y"));
    assertThat(e.getMessage(), is("undefined variable `y`"));
  }

  @Test
  void testAdt() {
    final Lambda leaf = Encoder.encode(CaramelParser.parse("#(Leaf)"));
    final Lambda nil = abs(abs(var(0)));
    final Lambda pair =
        abs(app(app(var(0), Encoder.encode(term.str("Leaf"))), nil));
    final Lambda list = abs(abs(app(app(var(1), pair), var(0))));
    assertThat(leaf, is(abs(app(var(0), list))));

    // "#" refers to the value being constructed; other names must be bound.
    assertThat(Encoder.encode(CaramelParser.parse("#(Node (left #))")),
        not(instanceOf(Lambda.Var.class)));
    assertThat(Encoder.encode(CaramelParser.parse("(x -> #(Node (left x)))")),
        instanceOf(Lambda.Abs.class));
    assertThrows(UnboundVariableException.class,
        () -> encode("#(Node (left x))"));
  }
}

// End EncoderTest.java
