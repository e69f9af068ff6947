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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Set;
import net.hydromatic.caramel.ast.Term;
import net.hydromatic.caramel.parse.CaramelParser;
import org.junit.jupiter.api.Test;

/** Tests {@link FreeFinder}. */
public class FreeFinderTest {
  private static Set<String> freeVars(String source) {
    return FreeFinder.freeVars(CaramelParser.parse(source));
  }

  @Test
  void testFn() {
    final Term t =
        term.fn(
            ImmutableList.of("x"),
            term.apply(term.id("x"), term.id("y")));
    assertThat(FreeFinder.freeVars(t), is(ImmutableSet.of("y")));
    assertThat(FreeFinder.isFree("y", t), is(true));
    assertThat(FreeFinder.isFree("x", t), is(false));
  }

  /** Variables are returned in the order they are first seen. */
  @Test
  void testOrder() {
    assertThat(freeVars("(x -> (x z y z))"), hasToString("[z, y]"));
    assertThat(freeVars("[c, (b, a), c]"), hasToString("[c, b, a]"));
  }

  @Test
  void testLiterals() {
    assertThat(freeVars("[1, 'a', \"bc\", #4]").isEmpty(), is(true));
  }

  @Test
  void testShadowing() {
    assertThat(freeVars("(x -> (x -> x))").isEmpty(), is(true));
    assertThat(freeVars("((x -> x) x)"), is(ImmutableSet.of("x")));
  }

  /** A let binds its names in its body and in every definition. */
  @Test
  void testLet() {
    assertThat(
        freeVars("{f x = (g x y); g = f; (f z)}"), hasToString("[y, z]"));
    assertThat(freeVars("{a = b; b = a; c}"), is(ImmutableSet.of("c")));
    // A parameter is only bound in its own definition.
    assertThat(freeVars("{f x = x; g = x; (f g)}"), is(ImmutableSet.of("x")));
  }

  @Test
  void testAdt() {
    assertThat(
        freeVars("#(Node (left #) (right t))"), is(ImmutableSet.of("t")));
    assertThat(freeVars("(#(Leaf) #)"), is(ImmutableSet.of("#")));
  }
}

// End FreeFinderTest.java
