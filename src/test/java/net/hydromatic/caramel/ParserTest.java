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

import static net.hydromatic.caramel.Cml.assertError;
import static net.hydromatic.caramel.Cml.cml;
import static net.hydromatic.caramel.Cml.cmlE;
import static net.hydromatic.caramel.Matchers.isTerm;
import static net.hydromatic.caramel.Matchers.throwsA;
import static net.hydromatic.caramel.ast.TermBuilder.term;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import net.hydromatic.caramel.ast.Term;
import net.hydromatic.caramel.parse.CaramelParser;
import org.junit.jupiter.api.Test;

/** Tests the parser. */
public class ParserTest {
  @Test
  void testLiterals() {
    cml("42").assertParse(isTerm(Term.Nat.class, "42"));
    cml("#42").assertParse(isTerm(Term.Word.class, "#42"));
    cml("#4294967295").assertParseSame();
    cml("'a'").assertParse(isTerm(Term.Chr.class, "'a'"));
    cml("' '").assertParseSame();
    cml("\"hello, world\"")
        .assertParse(isTerm(Term.Str.class, "\"hello, world\""));
    cml("\"\"").assertParse(isTerm(Term.Str.class, "\"\""));
  }

  @Test
  void testIdentifiers() {
    cml("x").assertParse(isTerm(Term.Id.class, "x"));
    cml("foo").assertParseSame();
    cml("is_zero?").assertParseSame();
    cml("+").assertParseSame();
    cml("a.b@c").assertParseSame();
    cml("#").assertParse(isTerm(Term.Id.class, "#"));
    cml("##").assertParse(isTerm(Term.Id.class, "##"));
    // A word literal must be a number; otherwise "#" is an identifier.
    cml("(# x)").assertParse(isTerm(Term.Apply.class, "(# x)"));
  }

  /**
   * Numbers that do not fit are not literals. A shorter prefix of the digits
   * is, so the parser does not fall back to an identifier, and the text does
   * not parse.
   */
  @Test
  void testOverflow() {
    cml("2147483647").assertParse(isTerm(Term.Nat.class, "2147483647"));
    assertError(
        () -> CaramelParser.parse("2147483648"),
        throwsA("CaramelParseException"));
    assertError(
        () -> CaramelParser.parse("[#4294967296]"),
        throwsA("CaramelParseException"));
  }

  @Test
  void testFunctions() {
    cml("(x -> x)").assertParse(isTerm(Term.Fn.class, "(x -> x)"));
    cml("(x y -> (x y))").assertParseSame();
    cml("(-> 1)").assertParse("( -> 1)");
    cml("(f x ->   (f x))").assertParse("(f x -> (f x))");
    cml("(f x -> (f (f x)))").assertParseSame();
  }

  @Test
  void testApply() {
    cml("(f x)").assertParse(isTerm(Term.Apply.class, "(f x)"));
    cml("(f x y z)").assertParseSame();
    cml("( f x )").assertParse("(f x)");
    cml("((f x) y)").assertParseSame();
    cml("(f (g x) [1])").assertParseSame();
  }

  @Test
  void testTuplesAndLists() {
    cml("(1, 2)").assertParse(isTerm(Term.Tuple.class, "(1,2)"));
    cml("(1,2,3)").assertParseSame();
    cml("( 1 ,  2 )").assertParse("(1,2)");
    cml("()").assertParse(isTerm(Term.Tuple.class, "()"));
    cml("(x)").assertParse(isTerm(Term.Tuple.class, "(x)"));
    cml("[1, 2, 3]").assertParse(isTerm(Term.ListExp.class, "[1,2,3]"));
    cml("[]").assertParse(isTerm(Term.ListExp.class, "[]"));
    cml("[[1], [2, 3], []]").assertParse("[[1],[2,3],[]]");
    cml("['a', \"b\", #3]").assertParse("['a',\"b\",#3]");
  }

  @Test
  void testLet() {
    cml("{a = 1; a}").assertParse(isTerm(Term.Let.class, "{a = 1; a}"));
    cml("{a = 1; b x = (x a); (b a)}").assertParseSame();
    cml("{ a = 1;  b = 2 ; (a, b) }").assertParse("{a = 1; b = 2; (a,b)}");
    cml("{f x  y = (x y); f}").assertParse("{f x y = (x y); f}");
  }

  @Test
  void testLetMultiline() {
    final String source = "{a = 1;\n"
        + " b = 2;\n"
        + " (a, b)}";
    cml(source).assertParse("{a = 1; b = 2; (a,b)}");
  }

  @Test
  void testLocalDefinitions() {
    final String source = "(f 1)\n"
        + "    f x = x";
    cml(source).assertParse(isTerm(Term.Let.class, "{f x = x; (f 1)}"));

    final String source2 = "(f (g 1))\n"
        + "    f x = x\n"
        + "    g = (y -> y)";
    cml(source2).assertParse("{f x = x; g = (y -> y); (f (g 1))}");
  }

  @Test
  void testNestedLocalDefinitions() {
    final String source = "(f 1)\n"
        + "    f x = (g x)\n"
        + "        g y = y\n"
        + "    h = 2";
    cml(source).assertParse("{f x = {g y = y; (g x)}; h = 2; (f 1)}");
  }

  @Test
  void testComments() {
    final String source = "-- The identity function\n"
        + "\n"
        + "(f 1)   -- apply it\n"
        + "    -- a comment between definitions\n"
        + "    f x = x   \n"
        + "\n";
    cml(source).assertParse("{f x = x; (f 1)}");
    cml("x -- y").assertParse("x");
  }

  @Test
  void testAdt() {
    final String source = "#(Cons (head 1) (tail 2) | Nil)";
    cml(source)
        .assertParse(isTerm(Term.Adt.class, source))
        .withParse(
            t -> {
              final Term.Adt adt = (Term.Adt) t;
              assertThat(adt.ctors.size(), is(2));
              assertThat(adt.ctors.get(0).name, is("Cons"));
              assertThat(adt.ctors.get(0).fields.get(1).name, is("tail"));
              assertThat(adt.ctors.get(1).fields.isEmpty(), is(true));
            });
    cml("#(Leaf)").assertParseSame();
    cml("#(Node (left #) (right #))").assertParseSame();
  }

  /** The longest parse wins; "foo" also parses as "f" followed by junk. */
  @Test
  void testLongestParse() {
    cml("foo").assertParse(isTerm(Term.Id.class, "foo"));
    cml("123").assertParse(isTerm(Term.Nat.class, "123"));
  }

  @Test
  void testRoundTrip() {
    cml("(x y -> (x y))").assertParseRoundTrip();
    cml("{a = 1; b x = (x a); (b [a, 2])}").assertParseRoundTrip();
    cml("((1, 'a'), [\"bc\", \"\"], #7)").assertParseRoundTrip();
    cml("(f 1)\n    f x = (g x)\n        g y = y").assertParseRoundTrip();
  }

  @Test
  void testBuiltTermRoundTrip() {
    final Term t =
        term.let(
            ImmutableList.of(
                term.def(
                    "f", term.fn("x", term.apply(term.id("x"), term.nat(1))))),
            term.tuple(term.str("s"), term.chr('c'), term.word(5L)));
    assertThat(CaramelParser.parse(t.toString()), is(t));
  }

  @Test
  void testErrors() {
    cmlE("[1, 2$}$").assertParseThrows("unexpected character '}'");
    cmlE("(x -> $;$)").assertParseThrows("unexpected character ';'");
    cml("{a = 1; a").assertParseThrows("unexpected end of input");
    cml("").assertParseThrows("unexpected end of input");
    cml("-- only a comment").assertParseThrows("unexpected end of input");
    cmlE("(f  $x$)").assertParseThrows("unexpected character 'x'");
  }
}

// End ParserTest.java
