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
package net.hydromatic.caramel.parse;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/** Tests {@link Rule}. */
public class RuleTest {
  /** Returns the matches of a rule at offset 0, as "value@end" strings. */
  private static <T> String matches(Rule<T> rule, String text) {
    return rule.matches(new Rule.Input(text), 0).toString();
  }

  @Test
  void testChars1() {
    final Rule<String> letters = Rule.chars1(Character::isLetter);
    assertThat(matches(letters, "abc1"), is("[a@1, ab@2, abc@3]"));
    assertThat(matches(letters, "1abc"), is("[]"));

    final Rule.Input input = new Rule.Input("abc1");
    letters.matches(input, 0);
    assertThat(input.furthest, is(3));
  }

  @Test
  void testChoice() {
    final Rule<String> a = Rule.chr('a').map(c -> "a");
    final Rule<String> ab = Rule.string("ab");
    assertThat(matches(a.or(ab), "ab"), is("[a@1, ab@2]"));
    assertThat(matches(a.orElse(ab), "ab"), is("[a@1]"));
    assertThat(matches(ab.orElse(a), "ac"), is("[a@1]"));
    assertThat(matches(Rule.choice(ab, a, ab), "ab"), is("[ab@2, a@1, ab@2]"));
  }

  @Test
  void testMany() {
    final Rule<List<Integer>> many = Rule.chr('a').many();
    assertThat(matches(many, "aab"), is("[[]@0, [97]@1, [97, 97]@2]"));
    assertThat(matches(Rule.chr('a').many1(), "b"), is("[]"));
    assertThat(
        matches(Rule.chr('a').many1(), "aa"), is("[[97]@1, [97, 97]@2]"));

    // A rule that matches the empty string does not loop forever.
    assertThat(matches(Rule.spaces().many(), "x"), is("[[]@0]"));
  }

  @Test
  void testSepBy() {
    final Rule<List<Integer>> rule = Rule.chr('x').sepBy(Rule.chr(','));
    assertThat(matches(rule, "x,x;"), is("[[]@0, [120]@1, [120, 120]@3]"));
    assertThat(matches(Rule.chr('x').sepBy1(Rule.chr(',')), ",x"), is("[]"));
  }

  @Test
  void testManyTill() {
    final Rule<List<Integer>> rule = Rule.any().manyTill(Rule.chr('"'));
    assertThat(matches(rule, "ab\"c\""), is("[[97, 98]@3]"));
    assertThat(matches(rule, "\""), is("[[]@1]"));
    assertThat(matches(rule, "abc"), is("[]"));
  }

  @Test
  void testThenAndFilter() {
    final Rule<String> digits = Rule.chars1(c -> c >= '0' && c <= '9');
    final Rule<String> small = digits.filter(s -> s.length() < 3);
    assertThat(matches(small, "1234"), is("[1@1, 12@2]"));
    final Rule<String> paren =
        digits.between(Rule.chr('('), Rule.chr(')'));
    assertThat(matches(paren, "(42)"), is("[42@4]"));
    assertThat(
        matches(Rule.pure("x").thenLeft(Rule.chr('y')), "y"), is("[x@1]"));
  }

  @Test
  void testMemoize() {
    final AtomicInteger count = new AtomicInteger();
    final Rule<String> rule =
        Rule.<String>of(
                (input, offset) -> {
                  count.incrementAndGet();
                  return ImmutableList.of(new Rule.Match<>("x", offset + 1));
                })
            .memoize();
    final Rule.Input input = new Rule.Input("xyz");
    assertThat(rule.matches(input, 0), hasToString("[x@1]"));
    assertThat(rule.matches(input, 0), hasToString("[x@1]"));
    assertThat(count.get(), is(1));
    rule.matches(input, 1);
    assertThat(count.get(), is(2));

    // A new parse has a new memo.
    rule.matches(new Rule.Input("xyz"), 0);
    assertThat(count.get(), is(3));
  }

  /** A lazy rule builds its delegate once, on first use. */
  @Test
  void testLazy() {
    final AtomicInteger count = new AtomicInteger();
    final List<Rule<Integer>> holder = new ArrayList<>();
    final Rule<Integer> nested =
        Rule.lazy(() -> {
          count.incrementAndGet();
          return holder.get(0);
        });
    holder.add(
        Rule.chr('x').orElse(nested.between(Rule.chr('('), Rule.chr(')'))));
    assertThat(count.get(), is(0));
    assertThat(matches(nested, "((x))"), is("[120@5]"));
    assertThat(matches(nested, "(x"), is("[]"));
    assertThat(count.get(), is(1));

    final Rule<Integer> broken = Rule.lazy(() -> null);
    assertThrows(NullPointerException.class,
        () -> broken.matches(new Rule.Input("x"), 0));
  }

  @Test
  void testFurthest() {
    final Rule<Integer> abc =
        Rule.chr('a').thenRight(Rule.chr('b')).thenRight(Rule.chr('c'));
    final Rule.Input input = new Rule.Input("abd");
    assertThat(abc.matches(input, 0).isEmpty(), is(true));
    assertThat(input.furthest, is(2));
  }
}

// End RuleTest.java
