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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Backtracking parser that returns every way that it can match the input at
 * a given offset.
 *
 * <p>Matches are returned in the order they were constructed. Two kinds of
 * choice are available: {@link #or} keeps the matches of both alternatives,
 * and {@link #orElse} commits to the first alternative if it matches at all.
 *
 * <p>A rule holds no state; the text, the furthest offset reached, and the
 * memo of {@link #memoize() memoized} rules live in an {@link Input}, which
 * belongs to a single call to the parser.
 *
 * @param <T> Type of value produced by a match
 */
public abstract class Rule<T> {
  /** Returns all matches of this rule at a given offset. */
  abstract List<Match<T>> matches(Input input, int offset);

  /** Creates a rule from a function. */
  static <T> Rule<T> of(BiFunction<Input, Integer, List<Match<T>>> fn) {
    return new Rule<T>() {
      @Override
      List<Match<T>> matches(Input input, int offset) {
        return fn.apply(input, offset);
      }
    };
  }

  /**
   * Creates a rule that is constructed the first time it is used; this allows
   * recursive grammars.
   */
  static <T> Rule<T> lazy(Supplier<Rule<T>> supplier) {
    return new Rule<T>() {
      private @Nullable Rule<T> rule;

      @Override
      List<Match<T>> matches(Input input, int offset) {
        Rule<T> r = rule;
        if (r == null) {
          r = rule = requireNonNull(supplier.get(), "rule");
        }
        return r.matches(input, offset);
      }
    };
  }

  /** Rule that consumes no input and produces a value. */
  static <T> Rule<T> pure(T value) {
    return of((input, offset) -> ImmutableList.of(new Match<>(value, offset)));
  }

  /** Rule that matches one code point that satisfies a predicate. */
  static Rule<Integer> satisfy(IntPredicate predicate) {
    return of(
        (input, offset) -> {
          if (offset < input.text.length()) {
            final int c = input.text.codePointAt(offset);
            if (predicate.test(c)) {
              return ImmutableList.of(
                  new Match<>(c, offset + Character.charCount(c)));
            }
          }
          input.fail(offset);
          return ImmutableList.of();
        });
  }

  /** Rule that matches any one code point. */
  static Rule<Integer> any() {
    return satisfy(c -> true);
  }

  /** Rule that matches a given character. */
  static Rule<Integer> chr(char c) {
    return satisfy(c2 -> c2 == c);
  }

  /** Rule that matches a given string. */
  static Rule<String> string(String s) {
    return of(
        (input, offset) -> {
          if (input.text.startsWith(s, offset)) {
            return ImmutableList.of(new Match<>(s, offset + s.length()));
          }
          input.fail(offset);
          return ImmutableList.of();
        });
  }

  /**
   * Rule that matches one or more code points that satisfy a predicate.
   * Like {@code many1(satisfy(predicate))}, it matches every non-empty
   * prefix, shortest first; but it builds each string only once.
   */
  static Rule<String> chars1(IntPredicate predicate) {
    return of(
        (input, offset) -> {
          final List<Match<String>> list = new ArrayList<>();
          int i = offset;
          while (i < input.text.length()) {
            final int c = input.text.codePointAt(i);
            if (!predicate.test(c)) {
              break;
            }
            i += Character.charCount(c);
            list.add(new Match<>(input.text.substring(offset, i), i));
          }
          if (list.isEmpty()) {
            input.fail(offset);
          } else if (i < input.text.length()) {
            input.fail(i);
          }
          return list;
        });
  }

  /** Rule that skips zero or more whitespace characters. Never fails. */
  static Rule<String> spaces() {
    return of(
        (input, offset) -> {
          int i = offset;
          while (i < input.text.length()
              && Character.isWhitespace(input.text.charAt(i))) {
            ++i;
          }
          return ImmutableList.of(
              new Match<>(input.text.substring(offset, i), i));
        });
  }

  /** Returns the matches of each of a list of rules, in order. */
  @SafeVarargs
  static <T> Rule<T> choice(Rule<T>... rules) {
    final List<Rule<T>> list = ImmutableList.copyOf(rules);
    return of(
        (input, offset) -> {
          final List<Match<T>> matches = new ArrayList<>();
          for (Rule<T> rule : list) {
            matches.addAll(rule.matches(input, offset));
          }
          return matches;
        });
  }

  /** Returns the matches of this rule, then the matches of another. */
  Rule<T> or(Rule<T> other) {
    return choice(this, other);
  }

  /**
   * Returns the matches of this rule; or, if this rule has no matches, the
   * matches of another.
   */
  Rule<T> orElse(Rule<T> other) {
    return of(
        (input, offset) -> {
          final List<Match<T>> matches = matches(input, offset);
          return matches.isEmpty() ? other.matches(input, offset) : matches;
        });
  }

  /**
   * Rule that matches this rule, then the rule generated from the value of
   * that match.
   */
  <U> Rule<U> then(Function<T, Rule<U>> fn) {
    return of(
        (input, offset) -> {
          final List<Match<U>> matches = new ArrayList<>();
          for (Match<T> match : matches(input, offset)) {
            matches.addAll(fn.apply(match.value).matches(input, match.end));
          }
          return matches;
        });
  }

  /** Matches this rule and then another, keeping the second value. */
  <U> Rule<U> thenRight(Rule<U> next) {
    return then(t -> next);
  }

  /** Matches this rule and then another, keeping the first value. */
  Rule<T> thenLeft(Rule<?> next) {
    return then(t -> next.map(u -> t));
  }

  <U> Rule<U> map(Function<T, U> fn) {
    return of(
        (input, offset) -> {
          final List<Match<U>> matches = new ArrayList<>();
          for (Match<T> match : matches(input, offset)) {
            matches.add(new Match<>(fn.apply(match.value), match.end));
          }
          return matches;
        });
  }

  /** Keeps only the matches whose value satisfies a predicate. */
  Rule<T> filter(Predicate<T> predicate) {
    return of(
        (input, offset) -> {
          final List<Match<T>> matches = new ArrayList<>();
          for (Match<T> match : matches(input, offset)) {
            if (predicate.test(match.value)) {
              matches.add(match);
            }
          }
          return matches;
        });
  }

  /** Matches {@code open}, this rule, then {@code close}. */
  Rule<T> between(Rule<?> open, Rule<?> close) {
    return open.thenRight(this).thenLeft(close);
  }

  /**
   * Matches this rule zero or more times. Returns every number of
   * repetitions, fewest first.
   */
  Rule<List<T>> many() {
    return of(
        (input, offset) -> {
          final List<Match<List<T>>> matches = new ArrayList<>();
          List<Match<List<T>>> frontier =
              ImmutableList.of(new Match<>(ImmutableList.of(), offset));
          while (!frontier.isEmpty()) {
            matches.addAll(frontier);
            final List<Match<List<T>>> next = new ArrayList<>();
            for (Match<List<T>> prefix : frontier) {
              for (Match<T> match : matches(input, prefix.end)) {
                if (match.end > prefix.end) {
                  next.add(
                      new Match<>(
                          ImmutableList.<T>builder()
                              .addAll(prefix.value)
                              .add(match.value)
                              .build(),
                          match.end));
                }
              }
            }
            frontier = next;
          }
          return matches;
        });
  }

  /** Matches this rule one or more times. */
  Rule<List<T>> many1() {
    return then(
        first ->
            many()
                .map(
                    rest ->
                        ImmutableList.<T>builder()
                            .add(first)
                            .addAll(rest)
                            .build()));
  }

  /** Matches zero or more occurrences of this rule, separated by another. */
  Rule<List<T>> sepBy(Rule<?> separator) {
    return Rule.<List<T>>pure(ImmutableList.of()).or(sepBy1(separator));
  }

  /** Matches one or more occurrences of this rule, separated by another. */
  Rule<List<T>> sepBy1(Rule<?> separator) {
    return then(
        first ->
            separator
                .thenRight(this)
                .many()
                .map(
                    rest ->
                        ImmutableList.<T>builder()
                            .add(first)
                            .addAll(rest)
                            .build()));
  }

  /**
   * Matches this rule repeatedly until {@code end} matches. Stops at the first
   * occurrence of {@code end}.
   */
  Rule<List<T>> manyTill(Rule<?> end) {
    return of(
        (input, offset) -> {
          final List<Match<List<T>>> matches = new ArrayList<>();
          List<Match<List<T>>> frontier =
              ImmutableList.of(new Match<>(ImmutableList.of(), offset));
          while (!frontier.isEmpty()) {
            final List<Match<List<T>>> next = new ArrayList<>();
            for (Match<List<T>> prefix : frontier) {
              final List<? extends Match<?>> ends =
                  end.matches(input, prefix.end);
              if (!ends.isEmpty()) {
                for (Match<?> e : ends) {
                  matches.add(new Match<>(prefix.value, e.end));
                }
                continue;
              }
              for (Match<T> match : matches(input, prefix.end)) {
                next.add(
                    new Match<>(
                        ImmutableList.<T>builder()
                            .addAll(prefix.value)
                            .add(match.value)
                            .build(),
                        match.end));
              }
            }
            frontier = next;
          }
          return matches;
        });
  }

  /**
   * Returns a rule that remembers its matches at each offset, for the
   * duration of one parse.
   */
  Rule<T> memoize() {
    final Rule<T> rule = this;
    return new Rule<T>() {
      @Override
      List<Match<T>> matches(Input input, int offset) {
        @SuppressWarnings("unchecked")
        final Map<Integer, List<Match<T>>> memo =
            (Map<Integer, List<Match<T>>>)
                (Map) input.memo.computeIfAbsent(this, r -> new HashMap<>());
        List<Match<T>> matches = memo.get(offset);
        if (matches == null) {
          matches = ImmutableList.copyOf(rule.matches(input, offset));
          memo.put(offset, matches);
        }
        return matches;
      }
    };
  }

  /** A successful match: a value, and the offset just after the match. */
  static final class Match<T> {
    final T value;
    final int end;

    Match(T value, int end) {
      this.value = requireNonNull(value);
      this.end = end;
    }

    @Override
    public String toString() {
      return value + "@" + end;
    }
  }

  /** Text being parsed, and the state of one parse. */
  static final class Input {
    final String text;
    final Map<Rule<?>, Map<Integer, ? extends List<?>>> memo =
        new IdentityHashMap<>();

    /** Furthest offset at which a rule failed to match. */
    int furthest = 0;

    Input(String text) {
      this.text = requireNonNull(text);
    }

    void fail(int offset) {
      furthest = Math.max(furthest, offset);
    }
  }
}

// End Rule.java
