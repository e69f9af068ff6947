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

import static net.hydromatic.caramel.ast.TermBuilder.term;
import static net.hydromatic.caramel.util.Static.skip;

import com.google.common.base.Strings;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.caramel.ast.Pos;
import net.hydromatic.caramel.ast.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parser for Caramel source text.
 *
 * <p>The alternatives for a term are tried in order, and the parser commits to
 * the first alternative that matches:
 *
 * <ol>
 *   <li>function, {@code (x y -> body)};
 *   <li>let, <code>{f x = v; g = w; body}</code>;
 *   <li>tuple, {@code (a, b)};
 *   <li>all matches of let, application {@code (f x y)}, string, character,
 *       list {@code [a, b]}, and algebraic data type {@code #(C (f x) | D)};
 *   <li>word, {@code #123};
 *   <li>natural, {@code 123};
 *   <li>identifier.
 * </ol>
 *
 * <p>A term may be followed by local definitions, each on its own line and
 * indented 4 spaces more than the term; they become a let whose body is the
 * term.
 *
 * <p>If the text has several parses, the parser takes the one that consumes
 * the most text; among those, the last one found.
 *
 * <p>A parser is used for one parse only; call {@link #parse(String)}.
 */
public class CaramelParser {
  private final Map<Integer, Rule<Term>> termRules = new HashMap<>();

  private final Rule<String> word = Rule.chars1(Parsers::isWordChar);
  private final Rule<String> digits = Rule.chars1(Parsers::isDigit);
  private final Rule<String> spaces = Rule.spaces();

  private CaramelParser() {}

  /** Parses source text. */
  public static Term parse(String source) {
    return parse(source, "");
  }

  /**
   * Parses source text from a file.
   *
   * @param source Source text
   * @param file File name, used in the position of errors
   * @throws CaramelParseException if the text is not a valid term
   */
  public static Term parse(String source, String file) {
    final String text = Parsers.stripComments(source);
    final Rule.Input input = new Rule.Input(text);
    final List<Rule.Match<Term>> matches =
        new CaramelParser().term(0).matches(input, 0);
    Rule.@Nullable Match<Term> best = null;
    int furthest = input.furthest;
    for (Rule.Match<Term> match : matches) {
      furthest = Math.max(furthest, match.end);
      if (Parsers.isBlank(text, match.end)
          && (best == null || match.end >= best.end)) {
        best = match;
      }
    }
    if (best == null) {
      throw error(text, file, furthest);
    }
    return best.value;
  }

  private static CaramelParseException error(
      String text, String file, int offset) {
    final Pos pos = Pos.of(text, file, offset);
    if (Parsers.isBlank(text, offset)) {
      return new CaramelParseException("unexpected end of input", pos);
    }
    final String c = new String(Character.toChars(text.codePointAt(offset)));
    return new CaramelParseException("unexpected character '" + c + "'", pos);
  }

  /**
   * Returns the rule for a term whose local definitions are indented at a
   * given depth. Rules are created on first use, and their matches are
   * memoized.
   */
  private Rule<Term> term(int depth) {
    Rule<Term> rule = termRules.get(depth);
    if (rule == null) {
      rule = Rule.lazy(() -> termAt(depth)).memoize();
      termRules.put(depth, rule);
    }
    return rule;
  }

  private Rule<Term> termAt(int depth) {
    final Rule<Term> alternatives =
        fn(depth)
            .orElse(let(depth))
            .orElse(tuple(depth))
            .orElse(
                Rule.choice(
                    let(depth),
                    apply(depth),
                    str(),
                    chr(),
                    list(depth),
                    adt(depth)))
            .orElse(word())
            .orElse(nat())
            .orElse(id());
    final Rule<List<Term.Def<Term>>> localDefs =
        Rule.string("\n" + Strings.repeat(" ", (depth + 1) * Parsers.INDENT))
            .thenRight(def(depth + 1))
            .many();
    return alternatives.then(
        t -> localDefs.map(defs -> defs.isEmpty() ? t : term.let(defs, t)));
  }

  /** Matches a separator with any amount of whitespace either side. */
  private Rule<String> spaced(Rule<?> separator) {
    return spaces.thenRight(separator).thenRight(spaces);
  }

  /** Matches {@code (x y -> body)}. */
  private Rule<Term> fn(int depth) {
    final Rule<List<String>> params = word.sepBy(Rule.chr(' '));
    return params
        .then(
            ps ->
                spaced(Rule.string("->"))
                    .thenRight(term(depth))
                    .<Term>map(body -> term.fn(ps, body)))
        .between(Rule.chr('('), Rule.chr(')'));
  }

  /** Matches <code>{f x = v; g = w; body}</code>. */
  private Rule<Term> let(int depth) {
    final Rule<List<Term.Def<Term>>> defs =
        def(depth).sepBy(Rule.chr(';').thenRight(spaces));
    return defs.then(
            ds ->
                spaced(Rule.chr(';'))
                    .thenRight(term(depth))
                    .<Term>map(body -> term.let(ds, body)))
        .between(
            Rule.chr('{').thenRight(spaces), spaces.thenRight(Rule.chr('}')));
  }

  /** Matches {@code f x = value}. */
  private Rule<Term.Def<Term>> def(int depth) {
    final Rule<List<String>> names =
        word.sepBy1(Rule.chr(' ').thenRight(spaces));
    return names.then(
        ns ->
            spaced(Rule.chr('='))
                .thenRight(term(depth))
                .map(value -> term.def(ns.get(0), skip(ns), value)));
  }

  private Rule<Term> tuple(int depth) {
    return term(depth)
        .sepBy(spaced(Rule.chr(',')))
        .between(
            Rule.chr('(').thenRight(spaces), spaces.thenRight(Rule.chr(')')))
        .map(term::tuple);
  }

  private Rule<Term> list(int depth) {
    return term(depth)
        .sepBy(spaced(Rule.chr(',')))
        .between(
            Rule.chr('[').thenRight(spaces), spaces.thenRight(Rule.chr(']')))
        .map(term::list);
  }

  /** Matches {@code (f x y)}; the terms are separated by one space. */
  private Rule<Term> apply(int depth) {
    return term(depth)
        .sepBy1(Rule.chr(' '))
        .between(
            Rule.chr('(').thenRight(spaces), spaces.thenRight(Rule.chr(')')))
        .map(term::apply);
  }

  /** Matches {@code "abc"}; there are no escape sequences. */
  private Rule<Term> str() {
    return Rule.chr('"')
        .thenRight(Rule.any().manyTill(Rule.chr('"')))
        .map(codePoints -> term.str(Parsers.toString(codePoints)));
  }

  /** Matches {@code 'c'}, where c is any character. */
  private Rule<Term> chr() {
    return Rule.any()
        .between(Rule.chr('\''), Rule.chr('\''))
        .map(term::chr);
  }

  /** Matches {@code #(Cons (head x) (tail y) | Nil)}. */
  private Rule<Term> adt(int depth) {
    final Rule<Term.Field<Term>> field =
        word.then(
                name ->
                    spaces
                        .thenRight(term(depth))
                        .map(value -> term.field(name, value)))
            .between(Rule.chr('('), Rule.chr(')'));
    final Rule<Term.Ctor<Term>> ctor =
        word.then(
            name ->
                spaces
                    .thenRight(field.sepBy(Rule.chr(' ').thenRight(spaces)))
                    .map(fields -> Term.Ctor.of(name, fields)));
    return ctor.sepBy(spaced(Rule.chr('|')))
        .between(Rule.string("#("), Rule.chr(')'))
        .map(term::adt);
  }

  /** Matches {@code #123}, a word between 0 and 2<sup>32</sup> - 1. */
  private Rule<Term> word() {
    return Rule.chr('#')
        .thenRight(digits)
        .filter(
            s -> {
              final Long value = Longs.tryParse(s);
              return value != null && value <= Term.MAX_WORD;
            })
        .map(s -> term.word(Long.parseLong(s)));
  }

  /** Matches {@code 123}, a natural number that fits in an {@code int}. */
  private Rule<Term> nat() {
    return digits
        .filter(s -> Ints.tryParse(s) != null)
        .map(s -> term.nat(Integer.parseInt(s)));
  }

  /** Matches an identifier: a word, or one or more '#' characters. */
  private Rule<Term> id() {
    return Rule.choice(word, Rule.chars1(c -> c == '#')).map(term::id);
  }
}

// End CaramelParser.java
