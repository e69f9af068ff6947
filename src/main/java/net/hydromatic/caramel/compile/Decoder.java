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
import static net.hydromatic.caramel.util.Static.allMatch;
import static net.hydromatic.caramel.util.Static.anyMatch;
import static net.hydromatic.caramel.util.Static.skip;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.caramel.ast.Shuttle;
import net.hydromatic.caramel.ast.Term;
import net.hydromatic.caramel.lambda.Lambda;
import net.hydromatic.caramel.lambda.LambdaFolder;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts a pure lambda term to a Caramel term, recovering as much sugar as
 * it can.
 *
 * <p>The conversion is bottom-up. At each abstraction it merges nested
 * abstractions into one with several parameters, then tries each of the
 * following recognizers in turn, each seeing the result of the previous:
 *
 * <ol>
 *   <li>natural, {@code (f x -> (f (f x)))} to {@code 2};
 *   <li>tuple, {@code (k -> (k 1 2))} to {@code (1,2)};
 *   <li>list, {@code (c n -> (c 1 (c 2 n)))} to {@code [1,2]};
 *   <li>character and word, a tuple of 8 or 32 bits to {@code 'a'} or
 *       {@code #97};
 *   <li>string, a list of characters to {@code "ab"}.
 * </ol>
 *
 * <p>At each application it merges nested applications, so that
 * {@code ((f x) y)} becomes {@code (f x y)}.
 *
 * <p>A recognizer only rewrites a term that exactly matches its pattern. Bit
 * 1 ({@code λt.λf.f}) has the same shape as the natural 0, so by the time the
 * character recognizer runs it has become {@code 0}; bit 0 ({@code λt.λf.t})
 * remains an abstraction.
 *
 * <p>Values of algebraic data types are never recovered; their encoding
 * decodes to lists, tuples and strings.
 */
public class Decoder {
  private static final Decoder SUGAR = new Decoder(true);
  private static final Decoder RAW = new Decoder(false);

  private final boolean resugar;

  private Decoder(boolean resugar) {
    this.resugar = resugar;
  }

  /** Converts a pure term to a Caramel term, recovering sugar. */
  public static Term decode(Lambda lambda) {
    return SUGAR.toTerm(lambda);
  }

  /**
   * Converts a pure term to a Caramel term that contains only abstractions,
   * applications and variables.
   */
  public static Term decodeRaw(Lambda lambda) {
    return RAW.toTerm(lambda);
  }

  /**
   * Applies the recognizers to a term that is already a Caramel term; for
   * example, {@code (f x -> (f x))} becomes {@code 1}.
   *
   * @throws UnsupportedOperationException if the term contains an algebraic
   *     data type value
   */
  public static Term resugar(Term t) {
    return t.fold(new Resugarer());
  }

  private Term toTerm(Lambda lambda) {
    return lambda.fold(
        new LambdaFolder<Term>() {
          @Override
          public Term abs(int depth, Term body) {
            final Term fn = mergeFn(term.fn(name(depth), body));
            return resugar ? recognize(fn) : fn;
          }

          @Override
          public Term app(Term fn, Term arg) {
            return mergeApply(term.apply(fn, arg));
          }

          @Override
          public Term var(int depth, int index) {
            return term.id(name(depth - index - 1));
          }
        });
  }

  /**
   * Returns the name of the variable bound at a given depth: "a" through "z",
   * then "aa", "ab", and so on.
   *
   * <p>A negative depth means a variable that is not bound by any
   * abstraction in the term; depth -1 is "$1", -2 is "$2", and so on.
   */
  static String name(int depth) {
    if (depth < 0) {
      return "$" + -depth;
    }
    final StringBuilder b = new StringBuilder();
    for (int n = depth; ; n = n / 26 - 1) {
      b.append((char) ('a' + n % 26));
      if (n < 26) {
        break;
      }
    }
    return b.reverse().toString();
  }

  /** Applies the recognizers, in order, to an abstraction. */
  static Term recognize(Term t) {
    t = natural(t);
    t = tuple(t);
    t = list(t);
    t = bits(t);
    return string(t);
  }

  /** Converts {@code (a -> (b -> c))} to {@code (a b -> c)}. */
  static Term mergeFn(Term t) {
    if (t instanceof Term.Fn && ((Term.Fn) t).body instanceof Term.Fn) {
      final Term.Fn fn = (Term.Fn) t;
      final Term.Fn inner = (Term.Fn) fn.body;
      return term.fn(
          ImmutableList.<String>builder()
              .addAll(fn.params)
              .addAll(inner.params)
              .build(),
          inner.body);
    }
    return t;
  }

  /** Converts {@code ((f x) y)} to {@code (f x y)}. */
  static Term mergeApply(Term t) {
    if (t instanceof Term.Apply
        && ((Term.Apply) t).terms.get(0) instanceof Term.Apply) {
      final Term.Apply apply = (Term.Apply) t;
      final Term.Apply inner = (Term.Apply) apply.terms.get(0);
      return term.apply(
          ImmutableList.<Term>builder()
              .addAll(inner.terms)
              .addAll(skip(apply.terms))
              .build());
    }
    return t;
  }

  /** Converts {@code (f x -> (f (f (f x))))} to {@code 3}. */
  static Term natural(Term t) {
    final Term.@Nullable Fn fn = fnWithArity(t, 2);
    if (fn == null) {
      return t;
    }
    final String f = fn.params.get(0);
    final String x = fn.params.get(1);
    int n = 0;
    Term body = fn.body;
    while (body instanceof Term.Apply) {
      final Term.Apply apply = (Term.Apply) body;
      if (apply.terms.size() != 2 || !isId(apply.terms.get(0), f)) {
        return t;
      }
      ++n;
      body = apply.terms.get(1);
    }
    return isId(body, x) ? term.nat(n) : t;
  }

  /** Converts {@code (k -> (k 1 2 3))} to {@code (1,2,3)}. */
  static Term tuple(Term t) {
    final Term.@Nullable Fn fn = fnWithArity(t, 1);
    if (fn == null || !(fn.body instanceof Term.Apply)) {
      return t;
    }
    final String k = fn.params.get(0);
    final Term.Apply apply = (Term.Apply) fn.body;
    final List<Term> args = skip(apply.terms);
    if (!isId(apply.terms.get(0), k)
        || anyMatch(args, arg -> FreeFinder.isFree(k, arg))) {
      return t;
    }
    return term.tuple(args);
  }

  /** Converts {@code (c n -> (c 1 (c 2 (c 3 n))))} to {@code [1,2,3]}. */
  static Term list(Term t) {
    final Term.@Nullable Fn fn = fnWithArity(t, 2);
    if (fn == null) {
      return t;
    }
    final String cons = fn.params.get(0);
    final String nil = fn.params.get(1);
    final List<Term> heads = new ArrayList<>();
    Term cells = fn.body;
    while (cells instanceof Term.Apply) {
      final Term.Apply apply = (Term.Apply) cells;
      if (apply.terms.size() != 3 || !isId(apply.terms.get(0), cons)) {
        return t;
      }
      final Term head = apply.terms.get(1);
      if (FreeFinder.isFree(cons, head) || FreeFinder.isFree(nil, head)) {
        return t;
      }
      heads.add(head);
      cells = apply.terms.get(2);
    }
    return isId(cells, nil) ? term.list(heads) : t;
  }

  /**
   * Converts a tuple of 8 bits to a character, and a tuple of 32 bits to a
   * word. The most significant bit comes first.
   */
  static Term bits(Term t) {
    if (!(t instanceof Term.Tuple)) {
      return t;
    }
    final List<Term> elements = ((Term.Tuple) t).elements;
    if (elements.size() != Encoder.CHAR_BITS
        && elements.size() != Encoder.WORD_BITS) {
      return t;
    }
    long value = 0;
    for (Term element : elements) {
      final int bit = bit(element);
      if (bit < 0) {
        return t;
      }
      value = value * 2 + bit;
    }
    return elements.size() == Encoder.CHAR_BITS
        ? term.chr((int) value)
        : term.word(value);
  }

  /** Returns the value of a bit, or -1 if the term is not a bit. */
  private static int bit(Term t) {
    if (t instanceof Term.Nat && ((Term.Nat) t).n == 0) {
      return 1;
    }
    final Term.@Nullable Fn fn = fnWithArity(t, 2);
    if (fn != null && isId(fn.body, fn.params.get(0))) {
      return 0;
    }
    return -1;
  }

  /**
   * Converts a list of characters to a string. The empty list becomes the
   * empty string.
   */
  static Term string(Term t) {
    if (!(t instanceof Term.ListExp)) {
      return t;
    }
    final List<Term> elements = ((Term.ListExp) t).elements;
    if (!allMatch(elements, e -> e instanceof Term.Chr)) {
      return t;
    }
    final StringBuilder b = new StringBuilder();
    elements.forEach(e -> b.appendCodePoint(((Term.Chr) e).codePoint));
    return term.str(b.toString());
  }

  private static Term.@Nullable Fn fnWithArity(Term t, int arity) {
    if (t instanceof Term.Fn && ((Term.Fn) t).params.size() == arity) {
      return (Term.Fn) t;
    }
    return null;
  }

  private static boolean isId(Term t, String name) {
    return t instanceof Term.Id && ((Term.Id) t).name.equals(name);
  }

  /** Shuttle that applies the recognizers to a Caramel term. */
  private static class Resugarer extends Shuttle {
    @Override
    public Term fn(List<String> params, Term body) {
      return recognize(mergeFn(term.fn(params, body)));
    }

    @Override
    public Term apply(List<Term> terms) {
      return mergeApply(term.apply(terms));
    }

    @Override
    public Term list(List<Term> elements) {
      return string(term.list(elements));
    }

    @Override
    public Term tuple(List<Term> elements) {
      return bits(term.tuple(elements));
    }

    @Override
    public Term adt(List<Term.Ctor<Term>> ctors) {
      throw new UnsupportedOperationException(
          "decoding an algebraic data type");
    }
  }
}

// End Decoder.java
