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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.caramel.ast.TermBuilder.term;
import static net.hydromatic.caramel.lambda.Lambda.abs;
import static net.hydromatic.caramel.lambda.Lambda.app;
import static net.hydromatic.caramel.lambda.Lambda.var;

import java.util.List;
import net.hydromatic.caramel.ast.Term;
import net.hydromatic.caramel.ast.TermFolder;
import net.hydromatic.caramel.lambda.Lambda;
import net.hydromatic.caramel.lambda.LambdaFolder;

/**
 * Converts a term to the pure lambda calculus, replacing each kind of sugar
 * with its Church encoding.
 *
 * <p>The encodings are:
 *
 * <ul>
 *   <li>natural {@code n}: {@code λf.λx. f (f ... (f x))}, with {@code f}
 *       applied {@code n} times;
 *   <li>list: {@code λc.λn. c e1 (c e2 ... (c eN n))};
 *   <li>tuple: {@code λk. k e1 e2 ... eN};
 *   <li>character, word: a tuple of 8 or 32 bits, most significant first,
 *       where bit 0 is {@code λt.λf.t} and bit 1 is {@code λt.λf.f};
 *   <li>string: the list of its characters;
 *   <li>let: {@code (λname. body) (λp1...λpN. value)} for each definition,
 *       the first definition outermost.
 * </ul>
 *
 * <p>There is no decoding for algebraic data types; see {@link Decoder}.
 */
public class Encoder implements TermFolder<Encoder.Emitter> {
  private static final Encoder INSTANCE = new Encoder();

  /** Largest code point that fits in a character's 8 bits. */
  public static final int MAX_CHAR = 0xFF;

  static final int CHAR_BITS = 8;
  static final int WORD_BITS = 32;

  /** Bit 0, {@code λt.λf.t}; selects the first of two arguments. */
  static final Lambda BIT0 = abs(abs(var(1)));

  /** Bit 1, {@code λt.λf.f}; selects the second of two arguments. */
  static final Lambda BIT1 = abs(abs(var(0)));

  private Encoder() {}

  /**
   * Encodes a closed term.
   *
   * @throws UnboundVariableException if the term references a variable that
   *     is not bound
   */
  public static Lambda encode(Term t) {
    return encode(t, Scope.empty(), 0);
  }

  /** Encodes a term whose free variables are bound in a given scope. */
  public static Lambda encode(Term t, Scope scope, int depth) {
    return t.fold(INSTANCE).emit(scope, depth);
  }

  @Override
  public Emitter fn(List<String> params, Emitter body) {
    return (scope, depth) -> bind(params, 0, body, scope, depth);
  }

  /** Wraps the body in one abstraction per parameter, from {@code i}. */
  private static Lambda bind(
      List<String> params, int i, Emitter body, Scope scope, int depth) {
    if (i == params.size()) {
      return body.emit(scope, depth);
    }
    final Scope scope2 = scope.bind(params.get(i), depth);
    return abs(bind(params, i + 1, body, scope2, depth + 1));
  }

  @Override
  public Emitter apply(List<Emitter> terms) {
    return (scope, depth) -> {
      Lambda fn = terms.get(0).emit(scope, depth);
      for (Emitter arg : terms.subList(1, terms.size())) {
        fn = app(fn, arg.emit(scope, depth));
      }
      return fn;
    };
  }

  @Override
  public Emitter id(String name) {
    return (scope, depth) -> var(scope.index(name, depth));
  }

  @Override
  public Emitter nat(int n) {
    return (scope, depth) -> church(n);
  }

  /** Returns the Church numeral for {@code n}. */
  static Lambda church(int n) {
    Lambda body = var(0);
    for (int i = 0; i < n; i++) {
      body = app(var(1), body);
    }
    return abs(abs(body));
  }

  @Override
  public Emitter list(List<Emitter> elements) {
    return (scope, depth) -> {
      Lambda cells = var(0);
      for (int i = elements.size() - 1; i >= 0; i--) {
        cells = app(app(var(1), elements.get(i).emit(scope, depth + 2)), cells);
      }
      return abs(abs(cells));
    };
  }

  @Override
  public Emitter tuple(List<Emitter> elements) {
    return (scope, depth) -> {
      Lambda body = var(0);
      for (Emitter element : elements) {
        body = app(body, element.emit(scope, depth + 1));
      }
      return abs(body);
    };
  }

  @Override
  public Emitter chr(int codePoint) {
    checkArgument(
        codePoint <= MAX_CHAR,
        "character %s does not fit in %s bits",
        codePoint,
        CHAR_BITS);
    return (scope, depth) -> bits(CHAR_BITS, codePoint);
  }

  @Override
  public Emitter word(long value) {
    return (scope, depth) -> bits(WORD_BITS, value);
  }

  /** Encodes the low {@code width} bits of a value as a tuple. */
  static Lambda bits(int width, long value) {
    Lambda body = var(0);
    for (int i = width - 1; i >= 0; i--) {
      body = app(body, ((value >>> i) & 1) == 1 ? BIT1 : BIT0);
    }
    return abs(body);
  }

  @Override
  public Emitter str(String value) {
    final Lambda lambda = encode(term.charList(value));
    return (scope, depth) -> lambda;
  }

  @Override
  public Emitter let(List<Term.Def<Emitter>> defs, Emitter body) {
    return (scope, depth) -> let(defs, 0, body, scope, depth);
  }

  /**
   * Encodes definitions from {@code i} onwards. Each definition is visible in
   * the definitions after it and in the body, but not in itself.
   */
  private static Lambda let(
      List<Term.Def<Emitter>> defs, int i, Emitter body, Scope scope,
      int depth) {
    if (i == defs.size()) {
      return body.emit(scope, depth);
    }
    final Term.Def<Emitter> def = defs.get(i);
    final Lambda value = bind(def.params, 0, def.value, scope, depth);
    final Scope scope2 = scope.bind(def.name, depth);
    return app(abs(let(defs, i + 1, body, scope2, depth + 1)), value);
  }

  /**
   * Encodes a value of an algebraic data type.
   *
   * <p>The value is {@code λk. k ctors}, where {@code ctors} is a list of
   * pairs (constructor name, fields), and {@code fields} is a list of pairs
   * (field name, field thunk). Names are encoded as strings.
   *
   * <p>Each field thunk is an abstraction whose parameter, {@link
   * Term.Adt#SELF}, stands for the value being constructed. The abstraction
   * is the seventh binder inside {@code λk}, so the field's expression is
   * encoded with {@code SELF} bound at {@code depth + 7}.
   */
  @Override
  public Emitter adt(List<Term.Ctor<Emitter>> ctors) {
    return (scope, depth) -> {
      final Scope fieldScope = scope.bind(Term.Adt.SELF, depth + 7);
      final Lambda[] ctorPairs = new Lambda[ctors.size()];
      for (int i = 0; i < ctors.size(); i++) {
        final Term.Ctor<Emitter> ctor = ctors.get(i);
        final Lambda[] fieldPairs = new Lambda[ctor.fields.size()];
        for (int j = 0; j < ctor.fields.size(); j++) {
          final Term.Field<Emitter> field = ctor.fields.get(j);
          final Lambda value = field.value.emit(fieldScope, depth + 8);
          final Lambda thunk = constSelf(abs(app(value, var(7))));
          fieldPairs[j] = pair(encode(term.str(field.name)), thunk);
        }
        ctorPairs[i] = pair(encode(term.str(ctor.name)), list(fieldPairs));
      }
      return abs(app(var(0), list(ctorPairs)));
    };
  }

  /** Church pair, {@code λk. k a b}. Does not shift {@code a} or {@code b}. */
  private static Lambda pair(Lambda a, Lambda b) {
    return abs(app(app(var(0), a), b));
  }

  /** Church list. Does not shift the elements. */
  private static Lambda list(Lambda... elements) {
    Lambda cells = var(0);
    for (int i = elements.length - 1; i >= 0; i--) {
      cells = app(app(var(1), elements[i]), cells);
    }
    return abs(abs(cells));
  }

  /**
   * Given a thunk {@code λs. body}, replaces each reference to {@code s}
   * within {@code body} by {@code λ_. s}, so that it ignores the argument it
   * is applied to.
   */
  private static Lambda constSelf(Lambda thunk) {
    return thunk.fold(
        new LambdaFolder<Lambda>() {
          @Override
          public Lambda abs(int depth, Lambda body) {
            return Lambda.abs(body);
          }

          @Override
          public Lambda app(Lambda fn, Lambda arg) {
            return Lambda.app(fn, arg);
          }

          @Override
          public Lambda var(int depth, int index) {
            // The thunk's own binder is at depth 0.
            return index == depth - 1
                ? Lambda.abs(Lambda.var(index + 1))
                : Lambda.var(index);
          }
        });
  }

  /** Generates a pure term, given the scope and depth of the node. */
  @FunctionalInterface
  interface Emitter {
    Lambda emit(Scope scope, int depth);
  }
}

// End Encoder.java
