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
package net.hydromatic.caramel.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Builds terms. */
public enum TermBuilder {
  /**
   * The singleton instance of the term builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  term;

  /** Creates a lambda with one or more parameters. */
  public Term.Fn fn(List<String> params, Term body) {
    return new Term.Fn(params, body);
  }

  /** Creates a lambda with one parameter. */
  public Term.Fn fn(String param, Term body) {
    return new Term.Fn(ImmutableList.of(param), body);
  }

  public Term.Apply apply(List<Term> terms) {
    return new Term.Apply(terms);
  }

  public Term.Apply apply(Term... terms) {
    return new Term.Apply(ImmutableList.copyOf(terms));
  }

  public Term.Id id(String name) {
    return new Term.Id(name);
  }

  public Term.Nat nat(int n) {
    return new Term.Nat(n);
  }

  public Term.ListExp list(List<Term> elements) {
    return new Term.ListExp(elements);
  }

  public Term.ListExp list(Term... elements) {
    return new Term.ListExp(ImmutableList.copyOf(elements));
  }

  public Term.Tuple tuple(List<Term> elements) {
    return new Term.Tuple(elements);
  }

  public Term.Tuple tuple(Term... elements) {
    return new Term.Tuple(ImmutableList.copyOf(elements));
  }

  public Term.Chr chr(int codePoint) {
    return new Term.Chr(codePoint);
  }

  public Term.Str str(String value) {
    return new Term.Str(value);
  }

  public Term.Word word(long value) {
    return new Term.Word(value);
  }

  public Term.Adt adt(List<Term.Ctor<Term>> ctors) {
    return new Term.Adt(ctors);
  }

  /** Creates a constructor of an algebraic data type. */
  @SafeVarargs
  public final Term.Ctor<Term> ctor(String name, Term.Field<Term>... fields) {
    return Term.Ctor.of(name, ImmutableList.copyOf(fields));
  }

  public Term.Field<Term> field(String name, Term value) {
    return Term.Field.of(name, value);
  }

  public Term.Let let(List<Term.Def<Term>> defs, Term body) {
    return new Term.Let(defs, body);
  }

  /** Creates a definition, for use in {@link #let}. */
  public Term.Def<Term> def(String name, List<String> params, Term value) {
    return Term.Def.of(name, params, value);
  }

  /** Creates a definition with no parameters, for use in {@link #let}. */
  public Term.Def<Term> def(String name, Term value) {
    return Term.Def.of(name, ImmutableList.of(), value);
  }

  /**
   * Converts a string into a list term whose elements are {@link Term.Chr}.
   * This is how a {@link Term.Str} is desugared.
   */
  public Term.ListExp charList(String value) {
    final ImmutableList.Builder<Term> b = ImmutableList.builder();
    value.codePoints().forEach(c -> b.add(chr(c)));
    return list(b.build());
  }
}

// End TermBuilder.java
