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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.caramel.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import net.hydromatic.caramel.compile.Pretty;

/**
 * Term of the Caramel language, with its syntactic sugar intact.
 *
 * <p>Sub-classes are immutable, and compare by value. Create them using
 * {@link TermBuilder#term}.
 */
public abstract class Term {
  /** Largest value of a {@link Word}, 2<sup>32</sup> - 1. */
  public static final long MAX_WORD = 0xFFFF_FFFFL;

  public final Op op;

  Term(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Folds this term bottom-up, calling the method of {@code folder} that
   * corresponds to each node.
   */
  public abstract <R> R fold(TermFolder<R> folder);

  /**
   * Converts this term into a string, for debugging.
   *
   * <p>The result is the same as {@link Pretty#pretty(Term)}, except that
   * terms that contain an {@link Adt} are printed too.
   */
  @Override
  public final String toString() {
    return Pretty.describe(this);
  }

  /** Folds each of a list of terms. */
  static <R> ImmutableList<R> foldAll(
      List<Term> terms, TermFolder<R> folder) {
    return transformEager(terms, t -> t.fold(folder));
  }

  /**
   * Lambda abstraction.
   *
   * <p>For example, "(f x -> (f x))".
   */
  public static class Fn extends Term {
    public final ImmutableList<String> params;
    public final Term body;

    Fn(List<String> params, Term body) {
      super(Op.ABSTRACTION);
      this.params = ImmutableList.copyOf(params);
      this.body = requireNonNull(body);
    }

    @Override
    public <R> R fold(TermFolder<R> folder) {
      return folder.fn(params, body.fold(folder));
    }

    @Override
    public int hashCode() {
      return Objects.hash(params, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Fn
              && params.equals(((Fn) o).params)
              && body.equals(((Fn) o).body);
    }
  }

  /**
   * Application of a function to zero or more arguments.
   *
   * <p>For example, "(f x y)"; it associates to the left, so it is the same
   * as "((f x) y)".
   */
  public static class Apply extends Term {
    public final ImmutableList<Term> terms;

    Apply(List<Term> terms) {
      super(Op.APPLICATION);
      this.terms = ImmutableList.copyOf(terms);
      checkArgument(!this.terms.isEmpty(), "empty application");
    }

    @Override
    public <R> R fold(TermFolder<R> folder) {
      return folder.apply(foldAll(terms, folder));
    }

    @Override
    public int hashCode() {
      return terms.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Apply && terms.equals(((Apply) o).terms);
    }
  }

  /** Reference to a variable, for example "x". */
  public static class Id extends Term {
    public final String name;

    Id(String name) {
      super(Op.VARIABLE);
      this.name = requireNonNull(name);
    }

    @Override
    public <R> R fold(TermFolder<R> folder) {
      return folder.id(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Id && name.equals(((Id) o).name);
    }
  }

  /** Natural number literal, for example "3". */
  public static class Nat extends Term {
    public final int n;

    Nat(int n) {
      super(Op.NATURAL);
      checkArgument(n >= 0, "negative natural %s", n);
      this.n = n;
    }

    @Override
    public <R> R fold(TermFolder<R> folder) {
      return folder.nat(n);
    }

    @Override
    public int hashCode() {
      return n;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Nat && n == ((Nat) o).n;
    }
  }

  /** List, for example "[1,2,3]". */
  public static class ListExp extends Term {
    public final ImmutableList<Term> elements;

    ListExp(List<Term> elements) {
      super(Op.LIST);
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    public <R> R fold(TermFolder<R> folder) {
      return folder.list(foldAll(elements, folder));
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, elements);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ListExp && elements.equals(((ListExp) o).elements);
    }
  }

  /** Tuple, for example "(1,x,[])". */
  public static class Tuple extends Term {
    public final ImmutableList<Term> elements;

    Tuple(List<Term> elements) {
      super(Op.TUPLE);
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    public <R> R fold(TermFolder<R> folder) {
      return folder.tuple(foldAll(elements, folder));
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, elements);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Tuple && elements.equals(((Tuple) o).elements);
    }
  }

  /** Character literal, for example "'a'". */
  public static class Chr extends Term {
    public final int codePoint;

    Chr(int codePoint) {
      super(Op.CHAR);
      checkArgument(
          Character.isValidCodePoint(codePoint),
          "invalid code point %s",
          codePoint);
      this.codePoint = codePoint;
    }

    @Override
    public <R> R fold(TermFolder<R> folder) {
      return folder.chr(codePoint);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, codePoint);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Chr && codePoint == ((Chr) o).codePoint;
    }
  }

  /** String literal, for example "\"abc\"". */
  public static class Str extends Term {
    public final String value;

    Str(String value) {
      super(Op.STRING);
      this.value = requireNonNull(value);
    }

    @Override
    public <R> R fold(TermFolder<R> folder) {
      return folder.str(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Str && value.equals(((Str) o).value);
    }
  }

  /** Unsigned 32-bit word literal, for example "#123". */
  public static class Word extends Term {
    public final long value;

    Word(long value) {
      super(Op.WORD);
      checkArgument(
          value >= 0 && value <= MAX_WORD, "word out of range: %s", value);
      this.value = value;
    }

    @Override
    public <R> R fold(TermFolder<R> folder) {
      return folder.word(value);
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Word && value == ((Word) o).value;
    }
  }

  /**
   * Algebraic data type value: a list of constructors, each with named fields.
   *
   * <p>For example, "#(Nil | Cons (head 1) (tail #))".
   */
  public static class Adt extends Term {
    /**
     * Name by which the expression of a field refers to the value that is
     * being constructed.
     */
    public static final String SELF = "#";

    public final ImmutableList<Ctor<Term>> ctors;

    Adt(List<Ctor<Term>> ctors) {
      super(Op.ADT);
      this.ctors = ImmutableList.copyOf(ctors);
    }

    @Override
    public <R> R fold(TermFolder<R> folder) {
      return folder.adt(transformEager(ctors, c -> c.map(t -> t.fold(folder))));
    }

    @Override
    public int hashCode() {
      return ctors.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Adt && ctors.equals(((Adt) o).ctors);
    }
  }

  /**
   * Block of mutually-visible definitions and a body.
   *
   * <p>For example, "{id x = x; two = 2; (id two)}".
   */
  public static class Let extends Term {
    public final ImmutableList<Def<Term>> defs;
    public final Term body;

    Let(List<Def<Term>> defs, Term body) {
      super(Op.LET);
      this.defs = ImmutableList.copyOf(defs);
      this.body = requireNonNull(body);
    }

    @Override
    public <R> R fold(TermFolder<R> folder) {
      return folder.let(
          transformEager(defs, d -> d.map(t -> t.fold(folder))),
          body.fold(folder));
    }

    @Override
    public int hashCode() {
      return Objects.hash(defs, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Let
              && defs.equals(((Let) o).defs)
              && body.equals(((Let) o).body);
    }
  }

  /**
   * Definition within a {@link Let}: a name, parameters, and a value.
   *
   * <p>For example, "add a b = (a f (b f x))" has name "add" and parameters
   * "a" and "b".
   *
   * @param <T> Type of value; {@link Term} in a tree, or the result type of a
   *     fold
   */
  public static final class Def<T> {
    public final String name;
    public final ImmutableList<String> params;
    public final T value;

    Def(String name, List<String> params, T value) {
      this.name = requireNonNull(name);
      this.params = ImmutableList.copyOf(params);
      this.value = requireNonNull(value);
    }

    public static <T> Def<T> of(String name, List<String> params, T value) {
      return new Def<>(name, params, value);
    }

    /** Returns a definition with the same name and parameters. */
    public <U> Def<U> map(Function<T, U> fn) {
      return new Def<>(name, params, fn.apply(value));
    }

    /** Returns a copy of this definition with different parameters. */
    public Def<T> withParams(List<String> params) {
      return new Def<>(name, params, value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, params, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Def
              && name.equals(((Def<?>) o).name)
              && params.equals(((Def<?>) o).params)
              && value.equals(((Def<?>) o).value);
    }

    @Override
    public String toString() {
      return name + params + " = " + value;
    }
  }

  /**
   * Constructor within an {@link Adt}.
   *
   * @param <T> Type of field values
   */
  public static final class Ctor<T> {
    public final String name;
    public final ImmutableList<Field<T>> fields;

    Ctor(String name, List<Field<T>> fields) {
      this.name = requireNonNull(name);
      this.fields = ImmutableList.copyOf(fields);
    }

    public static <T> Ctor<T> of(String name, List<Field<T>> fields) {
      return new Ctor<>(name, fields);
    }

    public <U> Ctor<U> map(Function<T, U> fn) {
      return new Ctor<>(name, transformEager(fields, f -> f.map(fn)));
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, fields);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Ctor
              && name.equals(((Ctor<?>) o).name)
              && fields.equals(((Ctor<?>) o).fields);
    }

    @Override
    public String toString() {
      return name + fields;
    }
  }

  /**
   * Named field of a {@link Ctor}.
   *
   * @param <T> Type of value
   */
  public static final class Field<T> {
    public final String name;
    public final T value;

    Field(String name, T value) {
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    public static <T> Field<T> of(String name, T value) {
      return new Field<>(name, value);
    }

    public <U> Field<U> map(Function<T, U> fn) {
      return new Field<>(name, fn.apply(value));
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Field
              && name.equals(((Field<?>) o).name)
              && value.equals(((Field<?>) o).value);
    }

    @Override
    public String toString() {
      return "(" + name + " " + value + ")";
    }
  }
}

// End Term.java
