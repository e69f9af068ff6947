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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.caramel.ast.Term;
import net.hydromatic.caramel.ast.TermFolder;

/**
 * Finds the free variables of a term.
 *
 * <p>The fold produces, for each node, a {@link Finder} that is later called
 * with the multiset of names bound around that node. Binders add their names
 * to the multiset before calling the finder of their body, and remove them
 * afterwards, so each membership test is a hash lookup.
 */
public class FreeFinder implements TermFolder<FreeFinder.Finder> {
  private static final FreeFinder INSTANCE = new FreeFinder();

  private static final Finder NONE = (bound, consumer) -> {};

  private FreeFinder() {}

  /**
   * Returns the free variables of a term, in the order that they are first
   * encountered.
   *
   * <p>For example, the free variables of "(x -> (x y))" are "y".
   */
  public static Set<String> freeVars(Term term) {
    final ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    term.fold(INSTANCE).find(HashMultiset.create(), builder::add);
    return builder.build();
  }

  /** Returns whether a variable is free in a term. */
  public static boolean isFree(String name, Term term) {
    return freeVars(term).contains(name);
  }

  @Override
  public Finder fn(List<String> params, Finder body) {
    return (bound, consumer) -> {
      bound.addAll(params);
      body.find(bound, consumer);
      params.forEach(bound::remove);
    };
  }

  @Override
  public Finder apply(List<Finder> terms) {
    return all(terms);
  }

  @Override
  public Finder id(String name) {
    return (bound, consumer) -> {
      if (!bound.contains(name)) {
        consumer.accept(name);
      }
    };
  }

  @Override
  public Finder nat(int n) {
    return NONE;
  }

  @Override
  public Finder list(List<Finder> elements) {
    return all(elements);
  }

  @Override
  public Finder tuple(List<Finder> elements) {
    return all(elements);
  }

  @Override
  public Finder chr(int codePoint) {
    return NONE;
  }

  @Override
  public Finder str(String value) {
    return NONE;
  }

  @Override
  public Finder word(long value) {
    return NONE;
  }

  /** Within a field, {@link Term.Adt#SELF} refers to the value itself. */
  @Override
  public Finder adt(List<Term.Ctor<Finder>> ctors) {
    return (bound, consumer) -> {
      bound.add(Term.Adt.SELF);
      for (Term.Ctor<Finder> ctor : ctors) {
        for (Term.Field<Finder> field : ctor.fields) {
          field.value.find(bound, consumer);
        }
      }
      bound.remove(Term.Adt.SELF);
    };
  }

  /**
   * The names defined by a let are visible in its body and in the values of
   * all of its definitions (not just later ones).
   */
  @Override
  public Finder let(List<Term.Def<Finder>> defs, Finder body) {
    return (bound, consumer) -> {
      defs.forEach(def -> bound.add(def.name));
      for (Term.Def<Finder> def : defs) {
        bound.addAll(def.params);
        def.value.find(bound, consumer);
        def.params.forEach(bound::remove);
      }
      body.find(bound, consumer);
      defs.forEach(def -> bound.remove(def.name));
    };
  }

  private static Finder all(List<Finder> finders) {
    return (bound, consumer) -> {
      for (Finder finder : finders) {
        finder.find(bound, consumer);
      }
    };
  }

  /** Reports the free variables of a term, given the names bound above it. */
  @FunctionalInterface
  interface Finder {
    void find(Multiset<String> bound, Consumer<String> consumer);
  }
}

// End FreeFinder.java
