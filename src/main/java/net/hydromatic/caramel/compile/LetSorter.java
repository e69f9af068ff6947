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
import static net.hydromatic.caramel.util.Static.plus;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.caramel.ast.Shuttle;
import net.hydromatic.caramel.ast.Term;

/**
 * Sorts the definitions in each {@link Term.Let} so that every definition
 * comes after the definitions it depends on, and gives each self-recursive
 * definition an extra parameter through which it can call itself.
 *
 * <p>For example,
 *
 * <pre>{@code
 * {sum n = (is_zero? n 0 (add n (sum (pred n 1)))); (Y sum 3)}
 * }</pre>
 *
 * <p>becomes
 *
 * <pre>{@code
 * {sum sum n = (is_zero? n 0 (add n (sum (pred n 1)))); (Y sum 3)}
 * }</pre>
 *
 * <p>so that {@code sum} can be passed to a fixed-point combinator such as
 * {@code Y}. The encoder binds each definition only in the definitions that
 * follow it, so without the extra parameter {@code sum} would be unbound.
 *
 * <p>Mutual recursion between two or more definitions gets no extra
 * parameter. Such definitions are emitted in their original order, after
 * every definition that can be placed, and the encoder will report the
 * forward reference as unbound.
 *
 * <p>The sort makes repeated passes over the definitions of a block, so it
 * is quadratic in the number of definitions in one block.
 */
public class LetSorter extends Shuttle {
  private static final LetSorter INSTANCE = new LetSorter();

  private LetSorter() {}

  /** Sorts every let block in a term. */
  public static Term sort(Term t) {
    return t.fold(INSTANCE);
  }

  @Override
  public Term let(List<Term.Def<Term>> defs, Term body) {
    final Set<String> names = new HashSet<>();
    defs.forEach(def -> names.add(def.name));
    final List<Node> nodes = new ArrayList<>();
    for (Term.Def<Term> def : defs) {
      final Set<String> freeVars =
          FreeFinder.freeVars(term.fn(def.params, def.value));
      final ImmutableSet.Builder<String> dependencies = ImmutableSet.builder();
      for (String freeVar : freeVars) {
        if (names.contains(freeVar) && !freeVar.equals(def.name)) {
          dependencies.add(freeVar);
        }
      }
      final Term.Def<Term> def2 =
          freeVars.contains(def.name)
              ? def.withParams(plus(def.name, def.params))
              : def;
      nodes.add(new Node(def2, dependencies.build()));
    }
    return term.let(sortTopologically(nodes), body);
  }

  /**
   * Orders nodes so that each comes after the nodes it depends on. Among
   * nodes that can be placed at the same time, keeps the original order.
   */
  private static List<Term.Def<Term>> sortTopologically(List<Node> nodes) {
    final ImmutableList.Builder<Term.Def<Term>> sorted =
        ImmutableList.builder();
    final Set<String> defined = new HashSet<>();
    List<Node> pending = nodes;
    while (!pending.isEmpty()) {
      final List<Node> rest = new ArrayList<>();
      for (Node node : pending) {
        if (defined.containsAll(node.dependencies)) {
          sorted.add(node.def);
          defined.add(node.def.name);
        } else {
          rest.add(node);
        }
      }
      if (rest.size() == pending.size()) {
        // A cycle; no node can be placed. Emit the rest as they are.
        rest.forEach(node -> sorted.add(node.def));
        break;
      }
      pending = rest;
    }
    return sorted.build();
  }

  /** Definition and the names of the sibling definitions it depends on. */
  private static class Node {
    final Term.Def<Term> def;
    final Set<String> dependencies;

    Node(Term.Def<Term> def, Set<String> dependencies) {
      this.def = def;
      this.dependencies = dependencies;
    }
  }
}

// End LetSorter.java
