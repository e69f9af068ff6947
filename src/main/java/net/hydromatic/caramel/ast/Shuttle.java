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

import static net.hydromatic.caramel.ast.TermBuilder.term;

import java.util.List;

/**
 * Folder that rebuilds a term.
 *
 * <p>Each method creates a node of the same kind as the node being folded,
 * from sub-terms that have already been rebuilt. Sub-classes override the
 * methods for the kinds of node they wish to change.
 */
public class Shuttle implements TermFolder<Term> {
  @Override
  public Term fn(List<String> params, Term body) {
    return term.fn(params, body);
  }

  @Override
  public Term apply(List<Term> terms) {
    return term.apply(terms);
  }

  @Override
  public Term id(String name) {
    return term.id(name);
  }

  @Override
  public Term nat(int n) {
    return term.nat(n);
  }

  @Override
  public Term list(List<Term> elements) {
    return term.list(elements);
  }

  @Override
  public Term tuple(List<Term> elements) {
    return term.tuple(elements);
  }

  @Override
  public Term chr(int codePoint) {
    return term.chr(codePoint);
  }

  @Override
  public Term str(String value) {
    return term.str(value);
  }

  @Override
  public Term word(long value) {
    return term.word(value);
  }

  @Override
  public Term adt(List<Term.Ctor<Term>> ctors) {
    return term.adt(ctors);
  }

  @Override
  public Term let(List<Term.Def<Term>> defs, Term body) {
    return term.let(defs, body);
  }
}

// End Shuttle.java
