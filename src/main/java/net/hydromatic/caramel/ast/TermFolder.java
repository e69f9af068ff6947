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

import java.util.List;

/**
 * Handler for each kind of {@link Term}, used by {@link Term#fold}.
 *
 * <p>The fold is bottom-up: each method receives the results of folding the
 * sub-terms of the node, never the sub-terms themselves. Adding a kind of term
 * means adding a method here, and the compiler then finds every traversal
 * that needs to handle it.
 *
 * @param <R> Result type
 */
public interface TermFolder<R> {
  R fn(List<String> params, R body);

  R apply(List<R> terms);

  R id(String name);

  R nat(int n);

  R list(List<R> elements);

  R tuple(List<R> elements);

  R chr(int codePoint);

  R str(String value);

  R word(long value);

  R adt(List<Term.Ctor<R>> ctors);

  R let(List<Term.Def<R>> defs, R body);
}

// End TermFolder.java
