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

import java.util.List;
import net.hydromatic.caramel.ast.Term;
import net.hydromatic.caramel.ast.TermFolder;

/**
 * Prints terms in Caramel syntax; the inverse of parsing.
 *
 * <p>The fold creates, for each node, an {@link Unparser} that appends that
 * node to a buffer. Only the root's unparser is called, and it calls the
 * unparsers of its sub-terms in order, so every character is appended to the
 * same {@link StringBuilder} exactly once and printing takes time linear in
 * the size of the term, however deep it is.
 */
public class Pretty implements TermFolder<Pretty.Unparser> {
  private static final Pretty STRICT = new Pretty(false);
  private static final Pretty DESCRIBE = new Pretty(true);

  private final boolean printAdt;

  private Pretty(boolean printAdt) {
    this.printAdt = printAdt;
  }

  /**
   * Prints a term.
   *
   * @throws UnsupportedOperationException if the term contains an algebraic
   *     data type value
   */
  public static String pretty(Term term) {
    return print(term, STRICT);
  }

  /**
   * Prints a term for debugging. Same as {@link #pretty(Term)}, except that
   * values of algebraic data types are printed too, in the syntax of the
   * parser.
   */
  public static String describe(Term term) {
    return print(term, DESCRIBE);
  }

  private static String print(Term term, Pretty pretty) {
    final StringBuilder b = new StringBuilder();
    term.fold(pretty).unparse(b);
    return b.toString();
  }

  @Override
  public Unparser fn(List<String> params, Unparser body) {
    return b -> {
      b.append('(');
      join(b, " ", params);
      b.append(" -> ");
      body.unparse(b);
      b.append(')');
    };
  }

  @Override
  public Unparser apply(List<Unparser> terms) {
    return b -> {
      b.append('(');
      unparseAll(b, " ", terms);
      b.append(')');
    };
  }

  @Override
  public Unparser id(String name) {
    return b -> b.append(name);
  }

  @Override
  public Unparser nat(int n) {
    return b -> b.append(n);
  }

  @Override
  public Unparser list(List<Unparser> elements) {
    return b -> {
      b.append('[');
      unparseAll(b, ",", elements);
      b.append(']');
    };
  }

  @Override
  public Unparser tuple(List<Unparser> elements) {
    return b -> {
      b.append('(');
      unparseAll(b, ",", elements);
      b.append(')');
    };
  }

  @Override
  public Unparser chr(int codePoint) {
    return b -> b.append('\'').appendCodePoint(codePoint).append('\'');
  }

  @Override
  public Unparser str(String value) {
    return b -> b.append('"').append(value).append('"');
  }

  @Override
  public Unparser word(long value) {
    return b -> b.append('#').append(value);
  }

  @Override
  public Unparser adt(List<Term.Ctor<Unparser>> ctors) {
    if (!printAdt) {
      throw new UnsupportedOperationException(
          "pretty-printing an algebraic data type");
    }
    return b -> {
      b.append("#(");
      for (int i = 0; i < ctors.size(); i++) {
        final Term.Ctor<Unparser> ctor = ctors.get(i);
        if (i > 0) {
          b.append(" | ");
        }
        b.append(ctor.name);
        for (Term.Field<Unparser> field : ctor.fields) {
          b.append(" (").append(field.name).append(' ');
          field.value.unparse(b);
          b.append(')');
        }
      }
      b.append(')');
    };
  }

  @Override
  public Unparser let(List<Term.Def<Unparser>> defs, Unparser body) {
    return b -> {
      b.append('{');
      for (int i = 0; i < defs.size(); i++) {
        final Term.Def<Unparser> def = defs.get(i);
        if (i > 0) {
          b.append("; ");
        }
        b.append(def.name);
        for (String param : def.params) {
          b.append(' ').append(param);
        }
        b.append(" = ");
        def.value.unparse(b);
      }
      b.append("; ");
      body.unparse(b);
      b.append('}');
    };
  }

  private static void join(StringBuilder b, String sep, List<String> list) {
    for (int i = 0; i < list.size(); i++) {
      if (i > 0) {
        b.append(sep);
      }
      b.append(list.get(i));
    }
  }

  private static void unparseAll(
      StringBuilder b, String sep, List<Unparser> list) {
    for (int i = 0; i < list.size(); i++) {
      if (i > 0) {
        b.append(sep);
      }
      list.get(i).unparse(b);
    }
  }

  /** Appends a term to a buffer. */
  @FunctionalInterface
  interface Unparser {
    void unparse(StringBuilder b);
  }
}

// End Pretty.java
