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

import net.hydromatic.caramel.ast.Term;
import net.hydromatic.caramel.lambda.Lambda;

/** Called on various events during parsing, encoding and decoding. */
public interface Tracer {
  /** Called when source text has been parsed. */
  void onParse(Term term);

  /** Called when the definitions of let blocks have been sorted. */
  void onSort(Term term);

  /** Called when a term has been encoded as a pure term. */
  void onEncode(Lambda lambda);

  /** Called with the normal form of the encoded term. */
  void onNormalize(Lambda lambda);

  /** Called when the normal form has been decoded. */
  void onDecode(Term term);

  /**
   * Called with an exception thrown while running a program. Returns whether
   * a handler was found; if not, the caller rethrows the exception.
   */
  boolean onException(RuntimeException e);
}

// End Tracer.java
