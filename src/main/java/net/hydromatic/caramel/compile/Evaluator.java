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

import static java.util.Objects.requireNonNull;

import net.hydromatic.caramel.ast.Term;
import net.hydromatic.caramel.lambda.Lambda;
import net.hydromatic.caramel.lambda.Normalizer;

/**
 * Evaluates a term by encoding it, normalizing the pure term, and decoding
 * the normal form.
 *
 * <p>An evaluator holds no mutable state, so one instance may be used by
 * several threads at once, provided that its normalizer may too.
 */
public class Evaluator {
  private final Normalizer normalizer;
  private final boolean resugar;
  private final Tracer tracer;

  /**
   * Creates an Evaluator.
   *
   * @param normalizer Reduces pure terms to normal form
   * @param resugar Whether to recover sugar when decoding
   * @param tracer Receives the intermediate terms
   */
  public Evaluator(Normalizer normalizer, boolean resugar, Tracer tracer) {
    this.normalizer = requireNonNull(normalizer);
    this.resugar = resugar;
    this.tracer = requireNonNull(tracer);
  }

  /** Creates an Evaluator that recovers sugar and traces nothing. */
  public static Evaluator of(Normalizer normalizer) {
    return new Evaluator(normalizer, true, Tracers.empty());
  }

  /**
   * Evaluates a term.
   *
   * <p>Exceptions from the encoder (such as {@link UnboundVariableException})
   * and from the normalizer are not caught. Decoding always succeeds.
   */
  public Term evaluate(Term term) {
    final Lambda encoded = Encoder.encode(term);
    tracer.onEncode(encoded);
    final Lambda normal = normalizer.normalize(encoded);
    tracer.onNormalize(normal);
    final Term decoded =
        resugar ? Decoder.decode(normal) : Decoder.decodeRaw(normal);
    tracer.onDecode(decoded);
    return decoded;
  }
}

// End Evaluator.java
