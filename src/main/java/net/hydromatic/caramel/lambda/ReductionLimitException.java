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
package net.hydromatic.caramel.lambda;

import net.hydromatic.caramel.ast.Pos;
import net.hydromatic.caramel.util.CaramelException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when a normalizer has performed its maximum number of reduction
 * steps without reaching a normal form.
 */
public class ReductionLimitException extends RuntimeException
    implements CaramelException {
  public final int steps;

  public ReductionLimitException(int steps) {
    super("no normal form after " + steps + " reduction steps");
    this.steps = steps;
  }

  @Override
  public @Nullable Pos pos() {
    return null;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }
}

// End ReductionLimitException.java
