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

import net.hydromatic.caramel.ast.Pos;
import net.hydromatic.caramel.util.CaramelException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when a term refers to a variable that is not bound in the current
 * scope.
 */
public class UnboundVariableException extends RuntimeException
    implements CaramelException {
  public final String name;

  public UnboundVariableException(String name) {
    super("undefined variable `" + name + "`");
    this.name = requireNonNull(name);
  }

  /** Terms do not remember their position, so there is none. */
  @Override
  public @Nullable Pos pos() {
    return null;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }
}

// End UnboundVariableException.java
