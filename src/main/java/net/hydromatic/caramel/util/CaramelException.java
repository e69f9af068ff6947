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
package net.hydromatic.caramel.util;

import net.hydromatic.caramel.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Error that can be reported to a user.
 *
 * <p>Every exception that the Caramel pipeline throws on purpose implements
 * this interface.
 */
public interface CaramelException {
  /**
   * Returns the position in the source text where the error occurred, or null
   * if the error is not associated with source text (for example, an error
   * while reducing a pure term).
   */
  @Nullable
  Pos pos();

  /** Writes a description of this error, for the user, to a buffer. */
  StringBuilder describeTo(StringBuilder buf);
}

// End CaramelException.java
