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

/**
 * Handler for each kind of {@link Lambda}, used by {@link Lambda#fold}.
 *
 * <p>The {@code depth} of a node is the number of abstractions that enclose
 * it; the root has depth 0.
 *
 * @param <R> Result type; must not be null
 */
public interface LambdaFolder<R> {
  /** Folds an abstraction at a given depth; its body is at depth + 1. */
  R abs(int depth, R body);

  R app(R fn, R arg);

  R var(int depth, int index);
}

// End LambdaFolder.java
