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
package net.hydromatic.caramel;

/** Utilities for tests. */
public abstract class TestUtils {
  /** Stack size of a thread in {@link #runWithSmallStack}; 1 MB. */
  public static final long SMALL_STACK = 1L << 20;

  private TestUtils() {}

  /**
   * Runs a task in a new thread whose stack is {@link #SMALL_STACK} bytes,
   * whatever {@code -Xss} the test JVM was started with, and rethrows
   * anything it throws.
   */
  public static void runWithSmallStack(Runnable task)
      throws InterruptedException {
    final Throwable[] thrown = {null};
    final Thread thread =
        new Thread(null, () -> {
          try {
            task.run();
          } catch (Throwable e) {
            thrown[0] = e;
          }
        }, "small-stack", SMALL_STACK);
    thread.start();
    thread.join();
    if (thrown[0] != null) {
      throw new AssertionError("task failed in small stack", thrown[0]);
    }
  }
}

// End TestUtils.java
