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
package net.hydromatic.derive.eval;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Value of the built-in {@code Either} type. */
public class Either {
  public final boolean isLeft;
  public final Object value;

  private Either(boolean isLeft, Object value) {
    this.isLeft = isLeft;
    this.value = requireNonNull(value);
  }

  /** Creates a left value, which capabilities leave unchanged. */
  public static Either left(Object value) {
    return new Either(true, value);
  }

  /** Creates a right value, which capabilities transform. */
  public static Either right(Object value) {
    return new Either(false, value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(isLeft, value);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Either
            && isLeft == ((Either) o).isLeft
            && value.equals(((Either) o).value);
  }

  @Override
  public String toString() {
    return (isLeft ? "Left " : "Right ") + value;
  }
}

// End Either.java
