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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Operations that every {@link Capability} supports by virtue of its
 * {@code traverse}.
 */
public abstract class Traversals {
  private Traversals() {}

  /**
   * Evaluates the effectful elements of a structure from left to right and
   * collects the results, "{@code traverse id}".
   *
   * <p>For example, sequencing {@code Pair.mk (Some 1, Some 2)} in the
   * option applicative gives {@code Some (Pair.mk (1, 2))}.
   */
  public static Object sequence(Capability capability,
      Applicative applicative, Object value) {
    return capability.traverse(applicative, x -> x, value);
  }

  /** Returns the elements of a structure, from left to right. */
  @SuppressWarnings("unchecked")
  public static List<Object> toList(Capability capability, Object value) {
    return (List<Object>)
        capability.traverse(Applicatives.CONST, ImmutableList::of, value);
  }

  /** Returns the number of elements in a structure. */
  public static int size(Capability capability, Object value) {
    return toList(capability, value).size();
  }
}

// End Traversals.java
