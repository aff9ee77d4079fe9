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

import java.util.Random;
import java.util.function.Function;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The pair of structural operations, {@code map} and {@code traverse}, that
 * a type constructor provides over its last type argument.
 *
 * <p>A type constructor must have a capability to occur as the outer type of
 * a nested field, for example {@code List} in a field of type {@code List
 * 'a}.
 */
public interface Capability {
  /** Name of the type constructor, e.g. "List". */
  String typeName();

  /**
   * Whether the functor and traversable laws of this capability have been
   * established. Laws of a type that nests this type can only be established
   * if this returns true.
   */
  boolean lawful();

  /** Applies a pure function to every element. */
  Object map(Function<Object, Object> fn, Object value);

  /**
   * Applies an effectful function to every element, from left to right, and
   * collects the results in the applicative.
   */
  Object traverse(Applicative applicative, Function<Object, Object> fn,
      Object value);

  /**
   * Generates a random value whose elements come from a supplier, or
   * returns null if this capability cannot generate values.
   *
   * <p>Laws of a datatype that nests this type are checked only if this
   * method returns values.
   */
  default @Nullable Object generate(Random random, Supplier<Object> element) {
    return null;
  }
}

// End Capability.java
