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

import java.util.function.Function;

/**
 * Applicative functor, the effect in which {@code traverse} runs.
 *
 * <p>Values are untyped; a value "of type {@code F b}" is whatever object
 * this applicative uses to represent an effectful {@code b}. A function "of
 * type {@code F (b -> c)}" wraps a {@code Function<Object, Object>}.
 *
 * <p>Implementations must satisfy the applicative laws:
 *
 * <ul>
 *   <li>identity: {@code pure id <*> v = v}
 *   <li>homomorphism: {@code pure f <*> pure x = pure (f x)}
 *   <li>interchange: {@code u <*> pure y = pure ($ y) <*> u}
 *   <li>composition: {@code pure (.) <*> u <*> v <*> w = u <*> (v <*> w)}
 * </ul>
 */
public interface Applicative {
  /** Name, for debugging. */
  String name();

  /** Lifts a pure value, "{@code pure x}". */
  Object pure(Object value);

  /**
   * Sequences an effectful function with an effectful argument, "{@code ef
   * <*> ex}". The effect of {@code fn} happens before the effect of {@code
   * arg}.
   */
  Object ap(Object fn, Object arg);

  /** Maps a pure function over an effectful value, "{@code f <$> ex}". */
  default Object map(Function<Object, Object> fn, Object arg) {
    return ap(pure(fn), arg);
  }
}

// End Applicative.java
