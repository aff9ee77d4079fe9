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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluation environment.
 *
 * <p>Maps the names of variables to values. Environments are immutable;
 * binding a variable creates a new environment.
 */
public interface EvalEnv {

  /** The name of the variable that contains the ambient {@link Applicative}. */
  String APPLICATIVE = "$applicative";

  /** Returns the binding of {@code name} if bound, null if not. */
  @Nullable Object getOpt(String name);

  /**
   * Creates an environment that has the same content as this one, plus the
   * binding (name, value).
   */
  default EvalEnv bind(String name, Object value) {
    return new EvalEnvs.SubEvalEnv(this, name, value);
  }

  /** Returns the ambient applicative; throws if there is none. */
  default Applicative applicative() {
    final Object o = getOpt(APPLICATIVE);
    if (o == null) {
      throw new AssertionError("no applicative in environment");
    }
    return (Applicative) o;
  }
}

// End EvalEnv.java
