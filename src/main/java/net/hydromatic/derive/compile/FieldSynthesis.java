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
package net.hydromatic.derive.compile;

import static java.util.Objects.requireNonNull;

import net.hydromatic.derive.ast.Core;

/** Result of synthesizing one field of a constructor. */
public class FieldSynthesis {
  /** The synthesized expression. Under {@code traverse}, has an applicative
   * type, e.g. "{@code f a0}" or "{@code pure a1}". */
  public final Core.Exp exp;
  /** The value of the field if it is not transformed, e.g. "{@code a1}";
   * equal to {@link #exp} under {@code map}. */
  public final Core.Exp value;
  public final boolean effectful;

  FieldSynthesis(Core.Exp exp, Core.Exp value, boolean effectful) {
    this.exp = requireNonNull(exp);
    this.value = requireNonNull(value);
    this.effectful = effectful;
  }

  @Override
  public String toString() {
    return exp.toString();
  }
}

// End FieldSynthesis.java
