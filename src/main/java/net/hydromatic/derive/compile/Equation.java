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

/**
 * Unfolding equation of a synthesized operation for one type constructor.
 *
 * <p>For example, "{@code Pair.map f (Pair.mk (b0, b1)) = Pair.mk (f b0, f
 * b1)}".
 */
public class Equation {
  public final String opName;
  public final String tyCon;
  public final Core.Exp lhs;
  public final Core.Exp rhs;

  Equation(String opName, String tyCon, Core.Exp lhs, Core.Exp rhs) {
    this.opName = requireNonNull(opName);
    this.tyCon = requireNonNull(tyCon);
    this.lhs = requireNonNull(lhs);
    this.rhs = requireNonNull(rhs);
  }

  @Override
  public String toString() {
    return lhs + " = " + rhs;
  }
}

// End Equation.java
