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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.derive.ast.Core;
import net.hydromatic.derive.type.DataType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Operation that has been synthesized for a datatype.
 *
 * <p>The body has the form "{@code fn f => fn x => case x of ...}", with one
 * arm per type constructor, in declaration order.
 */
public class SynthesizedOp {
  public final String name;
  public final CapabilityKind kind;
  public final DataType dataType;
  public final Core.Fn body;
  /** Unfolding equations, one per type constructor. Empty until
   * {@link LemmaGenerator} has run. */
  public final ImmutableList<Equation> equations;
  /** Laws that this operation satisfies. Empty until {@link LawProver}
   * has run. */
  public final ImmutableList<LawObligation> laws;

  SynthesizedOp(String name, CapabilityKind kind, DataType dataType,
      Core.Fn body, List<Equation> equations, List<LawObligation> laws) {
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    this.dataType = requireNonNull(dataType);
    this.body = requireNonNull(body);
    this.equations = ImmutableList.copyOf(equations);
    this.laws = ImmutableList.copyOf(laws);
    checkArgument(body.exp instanceof Core.Fn
        && ((Core.Fn) body.exp).exp instanceof Core.Case,
        "body must be 'fn f => fn x => case x of ...'");
  }

  /** Returns the name of an operation, e.g. "Pair.map". */
  static String name(DataType dataType, CapabilityKind kind) {
    return dataType.name + "." + kind.opName;
  }

  /** Returns the case expression at the heart of the body. */
  public Core.Case caseExp() {
    return (Core.Case) ((Core.Fn) body.exp).exp;
  }

  /** Returns the arm for a given type constructor, or null. */
  public Core.@Nullable Match match(String tyCon) {
    for (Core.Match match : caseExp().matchList) {
      if (match.pat.tyCon.equals(tyCon)) {
        return match;
      }
    }
    return null;
  }

  /** Returns the equation for a given type constructor, or null. */
  public @Nullable Equation equation(String tyCon) {
    for (Equation equation : equations) {
      if (equation.tyCon.equals(tyCon)) {
        return equation;
      }
    }
    return null;
  }

  /** Returns a copy of this operation with the given equations. */
  public SynthesizedOp withEquations(List<Equation> equations) {
    return new SynthesizedOp(name, kind, dataType, body, equations, laws);
  }

  /** Returns a copy of this operation with the given laws. */
  public SynthesizedOp withLaws(List<LawObligation> laws) {
    return new SynthesizedOp(name, kind, dataType, body, equations, laws);
  }

  @Override
  public String toString() {
    return "val " + name + " = " + body;
  }
}

// End SynthesizedOp.java
