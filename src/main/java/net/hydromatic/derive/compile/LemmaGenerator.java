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
import static net.hydromatic.derive.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.derive.ast.Core;
import net.hydromatic.derive.type.DataType;

/**
 * Generates the unfolding equations of a synthesized operation.
 *
 * <p>For each constructor {@code C} of arity {@code n}, the equation is
 * "{@code op f (C (b0, ..., bn)) = rhs}", where {@code b0}, ... are fresh
 * variables and {@code rhs} is synthesized afresh from them. Each equation is
 * discharged by reducing its left-hand side using the definition of the
 * operation and comparing the result to the right-hand side.
 */
public class LemmaGenerator {
  private final Context context;

  LemmaGenerator(Context context) {
    this.context = requireNonNull(context);
  }

  /**
   * Returns a copy of an operation with its equations.
   *
   * @throws DeriveException if an equation cannot be discharged
   */
  public SynthesizedOp generate(SynthesizedOp op) {
    final Context context = this.context.withKind(op.kind);
    final ConstructorSynthesizer constructorSynthesizer =
        new ConstructorSynthesizer(context);
    final DataType decl = context.decl;
    final ImmutableMap<String, Core.Exp> definitions =
        ImmutableMap.of(op.name, op.body);
    final Core.Id f = core.id(TypeSynthesizer.F);
    final ImmutableList.Builder<Equation> equations = ImmutableList.builder();
    for (DataType.TyCon tyCon : decl.tyCons) {
      final ImmutableList.Builder<Core.Exp> args = ImmutableList.builder();
      for (int i = 0; i < tyCon.arity(); i++) {
        args.add(core.id(context.nameGen.get("b")));
      }
      final List<Core.Exp> fields = args.build();
      final Core.Exp lhs =
          core.apply(core.id(op.name), f,
              core.con(decl.pos(tyCon), decl.name, tyCon.name, fields));
      final Core.Exp rhs = constructorSynthesizer.synthesize(tyCon, fields, f);
      final Core.Exp reduced = Reducer.reduce(definitions, lhs);
      if (!Reducer.alphaEquivalent(reduced, rhs)) {
        throw new DeriveException("equation not discharged: " + lhs
            + " reduces to " + reduced + ", expected " + rhs,
            decl.pos(tyCon));
      }
      final Equation equation = new Equation(op.name, tyCon.name, lhs, rhs);
      context.tracer.onEquation(equation);
      equations.add(equation);
    }
    return op.withEquations(equations.build());
  }
}

// End LemmaGenerator.java
