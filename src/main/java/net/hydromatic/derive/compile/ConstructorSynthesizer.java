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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.derive.ast.Core;
import net.hydromatic.derive.type.DataType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Synthesizes the right-hand side of one arm of a {@code map} or
 * {@code traverse} operation.
 *
 * <p>Under {@code map}, the result is the constructor applied to the
 * synthesized fields: "{@code Box.mk (f a0, a1)}".
 *
 * <p>Under {@code traverse}, the constructor is lifted to a curried function
 * over its effectful fields, the other fields being applied directly; the
 * first effectful field is combined using {@code <$>}, and each subsequent
 * effectful field using {@code <*>}. Effects therefore happen from left to
 * right in declaration order. For example, "{@code (fn y2 => fn y3 =>
 * Pair.mk (y2, y3)) <$> f a0 <*> f a1}". A constructor with no effectful
 * field becomes "{@code pure (C (...))}".
 */
public class ConstructorSynthesizer {
  private final Context context;
  private final FieldSynthesizer fieldSynthesizer;

  ConstructorSynthesizer(Context context) {
    this.context = requireNonNull(context);
    this.fieldSynthesizer = new FieldSynthesizer(context);
  }

  /**
   * Synthesizes the result of transforming a value of a constructor.
   *
   * @param tyCon Type constructor
   * @param fields Expressions for the values of the fields
   * @param f Leaf transform
   */
  public Core.Exp synthesize(DataType.TyCon tyCon,
      List<? extends Core.Exp> fields, Core.Exp f) {
    final ImmutableList<Classification> classifications =
        context.classifications(tyCon);
    final List<FieldSynthesis> syntheses = new ArrayList<>();
    for (int i = 0; i < fields.size(); i++) {
      syntheses.add(
          fieldSynthesizer.synthesize(classifications.get(i), fields.get(i),
              f, context.pos(tyCon, i)));
    }
    switch (context.kind) {
      case MAP:
        return con(tyCon, syntheses, null);
      case TRAVERSE:
        return lift(tyCon, syntheses);
      default:
        throw new AssertionError(context.kind);
    }
  }

  private Core.Exp lift(DataType.TyCon tyCon, List<FieldSynthesis> syntheses) {
    final List<Core.IdPat> ys = new ArrayList<>();
    final List<Core.Exp> effects = new ArrayList<>();
    for (FieldSynthesis synthesis : syntheses) {
      if (synthesis.effectful) {
        ys.add(core.idPat(context.nameGen.get("y")));
        effects.add(synthesis.exp);
      }
    }
    final Core.Con con = con(tyCon, syntheses, ys);
    if (effects.isEmpty()) {
      return core.pure(con);
    }
    // "pure g <*> e0" simplifies to "g <$> e0"
    Core.Exp acc = core.mapEffect(core.fn(ys, con), effects.get(0));
    for (Core.Exp effect : effects.subList(1, effects.size())) {
      acc = core.applyEffect(acc, effect);
    }
    return acc;
  }

  /** Applies a constructor to the synthesized fields. If {@code ys} is not
   * null, the effectful fields are replaced, in order, by references to
   * {@code ys}, and the other fields by their untransformed values. */
  private Core.Con con(DataType.TyCon tyCon, List<FieldSynthesis> syntheses,
      @Nullable List<Core.IdPat> ys) {
    final List<Core.Exp> args = new ArrayList<>();
    int y = 0;
    for (FieldSynthesis synthesis : syntheses) {
      if (ys == null) {
        args.add(synthesis.exp);
      } else if (synthesis.effectful) {
        args.add(core.id(ys.get(y++)));
      } else {
        args.add(synthesis.value);
      }
    }
    return core.con(context.decl.pos(tyCon), context.decl.name, tyCon.name,
        args);
  }
}

// End ConstructorSynthesizer.java
