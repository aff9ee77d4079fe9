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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.derive.ast.Core;
import net.hydromatic.derive.type.DataType;

/**
 * Synthesizes a {@code map} or {@code traverse} operation for a datatype.
 *
 * <p>The result has the form
 *
 * <blockquote><pre>
 * fn f => fn x => case x of
 *     C1 (a0, ...) => ...
 *   | ...
 *   | Cn (...) => ...
 * </pre></blockquote>
 *
 * <p>with one arm for each type constructor, in declaration order.
 */
public class TypeSynthesizer {
  /** Name of the parameter that holds the leaf transform. */
  public static final String F = "f";
  /** Name of the parameter that holds the value being transformed. */
  public static final String X = "x";

  private final Context context;
  private final ConstructorSynthesizer constructorSynthesizer;

  TypeSynthesizer(Context context) {
    this.context = requireNonNull(context);
    this.constructorSynthesizer = new ConstructorSynthesizer(context);
  }

  /** Synthesizes the operation. */
  public SynthesizedOp synthesize() {
    final DataType decl = context.decl;
    final Core.IdPat f = core.idPat(F);
    final Core.IdPat x = core.idPat(X);
    final ImmutableList.Builder<Core.Match> matches = ImmutableList.builder();
    for (DataType.TyCon tyCon : decl.tyCons) {
      final ImmutableList.Builder<Core.IdPat> args = ImmutableList.builder();
      for (int i = 0; i < tyCon.arity(); i++) {
        args.add(core.idPat(context.nameGen.get("a")));
      }
      final Core.ConPat pat =
          core.conPat(decl.pos(tyCon), decl.name, tyCon.name, args.build());
      final List<Core.Id> fields =
          pat.args.stream().map(Core.IdPat::toId)
              .collect(ImmutableList.toImmutableList());
      matches.add(
          core.match(pat,
              constructorSynthesizer.synthesize(tyCon, fields, core.id(f))));
    }
    final ImmutableList<Core.Match> matchList = matches.build();
    checkExhaustive(decl, matchList);
    final Core.Fn body =
        core.fn(f, core.fn(x, core.caseOf(decl.pos(), core.id(x), matchList)));
    final SynthesizedOp op =
        new SynthesizedOp(SynthesizedOp.name(decl, context.kind), context.kind,
            decl, body, ImmutableList.of(), ImmutableList.of());
    context.tracer.onSynthesized(op);
    return op;
  }

  /**
   * Checks that a list of arms covers every constructor of a datatype
   * exactly once, in declaration order.
   *
   * @throws NonExhaustiveException if not
   */
  public static void checkExhaustive(DataType decl,
      List<Core.Match> matchList) {
    if (decl.tyCons.isEmpty()) {
      throw new NonExhaustiveException("datatype " + decl.name
          + " has no constructors", decl.pos());
    }
    final Set<String> seen = new HashSet<>();
    for (Core.Match match : matchList) {
      if (!match.pat.typeName.equals(decl.name)
          || decl.tyCon(match.pat.tyCon) == null) {
        throw new NonExhaustiveException("arm " + match.pat.qualifiedName()
            + " is not a constructor of " + decl.name, decl.pos());
      }
      if (!seen.add(match.pat.tyCon)) {
        throw new NonExhaustiveException("constructor "
            + match.pat.qualifiedName() + " is matched more than once",
            match.pat.pos);
      }
    }
    for (int i = 0; i < decl.tyCons.size(); i++) {
      final DataType.TyCon tyCon = decl.tyCons.get(i);
      if (!seen.contains(tyCon.name)) {
        throw new NonExhaustiveException("constructor " + decl.name + "."
            + tyCon.name + " is not matched", decl.pos(tyCon));
      }
      if (!matchList.get(i).pat.tyCon.equals(tyCon.name)) {
        throw new NonExhaustiveException("constructor " + decl.name + "."
            + tyCon.name + " is not matched in declaration order",
            decl.pos(tyCon));
      }
    }
  }
}

// End TypeSynthesizer.java
