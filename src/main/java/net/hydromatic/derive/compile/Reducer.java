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

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.derive.ast.Core;
import net.hydromatic.derive.ast.Shuttle;

/**
 * Reduces Core expressions to normal form.
 *
 * <p>Performs three kinds of reduction:
 *
 * <ul>
 *   <li>delta: an identifier in function position that names a definition is
 *       replaced by the definition;
 *   <li>beta: "{@code (fn p => e) a}" becomes "{@code e}" with {@code p}
 *       replaced by {@code a};
 *   <li>case-of-constructor: "{@code case C (a0, a1) of ... | C (p0, p1) => e
 *       | ...}" becomes "{@code e}" with {@code p0} and {@code p1} replaced
 *       by {@code a0} and {@code a1}.
 * </ul>
 *
 * <p>Capability operations such as "{@code List.map}" are opaque.
 * Definitions must not be recursive.
 */
public class Reducer extends Shuttle {
  private final Map<String, ? extends Core.Exp> definitions;

  private Reducer(Map<String, ? extends Core.Exp> definitions) {
    this.definitions = requireNonNull(definitions);
  }

  /** Reduces an expression. */
  public static Core.Exp reduce(Map<String, ? extends Core.Exp> definitions,
      Core.Exp exp) {
    return exp.accept(new Reducer(definitions));
  }

  @Override
  protected Core.Exp visit(Core.Apply apply) {
    final Core.Exp fn = apply.fn.accept(this);
    final Core.Exp arg = apply.arg.accept(this);
    return reduceApply(apply, fn, arg);
  }

  private Core.Exp reduceApply(Core.Apply apply, Core.Exp fn, Core.Exp arg) {
    if (fn instanceof Core.Id) {
      final Core.Exp definition = definitions.get(((Core.Id) fn).name);
      if (definition != null) {
        return reduceApply(apply, definition.accept(this), arg);
      }
    }
    if (fn instanceof Core.Fn) {
      final Core.Fn fn2 = (Core.Fn) fn;
      return Replacer.substitute(fn2.idPat.name, arg, fn2.exp).accept(this);
    }
    return apply.copy(fn, arg);
  }

  @Override
  protected Core.Exp visit(Core.Case kase) {
    final Core.Exp exp = kase.exp.accept(this);
    if (exp instanceof Core.Con) {
      final Core.Con con = (Core.Con) exp;
      for (Core.Match match : kase.matchList) {
        if (match.pat.typeName.equals(con.typeName)
            && match.pat.tyCon.equals(con.tyCon)) {
          final Map<String, Core.Exp> substitution = new HashMap<>();
          for (int i = 0; i < match.pat.args.size(); i++) {
            substitution.put(match.pat.args.get(i).name, con.args.get(i));
          }
          return Replacer.substitute(substitution, match.exp).accept(this);
        }
      }
      throw new AssertionError("no arm for " + con.qualifiedName() + " in "
          + kase);
    }
    return kase.copy(exp, visitList(kase.matchList));
  }

  /**
   * Returns whether two expressions are equal modulo the names of bound
   * variables.
   *
   * <p>For example, "{@code fn y0 => Box.mk (y0, b1)}" and "{@code fn y5 =>
   * Box.mk (y5, b1)}" are alpha-equivalent, but "{@code fn y0 => Box.mk (y0,
   * b1)}" and "{@code fn y0 => Box.mk (b1, y0)}" are not.
   */
  public static boolean alphaEquivalent(Core.Exp e0, Core.Exp e1) {
    return alphaEquivalent(e0, e1, ImmutableMap.of(), ImmutableMap.of());
  }

  private static boolean alphaEquivalent(Core.Exp e0, Core.Exp e1,
      Map<String, String> bound0, Map<String, String> bound1) {
    if (e0.op != e1.op) {
      return false;
    }
    switch (e0.op) {
      case ID:
        final String name0 = ((Core.Id) e0).name;
        final String name1 = ((Core.Id) e1).name;
        final String target0 = bound0.get(name0);
        final String target1 = bound1.get(name1);
        if (target0 == null && target1 == null) {
          return name0.equals(name1);
        }
        return name1.equals(target0) && name0.equals(target1);

      case CAPABILITY_OP:
        return e0.equals(e1);

      case FN:
        final Core.Fn fn0 = (Core.Fn) e0;
        final Core.Fn fn1 = (Core.Fn) e1;
        return alphaEquivalent(fn0.exp, fn1.exp,
            bind(bound0, fn0.idPat.name, fn1.idPat.name),
            bind(bound1, fn1.idPat.name, fn0.idPat.name));

      case APPLY:
        final Core.Apply apply0 = (Core.Apply) e0;
        final Core.Apply apply1 = (Core.Apply) e1;
        return alphaEquivalent(apply0.fn, apply1.fn, bound0, bound1)
            && alphaEquivalent(apply0.arg, apply1.arg, bound0, bound1);

      case MAP_EFFECT:
      case APPLY_EFFECT:
        final Core.EffectOp effectOp0 = (Core.EffectOp) e0;
        final Core.EffectOp effectOp1 = (Core.EffectOp) e1;
        return alphaEquivalent(effectOp0.fn, effectOp1.fn, bound0, bound1)
            && alphaEquivalent(effectOp0.arg, effectOp1.arg, bound0, bound1);

      case PURE:
        return alphaEquivalent(((Core.Pure) e0).exp, ((Core.Pure) e1).exp,
            bound0, bound1);

      case CON:
        final Core.Con con0 = (Core.Con) e0;
        final Core.Con con1 = (Core.Con) e1;
        return con0.typeName.equals(con1.typeName)
            && con0.tyCon.equals(con1.tyCon)
            && allEquivalent(con0.args, con1.args, bound0, bound1);

      case CASE:
        final Core.Case case0 = (Core.Case) e0;
        final Core.Case case1 = (Core.Case) e1;
        if (!alphaEquivalent(case0.exp, case1.exp, bound0, bound1)
            || case0.matchList.size() != case1.matchList.size()) {
          return false;
        }
        for (int i = 0; i < case0.matchList.size(); i++) {
          final Core.Match match0 = case0.matchList.get(i);
          final Core.Match match1 = case1.matchList.get(i);
          if (!match0.pat.typeName.equals(match1.pat.typeName)
              || !match0.pat.tyCon.equals(match1.pat.tyCon)
              || match0.pat.args.size() != match1.pat.args.size()) {
            return false;
          }
          Map<String, String> b0 = bound0;
          Map<String, String> b1 = bound1;
          for (int j = 0; j < match0.pat.args.size(); j++) {
            final String arg0 = match0.pat.args.get(j).name;
            final String arg1 = match1.pat.args.get(j).name;
            b0 = bind(b0, arg0, arg1);
            b1 = bind(b1, arg1, arg0);
          }
          if (!alphaEquivalent(match0.exp, match1.exp, b0, b1)) {
            return false;
          }
        }
        return true;

      default:
        throw new AssertionError("unknown op " + e0.op);
    }
  }

  private static boolean allEquivalent(List<Core.Exp> list0,
      List<Core.Exp> list1, Map<String, String> bound0,
      Map<String, String> bound1) {
    if (list0.size() != list1.size()) {
      return false;
    }
    for (int i = 0; i < list0.size(); i++) {
      if (!alphaEquivalent(list0.get(i), list1.get(i), bound0, bound1)) {
        return false;
      }
    }
    return true;
  }

  private static Map<String, String> bind(Map<String, String> bound,
      String name, String target) {
    final Map<String, String> map = new HashMap<>(bound);
    map.put(name, target);
    return map;
  }
}

// End Reducer.java
