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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.derive.ast.Core;
import net.hydromatic.derive.ast.Shuttle;

/**
 * Replaces identifiers with expressions.
 *
 * <p>A binding (the parameter of a {@code fn}, or an argument of a
 * constructor pattern) hides any substitution for the same name within its
 * scope.
 */
public class Replacer extends Shuttle {
  protected final Map<String, ? extends Core.Exp> substitution;

  private Replacer(Map<String, ? extends Core.Exp> substitution) {
    this.substitution = requireNonNull(substitution);
  }

  /** Replaces identifiers in an expression. */
  public static Core.Exp substitute(
      Map<String, ? extends Core.Exp> substitution, Core.Exp exp) {
    if (substitution.isEmpty()) {
      return exp;
    }
    return exp.accept(new Replacer(substitution));
  }

  /** Replaces one identifier in an expression. */
  public static Core.Exp substitute(String name, Core.Exp replacement,
      Core.Exp exp) {
    return substitute(ImmutableMap.of(name, replacement), exp);
  }

  /** Returns a replacer that does not substitute the given names, or this
   * replacer if it substitutes none of them. */
  private Replacer hide(Iterable<Core.IdPat> idPats) {
    Map<String, Core.Exp> map = null;
    for (Core.IdPat idPat : idPats) {
      if (substitution.containsKey(idPat.name)) {
        if (map == null) {
          map = new HashMap<>(substitution);
        }
        map.remove(idPat.name);
      }
    }
    return map == null ? this : new Replacer(map);
  }

  @Override
  protected Core.Exp visit(Core.Id id) {
    final Core.Exp exp = substitution.get(id.name);
    return exp != null ? exp : id;
  }

  @Override
  protected Core.Exp visit(Core.Fn fn) {
    final Replacer replacer = hide(ImmutableList.of(fn.idPat));
    return fn.copy(fn.idPat, fn.exp.accept(replacer));
  }

  @Override
  protected Core.Match visit(Core.Match match) {
    final Replacer replacer = hide(match.pat.args);
    return match.copy(match.pat, match.exp.accept(replacer));
  }
}

// End Replacer.java
