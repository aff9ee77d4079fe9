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
package net.hydromatic.derive.ast;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.derive.compile.CapabilityKind;

/** Builds Core nodes. */
public enum CoreBuilder {
  /**
   * The singleton instance of the CORE builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  core;

  /** Creates a reference to a variable. */
  public Core.Id id(String name) {
    return new Core.Id(name);
  }

  /** Creates a reference to a variable bound by a pattern. */
  public Core.Id id(Core.IdPat idPat) {
    return new Core.Id(idPat.name);
  }

  /** Creates a named pattern. */
  public Core.IdPat idPat(String name) {
    return new Core.IdPat(name);
  }

  /** Creates a reference to an operation of a capability. */
  public Core.CapabilityOp capabilityOp(String typeName, CapabilityKind kind) {
    return new Core.CapabilityOp(typeName, kind);
  }

  /** Creates a lambda, "{@code fn p => e}". */
  public Core.Fn fn(Core.IdPat idPat, Core.Exp exp) {
    return new Core.Fn(idPat, exp);
  }

  /** Creates a curried lambda over several parameters,
   * "{@code fn p0 => fn p1 => e}". */
  public Core.Exp fn(List<Core.IdPat> idPats, Core.Exp exp) {
    Core.Exp e = exp;
    for (int i = idPats.size() - 1; i >= 0; i--) {
      e = fn(idPats.get(i), e);
    }
    return e;
  }

  /** Creates an application of a function to an argument. */
  public Core.Apply apply(Core.Exp fn, Core.Exp arg) {
    return new Core.Apply(fn, arg);
  }

  /** Creates an application of a curried function to several arguments. */
  public Core.Exp apply(Core.Exp fn, Core.Exp arg0, Core.Exp... args) {
    Core.Exp e = apply(fn, arg0);
    for (Core.Exp arg : args) {
      e = apply(e, arg);
    }
    return e;
  }

  /** Creates an application of a type constructor. */
  public Core.Con con(Pos pos, String typeName, String tyCon,
      List<? extends Core.Exp> args) {
    return new Core.Con(pos, typeName, tyCon, ImmutableList.copyOf(args));
  }

  /** Creates a type constructor pattern. */
  public Core.ConPat conPat(Pos pos, String typeName, String tyCon,
      List<Core.IdPat> args) {
    return new Core.ConPat(pos, typeName, tyCon, ImmutableList.copyOf(args));
  }

  /** Creates an arm of a case expression. */
  public Core.Match match(Core.ConPat pat, Core.Exp exp) {
    return new Core.Match(pat, exp);
  }

  /** Creates a case expression. */
  public Core.Case caseOf(Pos pos, Core.Exp exp, List<Core.Match> matchList) {
    return new Core.Case(pos, exp, ImmutableList.copyOf(matchList));
  }

  /** Creates a case expression. */
  public Core.Case caseOf(Pos pos, Core.Exp exp, Core.Match... matches) {
    return caseOf(pos, exp, Arrays.asList(matches));
  }

  /** Creates a "{@code pure e}" expression. */
  public Core.Pure pure(Core.Exp exp) {
    return new Core.Pure(exp);
  }

  /** Creates a "{@code f <$> e}" expression. */
  public Core.MapEffect mapEffect(Core.Exp fn, Core.Exp arg) {
    return new Core.MapEffect(fn, arg);
  }

  /** Creates a "{@code ef <*> e}" expression. */
  public Core.ApplyEffect applyEffect(Core.Exp fn, Core.Exp arg) {
    return new Core.ApplyEffect(fn, arg);
  }
}

// End CoreBuilder.java
