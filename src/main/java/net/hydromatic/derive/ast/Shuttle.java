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

import java.util.ArrayList;
import java.util.List;

/** Visits and transforms syntax trees. */
public class Shuttle {
  protected <E extends AstNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  // expressions

  protected Core.Exp visit(Core.Id id) {
    return id;
  }

  protected Core.Exp visit(Core.CapabilityOp capabilityOp) {
    return capabilityOp;
  }

  protected Core.Exp visit(Core.Fn fn) {
    return fn.copy(fn.idPat.accept(this), fn.exp.accept(this));
  }

  protected Core.Exp visit(Core.Apply apply) {
    return apply.copy(apply.fn.accept(this), apply.arg.accept(this));
  }

  protected Core.Exp visit(Core.Con con) {
    return con.copy(visitList(con.args));
  }

  protected Core.Exp visit(Core.Case kase) {
    return kase.copy(kase.exp.accept(this), visitList(kase.matchList));
  }

  protected Core.Exp visit(Core.Pure pure) {
    return pure.copy(pure.exp.accept(this));
  }

  protected Core.Exp visit(Core.MapEffect mapEffect) {
    return mapEffect.copy(mapEffect.fn.accept(this),
        mapEffect.arg.accept(this));
  }

  protected Core.Exp visit(Core.ApplyEffect applyEffect) {
    return applyEffect.copy(applyEffect.fn.accept(this),
        applyEffect.arg.accept(this));
  }

  // patterns and matches

  protected Core.IdPat visit(Core.IdPat idPat) {
    return idPat;
  }

  protected Core.ConPat visit(Core.ConPat conPat) {
    return conPat.copy(visitList(conPat.args));
  }

  protected Core.Match visit(Core.Match match) {
    return match.copy(match.pat.accept(this), match.exp.accept(this));
  }
}

// End Shuttle.java
