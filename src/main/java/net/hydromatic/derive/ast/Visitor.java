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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Core.Id id) {}

  protected void visit(Core.CapabilityOp capabilityOp) {}

  protected void visit(Core.Fn fn) {
    fn.idPat.accept(this);
    fn.exp.accept(this);
  }

  protected void visit(Core.Apply apply) {
    apply.fn.accept(this);
    apply.arg.accept(this);
  }

  protected void visit(Core.Con con) {
    con.args.forEach(this::accept);
  }

  protected void visit(Core.Case kase) {
    kase.exp.accept(this);
    kase.matchList.forEach(this::accept);
  }

  protected void visit(Core.Pure pure) {
    pure.exp.accept(this);
  }

  protected void visit(Core.MapEffect mapEffect) {
    mapEffect.fn.accept(this);
    mapEffect.arg.accept(this);
  }

  protected void visit(Core.ApplyEffect applyEffect) {
    applyEffect.fn.accept(this);
    applyEffect.arg.accept(this);
  }

  // patterns and matches

  protected void visit(Core.IdPat idPat) {}

  protected void visit(Core.ConPat conPat) {
    conPat.args.forEach(this::accept);
  }

  protected void visit(Core.Match match) {
    match.pat.accept(this);
    match.exp.accept(this);
  }
}

// End Visitor.java
