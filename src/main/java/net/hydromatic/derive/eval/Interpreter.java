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
package net.hydromatic.derive.eval;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.derive.eval.Applicatives.fn;

import com.google.common.collect.ImmutableList;
import java.util.function.Function;
import net.hydromatic.derive.ast.Core;
import net.hydromatic.derive.ast.Pos;
import net.hydromatic.derive.compile.CapabilityKind;
import net.hydromatic.derive.compile.Environment;
import net.hydromatic.derive.compile.MissingCapabilityException;

/**
 * Evaluates Core expressions.
 *
 * <p>Functions evaluate to {@link Function} closures that capture their
 * environment; type constructor applications evaluate to {@link DataValue};
 * the applicative operators delegate to the applicative bound to {@link
 * EvalEnv#APPLICATIVE}; and capability operations delegate to the {@link
 * Capability} that {@link Environment#lookupCapability} returns.
 */
public class Interpreter {
  private final Environment env;

  public Interpreter(Environment env) {
    this.env = requireNonNull(env);
  }

  /** Evaluates an expression in an environment. */
  public Object eval(EvalEnv evalEnv, Core.Exp exp) {
    switch (exp.op) {
      case ID:
        final Core.Id id = (Core.Id) exp;
        final Object value = evalEnv.getOpt(id.name);
        if (value == null) {
          throw new AssertionError("unbound variable " + id.name);
        }
        return value;

      case CAPABILITY_OP:
        return capabilityOp(evalEnv, (Core.CapabilityOp) exp);

      case FN:
        final Core.Fn fn = (Core.Fn) exp;
        return (Function<Object, Object>)
            arg -> eval(evalEnv.bind(fn.idPat.name, arg), fn.exp);

      case APPLY:
        final Core.Apply apply = (Core.Apply) exp;
        return fn(eval(evalEnv, apply.fn)).apply(eval(evalEnv, apply.arg));

      case CON:
        final Core.Con con = (Core.Con) exp;
        final ImmutableList.Builder<Object> args = ImmutableList.builder();
        for (Core.Exp arg : con.args) {
          args.add(eval(evalEnv, arg));
        }
        return new DataValue(con.typeName, con.tyCon, args.build());

      case CASE:
        return evalCase(evalEnv, (Core.Case) exp);

      case PURE:
        return evalEnv.applicative()
            .pure(eval(evalEnv, ((Core.Pure) exp).exp));

      case MAP_EFFECT:
        final Core.MapEffect mapEffect = (Core.MapEffect) exp;
        return evalEnv.applicative()
            .map(fn(eval(evalEnv, mapEffect.fn)),
                eval(evalEnv, mapEffect.arg));

      case APPLY_EFFECT:
        final Core.ApplyEffect applyEffect = (Core.ApplyEffect) exp;
        return evalEnv.applicative()
            .ap(eval(evalEnv, applyEffect.fn),
                eval(evalEnv, applyEffect.arg));

      default:
        throw new AssertionError("unknown op " + exp.op);
    }
  }

  private Object evalCase(EvalEnv evalEnv, Core.Case kase) {
    final DataValue value = (DataValue) eval(evalEnv, kase.exp);
    for (Core.Match match : kase.matchList) {
      if (match.pat.typeName.equals(value.typeName)
          && match.pat.tyCon.equals(value.tyCon)) {
        EvalEnv env2 = evalEnv;
        for (int i = 0; i < match.pat.args.size(); i++) {
          env2 = env2.bind(match.pat.args.get(i).name, value.args.get(i));
        }
        return eval(env2, match.exp);
      }
    }
    throw new AssertionError("no match for " + value + " in " + kase);
  }

  /** Evaluates a reference to a capability operation as a curried
   * function. */
  private Object capabilityOp(EvalEnv evalEnv, Core.CapabilityOp op) {
    final Capability capability = env.lookupCapability(op.typeName);
    if (capability == null) {
      throw new MissingCapabilityException("type " + op.typeName
          + " has no capability", Pos.of(op.typeName));
    }
    if (op.kind == CapabilityKind.MAP) {
      return (Function<Object, Object>) f ->
          (Function<Object, Object>) x -> capability.map(fn(f), x);
    }
    final Applicative applicative = evalEnv.applicative();
    return (Function<Object, Object>) f ->
        (Function<Object, Object>) x ->
            capability.traverse(applicative, fn(f), x);
  }
}

// End Interpreter.java
