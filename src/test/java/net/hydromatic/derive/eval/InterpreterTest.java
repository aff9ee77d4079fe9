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

import static net.hydromatic.derive.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import java.util.function.Function;
import net.hydromatic.derive.ast.Core;
import net.hydromatic.derive.ast.Pos;
import net.hydromatic.derive.compile.CapabilityKind;
import net.hydromatic.derive.compile.Environments;
import net.hydromatic.derive.compile.MissingCapabilityException;
import net.hydromatic.derive.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests for {@link Interpreter}. */
public class InterpreterTest {
  private static final Function<Object, Object> INC =
      x -> (Integer) x + 1;

  private static final Pos BOX_MK = Pos.of("Box", "mk");

  private final Interpreter interpreter =
      new Interpreter(Environments.env(new TypeSystem()));

  @Test
  void testFn() {
    final EvalEnv env = EvalEnvs.empty().bind("y", 5);
    final Core.Exp exp =
        core.apply(core.fn(core.idPat("x"), core.id("x")), core.id("y"));
    assertThat(interpreter.eval(env, exp), is(5));

    // An inner binding hides an outer one
    final Core.Exp exp2 =
        core.apply(core.fn(core.idPat("y"), core.id("y")), core.id("z"));
    assertThat(interpreter.eval(env.bind("z", 6), exp2), is(6));
  }

  @Test
  void testConAndCase() {
    final EvalEnv env = EvalEnvs.empty().bind("y", 5).bind("z", 6);
    final Core.Exp mk =
        core.con(BOX_MK, "Box", "mk",
            ImmutableList.of(core.id("y"), core.id("z")));
    assertThat(interpreter.eval(env, mk), is(DataValue.of("Box", "mk", 5, 6)));

    // fn x => case x of Box.mk (a, b) => Box.mk (b, a)
    final Core.Exp swap =
        core.fn(core.idPat("x"),
            core.caseOf(Pos.of("Box"), core.id("x"),
                core.match(
                    core.conPat(BOX_MK, "Box", "mk",
                        ImmutableList.of(core.idPat("a"), core.idPat("b"))),
                    core.con(BOX_MK, "Box", "mk",
                        ImmutableList.of(core.id("b"), core.id("a"))))));
    assertThat(interpreter.eval(env, core.apply(swap, mk)),
        is(DataValue.of("Box", "mk", 6, 5)));
  }

  @Test
  void testCapabilityOp() {
    final EvalEnv env =
        EvalEnvs.empty().bind("f", INC).bind("xs", ImmutableList.of(1, 2));
    final Core.Exp exp =
        core.apply(core.capabilityOp("List", CapabilityKind.MAP),
            core.id("f"), core.id("xs"));
    assertThat(interpreter.eval(env, exp), is(ImmutableList.of(2, 3)));

    final Function<Object, Object> log = x -> Logged.of(x, "visit " + x);
    final EvalEnv env2 =
        EvalEnvs.withApplicative(Applicatives.LOGGING)
            .bind("f", log)
            .bind("xs", ImmutableList.of(1, 2));
    final Core.Exp exp2 =
        core.apply(core.capabilityOp("List", CapabilityKind.TRAVERSE),
            core.id("f"), core.id("xs"));
    assertThat(interpreter.eval(env2, exp2),
        is(
            new Logged(ImmutableList.of(1, 2),
                ImmutableList.of("visit 1", "visit 2"))));
  }

  @Test
  void testEffects() {
    final EvalEnv env =
        EvalEnvs.withApplicative(Applicatives.OPTION)
            .bind("f", INC)
            .bind("y", Optional.of(1))
            .bind("n", Optional.empty());
    assertThat(interpreter.eval(env, core.pure(core.id("f"))),
        is(Optional.of(INC)));
    assertThat(
        interpreter.eval(env, core.mapEffect(core.id("f"), core.id("y"))),
        is(Optional.of(2)));
    assertThat(
        interpreter.eval(env, core.mapEffect(core.id("f"), core.id("n"))),
        is(Optional.empty()));
    assertThat(
        interpreter.eval(env,
            core.applyEffect(core.pure(core.id("f")), core.id("y"))),
        is(Optional.of(2)));
  }

  @Test
  void testErrors() {
    assertThrows(AssertionError.class,
        () -> interpreter.eval(EvalEnvs.empty(), core.id("x")));
    assertThrows(AssertionError.class,
        () -> interpreter.eval(EvalEnvs.empty(), core.pure(core.id("x"))));

    final Interpreter interpreter2 =
        new Interpreter(Environments.empty(new TypeSystem()));
    final MissingCapabilityException e =
        assertThrows(MissingCapabilityException.class,
            () -> interpreter2.eval(EvalEnvs.empty(),
                core.capabilityOp("List", CapabilityKind.MAP)));
    assertThat(e.getMessage(), is("type List has no capability"));
  }
}

// End InterpreterTest.java
