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

import static net.hydromatic.derive.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNot.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.derive.compile.CapabilityKind;
import org.junit.jupiter.api.Test;

/** Tests for {@link Core} expressions, in particular how they unparse. */
public class CoreTest {
  private static final Core.Id F = core.id("f");
  private static final Core.Id G = core.id("g");
  private static final Core.Id X = core.id("x");
  private static final Core.Id Y = core.id("y");

  private static final Pos BOX_MK = Pos.of("Box", "mk");

  @Test
  void testApply() {
    assertThat(core.apply(F, X), hasToString("f x"));
    assertThat(core.apply(F, X, Y), hasToString("f x y"));
    assertThat(core.apply(F, core.apply(G, X)), hasToString("f (g x)"));
    assertThat(core.apply(F, core.fn(core.idPat("x"), X)),
        hasToString("f (fn x => x)"));
    assertThat(core.apply(core.fn(core.idPat("x"), X), Y),
        hasToString("(fn x => x) y"));
    assertThat(
        core.apply(core.capabilityOp("List", CapabilityKind.MAP),
            core.apply(core.capabilityOp("Option", CapabilityKind.MAP), F)),
        hasToString("List.map (Option.map f)"));
  }

  @Test
  void testFn() {
    final Core.Exp fn =
        core.fn(ImmutableList.of(core.idPat("f"), core.idPat("x")),
            core.apply(F, X));
    assertThat(fn, hasToString("fn f => fn x => f x"));
    assertThat(core.fn(ImmutableList.of(), X), is(X));
  }

  @Test
  void testCon() {
    final Core.Con mk = core.con(BOX_MK, "Box", "mk",
        ImmutableList.of(core.apply(F, X), Y));
    final Core.Con none =
        core.con(Pos.of("Opt", "none"), "Opt", "none", ImmutableList.of());
    assertThat(mk, hasToString("Box.mk (f x, y)"));
    assertThat(none, hasToString("Opt.none"));
    assertThat(core.apply(F, mk), hasToString("f (Box.mk (f x, y))"));
    assertThat(core.apply(F, none), hasToString("f Opt.none"));
    assertThat(mk.qualifiedName(), is("Box.mk"));
  }

  @Test
  void testApplicative() {
    final Core.Id a = core.id("a");
    final Core.Id b = core.id("b");
    assertThat(core.pure(X), hasToString("pure x"));
    assertThat(core.pure(core.apply(F, X)), hasToString("pure (f x)"));
    assertThat(core.apply(F, core.pure(X)), hasToString("f (pure x)"));
    assertThat(core.mapEffect(G, core.apply(F, X)),
        hasToString("g <$> f x"));
    assertThat(core.applyEffect(core.mapEffect(G, a), b),
        hasToString("g <$> a <*> b"));
    assertThat(core.mapEffect(G, core.applyEffect(a, b)),
        hasToString("g <$> (a <*> b)"));
    assertThat(core.apply(F, core.mapEffect(G, a)),
        hasToString("f (g <$> a)"));
    assertThat(core.mapEffect(core.fn(core.idPat("y"), Y), a),
        hasToString("(fn y => y) <$> a"));
  }

  @Test
  void testCase() {
    final Core.Case kase =
        core.caseOf(Pos.of("Box"), X,
            core.match(
                core.conPat(BOX_MK, "Box", "mk",
                    ImmutableList.of(core.idPat("a"), core.idPat("b"))),
                core.con(BOX_MK, "Box", "mk",
                    ImmutableList.of(core.apply(F, core.id("a")),
                        core.id("b")))));
    assertThat(kase,
        hasToString("case x of Box.mk (a, b) => Box.mk (f a, b)"));
    assertThat(core.fn(core.idPat("x"), kase),
        hasToString("fn x => case x of Box.mk (a, b) => Box.mk (f a, b)"));
    assertThat(core.apply(F, kase),
        hasToString("f (case x of Box.mk (a, b) => Box.mk (f a, b))"));
  }

  @Test
  void testEquals() {
    assertThat(core.apply(F, X), is(core.apply(F, X)));
    assertThat(core.apply(F, X).hashCode(), is(core.apply(F, X).hashCode()));
    assertThat(core.apply(F, X), not(core.apply(F, Y)));
    assertThat(core.mapEffect(F, X), not(core.applyEffect(F, X)));
    assertThat(core.capabilityOp("List", CapabilityKind.MAP),
        not(core.capabilityOp("List", CapabilityKind.TRAVERSE)));
    assertThat(core.idPat("x").toId(), is(X));
    assertThrows(IllegalArgumentException.class, () -> core.idPat(""));
  }

  @Test
  void testShuttle() {
    final Core.Exp exp =
        core.fn(core.idPat("x"),
            core.mapEffect(G, core.apply(F, core.pure(X))));

    // A shuttle that changes nothing returns the same object
    assertThat(exp.accept(new Shuttle()) == exp, is(true));

    final Shuttle renamer = new Shuttle() {
      @Override
      protected Core.Exp visit(Core.Id id) {
        return id.name.equals("f") ? core.id("h") : id;
      }
    };
    assertThat(exp.accept(renamer),
        hasToString("fn x => g <$> h (pure x)"));
  }

  @Test
  void testVisitor() {
    final List<String> names = new ArrayList<>();
    final Visitor visitor = new Visitor() {
      @Override
      protected void visit(Core.Id id) {
        names.add(id.name);
      }
    };
    core.applyEffect(core.mapEffect(G, core.apply(F, X)), core.pure(Y))
        .accept(visitor);
    assertThat(names, is(ImmutableList.of("g", "f", "x", "y")));
  }
}

// End CoreTest.java
