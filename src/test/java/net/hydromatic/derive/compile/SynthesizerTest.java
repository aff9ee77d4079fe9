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

import static net.hydromatic.derive.TestUtils.box;
import static net.hydromatic.derive.TestUtils.shape;
import static net.hydromatic.derive.ast.CoreBuilder.core;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.derive.ast.Core;
import net.hydromatic.derive.ast.Pos;
import net.hydromatic.derive.type.DataType;
import net.hydromatic.derive.type.PrimitiveType;
import net.hydromatic.derive.type.TypeSystem;
import net.hydromatic.derive.type.TypeVar;
import org.junit.jupiter.api.Test;

/** Tests for the synthesizers, {@link Reducer} and {@link Replacer}. */
public class SynthesizerTest {
  private static final Core.Id F = core.id("f");
  private static final Core.Id V = core.id("v");

  private static Context context(DataType decl, TypeSystem typeSystem,
      CapabilityKind kind) {
    return Context.of(decl, Environments.env(typeSystem), Tracers.empty())
        .withKind(kind);
  }

  @Test
  void testNestedTransform() {
    final TypeSystem typeSystem = new TypeSystem();
    final TypeVar a = typeSystem.typeVariable(0);
    final DataType decl = shape(typeSystem);
    final Context context = context(decl, typeSystem, CapabilityKind.MAP);
    final Classifier classifier = new Classifier(context);
    final NestedTransformBuilder builder = new NestedTransformBuilder(context);
    final Pos pos = Pos.of("Shape", "many", 1);

    final Classification c =
        classifier.classify(
            typeSystem.listType(
                typeSystem.option(typeSystem.either(PrimitiveType.INT, a))),
            pos);
    assertThat(builder.build(c, F, pos),
        hasToString("List.map (Option.map (Either.map f))"));
    assertThat(builder.build(Classification.EXACT, F, pos), is((Core.Exp) F));

    final NestedTransformBuilder traverseBuilder =
        new NestedTransformBuilder(context.withKind(CapabilityKind.TRAVERSE));
    assertThat(traverseBuilder.build(c, F, pos),
        hasToString("List.traverse (Option.traverse (Either.traverse f))"));

    // Innermost type without capability
    final Classification c2 =
        classifier.classify(
            typeSystem.listType(typeSystem.apply("Sack", a)), pos);
    final MissingCapabilityException e =
        assertThrows(MissingCapabilityException.class,
            () -> builder.build(c2, F, pos));
    assertThat(e.getMessage(),
        is("type Sack has no map capability (required by Sack 'a)"));
  }

  @Test
  void testFieldSynthesizer() {
    final TypeSystem typeSystem = new TypeSystem();
    final TypeVar a = typeSystem.typeVariable(0);
    final DataType decl = shape(typeSystem);
    final Context mapContext = context(decl, typeSystem, CapabilityKind.MAP);
    final Context traverseContext =
        mapContext.withKind(CapabilityKind.TRAVERSE);
    final FieldSynthesizer map = new FieldSynthesizer(mapContext);
    final FieldSynthesizer traverse = new FieldSynthesizer(traverseContext);
    final Pos pos = Pos.of("Shape", "many", 0);
    final Classification nested =
        new Classifier(mapContext).classify(typeSystem.listType(a), pos);

    FieldSynthesis s = map.synthesize(Classification.EXACT, V, F, pos);
    assertThat(s.exp, hasToString("f v"));
    assertThat(s.effectful, is(true));

    s = map.synthesize(Classification.ABSENT, V, F, pos);
    assertThat(s.exp, hasToString("v"));
    assertThat(s.effectful, is(false));

    s = traverse.synthesize(Classification.ABSENT, V, F, pos);
    assertThat(s.exp, hasToString("pure v"));
    assertThat(s.value, hasToString("v"));
    assertThat(s.effectful, is(false));

    s = map.synthesize(nested, V, F, pos);
    assertThat(s.exp, hasToString("List.map f v"));
    s = traverse.synthesize(nested, V, F, pos);
    assertThat(s.exp, hasToString("List.traverse f v"));
    assertThat(s.effectful, is(true));

    assertThrows(RecursionException.class,
        () -> map.synthesize(Classification.RECURSIVE, V, F, pos));
  }

  /** Effects are combined from left to right; pure fields are applied
   * directly. */
  @Test
  void testConstructorSynthesizer() {
    final TypeSystem typeSystem = new TypeSystem();
    final TypeVar a = typeSystem.typeVariable(0);
    final DataType decl =
        typeSystem.dataType("Mix", a,
            typeSystem.tyCon("mix", PrimitiveType.BOOL, a,
                PrimitiveType.STRING, typeSystem.listType(a), a),
            typeSystem.tyCon("none", PrimitiveType.INT));
    final Context context =
        context(decl, typeSystem, CapabilityKind.TRAVERSE);
    final ConstructorSynthesizer synthesizer =
        new ConstructorSynthesizer(context);
    final ImmutableList<Core.Exp> fields =
        ImmutableList.of(core.id("p"), core.id("q"), core.id("r"),
            core.id("s"), core.id("t"));
    assertThat(synthesizer.synthesize(decl.tyCons.get(0), fields, F),
        hasToString("(fn y0 => fn y1 => fn y2 => Mix.mix (p, y0, r, y1, y2))"
            + " <$> f q <*> List.traverse f s <*> f t"));
    assertThat(
        synthesizer.synthesize(decl.tyCons.get(1),
            ImmutableList.of(core.id("n")), F),
        hasToString("pure (Mix.none (n))"));

    final ConstructorSynthesizer mapSynthesizer =
        new ConstructorSynthesizer(context.withKind(CapabilityKind.MAP));
    assertThat(mapSynthesizer.synthesize(decl.tyCons.get(0), fields, F),
        hasToString("Mix.mix (p, f q, r, List.map f s, f t)"));
  }

  @Test
  void testTypeSynthesizerTracer() {
    final TypeSystem typeSystem = new TypeSystem();
    final DataType decl = box(typeSystem);
    final StringBuilder b = new StringBuilder();
    final Tracer tracer =
        Tracers.withOnSynthesized(Tracers.empty(),
            op -> b.append(op.name).append(';'));
    final Context context =
        Context.of(decl, Environments.env(typeSystem), tracer);
    final SynthesizedOp op = new TypeSynthesizer(context).synthesize();
    assertThat(b.toString(), is("Box.map;"));
    assertThat(op.caseExp().matchList.size(), is(1));
    assertThat(op.match("mk"),
        hasToString("Box.mk (a0, a1) => Box.mk (f a0, a1)"));
    assertThat(op.match("nope") == null, is(true));
    assertThat(op,
        hasToString("val Box.map = fn f => fn x => case x of "
            + "Box.mk (a0, a1) => Box.mk (f a0, a1)"));
  }

  @Test
  void testReplacer() {
    // fn v => f v w; "v" is bound, so only "w" and "f" are replaced
    final Core.Exp exp =
        core.fn(core.idPat("v"), core.apply(F, V, core.id("w")));
    assertThat(
        Replacer.substitute(
            ImmutableMap.of("v", core.id("z"), "w", core.id("z"), "f",
                core.id("g")),
            exp),
        hasToString("fn v => g v z"));
    assertThat(Replacer.substitute(ImmutableMap.of(), exp) == exp, is(true));
  }

  @Test
  void testReducer() {
    // (fn x => case x of Box.mk (a, n) => Box.mk (f a, n)) (Box.mk (b, 3))
    final TypeSystem typeSystem = new TypeSystem();
    final DataType decl = box(typeSystem);
    final DataType.TyCon mk = decl.tyCons.get(0);
    final Core.IdPat x = core.idPat("x");
    final Core.IdPat p = core.idPat("p");
    final Core.IdPat n = core.idPat("n");
    final Core.Exp body =
        core.fn(x,
            core.caseOf(decl.pos(), core.id(x),
                core.match(
                    core.conPat(decl.pos(mk), "Box", "mk",
                        ImmutableList.of(p, n)),
                    core.con(decl.pos(mk), "Box", "mk",
                        ImmutableList.of(core.apply(F, core.id(p)),
                            core.id(n))))));
    final Core.Exp exp =
        core.apply(core.id("op"),
            core.con(decl.pos(mk), "Box", "mk",
                ImmutableList.of(core.id("b"), core.id("m"))));
    final Core.Exp reduced =
        Reducer.reduce(ImmutableMap.of("op", body), exp);
    assertThat(reduced, hasToString("Box.mk (f b, m)"));

    // Without the definition, nothing happens
    assertThat(Reducer.reduce(ImmutableMap.of(), exp) == exp, is(true));
  }

  @Test
  void testAlphaEquivalent() {
    final Core.Exp e0 =
        core.fn(core.idPat("y0"), core.apply(F, core.id("y0")));
    final Core.Exp e1 =
        core.fn(core.idPat("y5"), core.apply(F, core.id("y5")));
    final Core.Exp e2 =
        core.fn(core.idPat("y5"), core.apply(F, core.id("y0")));
    final Core.Exp e3 =
        core.fn(core.idPat("y5"), core.apply(core.id("g"), core.id("y5")));
    assertThat(Reducer.alphaEquivalent(e0, e0), is(true));
    assertThat(Reducer.alphaEquivalent(e0, e1), is(true));
    assertThat(Reducer.alphaEquivalent(e1, e0), is(true));
    assertThat(Reducer.alphaEquivalent(e0, e2), is(false));
    assertThat(Reducer.alphaEquivalent(e1, e3), is(false));

    // fn a => fn b => (a, b)  vs  fn b => fn a => (b, a)
    final Pos pos = Pos.of("P", "p");
    final Core.Exp e4 =
        core.fn(ImmutableList.of(core.idPat("a"), core.idPat("b")),
            core.con(pos, "P", "p",
                ImmutableList.of(core.id("a"), core.id("b"))));
    final Core.Exp e5 =
        core.fn(ImmutableList.of(core.idPat("b"), core.idPat("a")),
            core.con(pos, "P", "p",
                ImmutableList.of(core.id("b"), core.id("a"))));
    final Core.Exp e6 =
        core.fn(ImmutableList.of(core.idPat("b"), core.idPat("a")),
            core.con(pos, "P", "p",
                ImmutableList.of(core.id("a"), core.id("b"))));
    assertThat(Reducer.alphaEquivalent(e4, e5), is(true));
    assertThat(Reducer.alphaEquivalent(e4, e6), is(false));
  }

  @Test
  void testLemmaGenerator() {
    final TypeSystem typeSystem = new TypeSystem();
    final DataType decl = box(typeSystem);
    final StringBuilder b = new StringBuilder();
    final Tracer tracer =
        Tracers.withOnEquation(Tracers.empty(),
            eq -> b.append(eq).append(';'));
    final Context context =
        Context.of(decl, Environments.env(typeSystem), tracer)
            .withKind(CapabilityKind.TRAVERSE);
    final SynthesizedOp op = new TypeSynthesizer(context).synthesize();
    final SynthesizedOp op2 = new LemmaGenerator(context).generate(op);
    assertThat(op.equations.isEmpty(), is(true));
    assertThat(op2.equations.size(), is(1));
    assertThat(b.toString(),
        is("Box.traverse f (Box.mk (b3, b4)) = "
            + "(fn y5 => Box.mk (y5, b4)) <$> f b3;"));
  }
}

// End SynthesizerTest.java
