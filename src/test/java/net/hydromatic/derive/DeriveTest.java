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
package net.hydromatic.derive;

import static net.hydromatic.derive.TestUtils.box;
import static net.hydromatic.derive.TestUtils.deriveAndInstall;
import static net.hydromatic.derive.TestUtils.pair;
import static net.hydromatic.derive.TestUtils.shape;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import java.util.function.Function;
import net.hydromatic.derive.compile.Derivation;
import net.hydromatic.derive.compile.Deriver;
import net.hydromatic.derive.compile.Environments;
import net.hydromatic.derive.compile.Law;
import net.hydromatic.derive.eval.Applicatives;
import net.hydromatic.derive.eval.Capability;
import net.hydromatic.derive.eval.DataValue;
import net.hydromatic.derive.eval.Either;
import net.hydromatic.derive.eval.Identity;
import net.hydromatic.derive.eval.Logged;
import net.hydromatic.derive.type.PrimitiveType;
import net.hydromatic.derive.type.TypeSystem;
import net.hydromatic.derive.type.TypeVar;
import org.junit.jupiter.api.Test;

/** Tests that derive {@code map} and {@code traverse} for datatypes, and
 * evaluate the results. */
public class DeriveTest {
  private static final Function<Object, Object> LOG_VISIT =
      a -> Logged.of(a, "visit " + a);

  @Test
  void testPairOps() {
    final TypeSystem typeSystem = new TypeSystem();
    pair(typeSystem);
    final Environments.MapEnvironment env = Environments.env(typeSystem);
    final Derivation derivation = Deriver.of(env).derive("Pair");
    assertThat(derivation.mapOp.name, is("Pair.map"));
    assertThat(derivation.mapOp.body,
        hasToString("fn f => fn x => case x of "
            + "Pair.mk (a0, a1) => Pair.mk (f a0, f a1)"));
    assertThat(derivation.traverseOp.name, is("Pair.traverse"));
    assertThat(derivation.traverseOp.body,
        hasToString("fn f => fn x => case x of "
            + "Pair.mk (a4, a5) => "
            + "(fn y6 => fn y7 => Pair.mk (y6, y7)) <$> f a4 <*> f a5"));
  }

  @Test
  void testPairEquations() {
    final TypeSystem typeSystem = new TypeSystem();
    pair(typeSystem);
    final Environments.MapEnvironment env = Environments.env(typeSystem);
    final Derivation derivation = Deriver.of(env).derive("Pair");
    assertThat(derivation.equations(), hasSize(2));
    assertThat(derivation.mapOp.equation("mk"),
        hasToString("Pair.map f (Pair.mk (b2, b3)) = Pair.mk (f b2, f b3)"));
    assertThat(derivation.traverseOp.equation("mk"),
        hasToString("Pair.traverse f (Pair.mk (b8, b9)) = "
            + "(fn y10 => fn y11 => Pair.mk (y10, y11)) <$> f b8 <*> f b9"));
  }

  @Test
  void testPairLaws() {
    final TypeSystem typeSystem = new TypeSystem();
    pair(typeSystem);
    final Environments.MapEnvironment env = Environments.env(typeSystem);
    final Derivation derivation = Deriver.of(env).derive("Pair");
    assertThat(derivation.laws(), hasSize(Law.values().length));
    assertThat(derivation.mapOp.laws.get(0).law, is(Law.MAP_IDENTITY));
    assertThat(derivation.mapOp.laws.get(0).statement(),
        is("Pair.map id x = x"));
    assertThat(derivation.traverseOp.laws.get(0).law,
        is(Law.TRAVERSE_IDENTITY));
    assertThat(derivation.traverseOp.laws.get(0).cases,
        is(ImmutableList.of("mk")));
  }

  /** Map over a pair applies the function to both components. */
  @Test
  void testPairMap() {
    final TypeSystem typeSystem = new TypeSystem();
    pair(typeSystem);
    final Environments.MapEnvironment env = Environments.env(typeSystem);
    final Capability capability = deriveAndInstall(env, "Pair");
    assertThat(capability.lawful(), is(true));
    final DataValue value = DataValue.of("Pair", "mk", 1, 2);
    assertThat(capability.map(a -> (Integer) a * 10, value),
        is(DataValue.of("Pair", "mk", 10, 20)));
    assertThat(capability.map(a -> "s" + a, value),
        hasToString("Pair.mk (s1, s2)"));
  }

  /** Traverse over a pair performs effects from left to right. */
  @Test
  void testPairTraverse() {
    final TypeSystem typeSystem = new TypeSystem();
    pair(typeSystem);
    final Environments.MapEnvironment env = Environments.env(typeSystem);
    final Capability capability = deriveAndInstall(env, "Pair");
    final DataValue value = DataValue.of("Pair", "mk", 1, 2);
    assertThat(capability.traverse(Applicatives.LOGGING, LOG_VISIT, value),
        is(
            new Logged(value, ImmutableList.of("visit 1", "visit 2"))));

    // Option short-circuits
    final Function<Object, Object> evenOnly =
        a -> (Integer) a % 2 == 0 ? Optional.of(a) : Optional.empty();
    assertThat(capability.traverse(Applicatives.OPTION, evenOnly, value),
        is(Optional.empty()));
    assertThat(
        capability.traverse(Applicatives.OPTION, evenOnly,
            DataValue.of("Pair", "mk", 4, 6)),
        is(Optional.of(DataValue.of("Pair", "mk", 4, 6))));

    // Identity applicative coincides with map
    assertThat(
        capability.traverse(Applicatives.IDENTITY,
            a -> new Identity((Integer) a + 1), value),
        is(new Identity(DataValue.of("Pair", "mk", 2, 3))));
  }

  /** The second field of a box has no type variable, so is left alone. */
  @Test
  void testBox() {
    final TypeSystem typeSystem = new TypeSystem();
    box(typeSystem);
    final Environments.MapEnvironment env = Environments.env(typeSystem);
    final Derivation derivation = Deriver.of(env).derive("Box");
    assertThat(derivation.mapOp.body,
        hasToString("fn f => fn x => case x of "
            + "Box.mk (a0, a1) => Box.mk (f a0, a1)"));
    assertThat(derivation.traverseOp.body,
        hasToString("fn f => fn x => case x of "
            + "Box.mk (a4, a5) => (fn y6 => Box.mk (y6, a5)) <$> f a4"));

    Deriver.install(derivation, env);
    final Capability capability = TestUtils.capability(env, "Box");
    final DataValue value = DataValue.of("Box", "mk", "x", 3);
    assertThat(capability.map(a -> a + "!", value),
        is(DataValue.of("Box", "mk", "x!", 3)));
    assertThat(capability.traverse(Applicatives.LOGGING, LOG_VISIT, value),
        is(new Logged(value, ImmutableList.of("visit x"))));
  }

  @Test
  void testShapeMap() {
    final TypeSystem typeSystem = new TypeSystem();
    shape(typeSystem);
    final Environments.MapEnvironment env = Environments.env(typeSystem);
    final Derivation derivation = Deriver.of(env).derive("Shape");
    assertThat(derivation.mapOp.body,
        hasToString("fn f => fn x => case x of "
            + "Shape.empty => Shape.empty"
            + " | Shape.one (a0) => Shape.one (f a0)"
            + " | Shape.many (a1, a2, a3) => "
            + "Shape.many (a1, List.map (Option.map f) a2, Either.map f a3)"));
    assertThat(derivation.traverseOp.body,
        hasToString("fn f => fn x => case x of "
            + "Shape.empty => pure Shape.empty"
            + " | Shape.one (a8) => (fn y9 => Shape.one (y9)) <$> f a8"
            + " | Shape.many (a10, a11, a12) => "
            + "(fn y13 => fn y14 => Shape.many (a10, y13, y14))"
            + " <$> List.traverse (Option.traverse f) a11"
            + " <*> Either.traverse f a12"));
    assertThat(derivation.equations(), hasSize(6));
  }

  @Test
  void testShapeEvaluate() {
    final TypeSystem typeSystem = new TypeSystem();
    shape(typeSystem);
    final Environments.MapEnvironment env = Environments.env(typeSystem);
    final Capability capability = deriveAndInstall(env, "Shape");
    final DataValue many =
        DataValue.of("Shape", "many", 7,
            ImmutableList.of(Optional.of(1), Optional.empty(), Optional.of(2)),
            Either.right(3));
    assertThat(capability.map(a -> (Integer) a * 10, many),
        is(
            DataValue.of("Shape", "many", 7,
                ImmutableList.of(Optional.of(10), Optional.empty(),
                    Optional.of(20)),
                Either.right(30))));

    final Function<Object, Object> f =
        a -> Logged.of((Integer) a * 10, "f " + a);
    assertThat(capability.traverse(Applicatives.LOGGING, f, many),
        is(
            new Logged(
                DataValue.of("Shape", "many", 7,
                    ImmutableList.of(Optional.of(10), Optional.empty(),
                        Optional.of(20)),
                    Either.right(30)),
                ImmutableList.of("f 1", "f 2", "f 3"))));

    // Left values of an Either are not visited
    final DataValue left =
        DataValue.of("Shape", "many", 7, ImmutableList.of(),
            Either.left("oops"));
    assertThat(capability.traverse(Applicatives.LOGGING, f, left),
        is(new Logged(left, ImmutableList.of())));

    final DataValue empty = DataValue.of("Shape", "empty");
    assertThat(capability.map(a -> (Integer) a * 10, empty), is(empty));
    assertThat(capability.traverse(Applicatives.OPTION,
            a -> Optional.empty(), empty),
        is(Optional.of(empty)));
  }

  /** A derived type can be the outer type of a field of a type that is
   * derived later. */
  @Test
  void testDerivedInsideDerived() {
    final TypeSystem typeSystem = new TypeSystem();
    pair(typeSystem);
    final TypeVar a = typeSystem.typeVariable(0);
    typeSystem.dataType("Wrap", a,
        typeSystem.tyCon("wrap", typeSystem.apply("Pair", a),
            PrimitiveType.STRING));
    final Environments.MapEnvironment env = Environments.env(typeSystem);
    deriveAndInstall(env, "Pair");
    final Derivation derivation = Deriver.of(env).derive("Wrap");
    assertThat(derivation.mapOp.body,
        hasToString("fn f => fn x => case x of "
            + "Wrap.wrap (a0, a1) => Wrap.wrap (Pair.map f a0, a1)"));

    Deriver.install(derivation, env);
    final Capability capability = TestUtils.capability(env, "Wrap");
    final DataValue value =
        DataValue.of("Wrap", "wrap", DataValue.of("Pair", "mk", 1, 2), "w");
    assertThat(capability.map(x -> (Integer) x + 1, value),
        hasToString("Wrap.wrap (Pair.mk (2, 3), w)"));
    assertThat(capability.traverse(Applicatives.LOGGING, LOG_VISIT, value),
        is(new Logged(value, ImmutableList.of("visit 1", "visit 2"))));
  }

  /** A field of type "Self Int" does not contain the type variable, so is
   * left alone. */
  @Test
  void testSelfWithoutVariable() {
    final TypeSystem typeSystem = new TypeSystem();
    final TypeVar a = typeSystem.typeVariable(0);
    typeSystem.dataType("Odd", a,
        typeSystem.tyCon("leaf"),
        typeSystem.tyCon("odd", a,
            typeSystem.apply("Odd",
                PrimitiveType.INT)));
    final Environments.MapEnvironment env = Environments.env(typeSystem);
    final Derivation derivation = Deriver.of(env).derive("Odd");
    assertThat(derivation.mapOp.body,
        hasToString("fn f => fn x => case x of "
            + "Odd.leaf => Odd.leaf | Odd.odd (a0, a1) => Odd.odd (f a0, a1)"));
  }

  /** A type whose only constructor refers to the type itself, under an
   * option, derives with laws checked, and its operations leave the option
   * alone. */
  @Test
  void testSelfUnderOption() {
    final TypeSystem typeSystem = new TypeSystem();
    final TypeVar a = typeSystem.typeVariable(0);
    typeSystem.dataType("T", a,
        typeSystem.tyCon("mk", a,
            typeSystem.option(typeSystem.apply("T", PrimitiveType.INT))));
    final Environments.MapEnvironment env = Environments.env(typeSystem);
    final Derivation derivation = Deriver.of(env).derive("T");
    assertThat(derivation.laws(), hasSize(Law.values().length));
    Deriver.install(derivation, env);

    final Capability capability = TestUtils.capability(env, "T");
    final DataValue inner = DataValue.of("T", "mk", 5, Optional.empty());
    final DataValue value = DataValue.of("T", "mk", 1, Optional.of(inner));
    assertThat(capability.map(x -> (Integer) x * 10, value),
        is(DataValue.of("T", "mk", 10, Optional.of(inner))));
    assertThat(capability.traverse(Applicatives.LOGGING, LOG_VISIT, value),
        is(new Logged(value, ImmutableList.of("visit 1"))));
  }
}

// End DeriveTest.java
