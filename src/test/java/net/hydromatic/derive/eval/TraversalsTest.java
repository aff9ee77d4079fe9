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

import static net.hydromatic.derive.TestUtils.box;
import static net.hydromatic.derive.TestUtils.deriveAndInstall;
import static net.hydromatic.derive.TestUtils.pair;
import static net.hydromatic.derive.TestUtils.shape;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import net.hydromatic.derive.compile.Environments;
import net.hydromatic.derive.type.TypeSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link Traversals} over derived capabilities. */
public class TraversalsTest {
  private Environments.MapEnvironment env;

  @BeforeEach
  void setUp() {
    final TypeSystem typeSystem = new TypeSystem();
    pair(typeSystem);
    box(typeSystem);
    shape(typeSystem);
    env = Environments.env(typeSystem);
  }

  @Test
  void testToList() {
    final Capability pairCapability = deriveAndInstall(env, "Pair");
    final Capability boxCapability = deriveAndInstall(env, "Box");
    assertThat(
        Traversals.toList(pairCapability, DataValue.of("Pair", "mk", 1, 2)),
        is(ImmutableList.of(1, 2)));
    assertThat(
        Traversals.toList(boxCapability, DataValue.of("Box", "mk", 7, 3)),
        is(ImmutableList.of(7)));
    assertThat(
        Traversals.size(boxCapability, DataValue.of("Box", "mk", 7, 3)),
        is(1));
  }

  @Test
  void testToListShape() {
    final Capability capability = deriveAndInstall(env, "Shape");
    final DataValue many =
        DataValue.of("Shape", "many", 5,
            ImmutableList.of(Optional.of(1), Optional.empty(), Optional.of(2)),
            Either.right(3));
    assertThat(Traversals.toList(capability, many),
        is(ImmutableList.of(1, 2, 3)));
    final DataValue many2 =
        DataValue.of("Shape", "many", 5, ImmutableList.of(),
            Either.left("e"));
    assertThat(Traversals.size(capability, many2), is(0));
    assertThat(Traversals.size(capability, DataValue.of("Shape", "empty")),
        is(0));
  }

  @Test
  void testSequence() {
    final Capability capability = deriveAndInstall(env, "Pair");
    assertThat(
        Traversals.sequence(capability, Applicatives.OPTION,
            DataValue.of("Pair", "mk", Optional.of(1), Optional.of(2))),
        is(Optional.of(DataValue.of("Pair", "mk", 1, 2))));
    assertThat(
        Traversals.sequence(capability, Applicatives.OPTION,
            DataValue.of("Pair", "mk", Optional.of(1), Optional.empty())),
        is(Optional.empty()));
    assertThat(
        Traversals.sequence(capability, Applicatives.LIST,
            DataValue.of("Pair", "mk", ImmutableList.of(1, 2),
                ImmutableList.of(3))),
        is(
            ImmutableList.of(DataValue.of("Pair", "mk", 1, 3),
                DataValue.of("Pair", "mk", 2, 3))));
  }

  @Test
  void testDataValueToString() {
    assertThat(DataValue.of("Pair", "mk", 1, 2), hasToString("Pair.mk (1, 2)"));
    assertThat(DataValue.of("Shape", "empty"), hasToString("Shape.empty"));
    assertThat(
        DataValue.of("Shape", "many", 5, ImmutableList.of(1),
            Either.right(DataValue.of("Shape", "empty"))),
        hasToString("Shape.many (5, [1], Right Shape.empty)"));
    assertThat(Unit.INSTANCE, hasToString("()"));
  }

  @Test
  void testDerivedCapability() {
    final Capability capability = deriveAndInstall(env, "Box");
    assertThat(capability.typeName(), is("Box"));
    assertThat(capability.lawful(), is(true));
    assertThat(capability.map(x -> "s" + x, DataValue.of("Box", "mk", 7, 3)),
        is(DataValue.of("Box", "mk", "s7", 3)));
    assertThat(
        capability.traverse(Applicatives.LOGGING,
            x -> Logged.of(x, "visit " + x), DataValue.of("Box", "mk", 7, 3)),
        is(Logged.of(DataValue.of("Box", "mk", 7, 3), "visit 7")));
  }
}

// End TraversalsTest.java
