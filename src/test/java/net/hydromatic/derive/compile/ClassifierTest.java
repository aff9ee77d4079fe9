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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.derive.ast.Pos;
import net.hydromatic.derive.type.DataType;
import net.hydromatic.derive.type.PrimitiveType;
import net.hydromatic.derive.type.Type;
import net.hydromatic.derive.type.TypeSystem;
import net.hydromatic.derive.type.TypeVar;
import org.junit.jupiter.api.Test;

/** Tests for {@link Classifier} and {@link Classification}. */
public class ClassifierTest {
  private final TypeSystem typeSystem = new TypeSystem();
  private final TypeVar a = typeSystem.typeVariable(0);
  private final DataType decl =
      typeSystem.dataType("T", a, typeSystem.tyCon("t", a));
  private final Pos pos = Pos.of("T", "t", 0);
  private final Classifier classifier =
      new Classifier(
          Context.of(decl, Environments.env(typeSystem), Tracers.empty()));

  private Classification classify(Type type) {
    return classifier.classify(type, pos);
  }

  @Test
  void testExactAndAbsent() {
    assertThat(classify(a), sameInstance(Classification.EXACT));
    assertThat(classify(PrimitiveType.INT),
        sameInstance(Classification.ABSENT));
    assertThat(classify(typeSystem.listType(PrimitiveType.STRING)),
        sameInstance(Classification.ABSENT));
    // A different type variable is not the designated variable
    assertThat(classify(typeSystem.typeVariable(1)),
        sameInstance(Classification.ABSENT));
    // "T Int" does not contain the variable
    assertThat(classify(typeSystem.apply("T", PrimitiveType.INT)),
        sameInstance(Classification.ABSENT));
    assertThat(Classification.ABSENT.isEffectful(), is(false));
    assertThat(Classification.EXACT.isEffectful(), is(true));
  }

  @Test
  void testRecursive() {
    final Classification c = classify(typeSystem.apply("T", a));
    assertThat(c, sameInstance(Classification.RECURSIVE));
    assertThat(c.isRecursive(), is(true));
    final Classification c2 =
        classify(typeSystem.listType(typeSystem.apply("T", a)));
    assertThat(c2, hasToString("NESTED(List, RECURSIVE)"));
    assertThat(c2.isRecursive(), is(true));
  }

  @Test
  void testNested() {
    final Classification c = classify(typeSystem.listType(a));
    assertThat(c, hasToString("NESTED(List, EXACT)"));
    assertThat(c.kind, is(Classification.Kind.NESTED));
    assertThat(c.innerType(), is((Type) a));
    assertThat(c.isRecursive(), is(false));

    final Classification c2 =
        classify(typeSystem.listType(typeSystem.option(a)));
    assertThat(c2, hasToString("NESTED(List, NESTED(Option, EXACT))"));
    assertThat(c2.heads(), is(ImmutableList.of("List", "Option")));
    assertThat(c2.innerType(), hasToString("Option 'a"));

    // The variable may occur in the last argument of Either
    final Classification c3 =
        classify(typeSystem.either(PrimitiveType.STRING, a));
    assertThat(c3, hasToString("NESTED(Either, EXACT)"));
    assertThat(c3,
        is(Classification.nested(typeSystem.either(PrimitiveType.STRING, a),
            Classification.EXACT)));
  }

  /** Nesting strictly decreases the depth of the type being classified. */
  @Test
  void testNestingDecreasesDepth() {
    Type type = a;
    for (int i = 0; i < 5; i++) {
      type = i % 2 == 0 ? typeSystem.listType(type) : typeSystem.option(type);
    }
    Classification c = classify(type);
    int depth = type.depth();
    assertThat(depth, is(5));
    while (c.kind == Classification.Kind.NESTED) {
      final int innerDepth = c.innerType().depth();
      assertThat(innerDepth < depth, is(true));
      depth = innerDepth;
      c = c.inner;
    }
    assertThat(c, sameInstance(Classification.EXACT));
    assertThat(depth, is(0));
  }

  @Test
  void testNonFinalPosition() {
    final ClassificationException e =
        assertThrows(ClassificationException.class,
            () -> classify(typeSystem.either(a, PrimitiveType.INT)));
    assertThat(e.getMessage(),
        containsString("not a structurally-transformable position"));
    assertThat(e.pos(), is(pos));

    // Variable in both arguments
    assertThrows(ClassificationException.class,
        () -> classify(typeSystem.either(a, a)));

    // Variable deep inside a non-final argument
    assertThrows(ClassificationException.class,
        () -> classify(
            typeSystem.listType(
                typeSystem.either(typeSystem.listType(a),
                    PrimitiveType.INT))));
  }

  /** Classification of a declaration reports each field to the tracer. */
  @Test
  void testClassifyAll() {
    final TypeSystem typeSystem = new TypeSystem();
    final TypeVar a = typeSystem.typeVariable(0);
    final DataType decl =
        typeSystem.dataType("Rec", a,
            typeSystem.tyCon("r", PrimitiveType.INT, a,
                typeSystem.option(a)),
            typeSystem.tyCon("s"));
    final List<String> list = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnClassify(Tracers.empty(), c -> list.add(c.toString()));
    final Context context =
        Context.of(decl, Environments.env(typeSystem), tracer);
    assertThat(list,
        is(ImmutableList.of("ABSENT", "EXACT", "NESTED(Option, EXACT)")));
    assertThat(context.classifications(decl.tyCons.get(0)),
        hasToString("[ABSENT, EXACT, NESTED(Option, EXACT)]"));
    assertThat(context.classifications(decl.tyCons.get(1)),
        is(ImmutableList.of()));
  }
}

// End ClassifierTest.java
