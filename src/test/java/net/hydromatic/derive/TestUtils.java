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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.derive.compile.Deriver;
import net.hydromatic.derive.compile.Environments;
import net.hydromatic.derive.compile.Tracer;
import net.hydromatic.derive.compile.Tracers;
import net.hydromatic.derive.eval.Capability;
import net.hydromatic.derive.eval.Prop;
import net.hydromatic.derive.type.DataType;
import net.hydromatic.derive.type.PrimitiveType;
import net.hydromatic.derive.type.TypeSystem;
import net.hydromatic.derive.type.TypeVar;

/** Utilities for tests. */
public abstract class TestUtils {
  private TestUtils() {}

  /** Declares "{@code datatype 'a Pair = mk of 'a * 'a}". */
  public static DataType pair(TypeSystem typeSystem) {
    final TypeVar a = typeSystem.typeVariable(0);
    return typeSystem.dataType("Pair", a, typeSystem.tyCon("mk", a, a));
  }

  /** Declares "{@code datatype 'a Box = mk of 'a * Nat}". */
  public static DataType box(TypeSystem typeSystem) {
    final TypeVar a = typeSystem.typeVariable(0);
    return typeSystem.dataType("Box", a,
        typeSystem.tyCon("mk", a, PrimitiveType.NAT));
  }

  /** Declares a datatype with several constructors and nested fields:
   *
   * <pre>
   * datatype 'a Shape =
   *     empty
   *   | one of 'a
   *   | many of Int * List (Option 'a) * Either String 'a
   * </pre>
   */
  public static DataType shape(TypeSystem typeSystem) {
    final TypeVar a = typeSystem.typeVariable(0);
    return typeSystem.dataType("Shape", a,
        typeSystem.tyCon("empty"),
        typeSystem.tyCon("one", a),
        typeSystem.tyCon("many", PrimitiveType.INT,
            typeSystem.listType(typeSystem.option(a)),
            typeSystem.either(PrimitiveType.STRING, a)));
  }

  /** Returns the capability of a type, failing if it has none. */
  public static Capability capability(Environments.MapEnvironment env,
      String typeName) {
    return requireNonNull(env.lookupCapability(typeName), typeName);
  }

  /** Derives a datatype and installs its operations. */
  public static Capability deriveAndInstall(Environments.MapEnvironment env,
      String typeName) {
    return deriveAndInstall(env, Tracers.empty(), ImmutableMap.of(),
        typeName);
  }

  /** Derives a datatype and installs its operations, with a given tracer
   * and properties. */
  public static Capability deriveAndInstall(Environments.MapEnvironment env,
      Tracer tracer, Map<Prop, Object> props, String typeName) {
    new Deriver(env, tracer, props).deriveAndInstall(typeName, env);
    return capability(env, typeName);
  }
}

// End TestUtils.java
