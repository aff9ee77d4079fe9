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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.derive.ast.Pos;
import net.hydromatic.derive.eval.BuiltIn;
import net.hydromatic.derive.eval.Capability;
import net.hydromatic.derive.eval.DerivedCapability;
import net.hydromatic.derive.eval.Interpreter;
import net.hydromatic.derive.type.DataType;
import net.hydromatic.derive.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  /** Creates an environment whose declarations are those of a type system,
   * and that has no capabilities. */
  public static MapEnvironment empty(TypeSystem typeSystem) {
    return new MapEnvironment(typeSystem);
  }

  /** Creates an environment whose declarations are those of a type system,
   * with capabilities for the built-in types {@code List}, {@code Option}
   * and {@code Either}. */
  public static MapEnvironment env(TypeSystem typeSystem) {
    final MapEnvironment env = new MapEnvironment(typeSystem);
    for (BuiltIn builtIn : BuiltIn.values()) {
      env.addCapability(builtIn);
    }
    return env;
  }

  /**
   * Environment backed by a {@link TypeSystem} and a map of capabilities.
   *
   * <p>It is also an {@link InstanceRegistry}: once both the {@code map} and
   * {@code traverse} operations of a datatype have been registered, the
   * datatype has a capability, and can be used as the outer type of a nested
   * field of datatypes that are derived later.
   *
   * <p>Not thread-safe: registration must not run concurrently with
   * derivations that use this environment.
   */
  public static class MapEnvironment implements Environment, InstanceRegistry {
    private final TypeSystem typeSystem;
    private final Map<String, Capability> capabilities = new LinkedHashMap<>();
    private final Map<String, Map<CapabilityKind, SynthesizedOp>> ops =
        new HashMap<>();
    private final Interpreter interpreter = new Interpreter(this);

    MapEnvironment(TypeSystem typeSystem) {
      this.typeSystem = requireNonNull(typeSystem);
    }

    @Override
    public DataType lookupDecl(String name) {
      final DataType dataType = lookupDeclOpt(name);
      if (dataType == null) {
        throw new DeriveException("unknown type " + name, Pos.of(name));
      }
      return dataType;
    }

    @Override
    public @Nullable DataType lookupDeclOpt(String name) {
      return typeSystem.lookupOpt(name);
    }

    @Override
    public @Nullable Capability lookupCapability(String typeName) {
      return capabilities.get(typeName);
    }

    /** Adds a capability provided by the host. */
    public MapEnvironment addCapability(Capability capability) {
      checkArgument(!capabilities.containsKey(capability.typeName()),
          "type %s already has a capability", capability.typeName());
      capabilities.put(capability.typeName(), capability);
      return this;
    }

    @Override
    public void register(String typeName, CapabilityKind kind,
        SynthesizedOp op) {
      checkArgument(op.kind == kind, "op %s is not a %s", op.name, kind);
      checkArgument(op.dataType.name.equals(typeName),
          "op %s is not an operation of %s", op.name, typeName);
      final Map<CapabilityKind, SynthesizedOp> map =
          ops.computeIfAbsent(typeName,
              k -> new EnumMap<>(CapabilityKind.class));
      checkArgument(!map.containsKey(kind), "%s is already registered",
          op.name);
      map.put(kind, op);
      if (map.size() == CapabilityKind.values().length) {
        addCapability(
            new DerivedCapability(map.get(CapabilityKind.MAP),
                map.get(CapabilityKind.TRAVERSE), interpreter));
      }
    }

    /** Returns a registered operation, or null. */
    public @Nullable SynthesizedOp lookupOp(String typeName,
        CapabilityKind kind) {
      final Map<CapabilityKind, SynthesizedOp> map = ops.get(typeName);
      return map == null ? null : map.get(kind);
    }
  }
}

// End Environments.java
