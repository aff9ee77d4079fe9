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
package net.hydromatic.derive.type;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.derive.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Primitive type. */
public enum PrimitiveType implements Type {
  BOOL("Bool"),
  INT("Int"),
  NAT("Nat"),
  STRING("String"),
  UNIT("Unit");

  /** The name in the language, e.g. {@code Int}. */
  public final String moniker;

  private static final ImmutableMap<String, PrimitiveType> BY_MONIKER;

  static {
    final ImmutableMap.Builder<String, PrimitiveType> b =
        ImmutableMap.builder();
    for (PrimitiveType type : values()) {
      b.put(type.moniker, type);
    }
    BY_MONIKER = b.build();
  }

  PrimitiveType(String moniker) {
    this.moniker = moniker;
  }

  /** Looks up a primitive type by name; returns null if not found. */
  public static @Nullable PrimitiveType lookup(String moniker) {
    return BY_MONIKER.get(moniker);
  }

  @Override
  public Op op() {
    return Op.PRIMITIVE_TYPE;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public StringBuilder describe(StringBuilder buf, int left, int right) {
    return buf.append(moniker);
  }

  @Override
  public String moniker() {
    return moniker;
  }
}

// End PrimitiveType.java
